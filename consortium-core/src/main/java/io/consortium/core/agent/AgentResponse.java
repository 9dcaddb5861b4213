package io.consortium.core.agent;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Sealed hierarchy for the outcome of one agent invocation.
///
/// - {@link TextResponse}: the model's raw text output
/// - {@link Error}: the invocation failed with a timeout, transport or provider error
///
/// The orchestration core treats the text as untrusted free text; structured fields
/// are extracted later by {@link io.consortium.core.parse.ResponseParser}.
///
/// @see Agent#execute for the execution entry point
public sealed interface AgentResponse permits AgentResponse.TextResponse, AgentResponse.Error {

    /// Returns when this response was created.
    Instant timestamp();

    /// Raw text output from the model.
    ///
    /// @param content the model's text output, not null
    /// @param metadata additional execution metadata (tokens, latency, finish reason), not null
    /// @param timestamp when the response was created, not null
    record TextResponse(String content, Map<String, Object> metadata, Instant timestamp)
            implements AgentResponse {

        public TextResponse {
            Objects.requireNonNull(content, "content must not be null");
            metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static TextResponse of(String content) {
            return new TextResponse(content, Map.of(), Instant.now());
        }

        public static TextResponse of(String content, Map<String, Object> metadata) {
            return new TextResponse(content, metadata, Instant.now());
        }
    }

    /// Agent invocation failed.
    ///
    /// @param message error description, not null
    /// @param errorType classification of the error, not null
    /// @param cause the underlying exception, may be null
    /// @param timestamp when the error occurred, not null
    record Error(String message, ErrorType errorType, Throwable cause, Instant timestamp)
            implements AgentResponse {

        /// Failure classes of the Agent Invocation Interface.
        public enum ErrorType {
            /// The invocation exceeded its time budget.
            TIMEOUT,
            /// The endpoint could not be reached or the connection broke.
            TRANSPORT,
            /// The provider answered with an error, or the agent implementation failed.
            PROVIDER;

            /// Classifies a failure by walking its cause chain.
            ///
            /// Timeout types (or exception classes named `*Timeout*`) win over I/O types,
            /// since JDK socket and HTTP timeouts are themselves `IOException`s.
            ///
            /// @param failure the exception to classify, not null
            /// @return the matching error type, `PROVIDER` when nothing more specific applies
            public static ErrorType classify(Throwable failure) {
                boolean transport = false;
                for (Throwable t = failure; t != null; t = t.getCause()) {
                    if (t instanceof java.util.concurrent.TimeoutException
                            || t instanceof java.net.SocketTimeoutException
                            || t instanceof java.net.http.HttpTimeoutException
                            || t.getClass().getSimpleName().contains("Timeout")) {
                        return TIMEOUT;
                    }
                    if (t instanceof java.io.IOException) {
                        transport = true;
                    }
                    if (t.getCause() == t) {
                        break;
                    }
                }
                return transport ? TRANSPORT : PROVIDER;
            }
        }

        public Error {
            Objects.requireNonNull(message, "message must not be null");
            errorType = errorType != null ? errorType : ErrorType.PROVIDER;
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        /// Creates an error from an exception, classifying it by its cause chain.
        ///
        /// @param cause the failure, not null
        /// @return error response, never null
        public static Error from(Throwable cause) {
            return new Error(
                    cause.getMessage() != null
                            ? cause.getMessage()
                            : cause.getClass().getSimpleName(),
                    ErrorType.classify(cause),
                    cause,
                    Instant.now());
        }

        public static Error of(String message) {
            return new Error(message, ErrorType.PROVIDER, null, Instant.now());
        }

        public static Error of(String message, ErrorType type) {
            return new Error(message, type, null, Instant.now());
        }
    }
}
