package io.consortium.core.agent;

import static org.assertj.core.api.Assertions.assertThat;

import io.consortium.core.agent.AgentResponse.Error.ErrorType;
import io.consortium.core.agent.AgentResponse.TextResponse;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AgentResponseTest {

    @Nested
    class TextResponseTest {

        @Test
        void shouldCopyMetadataDefensively() {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("finish_reason", "stop");

            TextResponse response = TextResponse.of("hello", metadata);
            metadata.put("late", true);

            assertThat(response.metadata()).containsOnlyKeys("finish_reason");
            assertThat(response.timestamp()).isNotNull();
        }

        @Test
        void shouldDefaultToEmptyMetadata() {
            assertThat(new TextResponse("x", null, null).metadata()).isEmpty();
        }
    }

    @Nested
    class ErrorClassificationTest {

        @Test
        void shouldClassifyTimeouts() {
            assertThat(ErrorType.classify(new TimeoutException())).isEqualTo(ErrorType.TIMEOUT);
            assertThat(ErrorType.classify(new SocketTimeoutException("read")))
                    .isEqualTo(ErrorType.TIMEOUT);
            assertThat(ErrorType.classify(new RuntimeException(new SocketTimeoutException())))
                    .isEqualTo(ErrorType.TIMEOUT);
        }

        @Test
        void shouldClassifyIoFailuresAsTransport() {
            IOException reset = new IOException("reset");
            UncheckedIOException wrapped =
                    new UncheckedIOException(new ConnectException("refused"));

            assertThat(ErrorType.classify(reset)).isEqualTo(ErrorType.TRANSPORT);
            assertThat(ErrorType.classify(wrapped)).isEqualTo(ErrorType.TRANSPORT);
        }

        @Test
        void shouldClassifyEverythingElseAsProvider() {
            assertThat(ErrorType.classify(new IllegalStateException("429 rate limited")))
                    .isEqualTo(ErrorType.PROVIDER);
        }

        @Test
        void shouldUseClassNameWhenExceptionHasNoMessage() {
            AgentResponse.Error error = AgentResponse.Error.from(new IllegalStateException());

            assertThat(error.message()).isEqualTo("IllegalStateException");
            assertThat(error.errorType()).isEqualTo(ErrorType.PROVIDER);
            assertThat(error.cause()).isInstanceOf(IllegalStateException.class);
        }
    }
}
