package io.consortium.core.parse;

import java.util.Objects;

/// Outcome of one task (one agent instance) within one round.
///
/// A failed task keeps its identity and carries an {@link AgentFailure}; its text
/// fields are null. Failed tasks are recorded in history but never reach the arbiter.
///
/// @param agentIdentifier roster identifier the task was addressed to, not null
/// @param instanceIndex 1-based instance number within that identifier
/// @param reasoning parsed reasoning, null when absent
/// @param answer parsed answer, null only for failed tasks
/// @param selfConfidence self-reported confidence in [0, 1], null when absent
/// @param raw full reply text, null only for failed tasks
/// @param error failure description, null for successful tasks
public record RoundResponse(
        String agentIdentifier,
        int instanceIndex,
        String reasoning,
        String answer,
        Double selfConfidence,
        String raw,
        AgentFailure error) {

    public RoundResponse {
        Objects.requireNonNull(agentIdentifier, "agentIdentifier must not be null");
        if (error == null) {
            Objects.requireNonNull(raw, "raw must not be null for a successful response");
            Objects.requireNonNull(answer, "answer must not be null for a successful response");
        }
    }

    public static RoundResponse success(
            String agentIdentifier, int instanceIndex, ParsedResponse parsed, String raw) {
        return new RoundResponse(
                agentIdentifier,
                instanceIndex,
                parsed.reasoning(),
                parsed.answer(),
                parsed.confidence(),
                raw,
                null);
    }

    public static RoundResponse failure(
            String agentIdentifier, int instanceIndex, AgentFailure error) {
        return new RoundResponse(
                agentIdentifier, instanceIndex, null, null, null, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /// @return `identifier#instance`, used in logs and failure summaries
    public String taskLabel() {
        return agentIdentifier + "#" + instanceIndex;
    }
}
