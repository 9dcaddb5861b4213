package io.consortium.core.orchestration;

import io.consortium.core.parse.RoundResponse;
import io.consortium.core.synthesis.SynthesisResult;

/// Listener for orchestration lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override
/// only the events they care about.
///
/// ### Callback Lifecycle
/// Each round triggers callbacks in this order:
///
/// ```
/// onStateChange(round, DISPATCHING)
/// onRoundStart(runId, round, prompt)     - about to dispatch the round
/// onAgentStart(round, task, prompt)      - once per task, on a worker thread
/// onAgentComplete(round, response)       - once per task, including failures
/// onSynthesisComplete(round, synthesis)  - arbiter reply parsed
/// onRoundComplete(record)                - record appended to history
/// ```
///
/// @implNote `onAgentStart` and `onAgentComplete` are called from dispatcher worker
/// threads and may run concurrently. The other callbacks run on the orchestrating thread.
public interface OrchestrationListener {

    /// Called on every state transition of the run.
    ///
    /// @param round 1-based round number the transition belongs to
    /// @param state the state entered, not null
    default void onStateChange(int round, OrchestrationState state) {}

    /// Called before a round is dispatched.
    ///
    /// @param runId identifier of the orchestration run, not null
    /// @param round 1-based round number
    /// @param prompt the prompt sent to every task of the round, not null
    default void onRoundStart(String runId, int round, String prompt) {}

    /// Called before one agent instance is invoked.
    ///
    /// @param round 1-based round number
    /// @param taskLabel `identifier#instance`, not null
    /// @param prompt the prompt sent to the agent, not null
    default void onAgentStart(int round, String taskLabel, String prompt) {}

    /// Called when one task has finished, failed or timed out.
    ///
    /// @param round 1-based round number
    /// @param response the task's outcome, not null
    default void onAgentComplete(int round, RoundResponse response) {}

    /// Called after the arbiter's reply was parsed.
    ///
    /// @param round 1-based round number
    /// @param synthesis the parsed synthesis, not null
    default void onSynthesisComplete(int round, SynthesisResult synthesis) {}

    /// Called after a completed round was appended to the history.
    ///
    /// @param record the immutable record of the round, not null
    default void onRoundComplete(IterationRecord record) {}

    /// No-op listener instance that ignores all events.
    OrchestrationListener NOOP = new OrchestrationListener() {};
}
