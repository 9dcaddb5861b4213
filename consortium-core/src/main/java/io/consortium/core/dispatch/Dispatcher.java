package io.consortium.core.dispatch;

import io.consortium.core.agent.AgentResponse;
import io.consortium.core.agent.AgentResponse.TextResponse;
import io.consortium.core.exception.AllAgentsFailedException;
import io.consortium.core.parse.AgentFailure;
import io.consortium.core.parse.ResponseParser;
import io.consortium.core.parse.RoundResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/// Fans one prompt out to every task of a round and waits for all of them.
///
/// ### Failure Handling
/// - A task that returns {@link AgentResponse.Error}, throws, or misses the deadline is
///   recorded as a failed {@link RoundResponse}; the round continues
/// - When no task succeeds, {@link AllAgentsFailedException} carries every failure
/// - Interruption of the calling thread cancels every in-flight task and propagates
///   as {@link InterruptedException}
///
/// The deadline of every task is `timeout` after the round was dispatched, so a task
/// queued behind a busy pool consumes its budget while it waits.
///
/// @implNote The ExecutorService is NOT shut down by this dispatcher; its lifecycle
/// belongs to {@link io.consortium.core.ConsortiumEnvironment}.
public class Dispatcher {

    private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

    private static final List<String> FINISH_REASON_KEYS =
            List.of("finish_reason", "finishreason", "stop_reason");
    private static final List<String> TRUNCATION_INDICATORS = List.of("length", "max_token");

    private final ExecutorService executorService;
    private final ResponseParser responseParser;

    public Dispatcher(ExecutorService executorService, ResponseParser responseParser) {
        this.executorService = executorService;
        this.responseParser = responseParser;
    }

    /// Invokes all tasks concurrently and collects their outcomes in task order.
    ///
    /// @param prompt the prompt sent to every task, not null
    /// @param tasks the expanded roster, not empty
    /// @param context round number, system prompt, timeout and listener, not null
    /// @return all task outcomes, at least one of them successful
    /// @throws AllAgentsFailedException if every task failed
    /// @throws InterruptedException if the calling thread was interrupted while waiting
    public DispatchResult dispatch(String prompt, List<AgentTask> tasks, DispatchContext context)
            throws AllAgentsFailedException, InterruptedException {
        logger.info("Round " + context.round() + ": dispatching " + tasks.size() + " tasks");

        long deadline = System.nanoTime() + context.timeout().toNanos();

        List<Future<RoundResponse>> futures = new ArrayList<>(tasks.size());
        List<AtomicBoolean> reported = new ArrayList<>(tasks.size());
        for (AgentTask task : tasks) {
            AtomicBoolean taskReported = new AtomicBoolean();
            reported.add(taskReported);
            futures.add(
                    executorService.submit(() -> invoke(task, prompt, context, taskReported)));
        }

        List<RoundResponse> responses = new ArrayList<>(tasks.size());
        for (int i = 0; i < futures.size(); i++) {
            Future<RoundResponse> future = futures.get(i);
            AgentTask task = tasks.get(i);
            AtomicBoolean taskReported = reported.get(i);
            RoundResponse response;

            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                response = future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                logger.warning(
                        "Task timed out after " + context.timeout() + ": " + task.label());
                response =
                        RoundResponse.failure(
                                task.agentIdentifier(),
                                task.instanceIndex(),
                                AgentFailure.timeout(
                                        "No response within " + context.timeout()));
                report(context, response, taskReported);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warning("Task failed: " + task.label() + " - " + cause.getMessage());
                response =
                        RoundResponse.failure(
                                task.agentIdentifier(),
                                task.instanceIndex(),
                                AgentFailure.from(cause));
                report(context, response, taskReported);
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                logger.warning("Round " + context.round() + " interrupted; cancelled all tasks");
                throw e;
            }
            responses.add(response);
        }

        DispatchResult result = new DispatchResult(responses);
        List<RoundResponse> failures = result.failures();
        if (!failures.isEmpty()) {
            logger.warning(
                    "Partial failures in round "
                            + context.round()
                            + ": "
                            + failures.stream().map(RoundResponse::taskLabel).toList());
        }
        if (failures.size() == responses.size()) {
            throw new AllAgentsFailedException(
                    "All " + responses.size() + " tasks failed in round " + context.round(),
                    failures);
        }
        return result;
    }

    private RoundResponse invoke(
            AgentTask task, String prompt, DispatchContext context, AtomicBoolean reported) {
        context.listener().onAgentStart(context.round(), task.label(), prompt);
        logger.fine("Invoking " + task.label() + " with prompt:\n" + prompt);

        AgentResponse agentResponse;
        try {
            agentResponse = task.agent().execute(prompt, context.systemPrompt());
        } catch (RuntimeException e) {
            agentResponse = AgentResponse.Error.from(e);
        }

        RoundResponse response;
        if (agentResponse instanceof TextResponse text) {
            warnIfTruncated(task, text.metadata());
            response =
                    responseParser.parse(
                            task.agentIdentifier(), task.instanceIndex(), text.content());
        } else {
            AgentResponse.Error error = (AgentResponse.Error) agentResponse;
            logger.warning(
                    "Agent "
                            + task.label()
                            + " returned "
                            + error.errorType()
                            + " error: "
                            + error.message());
            response =
                    RoundResponse.failure(
                            task.agentIdentifier(), task.instanceIndex(), AgentFailure.from(error));
        }

        report(context, response, reported);
        return response;
    }

    // Whichever thread settles the task first reports it; a late answer after a timeout
    // stays silent.
    private static void report(
            DispatchContext context, RoundResponse response, AtomicBoolean reported) {
        if (reported.compareAndSet(false, true)) {
            context.listener().onAgentComplete(context.round(), response);
        }
    }

    private void warnIfTruncated(AgentTask task, Map<String, Object> metadata) {
        String finishReason = finishReason(metadata);
        if (finishReason != null
                && TRUNCATION_INDICATORS.stream().anyMatch(finishReason::contains)) {
            logger.warning(
                    "Response from " + task.label() + " truncated. Reason: " + finishReason);
        }
    }

    static String finishReason(Map<String, Object> metadata) {
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            if (FINISH_REASON_KEYS.contains(key) && entry.getValue() != null) {
                return entry.getValue().toString().toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }
}
