package io.consortium.core;

/// Configuration options for the consortium execution environment.
///
/// Controls thread pool sizing for agent invocations. Per-run parameters live in
/// {@link io.consortium.core.orchestration.OrchestrationConfig}.
///
/// ### Default Values
/// - `threadPoolSize`: `16`
/// - `asyncInteractionLog`: `true` (appends run on a background thread)
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link ConsortiumFactory}.
/// Do not modify after environment creation.
///
/// @see ConsortiumFactory#createEnvironment(ConsortiumConfig)
/// @see Builder
public class ConsortiumConfig {
    private int threadPoolSize = 16;
    private boolean asyncInteractionLog = true;

    /// Creates a configuration with default values.
    public ConsortiumConfig() {}

    /// Returns the number of platform threads running agent invocations.
    ///
    /// Tasks beyond this number wait in the pool's queue; their timeout keeps running
    /// while they wait.
    ///
    /// @return the fixed thread pool size
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the thread pool size.
    ///
    /// ### Contracts
    /// - **Precondition**: `threadPoolSize` should be positive
    ///
    /// @param threadPoolSize the number of threads in the fixed pool, must be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    /// Returns whether the interaction log is wrapped in
    /// {@link io.consortium.core.log.AsyncInteractionLog}.
    public boolean isAsyncInteractionLog() {
        return asyncInteractionLog;
    }

    public void setAsyncInteractionLog(boolean asyncInteractionLog) {
        this.asyncInteractionLog = asyncInteractionLog;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link ConsortiumConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final ConsortiumConfig config = new ConsortiumConfig();

        /// Sets the thread pool size for agent invocations.
        ///
        /// @param threadPoolSize the number of threads, must be positive
        /// @return this builder for chaining, never null
        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        /// @param asyncInteractionLog `false` to append on the orchestrating thread
        /// @return this builder for chaining, never null
        public Builder asyncInteractionLog(boolean asyncInteractionLog) {
            config.asyncInteractionLog = asyncInteractionLog;
            return this;
        }

        /// Builds and returns the configured {@link ConsortiumConfig} instance.
        ///
        /// @return the configured instance, never null
        /// @throws IllegalArgumentException if the thread pool size is not positive
        public ConsortiumConfig build() {
            if (config.threadPoolSize < 1) {
                throw new IllegalArgumentException(
                        "Thread pool size must be positive, got " + config.threadPoolSize);
            }
            return config;
        }
    }
}
