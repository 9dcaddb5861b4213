package io.consortium.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Jackson mixin that drops the `cause` exception from failure records.
///
/// Applied to `AgentFailure` and `OrchestrationFailure`. The failure message and
/// type already describe what went wrong; a serialized `Throwable` would add a stack
/// trace to every log line.
///
/// @see io.consortium.serialization.ConsortiumJacksonModule
@JsonIgnoreProperties({"cause"})
public abstract class FailureCauseMixin {}
