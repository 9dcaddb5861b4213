package io.consortium.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.consortium.core.orchestration.OrchestrationResult;

/// Jackson mixin that tags each `OrchestrationResult` variant with a `status` field.
///
/// `completed` carries the retained synthesis and run metadata, `failed` carries the
/// failure. The convenience accessors of the sealed interface are hidden: `getOrThrow`
/// would throw while serializing a failed result.
///
/// @see io.consortium.serialization.ConsortiumJacksonModule
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OrchestrationResult.Completed.class, name = "completed"),
    @JsonSubTypes.Type(value = OrchestrationResult.Failed.class, name = "failed")
})
public abstract class OrchestrationResultMixin {

    @JsonIgnore
    abstract boolean isCompleted();

    @JsonIgnore
    abstract OrchestrationResult.Completed getOrThrow();

    /// Fixes the type id when a `Completed` is serialized as the root value.
    @JsonTypeName("completed")
    public abstract static class CompletedMixin {}

    /// Fixes the type id when a `Failed` is serialized as the root value.
    @JsonTypeName("failed")
    public abstract static class FailedMixin {}
}
