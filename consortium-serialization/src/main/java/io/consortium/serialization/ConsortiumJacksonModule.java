package io.consortium.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.consortium.core.orchestration.OrchestrationFailure;
import io.consortium.core.orchestration.OrchestrationResult;
import io.consortium.core.parse.AgentFailure;
import io.consortium.serialization.mixin.FailureCauseMixin;
import io.consortium.serialization.mixin.OrchestrationResultMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the consortium serialization configuration.
///
/// Everything else in the result graph is a record or an enum and serializes through
/// Jackson's defaults; only two groups need mixins:
/// - `OrchestrationResult`: `status` discriminator, convenience accessors hidden
/// - `AgentFailure`, `OrchestrationFailure`: `cause` exception omitted
///
/// @implNote All registrations are explicit, no classpath scanning.
/// @see ResultSerializer for the convenience factory API
public class ConsortiumJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4417210397715030361L;

    public ConsortiumJacksonModule() {
        super("ConsortiumJacksonModule");
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(OrchestrationResult.class, OrchestrationResultMixin.class);
        context.setMixInAnnotations(
                OrchestrationResult.Completed.class, OrchestrationResultMixin.CompletedMixin.class);
        context.setMixInAnnotations(
                OrchestrationResult.Failed.class, OrchestrationResultMixin.FailedMixin.class);

        context.setMixInAnnotations(AgentFailure.class, FailureCauseMixin.class);
        context.setMixInAnnotations(OrchestrationFailure.class, FailureCauseMixin.class);
    }
}
