package io.consortium.core.agent.stub;

import io.consortium.core.agent.Agent;
import io.consortium.core.agent.AgentConfig;
import io.consortium.core.agent.AgentResponse;
import io.consortium.core.agent.AgentResponse.TextResponse;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/// Offline agent that returns configured or generated replies without calling any model.
///
/// Lets an entire consortium run, arbiter included, without API keys. Replies can be
/// configured via resource files or programmatically through {@link StubResponseRegistry}.
///
/// ### Response Resolution Order
/// 1. Programmatically registered responses via {@link StubResponseRegistry}
/// 2. Resource files at `/stubs/{scenario}/{agentId}.txt`
/// 3. Files under the registry's stubs directory
/// 4. A generated, well-formed tagged reply shaped by the prompt
///
/// Generated replies recognise the arbiter prompts: a prompt asking for a `<ranking>`
/// gets a ranking, one asking for a `<response_id>` gets a pick, one asking for a
/// `<synthesis>` gets a full synthesis block. Every other prompt gets a
/// `<reasoning>`/`<answer>`/`<confidence>` reply.
///
/// @implNote Thread-safe. Uses the singleton {@link StubResponseRegistry} for lookup.
///
/// @see StubAgentProvider for enabling stub mode
public class StubAgent implements Agent {

    private static final Logger logger = Logger.getLogger(StubAgent.class.getName());

    static final double GENERATED_CONFIDENCE = 0.9;

    private final String id;
    private final AgentConfig config;
    private final StubResponseRegistry responseRegistry;

    /// Creates a new stub agent with the given configuration.
    ///
    /// @param id unique agent identifier, not null
    /// @param config agent configuration, not null
    public StubAgent(String id, AgentConfig config) {
        this.id = id;
        this.config = config;
        this.responseRegistry = StubResponseRegistry.getInstance();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AgentConfig getConfig() {
        return config;
    }

    @Override
    public AgentResponse execute(String prompt, String systemPrompt) {
        logger.info("[STUB] Agent '" + id + "' received prompt (" + prompt.length() + " chars)");

        String response = responseRegistry.getResponse(id);
        if (response == null) {
            response = generateTaggedResponse(prompt);
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("stub", true);
        metadata.put("model", config.getModel());
        metadata.put("prompt_length", prompt.length());
        metadata.put("scenario", responseRegistry.getScenario());

        return TextResponse.of(response, metadata);
    }

    private String generateTaggedResponse(String prompt) {
        if (prompt.contains("<ranking>")) {
            return """
                    <analysis>[STUB] Responses ranked in the order they were presented.</analysis>
                    <ranking>
                    <rank position="1">1</rank>
                    </ranking>""";
        }
        if (prompt.contains("<response_id>")) {
            return """
                    <analysis>[STUB] The first response was selected.</analysis>
                    <response_id>1</response_id>""";
        }
        if (prompt.contains("<synthesis>")) {
            return String.format(
                    """
                            <synthesis>[STUB SYNTHESIS from %s] Combined answer.</synthesis>
                            <confidence>%s</confidence>
                            <analysis>[STUB] All responses agree.</analysis>
                            <dissent></dissent>
                            <needs_iteration>false</needs_iteration>
                            <refinement_areas></refinement_areas>""",
                    id, GENERATED_CONFIDENCE);
        }

        return String.format(
                """
                        <reasoning>[STUB RESPONSE from %s] Model %s was not called.</reasoning>
                        <answer>Stub answer to: %s</answer>
                        <confidence>%s</confidence>""",
                id,
                config.getModel(),
                excerpt(prompt),
                GENERATED_CONFIDENCE);
    }

    private static String excerpt(String prompt) {
        String plain = prompt.replaceAll("<[^>]+>", " ").replaceAll("\\s+", " ").strip();
        return plain.length() > 120 ? plain.substring(0, 120) + "..." : plain;
    }
}
