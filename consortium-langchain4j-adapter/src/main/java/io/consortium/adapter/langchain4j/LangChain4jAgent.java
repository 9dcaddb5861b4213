package io.consortium.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.ChatResponseMetadata;
import io.consortium.core.agent.Agent;
import io.consortium.core.agent.AgentConfig;
import io.consortium.core.agent.AgentResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link Agent}.
///
/// Sends a single stateless exchange per call: an optional system message built from
/// the agent's configured instructions and the caller's system prompt, followed by the
/// prompt as a user message. Nothing is carried over between calls, since every round
/// of a consortium run sends a self-contained prompt.
///
/// Failures never escape as exceptions: they come back as {@link AgentResponse.Error},
/// classified by the exception's cause chain.
///
/// @implNote Thread-safe. The same instance serves every parallel instance of a roster
/// entry; LangChain4j chat models are safe for concurrent use.
///
/// @see LangChain4jProvider for agent creation
/// @see Agent for the contract
public class LangChain4jAgent implements Agent {

    private static final Logger logger = Logger.getLogger(LangChain4jAgent.class.getName());

    private final String id;
    private final AgentConfig config;
    private final ChatModel model;

    /// Creates a new agent wrapping the given chat model.
    ///
    /// @param id unique agent identifier, not null
    /// @param config agent configuration (instructions, model params), not null
    /// @param model the LangChain4j chat model to delegate to, not null
    public LangChain4jAgent(String id, AgentConfig config, ChatModel model) {
        this.id = id;
        this.config = config;
        this.model = model;
    }

    /// Executes the prompt against the underlying chat model.
    ///
    /// @param prompt the full prompt text, not null
    /// @param systemPrompt caller-supplied system instructions, may be null
    /// @return text response with metadata on success, error response on failure; never null
    @Override
    public AgentResponse execute(String prompt, String systemPrompt) {
        Instant startTime = Instant.now();

        try {
            logger.fine("Agent '" + id + "' calling model " + config.getModel());

            ChatResponse response = model.chat(buildMessages(prompt, systemPrompt));

            if (response == null || response.aiMessage() == null) {
                return AgentResponse.Error.of("No response from model " + config.getModel());
            }

            AiMessage aiMessage = response.aiMessage();
            String output = aiMessage.text();
            if (output == null) {
                return AgentResponse.Error.of(
                        "Model " + config.getModel() + " returned no text content");
            }

            Map<String, Object> metadata = buildMetadata(response, startTime);
            logger.fine("Agent '" + id + "' completed successfully");

            return AgentResponse.TextResponse.of(output, metadata);

        } catch (RuntimeException e) {
            logger.severe("Agent '" + id + "' execution failed: " + e.getMessage());
            return AgentResponse.Error.from(e);
        }
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AgentConfig getConfig() {
        return config;
    }

    /// Builds the ordered message list: system message, then user prompt.
    List<ChatMessage> buildMessages(String prompt, String systemPrompt) {
        List<ChatMessage> messages = new ArrayList<>(2);

        String system = buildSystemPrompt(config.getInstructions(), systemPrompt);
        if (!system.isEmpty()) {
            messages.add(SystemMessage.from(system));
        }

        messages.add(UserMessage.from(prompt));
        return messages;
    }

    private static String buildSystemPrompt(String instructions, String systemPrompt) {
        List<String> parts = new ArrayList<>(2);
        if (instructions != null && !instructions.isBlank()) {
            parts.add(instructions.strip());
        }
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            parts.add(systemPrompt.strip());
        }
        return String.join("\n\n", parts);
    }

    /// Extracts response metadata including token usage and finish reason.
    private Map<String, Object> buildMetadata(ChatResponse response, Instant startTime) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("agent_id", id);
        metadata.put("model", config.getModel());
        metadata.put("timestamp", startTime.toString());
        metadata.put("duration_ms", Duration.between(startTime, Instant.now()).toMillis());

        ChatResponseMetadata responseMetadata = response.metadata();
        if (responseMetadata == null) {
            return metadata;
        }

        var tokenUsage = responseMetadata.tokenUsage();
        if (tokenUsage != null) {
            putIfPresent(metadata, "input_tokens", tokenUsage.inputTokenCount());
            putIfPresent(metadata, "output_tokens", tokenUsage.outputTokenCount());
            putIfPresent(metadata, "total_tokens", tokenUsage.totalTokenCount());
        }

        var finishReason = responseMetadata.finishReason();
        if (finishReason != null) {
            metadata.put("finish_reason", finishReason.toString());
        }

        return metadata;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
