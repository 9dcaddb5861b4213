package io.consortium.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.consortium.core.agent.Agent;
import io.consortium.core.agent.AgentConfig;
import io.consortium.core.agent.spi.AgentProvider;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/// Resolves roster identifiers such as `claude-sonnet-4`, `gpt-4o` or
/// `deepseek-chat` to LangChain4j chat models.
///
/// An identifier without explicit configuration arrives here as its own model name,
/// so the name prefix picks the {@link ModelFamily}. Each family names the credential
/// keys it accepts; a missing key fails agent creation, which the orchestrator
/// reports before the first round is dispatched.
///
/// Sampling defaults apply when the {@link AgentConfig} leaves a value unset. The
/// `maxRetries` value is handed to the LangChain4j client; the orchestrator itself
/// never retries an agent.
///
/// @implNote Stateless and thread-safe. Every {@link #createAgent} call builds a new
/// chat model.
///
/// @see LangChain4jAgent
public class LangChain4jProvider implements AgentProvider {

    private static final Logger logger = Logger.getLogger(LangChain4jProvider.class.getName());

    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);
    private static final double DEFAULT_TEMPERATURE = 0.7;
    private static final int DEFAULT_MAX_RETRIES = 2;

    /// Hosted model families, matched by model name prefix.
    enum ModelFamily {
        ANTHROPIC(List.of("claude"), "anthropic_api_key", "ANTHROPIC_API_KEY"),
        OPENAI(List.of("gpt", "chatgpt", "o1", "o3", "o4"), "openai_api_key", "OPENAI_API_KEY"),
        GOOGLE(List.of("gemini", "gemma"), "google_api_key", "GOOGLE_API_KEY"),
        // OpenAI-compatible endpoint
        DEEPSEEK(List.of("deepseek"), "deepseek_api_key", "DEEPSEEK_API_KEY");

        private final List<String> prefixes;
        private final String[] credentialKeys;

        ModelFamily(List<String> prefixes, String... credentialKeys) {
            this.prefixes = prefixes;
            this.credentialKeys = credentialKeys;
        }

        static Optional<ModelFamily> of(String modelName) {
            if (modelName == null) {
                return Optional.empty();
            }
            for (ModelFamily family : values()) {
                if (family.prefixes.stream().anyMatch(modelName::startsWith)) {
                    return Optional.of(family);
                }
            }
            return Optional.empty();
        }
    }

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsModel(String modelName) {
        return ModelFamily.of(modelName).isPresent();
    }

    @Override
    public Agent createAgent(String agentId, AgentConfig config, Map<String, String> credentials) {
        ModelFamily family =
                ModelFamily.of(config.getModel())
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Unsupported model: " + config.getModel()));
        String apiKey = requireApiKey(credentials, family.credentialKeys);

        logger.info(
                "Creating " + family + " agent '" + agentId + "' for model " + config.getModel());
        return new LangChain4jAgent(agentId, config, createModel(family, config, apiKey));
    }

    @Override
    public int getPriority() {
        return 100;
    }

    private ChatModel createModel(ModelFamily family, AgentConfig config, String apiKey) {
        switch (family) {
            case ANTHROPIC:
                return anthropic(config, apiKey);
            case GOOGLE:
                return gemini(config, apiKey);
            case DEEPSEEK:
                return openAiCompatible(config, apiKey, DEEPSEEK_BASE_URL);
            case OPENAI:
            default:
                return openAiCompatible(config, apiKey, null);
        }
    }

    private ChatModel anthropic(AgentConfig config, String apiKey) {
        var builder =
                AnthropicChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModel())
                        .temperature(temperature(config))
                        .maxTokens(maxTokens(config))
                        .timeout(timeout(config))
                        .maxRetries(maxRetries(config));
        if (config.getTopP() != null) builder.topP(config.getTopP());
        return builder.build();
    }

    /// @param baseUrl endpoint override, null for api.openai.com
    private ChatModel openAiCompatible(AgentConfig config, String apiKey, String baseUrl) {
        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModel())
                        .temperature(temperature(config))
                        .maxTokens(maxTokens(config))
                        .timeout(timeout(config))
                        .maxRetries(maxRetries(config));
        if (baseUrl != null) builder.baseUrl(baseUrl);
        if (config.getTopP() != null) builder.topP(config.getTopP());
        return builder.build();
    }

    private ChatModel gemini(AgentConfig config, String apiKey) {
        var builder =
                GoogleAiGeminiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModel())
                        .temperature(temperature(config))
                        .maxOutputTokens(maxTokens(config))
                        .timeout(timeout(config))
                        .maxRetries(maxRetries(config));
        if (config.getTopP() != null) builder.topP(config.getTopP());
        return builder.build();
    }

    /// Returns the first non-blank credential among `keyNames`.
    ///
    /// @throws IllegalStateException if none is set
    static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }

    private static double temperature(AgentConfig config) {
        return config.getTemperature() != null ? config.getTemperature() : DEFAULT_TEMPERATURE;
    }

    private static int maxTokens(AgentConfig config) {
        return config.getMaxTokens() != null ? config.getMaxTokens() : DEFAULT_MAX_TOKENS;
    }

    private static Duration timeout(AgentConfig config) {
        return config.getTimeout() != null ? config.getTimeout() : DEFAULT_TIMEOUT;
    }

    private static int maxRetries(AgentConfig config) {
        return config.getMaxRetries() != null ? config.getMaxRetries() : DEFAULT_MAX_RETRIES;
    }
}
