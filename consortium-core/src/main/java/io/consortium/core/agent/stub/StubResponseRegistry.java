package io.consortium.core.agent.stub;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Singleton registry for configurable stub replies.
///
/// ### Response Resolution Order
/// 1. Programmatically registered responses (highest priority)
/// 2. Classpath resource: `/stubs/{scenario}/{agentId}.txt`
/// 3. Filesystem: `{stubsDir}/{scenario}/{agentId}.txt`
/// 4. The same two lookups in the `default` scenario
/// 5. Returns null (triggers reply generation in {@link StubAgent})
///
/// A registered sequence hands out one reply per call and keeps repeating its last
/// reply once exhausted, so multi-round runs can script a rising arbiter confidence.
///
/// ### Scenario Selection
/// - Programmatic: {@link #setScenario(String)}
/// - System property: `-Dconsortium.stub.scenario=disagreement`
/// - Default: `"default"`
///
/// @implNote Thread-safe singleton. Uses {@link ConcurrentHashMap} for storage.
/// Resource loading is cached to avoid repeated file I/O.
public class StubResponseRegistry {

    private static final Logger logger = Logger.getLogger(StubResponseRegistry.class.getName());
    private static final String STUB_RESOURCE_BASE = "/stubs/";
    private static final String DEFAULT_SCENARIO = "default";
    private static final String SCENARIO_PROPERTY = "consortium.stub.scenario";

    private static final StubResponseRegistry INSTANCE = new StubResponseRegistry();

    private final Map<String, Map<String, Deque<String>>> registeredResponses =
            new ConcurrentHashMap<>();
    private final Map<String, String> resourceCache = new ConcurrentHashMap<>();
    private volatile Path stubsDirectory;
    private volatile String scenario;

    private StubResponseRegistry() {}

    /// @return the shared registry instance, never null
    public static StubResponseRegistry getInstance() {
        return INSTANCE;
    }

    /// Registers a fixed reply for an agent in a scenario.
    ///
    /// @apiNote **Side effects**:
    /// - Replaces any reply or sequence already registered for the key
    ///
    /// @param scenario the scenario name, not null
    /// @param agentId the agent ID to match, not null
    /// @param response the reply text, not null
    public void registerResponse(String scenario, String agentId, String response) {
        registerSequence(scenario, agentId, List.of(response));
    }

    /// Registers a fixed reply for an agent in the default scenario.
    public void registerResponse(String agentId, String response) {
        registerResponse(DEFAULT_SCENARIO, agentId, response);
    }

    /// Registers replies handed out in order, one per invocation of the agent.
    ///
    /// @param scenario the scenario name, not null
    /// @param agentId the agent ID to match, not null
    /// @param responses the replies, not empty
    /// @throws IllegalArgumentException if responses is empty
    public void registerSequence(String scenario, String agentId, List<String> responses) {
        if (responses.isEmpty()) {
            throw new IllegalArgumentException("Stub sequence must not be empty");
        }
        registeredResponses
                .computeIfAbsent(scenario, key -> new ConcurrentHashMap<>())
                .put(agentId, new ArrayDeque<>(responses));
        logger.fine(
                "Registered "
                        + responses.size()
                        + " stub response(s) for scenario="
                        + scenario
                        + ", agent="
                        + agentId);
    }

    /// Clears all registered responses, cached resources and the scenario override.
    public void clearResponses() {
        registeredResponses.clear();
        resourceCache.clear();
        scenario = null;
    }

    /// Sets the filesystem directory searched after classpath resources.
    ///
    /// Expected structure: `{path}/{scenario}/{agentId}.txt`.
    ///
    /// @param path the stubs directory, not null
    public void setStubsDirectory(Path path) {
        this.stubsDirectory = path;
        resourceCache.clear();
        logger.info("[STUB] Filesystem stubs directory set to: " + path);
    }

    /// Removes the filesystem stubs directory, reverting to classpath-only resolution.
    public void clearStubsDirectory() {
        this.stubsDirectory = null;
        resourceCache.clear();
    }

    /// Overrides the scenario for subsequent lookups; null reverts to the system property.
    public void setScenario(String scenario) {
        this.scenario = scenario;
    }

    /// @return the active scenario, never null
    public String getScenario() {
        String override = scenario;
        if (override != null && !override.isBlank()) {
            return override;
        }
        String sysProp = System.getProperty(SCENARIO_PROPERTY);
        if (sysProp != null && !sysProp.isBlank()) {
            return sysProp;
        }
        return DEFAULT_SCENARIO;
    }

    /// Resolves the next stub reply for an agent.
    ///
    /// @param agentId the agent ID, not null
    /// @return the reply, or null when nothing is configured
    public String getResponse(String agentId) {
        String active = getScenario();

        String response = nextRegisteredResponse(active, agentId);
        if (response == null && !DEFAULT_SCENARIO.equals(active)) {
            response = nextRegisteredResponse(DEFAULT_SCENARIO, agentId);
        }
        if (response != null) {
            logger.info("[STUB] Using registered response for agent: " + agentId);
            return response;
        }

        response = loadStoredResponse(active, agentId);
        if (response == null && !DEFAULT_SCENARIO.equals(active)) {
            response = loadStoredResponse(DEFAULT_SCENARIO, agentId);
        }
        if (response != null) {
            logger.info("[STUB] Loaded stored response for agent: " + agentId);
            return response;
        }

        logger.fine("[STUB] Generating fallback response for: " + agentId);
        return null;
    }

    private String nextRegisteredResponse(String scenario, String agentId) {
        Map<String, Deque<String>> scenarioResponses = registeredResponses.get(scenario);
        if (scenarioResponses == null) {
            return null;
        }
        Deque<String> queue = scenarioResponses.get(agentId);
        if (queue == null) {
            return null;
        }
        synchronized (queue) {
            return queue.size() > 1 ? queue.pollFirst() : queue.peekFirst();
        }
    }

    private String loadStoredResponse(String scenario, String agentId) {
        String content = loadResourceResponse(scenario, agentId);
        return content != null ? content : loadFilesystemResponse(scenario, agentId);
    }

    private String loadResourceResponse(String scenario, String key) {
        String cacheKey = scenario + "/" + key;
        String cached = resourceCache.get(cacheKey);
        if (cached != null) {
            return cached.isEmpty() ? null : cached;
        }

        String content = loadResource(STUB_RESOURCE_BASE + scenario + "/" + key + ".txt");
        resourceCache.put(cacheKey, content != null ? content : "");
        return content;
    }

    private String loadResource(String path) {
        try (InputStream is = getClass().getResourceAsStream(path)) {
            if (is == null) {
                return null;
            }
            try (BufferedReader reader =
                    new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            }
        } catch (IOException e) {
            logger.warning("Failed to load stub resource: " + path + " - " + e.getMessage());
            return null;
        }
    }

    private String loadFilesystemResponse(String scenario, String key) {
        Path dir = stubsDirectory;
        if (dir == null) {
            return null;
        }

        String cacheKey = "fs:" + scenario + "/" + key;
        String cached = resourceCache.get(cacheKey);
        if (cached != null) {
            return cached.isEmpty() ? null : cached;
        }

        Path file = dir.resolve(scenario).resolve(key + ".txt");
        String content = null;
        if (Files.isRegularFile(file)) {
            try {
                content = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                logger.warning("Failed to load filesystem stub: " + file + " - " + e.getMessage());
            }
        }

        resourceCache.put(cacheKey, content != null ? content : "");
        return content;
    }
}
