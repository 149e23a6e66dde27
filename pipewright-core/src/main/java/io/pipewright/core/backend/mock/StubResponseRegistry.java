package io.pipewright.core.backend.mock;

import io.pipewright.core.state.StateKeys;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// Singleton registry of canned agent responses, organized by scenario.
///
/// Consulted by {@link MockAgentInvoker} when its own table has no entry for an agent.
///
/// ### Response Resolution Order
/// 1. Programmatically registered responses for the scenario
/// 2. Classpath resource: `/stubs/{scenario}/{agentName}.txt`
/// 3. Filesystem: `{stubsDir}/{scenario}/{agentName}.txt`
/// 4. The same three lookups in the `default` scenario
/// 5. `null`
///
/// ### Scenario Selection
/// - State key: `state.put("stub_scenario", "low_score")`
/// - System property: `-Dpipewright.stub.scenario=low_score`
/// - The caller's fallback scenario, usually from configuration
///
/// ### Template Variables
/// Responses support `{{key}}` placeholders, substituted from state.
///
/// @implNote Thread-safe singleton. Resource lookups are cached, misses included.
public final class StubResponseRegistry {

    private static final Logger logger = Logger.getLogger(StubResponseRegistry.class.getName());
    private static final String STUB_RESOURCE_BASE = "/stubs/";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    public static final String DEFAULT_SCENARIO = "default";
    public static final String SCENARIO_PROPERTY = "pipewright.stub.scenario";

    private static final StubResponseRegistry INSTANCE = new StubResponseRegistry();

    private final Map<String, Map<String, String>> registeredResponses = new ConcurrentHashMap<>();
    private final Map<String, String> resourceCache = new ConcurrentHashMap<>();
    private volatile Path stubsDirectory;

    private StubResponseRegistry() {}

    public static StubResponseRegistry getInstance() {
        return INSTANCE;
    }

    /// Registers a response for one agent in one scenario, replacing any previous one.
    ///
    /// @param scenario scenario name, not null
    /// @param agentName agent to answer for, not null
    /// @param response response text, may contain `{{key}}` placeholders, not null
    public void registerResponse(String scenario, String agentName, String response) {
        registeredResponses
                .computeIfAbsent(scenario, key -> new ConcurrentHashMap<>())
                .put(agentName, response);
        logger.fine("Registered stub response for scenario=" + scenario + ", agent=" + agentName);
    }

    public void registerResponse(String agentName, String response) {
        registerResponse(DEFAULT_SCENARIO, agentName, response);
    }

    /// Clears all registered responses and cached resources.
    public void clearResponses() {
        registeredResponses.clear();
        resourceCache.clear();
    }

    public void clearScenario(String scenario) {
        registeredResponses.remove(scenario);
        resourceCache.keySet().removeIf(key -> key.startsWith(scenario + "/"));
    }

    /// Sets the filesystem directory searched after classpath resources.
    ///
    /// @apiNote **Side effects**: clears the resource cache
    ///
    /// @param path directory laid out as `{path}/{scenario}/{agentName}.txt`, not null
    public void setStubsDirectory(Path path) {
        this.stubsDirectory = path;
        resourceCache.clear();
        logger.info("[STUB] Filesystem stubs directory set to: " + path);
    }

    public void clearStubsDirectory() {
        this.stubsDirectory = null;
        resourceCache.clear();
    }

    /// Resolves a response for the agent.
    ///
    /// @param agentName agent name, not null
    /// @param state current state, used for scenario selection and substitution, may be null
    /// @param fallbackScenario scenario used when neither state nor system property names
    ///     one, may be null
    /// @return response with placeholders substituted, or null when none is configured
    public String getResponse(String agentName, Map<String, Object> state, String fallbackScenario) {
        String scenario = scenario(state, fallbackScenario);
        String response = lookup(scenario, agentName);
        if (response == null && !DEFAULT_SCENARIO.equals(scenario)) {
            response = lookup(DEFAULT_SCENARIO, agentName);
        }
        if (response == null) {
            logger.fine("[STUB] No response for agent '" + agentName + "' (scenario: " + scenario + ")");
            return null;
        }
        logger.info("[STUB] Using response for agent '" + agentName + "' (scenario: " + scenario + ")");
        return substitute(response, state);
    }

    public String getResponse(String agentName, Map<String, Object> state) {
        return getResponse(agentName, state, null);
    }

    /// Returns the default scenario plus every scenario with registered responses.
    ///
    /// @return sorted scenario names, never null
    public Set<String> getAvailableScenarios() {
        Set<String> scenarios = new TreeSet<>(registeredResponses.keySet());
        scenarios.add(DEFAULT_SCENARIO);
        return scenarios;
    }

    private String lookup(String scenario, String agentName) {
        Map<String, String> scenarioResponses = registeredResponses.get(scenario);
        if (scenarioResponses != null && scenarioResponses.containsKey(agentName)) {
            return scenarioResponses.get(agentName);
        }
        String response = loadResourceResponse(scenario, agentName);
        return response != null ? response : loadFilesystemResponse(scenario, agentName);
    }

    private static String scenario(Map<String, Object> state, String fallbackScenario) {
        if (state != null) {
            Object scenario = state.get(StateKeys.STUB_SCENARIO);
            if (scenario != null) {
                return scenario.toString();
            }
        }
        String property = System.getProperty(SCENARIO_PROPERTY);
        if (property != null && !property.isBlank()) {
            return property;
        }
        return fallbackScenario != null && !fallbackScenario.isBlank()
                ? fallbackScenario
                : DEFAULT_SCENARIO;
    }

    private String loadResourceResponse(String scenario, String agentName) {
        String cacheKey = scenario + "/" + agentName;
        String cached = resourceCache.get(cacheKey);
        if (cached != null) {
            return cached.isEmpty() ? null : cached;
        }
        String content = loadResource(STUB_RESOURCE_BASE + scenario + "/" + agentName + ".txt");
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

    private String loadFilesystemResponse(String scenario, String agentName) {
        Path dir = stubsDirectory;
        if (dir == null) {
            return null;
        }
        String cacheKey = "fs:" + scenario + "/" + agentName;
        String cached = resourceCache.get(cacheKey);
        if (cached != null) {
            return cached.isEmpty() ? null : cached;
        }
        Path file = dir.resolve(scenario).resolve(agentName + ".txt");
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

    private static String substitute(String response, Map<String, Object> state) {
        if (state == null) {
            return response;
        }
        Matcher matcher = PLACEHOLDER.matcher(response);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = state.get(matcher.group(1));
            matcher.appendReplacement(
                    result, value != null ? Matcher.quoteReplacement(value.toString()) : "");
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
