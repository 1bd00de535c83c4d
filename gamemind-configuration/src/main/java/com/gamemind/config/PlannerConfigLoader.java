package com.gamemind.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Loads {@link PlannerConfig} from a JSON file and applies environment overrides.
 * <p>
 * File: {@code GAMEMIND_PLANNER_CONFIG} (default {@code config/planner.json}); a missing file means defaults.
 * Overrides, applied after the file: OLLAMA_BASE_URL, OLLAMA_MODEL, OLLAMA_API_KEY, GAMEMIND_PLANNER_ENABLED,
 * GAMEMIND_ORACLE_ENABLED. Invalid content fails with {@link IllegalArgumentException}; an unreadable file
 * with {@link UncheckedIOException}.
 */
public final class PlannerConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PlannerConfigLoader.class);

    public static final String ENV_CONFIG_FILE = "GAMEMIND_PLANNER_CONFIG";
    public static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    public static final String ENV_OLLAMA_MODEL = "OLLAMA_MODEL";
    public static final String ENV_OLLAMA_API_KEY = "OLLAMA_API_KEY";
    public static final String ENV_PLANNER_ENABLED = "GAMEMIND_PLANNER_ENABLED";
    public static final String ENV_ORACLE_ENABLED = "GAMEMIND_ORACLE_ENABLED";

    private static final String DEFAULT_CONFIG_FILE = "config/planner.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path configFile;
    private final Function<String, String> environment;

    /**
     * @param configFile  JSON file to read; null or missing means defaults
     * @param environment variable lookup (e.g. {@code System::getenv}); returns null for unset names
     */
    public PlannerConfigLoader(Path configFile, Function<String, String> environment) {
        this.configFile = configFile;
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /** Loader reading the file named by GAMEMIND_PLANNER_CONFIG and overrides from the process environment. */
    public static PlannerConfigLoader fromEnvironment() {
        String file = System.getenv(ENV_CONFIG_FILE);
        Path path = Path.of(file != null && !file.isBlank() ? file.trim() : DEFAULT_CONFIG_FILE);
        return new PlannerConfigLoader(path, System::getenv);
    }

    /**
     * Reads the file (if present) and applies environment overrides.
     *
     * @return validated configuration (never null)
     */
    public PlannerConfig load() {
        PlannerConfig fromFile = readFile();
        PlannerConfig effective = applyEnvironmentOverrides(fromFile);
        log.info("Planner configuration loaded: {}", effective);
        return effective;
    }

    /**
     * Parses a planner configuration document.
     *
     * @throws IllegalArgumentException on malformed JSON, unknown keys or out-of-range values
     */
    public static PlannerConfig fromJson(String json) {
        if (json == null || json.isBlank()) {
            return PlannerConfig.defaults();
        }
        try {
            return MAPPER.readValue(json, PlannerConfig.class);
        } catch (ValueInstantiationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException("Invalid planner configuration: " + cause.getMessage(), cause);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid planner configuration: " + e.getOriginalMessage(), e);
        }
    }

    private PlannerConfig readFile() {
        if (configFile == null || !Files.isRegularFile(configFile)) {
            log.info("No planner configuration file at {}; using defaults", configFile);
            return PlannerConfig.defaults();
        }
        String json;
        try {
            json = Files.readString(configFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read planner configuration file " + configFile, e);
        }
        PlannerConfig config = fromJson(json);
        log.info("Planner configuration read from file: {}", configFile);
        return config;
    }

    private PlannerConfig applyEnvironmentOverrides(PlannerConfig config) {
        String baseUrl = env(ENV_OLLAMA_BASE_URL);
        String model = env(ENV_OLLAMA_MODEL);
        String apiKey = env(ENV_OLLAMA_API_KEY);
        String plannerEnabled = env(ENV_PLANNER_ENABLED);
        String oracleEnabled = env(ENV_ORACLE_ENABLED);
        if (baseUrl == null && model == null && apiKey == null && plannerEnabled == null && oracleEnabled == null) {
            return config;
        }

        OracleConfig.Builder oracle = config.getOracle().toBuilder();
        if (baseUrl != null) oracle.baseUrl(baseUrl);
        if (model != null) oracle.modelName(model);
        if (apiKey != null) oracle.apiKey(apiKey);
        if (oracleEnabled != null) oracle.enabled(parseBoolean(ENV_ORACLE_ENABLED, oracleEnabled));

        PlannerConfig.Builder planner = config.toBuilder().oracle(oracle.build());
        if (plannerEnabled != null) planner.enabled(parseBoolean(ENV_PLANNER_ENABLED, plannerEnabled));
        log.debug("Applied environment overrides to planner configuration");
        return planner.build();
    }

    private String env(String name) {
        String value = environment.apply(name);
        return value != null && !value.isBlank() ? value.trim() : null;
    }

    private static boolean parseBoolean(String name, String value) {
        if ("true".equalsIgnoreCase(value)) return true;
        if ("false".equalsIgnoreCase(value)) return false;
        throw new IllegalArgumentException(name + " must be true or false but was " + value);
    }
}
