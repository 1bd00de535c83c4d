package com.gamemind.oracle;

import com.gamemind.config.OracleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Oracle backed by a text-generation {@link OracleBackend}, answering from a {@link FallbackOracle}
 * whenever the backend fails, times out or returns nothing usable.
 * <p>
 * When {@link OracleConfig#isProbeOnStart()} is set, the backend is checked once on construction; if the
 * check fails the oracle disables itself and routes every call to the fallback. Construction never fails
 * because of the backend.
 * <p>
 * Thread-safe as long as the backend is: this class holds only immutable state.
 */
public final class RemoteOracle implements SubgoalOracle {

    private static final Logger log = LoggerFactory.getLogger(RemoteOracle.class);

    private final OracleBackend backend;
    private final OracleConfig config;
    private final FallbackOracle fallback;
    private final SubgoalResponseParser parser = new SubgoalResponseParser();
    private final boolean available;

    public RemoteOracle(OracleBackend backend, OracleConfig config, FallbackOracle fallback) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.config = Objects.requireNonNull(config, "config");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.available = !config.isProbeOnStart() || probe(backend);
    }

    public RemoteOracle(OracleBackend backend, OracleConfig config) {
        this(backend, config, new FallbackOracle());
    }

    private static boolean probe(OracleBackend backend) {
        boolean ok;
        try {
            ok = backend.isAvailable();
        } catch (RuntimeException e) {
            log.warn("Oracle backend probe failed: {}", e.getMessage());
            ok = false;
        }
        if (ok) {
            log.info("Oracle backend is available; remote subgoal generation enabled");
        } else {
            log.warn("Oracle backend is unavailable; all subgoal requests will use the rule-based fallback");
        }
        return ok;
    }

    /** False when the startup probe failed and every call is answered by the fallback. */
    public boolean isAvailable() {
        return available;
    }

    @Override
    public List<String> generateSubgoals(String goal, Object currentState) {
        String g = goal != null ? goal : "";
        if (!available) {
            return fallback.generateSubgoals(g, currentState);
        }
        String response;
        try {
            String prompt = OraclePrompts.subgoalPrompt(config.getPrompts(), g, currentState);
            log.debug("Requesting subgoals for goal='{}'", g);
            response = backend.generate(prompt, config.getMaxTokens(), config.getTemperature());
        } catch (OracleBackendException e) {
            log.warn("Subgoal generation failed for goal='{}', using fallback: {}", g, e.getMessage());
            return fallback.generateSubgoals(g, currentState);
        } catch (RuntimeException e) {
            log.warn("Unexpected error while requesting subgoals for goal='{}', using fallback", g, e);
            return fallback.generateSubgoals(g, currentState);
        }
        List<String> subgoals = parser.parse(response);
        if (subgoals.isEmpty()) {
            log.warn("Oracle response for goal='{}' had no usable subgoals, using fallback", g);
            log.debug("Raw oracle response: {}", response);
            return fallback.generateSubgoals(g, currentState);
        }
        log.debug("Oracle produced {} subgoals for goal='{}': {}", subgoals.size(), g, subgoals);
        return List.copyOf(subgoals);
    }

    @Override
    public TaskAnalysis analyzeTask(String task) {
        String t = task != null ? task : "";
        if (!available) {
            return fallback.analyzeTask(t);
        }
        String response;
        try {
            response = backend.generate(OraclePrompts.taskAnalysisPrompt(config.getPrompts(), t),
                    config.getMaxTokens(), config.getTemperature());
        } catch (OracleBackendException e) {
            log.warn("Task analysis failed for task='{}', using fallback: {}", t, e.getMessage());
            return fallback.analyzeTask(t);
        } catch (RuntimeException e) {
            log.warn("Unexpected error while analyzing task='{}', using fallback", t, e);
            return fallback.analyzeTask(t);
        }
        if (response == null || response.isBlank()) {
            log.warn("Oracle returned an empty analysis for task='{}', using fallback", t);
            return fallback.analyzeTask(t);
        }
        return TaskAnalyzer.analyze(t, response.strip());
    }
}
