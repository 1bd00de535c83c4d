package com.gamemind.planner;

import com.gamemind.config.OracleConfig;
import com.gamemind.config.PlannerConfig;
import com.gamemind.oracle.FallbackOracle;
import com.gamemind.oracle.OracleBackend;
import com.gamemind.oracle.RemoteOracle;
import com.gamemind.oracle.SubgoalOracle;
import com.gamemind.oracle.ollama.OllamaClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/** Chooses the {@link SubgoalOracle} variant for a configuration. */
public final class SubgoalOracles {

    private static final Logger log = LoggerFactory.getLogger(SubgoalOracles.class);

    private SubgoalOracles() {
    }

    /** Remote oracle over Ollama when subgoal generation and the oracle are both enabled, else the rule table. */
    public static SubgoalOracle create(PlannerConfig config) {
        return create(config, OllamaClient::new);
    }

    /**
     * @param backendFactory builds the backend for a remote oracle; not called when the rule table is chosen
     */
    public static SubgoalOracle create(PlannerConfig config, Function<OracleConfig, OracleBackend> backendFactory) {
        OracleConfig oracle = config.getOracle();
        if (!config.getSubgoalGeneration().isEnabled() || !oracle.isEnabled()) {
            log.info("Using rule-based subgoal oracle (subgoalGeneration.enabled={}, oracle.enabled={})",
                    config.getSubgoalGeneration().isEnabled(), oracle.isEnabled());
            return new FallbackOracle();
        }
        log.info("Using remote subgoal oracle: baseUrl={}, model={}", oracle.getBaseUrl(), oracle.getModelName());
        return new RemoteOracle(backendFactory.apply(oracle), oracle);
    }
}
