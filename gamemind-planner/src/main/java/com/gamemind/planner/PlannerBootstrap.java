package com.gamemind.planner;

import com.gamemind.config.PlannerConfig;
import com.gamemind.config.PlannerConfigLoader;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles a ready {@link HierarchicalPlanner}: loads configuration, selects the oracle variant and wires
 * metrics. Invalid configuration fails here with {@link IllegalArgumentException}, before any planner exists.
 */
public final class PlannerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(PlannerBootstrap.class);

    private PlannerBootstrap() {
    }

    /** Loads configuration from the file named by GAMEMIND_PLANNER_CONFIG plus environment overrides. */
    public static HierarchicalPlanner fromEnvironment() {
        log.info("Bootstrap: loading planner configuration from environment");
        return create(PlannerConfigLoader.fromEnvironment().load());
    }

    public static HierarchicalPlanner create(PlannerConfig config) {
        return create(config, new SimpleMeterRegistry());
    }

    public static HierarchicalPlanner create(PlannerConfig config, MeterRegistry registry) {
        return HierarchicalPlanner.builder(config)
                .metrics(new PlannerMetrics(registry))
                .build();
    }
}
