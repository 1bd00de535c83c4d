package com.gamemind.planner;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Planner meters: {@value #PLANS} counted per {@link PlanOutcome}, {@value #REPLANS} and the
 * {@value #SEARCH_DURATION} timer. Meters are registered once on construction and are thread-safe.
 */
public final class PlannerMetrics {

    public static final String PLANS = "gamemind.planner.plans";
    public static final String REPLANS = "gamemind.planner.replans";
    public static final String SEARCH_DURATION = "gamemind.search.duration";

    /** How a {@code plan} call ended. Tag value is the lower-case name. */
    public enum PlanOutcome {
        PLANNED,
        DISABLED,
        NO_SUBGOALS,
        ORACLE_FAILED,
        SEARCH_FAILED;

        String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final MeterRegistry registry;
    private final Map<PlanOutcome, Counter> plans = new EnumMap<>(PlanOutcome.class);
    private final Counter replans;
    private final Timer searchDuration;

    public PlannerMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        for (PlanOutcome outcome : PlanOutcome.values()) {
            plans.put(outcome, Counter.builder(PLANS)
                    .description("Planning calls by outcome")
                    .tag("outcome", outcome.tagValue())
                    .register(registry));
        }
        this.replans = Counter.builder(REPLANS)
                .description("Replans triggered by a negative reward")
                .register(registry);
        this.searchDuration = Timer.builder(SEARCH_DURATION)
                .description("Wall time of one tree search")
                .register(registry);
    }

    /** Metrics over a private in-memory registry. */
    public PlannerMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    void recordPlan(PlanOutcome outcome) {
        plans.get(outcome).increment();
    }

    void recordReplan() {
        replans.increment();
    }

    Timer searchTimer() {
        return searchDuration;
    }

    public double planCount(PlanOutcome outcome) {
        return plans.get(outcome).count();
    }

    public double replanCount() {
        return replans.count();
    }
}
