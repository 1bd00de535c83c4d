package com.gamemind.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable planner configuration: tree search budget and shape, subgoal generation and the remote oracle.
 * <p>
 * Built once, either through {@link #builder()} or from JSON by {@link PlannerConfigLoader}. Missing values
 * take defaults ({@code enabled=true}, {@code mctsSimulations=100}, {@code maxDepth=10},
 * {@code explorationConstant=1.0}, {@code rolloutSteps=10}); out-of-range values are rejected with
 * {@link IllegalArgumentException} here, never later at planning time.
 */
public final class PlannerConfig {

    public static final int DEFAULT_MCTS_SIMULATIONS = 100;
    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final double DEFAULT_EXPLORATION_CONSTANT = 1.0;
    public static final int DEFAULT_ROLLOUT_STEPS = 10;

    private final boolean enabled;
    private final int mctsSimulations;
    private final int maxDepth;
    private final double explorationConstant;
    private final int rolloutSteps;
    private final Long randomSeed;
    private final SubgoalGenerationConfig subgoalGeneration;
    private final OracleConfig oracle;

    @JsonCreator
    public PlannerConfig(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("mctsSimulations") Integer mctsSimulations,
            @JsonProperty("maxDepth") Integer maxDepth,
            @JsonProperty("explorationConstant") Double explorationConstant,
            @JsonProperty("rolloutSteps") Integer rolloutSteps,
            @JsonProperty("randomSeed") Long randomSeed,
            @JsonProperty("subgoalGeneration") SubgoalGenerationConfig subgoalGeneration,
            @JsonProperty("oracle") OracleConfig oracle) {
        this.enabled = enabled != null ? enabled : true;
        this.mctsSimulations = mctsSimulations != null ? mctsSimulations : DEFAULT_MCTS_SIMULATIONS;
        this.maxDepth = maxDepth != null ? maxDepth : DEFAULT_MAX_DEPTH;
        this.explorationConstant = explorationConstant != null ? explorationConstant : DEFAULT_EXPLORATION_CONSTANT;
        this.rolloutSteps = rolloutSteps != null ? rolloutSteps : DEFAULT_ROLLOUT_STEPS;
        this.randomSeed = randomSeed;
        this.subgoalGeneration = subgoalGeneration != null ? subgoalGeneration : SubgoalGenerationConfig.DEFAULTS;
        this.oracle = oracle != null ? oracle : OracleConfig.DEFAULTS;

        if (this.mctsSimulations < 1) {
            throw new IllegalArgumentException("mctsSimulations must be >= 1 but was " + this.mctsSimulations);
        }
        if (this.maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1 but was " + this.maxDepth);
        }
        if (!(this.explorationConstant >= 0) || Double.isInfinite(this.explorationConstant)) {
            throw new IllegalArgumentException(
                    "explorationConstant must be a finite value >= 0 but was " + this.explorationConstant);
        }
        if (this.rolloutSteps < 1) {
            throw new IllegalArgumentException("rolloutSteps must be >= 1 but was " + this.rolloutSteps);
        }
    }

    /** Configuration with every default applied. */
    public static PlannerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this configuration's values. */
    public Builder toBuilder() {
        Builder b = new Builder()
                .enabled(enabled)
                .mctsSimulations(mctsSimulations)
                .maxDepth(maxDepth)
                .explorationConstant(explorationConstant)
                .rolloutSteps(rolloutSteps)
                .subgoalGenerationEnabled(subgoalGeneration.isEnabled())
                .maxSubgoals(subgoalGeneration.getMaxSubgoals())
                .oracle(oracle);
        b.randomSeed = randomSeed;
        return b;
    }

    /** When false, {@code plan} returns an empty plan without consulting the oracle. */
    public boolean isEnabled() {
        return enabled;
    }

    public int getMctsSimulations() {
        return mctsSimulations;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public double getExplorationConstant() {
        return explorationConstant;
    }

    /** Length of the default rollout used to estimate a node's value. */
    public int getRolloutSteps() {
        return rolloutSteps;
    }

    /** Seed for expansion and rollout randomness, or null for a non-reproducible source. */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public SubgoalGenerationConfig getSubgoalGeneration() {
        return subgoalGeneration;
    }

    public OracleConfig getOracle() {
        return oracle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlannerConfig that = (PlannerConfig) o;
        return enabled == that.enabled
                && mctsSimulations == that.mctsSimulations
                && maxDepth == that.maxDepth
                && Double.compare(explorationConstant, that.explorationConstant) == 0
                && rolloutSteps == that.rolloutSteps
                && Objects.equals(randomSeed, that.randomSeed)
                && subgoalGeneration.equals(that.subgoalGeneration)
                && oracle.equals(that.oracle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, mctsSimulations, maxDepth, explorationConstant, rolloutSteps, randomSeed,
                subgoalGeneration, oracle);
    }

    @Override
    public String toString() {
        return "PlannerConfig{enabled=" + enabled
                + ", mctsSimulations=" + mctsSimulations
                + ", maxDepth=" + maxDepth
                + ", explorationConstant=" + explorationConstant
                + ", rolloutSteps=" + rolloutSteps
                + ", randomSeed=" + randomSeed
                + ", subgoalGeneration.enabled=" + subgoalGeneration.isEnabled()
                + ", subgoalGeneration.maxSubgoals=" + subgoalGeneration.getMaxSubgoals()
                + ", oracle=" + oracle + "}";
    }

    public static final class Builder {
        private Boolean enabled;
        private Integer mctsSimulations;
        private Integer maxDepth;
        private Double explorationConstant;
        private Integer rolloutSteps;
        private Long randomSeed;
        private Boolean subgoalGenerationEnabled;
        private Integer maxSubgoals;
        private OracleConfig oracle;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder mctsSimulations(int mctsSimulations) {
            this.mctsSimulations = mctsSimulations;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder explorationConstant(double explorationConstant) {
            this.explorationConstant = explorationConstant;
            return this;
        }

        public Builder rolloutSteps(int rolloutSteps) {
            this.rolloutSteps = rolloutSteps;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder subgoalGenerationEnabled(boolean subgoalGenerationEnabled) {
            this.subgoalGenerationEnabled = subgoalGenerationEnabled;
            return this;
        }

        public Builder maxSubgoals(int maxSubgoals) {
            this.maxSubgoals = maxSubgoals;
            return this;
        }

        public Builder oracle(OracleConfig oracle) {
            this.oracle = oracle;
            return this;
        }

        /** @throws IllegalArgumentException if any value is out of range */
        public PlannerConfig build() {
            SubgoalGenerationConfig subgoals = new SubgoalGenerationConfig(subgoalGenerationEnabled, maxSubgoals);
            return new PlannerConfig(enabled, mctsSimulations, maxDepth, explorationConstant, rolloutSteps,
                    randomSeed, subgoals, oracle);
        }
    }
}
