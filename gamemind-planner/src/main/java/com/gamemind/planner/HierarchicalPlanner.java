package com.gamemind.planner;

import com.gamemind.config.PlannerConfig;
import com.gamemind.oracle.FallbackOracle;
import com.gamemind.oracle.SubgoalOracle;
import com.gamemind.planner.PlannerMetrics.PlanOutcome;
import com.gamemind.search.MonteCarloTreeSearch;
import com.gamemind.search.RandomRolloutEstimator;
import com.gamemind.search.SearchSettings;
import com.gamemind.search.ValueEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.UnaryOperator;

/**
 * Two-level planner: a {@link SubgoalOracle} turns a goal into candidate subgoals and a
 * {@link MonteCarloTreeSearch} orders them into a plan, rooted at the caller's observation.
 * <p>
 * {@link #plan} and {@link #updatePlan} never throw: an oracle failure yields an empty plan and a search
 * failure yields the subgoal list itself. Each call builds and discards its own tree, so concurrent calls
 * are safe when the oracle and estimator are.
 */
public final class HierarchicalPlanner {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalPlanner.class);

    /** Goal used to replan after a negative reward. */
    public static final String RECOVERY_GOAL = "recover from failure";

    private final PlannerConfig config;
    private final SubgoalOracle oracle;
    private final MonteCarloTreeSearch<Object, String> search;
    private final PlannerMetrics metrics;

    private HierarchicalPlanner(Builder builder) {
        this.config = builder.config;
        this.oracle = builder.oracle != null ? builder.oracle : defaultOracle(config);
        Random random = builder.random != null ? builder.random : newRandom(config.getRandomSeed());
        ValueEstimator<Object, String> estimator = builder.estimator != null
                ? builder.estimator : new RandomRolloutEstimator<>(config.getRolloutSteps(), random);
        UnaryOperator<Object> stateCopier = builder.stateCopier != null ? builder.stateCopier : UnaryOperator.identity();
        SearchSettings settings = new SearchSettings(
                config.getMctsSimulations(), config.getMaxDepth(), config.getExplorationConstant());
        this.search = new MonteCarloTreeSearch<>(settings, estimator, random, stateCopier);
        this.metrics = builder.metrics != null ? builder.metrics : new PlannerMetrics();
        log.info("Planner ready: enabled={}, oracle={}, search={}",
                config.isEnabled(), oracle.getClass().getSimpleName(), settings);
    }

    // A disabled planner never consults its oracle, so no backend is built or probed for it.
    private static SubgoalOracle defaultOracle(PlannerConfig config) {
        return config.isEnabled() ? SubgoalOracles.create(config) : new FallbackOracle();
    }

    private static Random newRandom(Long seed) {
        return seed != null ? new Random(seed) : new Random();
    }

    /** Builder for a planner over a validated configuration. */
    public static Builder builder(PlannerConfig config) {
        return new Builder(config);
    }

    /**
     * Produces an ordered action plan for {@code goal}. Empty when the planner is disabled, when the oracle
     * offers no subgoals, or when the oracle fails.
     *
     * @param observation opaque search-root state; forwarded, never inspected
     * @param goal        free-text goal
     */
    public List<String> plan(Object observation, String goal) {
        if (!config.isEnabled()) {
            log.debug("Planner disabled; returning empty plan for goal='{}'", goal);
            metrics.recordPlan(PlanOutcome.DISABLED);
            return List.of();
        }
        List<String> subgoals;
        try {
            subgoals = bound(oracle.generateSubgoals(goal, observation));
        } catch (RuntimeException e) {
            log.warn("Subgoal oracle failed for goal='{}'; returning empty plan", goal, e);
            metrics.recordPlan(PlanOutcome.ORACLE_FAILED);
            return List.of();
        }
        if (subgoals.isEmpty()) {
            log.debug("No subgoals for goal='{}'", goal);
            metrics.recordPlan(PlanOutcome.NO_SUBGOALS);
            return List.of();
        }
        List<String> candidates = subgoals;
        List<String> plan;
        try {
            plan = metrics.searchTimer().record(() -> search.search(observation, candidates));
        } catch (RuntimeException e) {
            log.warn("Search failed for goal='{}'; returning subgoals unordered by search", goal, e);
            metrics.recordPlan(PlanOutcome.SEARCH_FAILED);
            return subgoals;
        }
        log.debug("Plan for goal='{}': subgoals={} plan={}", goal, subgoals, plan);
        metrics.recordPlan(PlanOutcome.PLANNED);
        return plan;
    }

    /**
     * Reacts to the reward observed after executing one action. A negative reward replans toward
     * {@link #RECOVERY_GOAL} from {@code currentState}; otherwise the current plan stands.
     *
     * @return the new plan, or empty to keep executing the previous one
     */
    public Optional<List<String>> updatePlan(Object currentState, String executedAction, double reward) {
        if (reward < 0) {
            log.info("Negative reward {} after action='{}'; replanning", reward, executedAction);
            metrics.recordReplan();
            return Optional.of(plan(currentState, RECOVERY_GOAL));
        }
        return Optional.empty();
    }

    private List<String> bound(List<String> subgoals) {
        if (subgoals == null || subgoals.isEmpty()) {
            return List.of();
        }
        int max = config.getSubgoalGeneration().getMaxSubgoals();
        List<String> bounded = subgoals.size() > max ? subgoals.subList(0, max) : subgoals;
        return List.copyOf(bounded);
    }

    public PlannerConfig getConfig() {
        return config;
    }

    public SubgoalOracle getOracle() {
        return oracle;
    }

    public PlannerMetrics getMetrics() {
        return metrics;
    }

    public static final class Builder {
        private final PlannerConfig config;
        private SubgoalOracle oracle;
        private ValueEstimator<Object, String> estimator;
        private Random random;
        private UnaryOperator<Object> stateCopier;
        private PlannerMetrics metrics;

        private Builder(PlannerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        /** Defaults to {@link SubgoalOracles#create(PlannerConfig)}, or the rule table when the planner is disabled. */
        public Builder oracle(SubgoalOracle oracle) {
            this.oracle = oracle;
            return this;
        }

        /** Defaults to a {@link RandomRolloutEstimator} of {@code rolloutSteps} draws. */
        public Builder estimator(ValueEstimator<Object, String> estimator) {
            this.estimator = estimator;
            return this;
        }

        /** Defaults to a generator seeded with {@code randomSeed} when one is configured. */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        /** Copies the parent's state for each expanded node. Defaults to sharing the same object. */
        public Builder stateCopier(UnaryOperator<Object> stateCopier) {
            this.stateCopier = stateCopier;
            return this;
        }

        public Builder metrics(PlannerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public HierarchicalPlanner build() {
            return new HierarchicalPlanner(this);
        }
    }
}
