package com.gamemind.oracle;

import java.util.List;

/**
 * Contract: turns a goal into an ordered list of subgoal descriptions and analyzes tasks.
 * <p>
 * Implementations never throw from either method. Backend failures, timeouts and malformed output are
 * absorbed and answered from a deterministic rule table, so callers hold no fallback logic of their own.
 * Whether an implementation is safe for concurrent use is documented on the implementation.
 */
public interface SubgoalOracle {

    /** Upper bound on the number of subgoals any oracle returns. */
    int MAX_SUBGOALS = 5;

    /**
     * Decomposes a goal into subgoals.
     *
     * @param goal         goal description (e.g. "collect wood"); null is treated as empty
     * @param currentState opaque state snapshot used as prompt context; may be null
     * @return ordered subgoals, at most {@link #MAX_SUBGOALS}; never null
     */
    List<String> generateSubgoals(String goal, Object currentState);

    /** Same as {@link #generateSubgoals(String, Object)} without state context. */
    default List<String> generateSubgoals(String goal) {
        return generateSubgoals(goal, null);
    }

    /**
     * Produces a lightweight structured analysis of a task.
     *
     * @param task task description; null is treated as empty
     * @return analysis; never null
     */
    TaskAnalysis analyzeTask(String task);
}
