package com.gamemind.oracle;

import java.util.Objects;

/**
 * Result of {@link SubgoalOracle#analyzeTask(String)}.
 *
 * @param task           the analyzed task text
 * @param rationale      free-text analysis (backend output, or a fixed text for the deterministic analysis)
 * @param complexity     coarse complexity
 * @param estimatedSteps estimated number of steps, in [{@value #MIN_STEPS}, {@value #MAX_STEPS}]
 */
public record TaskAnalysis(String task, String rationale, Complexity complexity, int estimatedSteps) {

    public static final int MIN_STEPS = 2;
    public static final int MAX_STEPS = 6;

    public TaskAnalysis {
        task = task != null ? task : "";
        rationale = rationale != null ? rationale : "";
        Objects.requireNonNull(complexity, "complexity");
        if (estimatedSteps < MIN_STEPS || estimatedSteps > MAX_STEPS) {
            throw new IllegalArgumentException(
                    "estimatedSteps must be in [" + MIN_STEPS + "," + MAX_STEPS + "] but was " + estimatedSteps);
        }
    }
}
