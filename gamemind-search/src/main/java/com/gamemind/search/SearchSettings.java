package com.gamemind.search;

/**
 * Budget and shape of one search: number of simulations, maximum expansion depth and the UCB1
 * exploration constant.
 */
public final class SearchSettings {

    private final int simulations;
    private final int maxDepth;
    private final double explorationConstant;

    /** @throws IllegalArgumentException if a value is out of range */
    public SearchSettings(int simulations, int maxDepth, double explorationConstant) {
        if (simulations < 1) {
            throw new IllegalArgumentException("simulations must be >= 1 but was " + simulations);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1 but was " + maxDepth);
        }
        if (!(explorationConstant >= 0) || Double.isInfinite(explorationConstant)) {
            throw new IllegalArgumentException(
                    "explorationConstant must be a finite value >= 0 but was " + explorationConstant);
        }
        this.simulations = simulations;
        this.maxDepth = maxDepth;
        this.explorationConstant = explorationConstant;
    }

    public int getSimulations() {
        return simulations;
    }

    /** Nodes at this depth or deeper are never expanded. */
    public int getMaxDepth() {
        return maxDepth;
    }

    public double getExplorationConstant() {
        return explorationConstant;
    }

    @Override
    public String toString() {
        return "SearchSettings{simulations=" + simulations + ", maxDepth=" + maxDepth
                + ", explorationConstant=" + explorationConstant + "}";
    }
}
