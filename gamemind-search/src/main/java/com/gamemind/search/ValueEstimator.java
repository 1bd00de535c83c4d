package com.gamemind.search;

/**
 * Scalar estimate of a leaf reached during search. Replace the default rollout with a simulator or a learned
 * model without touching {@link MonteCarloTreeSearch}.
 */
@FunctionalInterface
public interface ValueEstimator<S, A> {

    /**
     * @param node the node just selected or expanded
     * @return estimated return; any sign
     */
    double estimate(SearchNode<S, A> node);
}
