package com.gamemind.search;

import java.util.Objects;
import java.util.Random;

/**
 * Domain-agnostic rollout: the sum of {@code steps} standard-normal draws. Ignores the node entirely.
 * Thread-safe when the supplied {@link Random} is (java.util.Random is).
 */
public final class RandomRolloutEstimator<S, A> implements ValueEstimator<S, A> {

    public static final int DEFAULT_STEPS = 10;

    private final int steps;
    private final Random random;

    public RandomRolloutEstimator(int steps, Random random) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be >= 1 but was " + steps);
        }
        this.steps = steps;
        this.random = Objects.requireNonNull(random, "random");
    }

    public RandomRolloutEstimator(Random random) {
        this(DEFAULT_STEPS, random);
    }

    @Override
    public double estimate(SearchNode<S, A> node) {
        double total = 0.0;
        for (int i = 0; i < steps; i++) {
            total += random.nextGaussian();
        }
        return total;
    }
}
