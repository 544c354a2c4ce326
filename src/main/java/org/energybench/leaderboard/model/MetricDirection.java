package org.energybench.leaderboard.model;

import java.util.Comparator;

/**
 * Whether larger or smaller values of a metric are better.
 */
public enum MetricDirection {
    HIGHER_IS_BETTER,
    LOWER_IS_BETTER;

    /**
     * Comparator placing better values first.
     *
     * Values compare numerically, so {@code -0.0} and {@code 0.0} are equal.
     *
     * @return descending order for {@link #HIGHER_IS_BETTER}, ascending otherwise
     */
    public Comparator<Double> bestFirst() {
        Comparator<Double> natural = (a, b) -> Double.compare(a + 0.0, b + 0.0);
        return this == HIGHER_IS_BETTER ? natural.reversed() : natural;
    }
}
