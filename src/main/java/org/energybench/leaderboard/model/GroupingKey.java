package org.energybench.leaderboard.model;

/**
 * Fields that together identify one leaderboard entry after aggregation.
 */
public enum GroupingKey {
    MODEL,
    CATEGORY,
    /** Masking level of an imputation run; runs at different levels are never merged. */
    MASK
}
