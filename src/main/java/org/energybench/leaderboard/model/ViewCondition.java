package org.energybench.leaderboard.model;

/**
 * Non-fatal conditions reported alongside a rendered view. The presentation layer decides
 * how to surface them (empty-state message, notice, etc.).
 */
public enum ViewCondition {
    /** The category filter accepted nothing, or nothing matched it. */
    EMPTY_FILTER_RESULT("No models match the selected model types"),
    /** Only identity columns remain after projection. */
    NO_METRIC_COLUMNS("No metric columns selected"),
    /** The sort column was projected away; rows keep insertion order. */
    SORT_COLUMN_UNAVAILABLE("Sort column is not displayed; rows are shown in source order");

    private final String message;

    ViewCondition(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
