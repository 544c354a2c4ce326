package org.energybench.leaderboard.model;

import java.util.Objects;

/**
 * Sort column and direction for the final display order.
 */
public final class SortOrder {

    private final Column column;
    private final MetricDirection direction;

    public SortOrder(Column column, MetricDirection direction) {
        this.column = Objects.requireNonNull(column, "Sort column cannot be null");
        this.direction = Objects.requireNonNull(direction, "Sort direction cannot be null");
        if (!column.isMetric() && column != Column.RANK) {
            throw new IllegalArgumentException("Only metric or rank columns can be sorted on: " + column);
        }
    }

    /** The task's default ordering: primary metric in its natural direction. */
    public static SortOrder defaultFor(TaskConfig config) {
        return new SortOrder(config.getPrimaryMetric(), config.getDirection());
    }

    /** Ascending by rank, unranked rows last. */
    public static SortOrder byRank() {
        return new SortOrder(Column.RANK, MetricDirection.LOWER_IS_BETTER);
    }

    public Column getColumn() {
        return column;
    }

    public MetricDirection getDirection() {
        return direction;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        SortOrder that = (SortOrder) obj;
        return column == that.column && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, direction);
    }

    @Override
    public String toString() {
        return "SortOrder{" + column + ", " + direction + "}";
    }
}
