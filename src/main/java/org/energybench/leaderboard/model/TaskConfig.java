package org.energybench.leaderboard.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Per-task engine settings: grouping fields, the primary metric and its direction,
 * and the column universe offered for display.
 *
 * <p>Instances are immutable and shared across renders. Use {@link #builder(Task)}.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public final class TaskConfig {

    private final Task task;
    private final String fileName;
    private final Set<GroupingKey> groupingKeys;
    private final List<Column> metricColumns;
    private final Column primaryMetric;
    private final MetricDirection direction;
    private final List<Column> availableColumns;
    private final List<Column> defaultColumns;
    private final boolean rankingEnabled;
    private final boolean categoryOptional;

    private TaskConfig(Builder builder) {
        this.task = Objects.requireNonNull(builder.task, "Task cannot be null");
        this.fileName = builder.fileName;
        this.primaryMetric = Objects.requireNonNull(builder.primaryMetric, "Primary metric cannot be null");
        this.direction = Objects.requireNonNull(builder.direction, "Direction cannot be null");
        this.rankingEnabled = builder.rankingEnabled;
        this.categoryOptional = builder.categoryOptional;

        if (builder.groupingKeys.isEmpty() || !builder.groupingKeys.contains(GroupingKey.MODEL)) {
            throw new IllegalArgumentException("Grouping keys must include MODEL for " + task);
        }
        if (builder.metricColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one metric column is required for " + task);
        }
        for (Column column : builder.metricColumns) {
            if (!column.isMetric()) {
                throw new IllegalArgumentException(column + " is not a metric column");
            }
        }
        if (!builder.metricColumns.contains(primaryMetric)) {
            throw new IllegalArgumentException(String.format(
                "Primary metric %s is not among the metric columns of %s", primaryMetric, task));
        }
        if (builder.groupingKeys.contains(GroupingKey.MASK) && !builder.metricColumns.contains(Column.MASK)) {
            throw new IllegalArgumentException("MASK grouping requires the MASK column for " + task);
        }
        for (Column column : builder.availableColumns) {
            if (column.isMetric() && !builder.metricColumns.contains(column)) {
                throw new IllegalArgumentException(String.format(
                    "Available column %s is not a declared metric of %s", column, task));
            }
            if (column == Column.RANK && !rankingEnabled) {
                throw new IllegalArgumentException("RANK column offered but ranking is disabled for " + task);
            }
        }
        if (!builder.availableColumns.containsAll(builder.defaultColumns)) {
            throw new IllegalArgumentException("Default columns must be a subset of available columns for " + task);
        }

        this.groupingKeys = Collections.unmodifiableSet(EnumSet.copyOf(builder.groupingKeys));
        this.metricColumns = Collections.unmodifiableList(new ArrayList<>(builder.metricColumns));
        this.availableColumns = Collections.unmodifiableList(withIdentity(builder.availableColumns));
        this.defaultColumns = Collections.unmodifiableList(withIdentity(builder.defaultColumns));
    }

    private static List<Column> withIdentity(List<Column> columns) {
        Set<Column> ordered = EnumSet.of(Column.ICON, Column.MODEL);
        ordered.addAll(columns);
        return new ArrayList<>(ordered);
    }

    public static Builder builder(Task task) {
        return new Builder(task);
    }

    public Task getTask() {
        return task;
    }

    /** Source CSV file name, relative to the data directory. */
    public String getFileName() {
        return fileName;
    }

    public Set<GroupingKey> getGroupingKeys() {
        return groupingKeys;
    }

    public List<Column> getMetricColumns() {
        return metricColumns;
    }

    public Column getPrimaryMetric() {
        return primaryMetric;
    }

    public MetricDirection getDirection() {
        return direction;
    }

    /** Columns the task can display, identity columns first, in display order. */
    public List<Column> getAvailableColumns() {
        return availableColumns;
    }

    public List<Column> getDefaultColumns() {
        return defaultColumns;
    }

    public boolean isRankingEnabled() {
        return rankingEnabled;
    }

    /** Whether the source file may omit the {@code Type} column. */
    public boolean isCategoryOptional() {
        return categoryOptional;
    }

    /**
     * Grouping keys in effect for a dataset: without a category column the category
     * carries no information and grouping degrades to the remaining keys.
     */
    public Set<GroupingKey> effectiveGroupingKeys(boolean categoryColumnPresent) {
        if (categoryColumnPresent) {
            return groupingKeys;
        }
        Set<GroupingKey> keys = EnumSet.copyOf(groupingKeys);
        keys.remove(GroupingKey.CATEGORY);
        return Collections.unmodifiableSet(keys);
    }

    @Override
    public String toString() {
        return String.format("TaskConfig{task=%s, primary=%s, direction=%s, grouping=%s, ranking=%s}",
            task, primaryMetric, direction, groupingKeys, rankingEnabled);
    }

    /**
     * Builder for {@link TaskConfig}.
     */
    public static final class Builder {
        private final Task task;
        private String fileName;
        private Set<GroupingKey> groupingKeys = EnumSet.of(GroupingKey.MODEL, GroupingKey.CATEGORY);
        private List<Column> metricColumns = new ArrayList<>();
        private Column primaryMetric;
        private MetricDirection direction = MetricDirection.HIGHER_IS_BETTER;
        private List<Column> availableColumns = new ArrayList<>();
        private List<Column> defaultColumns = new ArrayList<>();
        private boolean rankingEnabled;
        private boolean categoryOptional = true;

        private Builder(Task task) {
            this.task = task;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder groupingKeys(Set<GroupingKey> groupingKeys) {
            this.groupingKeys = EnumSet.noneOf(GroupingKey.class);
            this.groupingKeys.addAll(groupingKeys);
            return this;
        }

        public Builder metricColumns(List<Column> metricColumns) {
            this.metricColumns = new ArrayList<>(metricColumns);
            return this;
        }

        public Builder primaryMetric(Column primaryMetric) {
            this.primaryMetric = primaryMetric;
            return this;
        }

        public Builder direction(MetricDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder availableColumns(List<Column> availableColumns) {
            this.availableColumns = new ArrayList<>(availableColumns);
            return this;
        }

        public Builder defaultColumns(List<Column> defaultColumns) {
            this.defaultColumns = new ArrayList<>(defaultColumns);
            return this;
        }

        public Builder rankingEnabled(boolean rankingEnabled) {
            this.rankingEnabled = rankingEnabled;
            return this;
        }

        public Builder categoryOptional(boolean categoryOptional) {
            this.categoryOptional = categoryOptional;
            return this;
        }

        public TaskConfig build() {
            return new TaskConfig(this);
        }
    }
}
