package org.energybench.leaderboard.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * One leaderboard entry: a model's benchmark metrics for a single task.
 *
 * <p>Instances are immutable. A missing metric is an empty {@link OptionalDouble}; it is never
 * stored as zero or {@code NaN}. The rank is {@code null} until the ranker assigns one.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public final class ResultRecord {

    private final Task task;
    private final String model;
    private final String category;
    private final Map<Column, OptionalDouble> metrics;
    private final Integer rank;
    private final List<Integer> sourceRows;

    public ResultRecord(Task task, String model, String category,
                        Map<Column, OptionalDouble> metrics, Integer rank, List<Integer> sourceRows) {
        this.task = Objects.requireNonNull(task, "Task cannot be null");
        this.model = Objects.requireNonNull(model, "Model cannot be null");
        this.category = Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(metrics, "Metrics cannot be null");

        Map<Column, OptionalDouble> copy = new EnumMap<>(Column.class);
        for (Map.Entry<Column, OptionalDouble> entry : metrics.entrySet()) {
            if (!entry.getKey().isMetric()) {
                throw new IllegalArgumentException("Not a metric column: " + entry.getKey());
            }
            copy.put(entry.getKey(), Objects.requireNonNull(entry.getValue(),
                "Metric value cannot be null for " + entry.getKey()));
        }
        this.metrics = Collections.unmodifiableMap(copy);
        this.rank = rank;
        this.sourceRows = sourceRows != null
            ? Collections.unmodifiableList(new ArrayList<>(sourceRows))
            : Collections.emptyList();
    }

    public ResultRecord(Task task, String model, String category, Map<Column, OptionalDouble> metrics) {
        this(task, model, category, metrics, null, Collections.emptyList());
    }

    public Task getTask() {
        return task;
    }

    public String getModel() {
        return model;
    }

    public String getCategory() {
        return category;
    }

    /** Icon badge derived from the category. */
    public String getIcon() {
        return ModelCategory.iconFor(category);
    }

    public Map<Column, OptionalDouble> getMetrics() {
        return metrics;
    }

    /**
     * Value of a metric column; empty if the column is missing or absent from this record.
     */
    public OptionalDouble getMetric(Column column) {
        return metrics.getOrDefault(column, OptionalDouble.empty());
    }

    public Integer getRank() {
        return rank;
    }

    public boolean isRanked() {
        return rank != null;
    }

    /** 1-based data row numbers of the source file this record was built from. */
    public List<Integer> getSourceRows() {
        return sourceRows;
    }

    public ResultRecord withRank(Integer newRank) {
        return new ResultRecord(task, model, category, metrics, newRank, sourceRows);
    }

    public ResultRecord withMetrics(Map<Column, OptionalDouble> newMetrics, List<Integer> newSourceRows) {
        return new ResultRecord(task, model, category, newMetrics, null, newSourceRows);
    }

    /**
     * Builds the grouping identity of this record for the given key fields.
     * Two records with equal identities are duplicates of the same leaderboard entry.
     *
     * @param keys grouping fields declared by the task
     * @return a list usable as a map key
     */
    public List<Object> groupingIdentity(Set<GroupingKey> keys) {
        List<Object> identity = new ArrayList<>(3);
        if (keys.contains(GroupingKey.MODEL)) {
            identity.add(model);
        }
        if (keys.contains(GroupingKey.CATEGORY)) {
            identity.add(category);
        }
        if (keys.contains(GroupingKey.MASK)) {
            OptionalDouble mask = getMetric(Column.MASK);
            identity.add(mask.isPresent() ? (Object) mask.getAsDouble() : "missing");
        }
        return identity;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        ResultRecord that = (ResultRecord) obj;
        return task == that.task
            && model.equals(that.model)
            && category.equals(that.category)
            && metrics.equals(that.metrics)
            && Objects.equals(rank, that.rank)
            && sourceRows.equals(that.sourceRows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(task, model, category, metrics, rank, sourceRows);
    }

    @Override
    public String toString() {
        return String.format("ResultRecord{task=%s, model='%s', category='%s', metrics=%s, rank=%s}",
            task, model, category, metrics, rank);
    }
}
