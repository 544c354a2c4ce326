package org.energybench.leaderboard.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable set of result records for one task.
 *
 * <p>Besides the records it remembers the order in which categories were first seen during
 * normalization, so category filters and legends render in a stable order.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public final class TaskDataset {

    private final Task task;
    private final List<ResultRecord> records;
    private final List<String> categoryOrder;
    private final boolean categoryColumnPresent;

    public TaskDataset(Task task, List<ResultRecord> records, List<String> categoryOrder,
                       boolean categoryColumnPresent) {
        this.task = Objects.requireNonNull(task, "Task cannot be null");
        Objects.requireNonNull(records, "Records cannot be null");
        Objects.requireNonNull(categoryOrder, "Category order cannot be null");

        for (ResultRecord record : records) {
            if (record.getTask() != task) {
                throw new IllegalArgumentException(String.format(
                    "Record for model '%s' belongs to %s, not %s", record.getModel(), record.getTask(), task));
            }
        }
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.categoryOrder = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(categoryOrder)));
        this.categoryColumnPresent = categoryColumnPresent;
    }

    public Task getTask() {
        return task;
    }

    public List<ResultRecord> getRecords() {
        return records;
    }

    /** Distinct categories in first-seen order. */
    public List<String> getCategoryOrder() {
        return categoryOrder;
    }

    public boolean isCategoryColumnPresent() {
        return categoryColumnPresent;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Returns a dataset with the same task and category order but different records.
     */
    public TaskDataset withRecords(List<ResultRecord> newRecords) {
        return new TaskDataset(task, newRecords, categoryOrder, categoryColumnPresent);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        TaskDataset that = (TaskDataset) obj;
        return task == that.task
            && categoryColumnPresent == that.categoryColumnPresent
            && records.equals(that.records)
            && categoryOrder.equals(that.categoryOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(task, records, categoryOrder, categoryColumnPresent);
    }

    @Override
    public String toString() {
        return String.format("TaskDataset{task=%s, records=%d, categories=%s}", task, records.size(), categoryOrder);
    }
}
