package org.energybench.leaderboard.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Filtered records together with the columns that remain visible after projection.
 * The records themselves are untouched; visibility is a property of the view.
 */
public final class ProjectedView {

    private final Task task;
    private final List<Column> columns;
    private final List<ResultRecord> records;
    private final Set<ViewCondition> conditions;

    public ProjectedView(Task task, List<Column> columns, List<ResultRecord> records,
                         Set<ViewCondition> conditions) {
        this.task = Objects.requireNonNull(task, "Task cannot be null");
        this.columns = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(columns, "Columns cannot be null")));
        this.records = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(records, "Records cannot be null")));
        Set<ViewCondition> copy = EnumSet.noneOf(ViewCondition.class);
        copy.addAll(Objects.requireNonNull(conditions, "Conditions cannot be null"));
        this.conditions = Collections.unmodifiableSet(copy);
    }

    public Task getTask() {
        return task;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<ResultRecord> getRecords() {
        return records;
    }

    public Set<ViewCondition> getConditions() {
        return conditions;
    }

    public boolean isVisible(Column column) {
        return columns.contains(column);
    }

    public ProjectedView withRecords(List<ResultRecord> newRecords, Set<ViewCondition> extraConditions) {
        Set<ViewCondition> merged = EnumSet.noneOf(ViewCondition.class);
        merged.addAll(conditions);
        merged.addAll(extraConditions);
        return new ProjectedView(task, columns, newRecords, merged);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        ProjectedView that = (ProjectedView) obj;
        return task == that.task
            && columns.equals(that.columns)
            && records.equals(that.records)
            && conditions.equals(that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(task, columns, records, conditions);
    }

    @Override
    public String toString() {
        return String.format("ProjectedView{task=%s, columns=%s, records=%d, conditions=%s}",
            task, columns, records.size(), conditions);
    }
}
