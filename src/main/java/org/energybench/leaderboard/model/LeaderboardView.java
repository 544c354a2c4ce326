package org.energybench.leaderboard.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The sorted, display-ready table of one task. This is the only pipeline output handed to
 * the presentation layer.
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public final class LeaderboardView {

    private final Task task;
    private final List<Column> columns;
    private final List<ResultRecord> records;
    private final List<Map<Column, String>> rows;
    private final Set<ViewCondition> conditions;
    private final SortOrder sortOrder;
    private final List<CategoryOption> categoryOptions;

    public LeaderboardView(Task task, List<Column> columns, List<ResultRecord> records,
                           List<Map<Column, String>> rows, Set<ViewCondition> conditions,
                           SortOrder sortOrder, List<CategoryOption> categoryOptions) {
        this.task = Objects.requireNonNull(task, "Task cannot be null");
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        if (rows.size() != records.size()) {
            throw new IllegalArgumentException(String.format(
                "Row count %d does not match record count %d", rows.size(), records.size()));
        }
        List<Map<Column, String>> rowCopies = new ArrayList<>(rows.size());
        for (Map<Column, String> row : rows) {
            rowCopies.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(rowCopies);
        Set<ViewCondition> conditionCopy = EnumSet.noneOf(ViewCondition.class);
        conditionCopy.addAll(conditions);
        this.conditions = Collections.unmodifiableSet(conditionCopy);
        this.sortOrder = Objects.requireNonNull(sortOrder, "Sort order cannot be null");
        this.categoryOptions = List.copyOf(categoryOptions);
    }

    public Task getTask() {
        return task;
    }

    /** Visible columns in display order. */
    public List<Column> getColumns() {
        return columns;
    }

    /** Records in display order, one per row. */
    public List<ResultRecord> getRecords() {
        return records;
    }

    /** Formatted rows, each keyed by visible column in display order. */
    public List<Map<Column, String>> getRows() {
        return rows;
    }

    public Set<ViewCondition> getConditions() {
        return conditions;
    }

    public boolean hasCondition(ViewCondition condition) {
        return conditions.contains(condition);
    }

    /** The ordering that was requested; check {@link ViewCondition#SORT_COLUMN_UNAVAILABLE} to see if it applied. */
    public SortOrder getSortOrder() {
        return sortOrder;
    }

    /**
     * Every category of the task's dataset in first-seen order, regardless of the filter
     * this view was rendered with.
     */
    public List<CategoryOption> getCategoryOptions() {
        return categoryOptions;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public List<String> getHeaderLabels() {
        List<String> labels = new ArrayList<>(columns.size());
        for (Column column : columns) {
            labels.add(column.getLabel());
        }
        return labels;
    }

    @Override
    public String toString() {
        return String.format("LeaderboardView{task=%s, columns=%s, rows=%d, conditions=%s, sort=%s}",
            task, columns, rows.size(), conditions, sortOrder);
    }
}
