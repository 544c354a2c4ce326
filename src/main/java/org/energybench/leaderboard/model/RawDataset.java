package org.energybench.leaderboard.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Read-only raw input of one task, as loaded at startup. Safe to share between renders.
 */
public final class RawDataset {

    private final Task task;
    private final List<String> headers;
    private final List<RawRow> rows;

    public RawDataset(Task task, List<String> headers, List<RawRow> rows) {
        this.task = Objects.requireNonNull(task, "Task cannot be null");
        this.headers = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(headers, "Headers cannot be null")));
        this.rows = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rows, "Rows cannot be null")));
    }

    public Task getTask() {
        return task;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<RawRow> getRows() {
        return rows;
    }

    public boolean hasColumn(String label) {
        return headers.contains(label);
    }

    public int size() {
        return rows.size();
    }

    @Override
    public String toString() {
        return String.format("RawDataset{task=%s, headers=%s, rows=%d}", task, headers, rows.size());
    }
}
