package org.energybench.leaderboard.exceptions;

import org.energybench.leaderboard.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * A raw result row could not be turned into a result record.
 *
 * <p>Every failure points at one cell of one task file: the task, the 1-based data row,
 * the column header and the cell text as read. Instances come from the factory methods
 * or from subclasses; the {@link Reason} code is stable across releases.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class ValidationException extends Exception implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger logger = LoggerFactory.getLogger(ValidationException.class);

    /**
     * Why a row was rejected.
     */
    public enum Reason {
        MISSING_COLUMN("VAL001", "Required column missing"),
        MALFORMED_VALUE("VAL002", "Malformed metric value"),
        BLANK_VALUE("VAL003", "Required value is blank");

        private final String code;
        private final String description;

        Reason(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Reason reason;
    private final Task task;
    private final int rowNumber;
    private final String columnLabel;
    private final String rawValue;

    /**
     * @param reason why the row was rejected
     * @param detail human-readable explanation appended to the reason
     * @param task task whose file holds the row
     * @param rowNumber 1-based data row number
     * @param columnLabel header of the offending cell
     * @param rawValue cell text as read, may be null when the cell is absent
     * @param cause underlying parse failure, may be null
     */
    protected ValidationException(Reason reason, String detail, Task task, int rowNumber,
                                  String columnLabel, String rawValue, Throwable cause) {
        super(String.format("[%s] %s: %s",
                Objects.requireNonNull(reason, "Reason cannot be null").getCode(),
                reason.getDescription(), detail), cause);
        this.reason = reason;
        this.task = Objects.requireNonNull(task, "Task cannot be null");
        this.rowNumber = rowNumber;
        this.columnLabel = columnLabel;
        this.rawValue = rawValue;

        logger.debug("Rejected {} row {}: {}", task, rowNumber, getMessage());
    }

    /**
     * A row lacks a column every row of the task must have.
     */
    public static ValidationException missingColumn(Task task, int rowNumber, String columnLabel) {
        return new ValidationException(Reason.MISSING_COLUMN,
                String.format("column '%s' not found in %s row %d", columnLabel, task.getDisplayName(), rowNumber),
                task, rowNumber, columnLabel, null, null);
    }

    /**
     * A required cell is empty or whitespace.
     */
    public static ValidationException blankValue(Task task, int rowNumber, String columnLabel, String rawValue) {
        return new ValidationException(Reason.BLANK_VALUE,
                String.format("'%s' is blank in %s row %d", columnLabel, task.getDisplayName(), rowNumber),
                task, rowNumber, columnLabel, rawValue, null);
    }

    public Reason getReason() {
        return reason;
    }

    public Task getTask() {
        return task;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public String getColumnLabel() {
        return columnLabel;
    }

    public String getRawValue() {
        return rawValue;
    }

    /**
     * Multi-line description of the offending cell, for debug logs.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append(' ').append(reason.getCode()).append('\n');
        sb.append("  Task: ").append(task.getDisplayName()).append('\n');
        sb.append("  Row: ").append(rowNumber).append('\n');
        sb.append("  Column: ").append(columnLabel).append('\n');
        if (rawValue != null) {
            sb.append("  Value: '").append(rawValue).append("'\n");
        }
        if (getCause() != null) {
            sb.append("  Cause: ").append(getCause().getClass().getName())
              .append(" - ").append(getCause().getMessage()).append('\n');
        }
        return sb.toString();
    }
}
