package org.energybench.leaderboard.exceptions;

import org.energybench.leaderboard.model.Column;
import org.energybench.leaderboard.model.Task;

import java.io.Serial;

/**
 * A metric cell held text that is neither a number nor the missing-value sentinel.
 * The task's load is aborted; the offending row is never dropped silently.
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class MalformedMetricException extends ValidationException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Column column;

    /**
     * @param task task whose dataset was being normalized
     * @param rowNumber 1-based data row number in the source
     * @param column metric column of the bad cell
     * @param rawValue the cell text as read
     * @param cause parse failure, may be null
     */
    public MalformedMetricException(Task task, int rowNumber, Column column, String rawValue, Throwable cause) {
        super(Reason.MALFORMED_VALUE,
            String.format("'%s' for metric '%s' in %s row %d",
                rawValue, column.getLabel(), task.getDisplayName(), rowNumber),
            task, rowNumber, column.getLabel(), rawValue, cause);
        this.column = column;
    }

    public Column getColumn() {
        return column;
    }
}
