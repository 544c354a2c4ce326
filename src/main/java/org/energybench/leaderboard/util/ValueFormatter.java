package org.energybench.leaderboard.util;

import org.energybench.leaderboard.model.Column;
import org.energybench.leaderboard.model.ResultRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Display formatting of record values: metrics to four decimals, the mask level as a bare
 * integer, missing values as {@value #MISSING_TEXT}.
 */
public final class ValueFormatter {

    public static final String MISSING_TEXT = "-";

    private ValueFormatter() {
        // Utility class
    }

    /**
     * Formats the visible columns of a record.
     *
     * @param record the record to render
     * @param columns visible columns in display order
     * @return column to display text, in the given column order
     */
    public static Map<Column, String> formatRow(ResultRecord record, List<Column> columns) {
        Map<Column, String> row = new LinkedHashMap<>();
        for (Column column : columns) {
            row.put(column, format(record, column));
        }
        return row;
    }

    public static String format(ResultRecord record, Column column) {
        switch (column.getKind()) {
            case IDENTITY:
                return column == Column.ICON ? record.getIcon() : record.getModel();
            case CATEGORY:
                return record.getCategory();
            case RANK:
                return record.isRanked() ? String.valueOf(record.getRank()) : MISSING_TEXT;
            case INTEGER_METRIC:
                return formatInteger(record.getMetric(column));
            case METRIC:
            default:
                return formatDecimal(record.getMetric(column));
        }
    }

    public static String formatDecimal(OptionalDouble value) {
        return value.isPresent() ? String.format(Locale.ROOT, "%.4f", value.getAsDouble()) : MISSING_TEXT;
    }

    public static String formatInteger(OptionalDouble value) {
        return value.isPresent() ? String.valueOf(Math.round(value.getAsDouble())) : MISSING_TEXT;
    }
}
