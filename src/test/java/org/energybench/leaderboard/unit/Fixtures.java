package org.energybench.leaderboard.unit;

import org.energybench.leaderboard.model.*;

import java.util.*;

/**
 * Shared builders for leaderboard tests.
 */
final class Fixtures {

    private Fixtures() {
    }

    static TaskConfig anomalyConfig() {
        return TaskConfig.builder(Task.ANOMALY_DETECTION)
            .fileName("Anomaly_Detection_Results.csv")
            .groupingKeys(EnumSet.of(GroupingKey.MODEL, GroupingKey.CATEGORY))
            .metricColumns(List.of(Column.F1_SCORE, Column.PRECISION, Column.RECALL))
            .primaryMetric(Column.F1_SCORE)
            .direction(MetricDirection.HIGHER_IS_BETTER)
            .rankingEnabled(true)
            .categoryOptional(false)
            .availableColumns(List.of(Column.ICON, Column.MODEL, Column.TYPE, Column.RANK,
                Column.F1_SCORE, Column.PRECISION, Column.RECALL))
            .defaultColumns(List.of(Column.ICON, Column.MODEL, Column.F1_SCORE, Column.PRECISION, Column.RECALL))
            .build();
    }

    static TaskConfig imputationConfig() {
        return TaskConfig.builder(Task.IMPUTATION)
            .fileName("Imputation_Results.csv")
            .groupingKeys(EnumSet.of(GroupingKey.MODEL, GroupingKey.CATEGORY, GroupingKey.MASK))
            .metricColumns(List.of(Column.MASK, Column.MAE, Column.MSE))
            .primaryMetric(Column.MAE)
            .direction(MetricDirection.LOWER_IS_BETTER)
            .categoryOptional(false)
            .availableColumns(List.of(Column.ICON, Column.MODEL, Column.TYPE, Column.MASK, Column.MAE, Column.MSE))
            .defaultColumns(List.of(Column.ICON, Column.MODEL, Column.MASK, Column.MAE, Column.MSE))
            .build();
    }

    /**
     * Builds a raw row from alternating header/cell arguments.
     */
    static RawRow row(int rowNumber, String... headerAndCell) {
        if (headerAndCell.length % 2 != 0) {
            throw new IllegalArgumentException("Expected header/cell pairs");
        }
        Map<String, String> cells = new LinkedHashMap<>();
        for (int i = 0; i < headerAndCell.length; i += 2) {
            cells.put(headerAndCell[i], headerAndCell[i + 1]);
        }
        return new RawRow(rowNumber, cells);
    }

    /** Anomaly-detection row with Model, Type, F1-score, Precision and Recall cells. */
    static RawRow anomalyRow(int rowNumber, String model, String type, String f1, String precision, String recall) {
        return row(rowNumber, "Model", model, "Type", type, "F1-score", f1, "Precision", precision, "Recall", recall);
    }

    static ResultRecord record(Task task, String model, String category, Column metric, Double value) {
        Map<Column, OptionalDouble> metrics = new EnumMap<>(Column.class);
        metrics.put(metric, value == null ? OptionalDouble.empty() : OptionalDouble.of(value));
        return new ResultRecord(task, model, category, metrics);
    }

    static TaskDataset dataset(Task task, ResultRecord... records) {
        List<String> categories = new ArrayList<>();
        for (ResultRecord record : records) {
            categories.add(record.getCategory());
        }
        return new TaskDataset(task, Arrays.asList(records), categories, true);
    }
}
