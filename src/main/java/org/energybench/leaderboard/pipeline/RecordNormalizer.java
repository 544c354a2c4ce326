package org.energybench.leaderboard.pipeline;

import org.energybench.leaderboard.exceptions.MalformedMetricException;
import org.energybench.leaderboard.exceptions.ValidationException;
import org.energybench.leaderboard.model.Column;
import org.energybench.leaderboard.model.ModelCategory;
import org.energybench.leaderboard.model.RawRow;
import org.energybench.leaderboard.model.ResultRecord;
import org.energybench.leaderboard.model.TaskConfig;
import org.energybench.leaderboard.model.TaskDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Turns raw rows of one task into result records.
 *
 * <p>Category labels are canonicalized so casing variants collapse into one category:
 * labels matching a known {@link ModelCategory} take its spelling, anything else is
 * capitalized. Blank categories become {@value ModelCategory#UNKNOWN_LABEL}; a source
 * without a {@code Type} column puts every row under {@value ModelCategory#NOT_APPLICABLE_LABEL}.</p>
 *
 * <p>Metric cells that are absent, blank or {@value #MISSING_SENTINEL} become missing.
 * Any other non-numeric text aborts the load with {@link MalformedMetricException}.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class RecordNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(RecordNormalizer.class);

    /** Cell text the result files use for "no value". */
    public static final String MISSING_SENTINEL = "-";

    // Plain decimal or scientific notation; rejects NaN, Infinity, hex and type suffixes
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Normalizes raw rows into a task dataset.
     *
     * @param config task configuration naming the metric columns
     * @param rows raw rows in source order
     * @return a new dataset in source order with category first-seen order recorded
     * @throws MalformedMetricException if a metric cell cannot be parsed
     * @throws ValidationException if the model column is absent or a model cell is blank
     */
    public TaskDataset normalize(TaskConfig config, List<RawRow> rows) throws ValidationException {
        Objects.requireNonNull(config, "Config cannot be null");
        Objects.requireNonNull(rows, "Rows cannot be null");

        boolean categoryPresent = rows.stream().anyMatch(r -> r.hasColumn(Column.TYPE.getLabel()));
        if (!categoryPresent && !rows.isEmpty() && !config.isCategoryOptional()) {
            logger.warn("{} data has no '{}' column; all models are listed under '{}'",
                config.getTask().getDisplayName(), Column.TYPE.getLabel(), ModelCategory.NOT_APPLICABLE_LABEL);
        }

        List<ResultRecord> records = new ArrayList<>(rows.size());
        Set<String> categoryOrder = new LinkedHashSet<>();

        for (RawRow row : rows) {
            if (!row.hasColumn(Column.MODEL.getLabel())) {
                throw ValidationException.missingColumn(config.getTask(), row.getRowNumber(), Column.MODEL.getLabel());
            }
            String model = row.get(Column.MODEL.getLabel());
            if (model == null || model.isBlank()) {
                throw ValidationException.blankValue(config.getTask(), row.getRowNumber(), Column.MODEL.getLabel(), model);
            }

            String category = categoryPresent
                ? canonicalCategory(row.get(Column.TYPE.getLabel()))
                : ModelCategory.NOT_APPLICABLE_LABEL;
            categoryOrder.add(category);

            Map<Column, OptionalDouble> metrics = new EnumMap<>(Column.class);
            for (Column column : config.getMetricColumns()) {
                metrics.put(column, parseMetric(config, row, column));
            }

            records.add(new ResultRecord(config.getTask(), model.trim(), category, metrics,
                null, List.of(row.getRowNumber())));
        }

        logger.debug("Normalized {} {} rows into categories {}", records.size(),
            config.getTask().getDisplayName(), categoryOrder);
        return new TaskDataset(config.getTask(), records, new ArrayList<>(categoryOrder), categoryPresent);
    }

    /**
     * Canonical spelling of a category label.
     *
     * @param raw raw cell text, may be null
     * @return the canonical label, {@value ModelCategory#UNKNOWN_LABEL} when blank
     */
    public static String canonicalCategory(String raw) {
        if (raw == null || raw.isBlank()) {
            return ModelCategory.UNKNOWN_LABEL;
        }
        String trimmed = raw.trim();
        Optional<ModelCategory> known = ModelCategory.fromLabel(trimmed);
        if (known.isPresent()) {
            return known.get().getLabel();
        }
        return trimmed.substring(0, 1).toUpperCase(Locale.ROOT) + trimmed.substring(1).toLowerCase(Locale.ROOT);
    }

    private OptionalDouble parseMetric(TaskConfig config, RawRow row, Column column)
            throws MalformedMetricException {
        String raw = row.get(column.getLabel());
        if (raw == null) {
            return OptionalDouble.empty();
        }
        String text = raw.trim();
        if (text.isEmpty() || MISSING_SENTINEL.equals(text)) {
            return OptionalDouble.empty();
        }
        // Mask levels may be written as percentages
        if (column.getKind() == Column.Kind.INTEGER_METRIC && text.endsWith("%")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        if (!NUMBER.matcher(text).matches()) {
            throw new MalformedMetricException(config.getTask(), row.getRowNumber(), column, raw, null);
        }
        try {
            // Adding 0.0 folds -0.0 into 0.0
            return OptionalDouble.of(Double.parseDouble(text) + 0.0);
        } catch (NumberFormatException e) {
            throw new MalformedMetricException(config.getTask(), row.getRowNumber(), column, raw, e);
        }
    }
}
