package org.energybench.leaderboard.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Typed column identifiers for every task table, each mapped to the fixed header label
 * used in the source CSV files and in rendered output.
 *
 * <p>Declaration order is the display order.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public enum Column {
    ICON("Icon", Kind.IDENTITY),
    MODEL("Model", Kind.IDENTITY),
    TYPE("Type", Kind.CATEGORY),
    RANK("Rank", Kind.RANK),
    OOD_COMMERCIAL("Out-of-distribution(OOD)_Commercial", Kind.METRIC),
    OOD_RESIDENTIAL("Out-of-distribution(OOD)_Residential", Kind.METRIC),
    ID_COMMERCIAL("In-Distribution(ID)_Commercial", Kind.METRIC),
    ID_RESIDENTIAL("In-Distribution(ID)_Residential", Kind.METRIC),
    F1_SCORE("F1-score", Kind.METRIC),
    PRECISION("Precision", Kind.METRIC),
    RECALL("Recall", Kind.METRIC),
    MASK("Mask", Kind.INTEGER_METRIC),
    MAE("MAE", Kind.METRIC),
    MSE("MSE", Kind.METRIC),
    NRMSE("NRMSE", Kind.METRIC);

    /**
     * How a column's values are sourced and rendered.
     */
    public enum Kind {
        /** Always shown, keeps a row traceable to its model. */
        IDENTITY,
        CATEGORY,
        RANK,
        /** Numeric, rendered with four decimals. */
        METRIC,
        /** Numeric, rendered as a bare integer. */
        INTEGER_METRIC
    }

    private final String label;
    private final Kind kind;

    Column(String label, Kind kind) {
        this.label = label;
        this.kind = kind;
    }

    public String getLabel() {
        return label;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isIdentity() {
        return kind == Kind.IDENTITY;
    }

    public boolean isMetric() {
        return kind == Kind.METRIC || kind == Kind.INTEGER_METRIC;
    }

    /**
     * Looks up a column by its header label (exact match).
     *
     * @param label the CSV header label
     * @return the column, or empty if the label is not a known column
     */
    public static Optional<Column> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values())
            .filter(c -> c.label.equals(trimmed))
            .findFirst();
    }

    /**
     * Looks up a column by enum name or header label, ignoring case.
     *
     * @param name the enum name (e.g. {@code F1_SCORE}) or the label (e.g. {@code F1-score})
     * @return the column, or empty if nothing matches
     */
    public static Optional<Column> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
            .filter(c -> c.name().equalsIgnoreCase(trimmed) || c.label.equalsIgnoreCase(trimmed))
            .findFirst();
    }
}
