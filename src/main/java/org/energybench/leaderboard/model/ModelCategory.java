package org.energybench.leaderboard.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Known model-family labels with their icon badge and legend text.
 * Labels outside this table are still valid categories; they render with {@link #UNKNOWN_ICON}.
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public enum ModelCategory {
    BASELINE("Baseline", "⚪",
        "A simple model used as a benchmark to evaluate the performance of more complex models"),
    STATISTICAL("Statistical", "🔶",
        "A simple model used as a benchmark to evaluate the performance of more complex models"),
    ML_DL("ML/DL", "🔷",
        "These are task-specific models that are trained from scratch on the given dataset."),
    ZERO_SHOT("Zero-shot", "🔴",
        "These are pretrained models that can generalize to unseen tasks or datasets without additional "
            + "training, leveraging pretrained knowledge to make predictions directly."),
    FINE_TUNED("Fine-tuned", "🟣",
        "Pretrained models adapted to a specific task through additional training on the target dataset."),
    PRE_TRAINED("Pre-trained", "🟢",
        "Models trained on large-scale datasets to capture general patterns, which can later be adapted "
            + "for specific tasks.");

    /** Category assigned to rows whose category cell is blank. */
    public static final String UNKNOWN_LABEL = "Unknown";

    /** Category assigned to every row of a dataset without a category column. */
    public static final String NOT_APPLICABLE_LABEL = "N/A";

    public static final String UNKNOWN_ICON = "❔";

    private final String label;
    private final String icon;
    private final String description;

    ModelCategory(String label, String icon, String description) {
        this.label = label;
        this.icon = icon;
        this.description = description;
    }

    public String getLabel() {
        return label;
    }

    public String getIcon() {
        return icon;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Finds the known category whose label equals the given text, ignoring case.
     *
     * @param label a category label in any casing
     * @return the known category, or empty
     */
    public static Optional<ModelCategory> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values())
            .filter(c -> c.label.equalsIgnoreCase(trimmed))
            .findFirst();
    }

    /**
     * Icon badge for any category label, falling back to {@link #UNKNOWN_ICON}.
     *
     * @param label the canonical category label
     * @return the badge to show next to the model
     */
    public static String iconFor(String label) {
        return fromLabel(label).map(ModelCategory::getIcon).orElse(UNKNOWN_ICON);
    }
}
