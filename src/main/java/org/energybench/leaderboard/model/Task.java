package org.energybench.leaderboard.model;

import java.util.Arrays;

/**
 * The benchmark tasks shown on the leaderboard, one tab each.
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public enum Task {
    FORECASTING("forecasting", "Forecasting", "🏆",
        "We curated a large-scale energy consumption dataset consisting of 1.26 billion hourly "
            + "observations collected from 76,217 real-world buildings, encompassing both commercial "
            + "and residential types across diverse countries and temporal spans."),
    ANOMALY_DETECTION("anomaly_detection", "Anomaly Detection", "🔍",
        "We use the Large-scale Energy Anomaly Detection (LEAD) dataset which contains electricity "
            + "meter readings from 200 buildings and anomaly labels. Missing readings were median "
            + "imputed and all readings were normalized using the Standard Scaler. Model performance "
            + "was evaluated using the F1-score as the primary evaluation metric."),
    CLASSIFICATION("classification", "Classification", "🏷️",
        "The ComStock dataset provides 15-minute simulated energy data for U.S. commercial buildings. "
            + "We selected 1,000 California buildings, using 60-minute appliance-level load data from "
            + "2018. Each appliance has binary labels. Data were split 70% for training and 30% for testing."),
    IMPUTATION("imputation", "Imputation", "🩹",
        "We used meter data from 78 commercial buildings, a subset of the BDG2 dataset, Min-Max scaled "
            + "per meter. Masking was applied to simulate missing values at 5%, 10%, 15%, and 20% levels. "
            + "Model performance was assessed using Mean Absolute Error (MAE) and Mean Squared Error (MSE).");

    private final String key;
    private final String displayName;
    private final String badge;
    private final String description;

    Task(String key, String displayName, String badge, String description) {
        this.key = key;
        this.displayName = displayName;
        this.badge = badge;
        this.description = description;
    }

    /** Key used in configuration properties and output file names. */
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getBadge() {
        return badge;
    }

    /** Dataset blurb shown above the task's table. */
    public String getDescription() {
        return description;
    }

    /** Tab title, badge followed by the display name. */
    public String getTabTitle() {
        return badge + " " + displayName;
    }

    /**
     * Resolves a task from its configuration key, ignoring case.
     *
     * @param key the configuration key, e.g. {@code anomaly_detection}
     * @return the matching task
     * @throws IllegalArgumentException if no task uses the key
     */
    public static Task fromKey(String key) {
        return Arrays.stream(values())
            .filter(t -> t.key.equalsIgnoreCase(key.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown task key: " + key));
    }
}
