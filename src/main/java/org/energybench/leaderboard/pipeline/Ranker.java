package org.energybench.leaderboard.pipeline;

import org.energybench.leaderboard.model.Column;
import org.energybench.leaderboard.model.MetricDirection;
import org.energybench.leaderboard.model.ResultRecord;
import org.energybench.leaderboard.model.TaskConfig;
import org.energybench.leaderboard.model.TaskDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Competition ("min") ranking on the task's primary metric.
 *
 * <p>Tied values share the rank of the first record of the tie group and the next distinct
 * value resumes at its 1-based position, so {@code [0.9, 0.9, 0.8]} under
 * higher-is-better ranks {@code [1, 1, 3]}. Records without a primary metric get no rank
 * and are placed last.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class Ranker {
    private static final Logger logger = LoggerFactory.getLogger(Ranker.class);

    /**
     * Ranks an aggregated dataset.
     *
     * @param config task configuration naming the primary metric and direction
     * @param dataset aggregated dataset
     * @return a new dataset in rank order with ranks attached
     */
    public TaskDataset rank(TaskConfig config, TaskDataset dataset) {
        Objects.requireNonNull(config, "Config cannot be null");
        Objects.requireNonNull(dataset, "Dataset cannot be null");

        Column metric = config.getPrimaryMetric();
        List<ResultRecord> ordered = new ArrayList<>(dataset.getRecords());
        ordered.sort(bestFirst(metric, config.getDirection()));

        List<ResultRecord> ranked = new ArrayList<>(ordered.size());
        Integer currentRank = null;
        double previous = Double.NaN;
        for (int i = 0; i < ordered.size(); i++) {
            ResultRecord record = ordered.get(i);
            OptionalDouble value = record.getMetric(metric);
            if (value.isEmpty()) {
                ranked.add(record.withRank(null));
                continue;
            }
            if (currentRank == null || value.getAsDouble() != previous) {
                currentRank = i + 1;
                previous = value.getAsDouble();
            }
            ranked.add(record.withRank(currentRank));
        }

        logger.debug("Ranked {} {} records on {} ({})", ranked.size(),
            config.getTask().getDisplayName(), metric.getLabel(), config.getDirection());
        return dataset.withRecords(ranked);
    }

    /**
     * Stable ordering by a metric, best first, missing values last in either direction.
     *
     * @param metric the metric column to order by
     * @param direction which end of the scale is better
     * @return comparator usable with a stable sort
     */
    public static Comparator<ResultRecord> bestFirst(Column metric, MetricDirection direction) {
        Comparator<Double> values = direction.bestFirst();
        return (a, b) -> {
            OptionalDouble va = a.getMetric(metric);
            OptionalDouble vb = b.getMetric(metric);
            if (va.isEmpty() || vb.isEmpty()) {
                return Boolean.compare(va.isEmpty(), vb.isEmpty());
            }
            return values.compare(va.getAsDouble(), vb.getAsDouble());
        };
    }
}
