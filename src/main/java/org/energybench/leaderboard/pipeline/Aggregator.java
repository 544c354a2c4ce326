package org.energybench.leaderboard.pipeline;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.energybench.leaderboard.model.Column;
import org.energybench.leaderboard.model.GroupingKey;
import org.energybench.leaderboard.model.ResultRecord;
import org.energybench.leaderboard.model.TaskConfig;
import org.energybench.leaderboard.model.TaskDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Collapses repeated runs of the same leaderboard entry into one record.
 *
 * <p>Records sharing a grouping identity are merged by taking the arithmetic mean of each
 * metric over its non-missing values. A metric missing in every contributing run stays
 * missing. Output follows first-occurrence order and carries no ranks.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class Aggregator {
    private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);

    /**
     * Aggregates duplicate entries.
     *
     * @param config task configuration declaring the grouping keys and metrics
     * @param dataset normalized dataset, possibly with duplicates
     * @return a new dataset with unique grouping identities
     */
    public TaskDataset aggregate(TaskConfig config, TaskDataset dataset) {
        Objects.requireNonNull(config, "Config cannot be null");
        Objects.requireNonNull(dataset, "Dataset cannot be null");

        Set<GroupingKey> keys = config.effectiveGroupingKeys(dataset.isCategoryColumnPresent());
        Map<List<Object>, List<ResultRecord>> groups = new LinkedHashMap<>();
        for (ResultRecord record : dataset.getRecords()) {
            groups.computeIfAbsent(record.groupingIdentity(keys), k -> new ArrayList<>()).add(record);
        }

        List<ResultRecord> aggregated = new ArrayList<>(groups.size());
        for (List<ResultRecord> group : groups.values()) {
            aggregated.add(merge(config, group));
        }

        if (aggregated.size() < dataset.size()) {
            logger.info("Aggregated {} {} records into {} entries (grouping by {})",
                dataset.size(), config.getTask().getDisplayName(), aggregated.size(), keys);
        }
        return dataset.withRecords(aggregated);
    }

    private ResultRecord merge(TaskConfig config, List<ResultRecord> group) {
        ResultRecord first = group.get(0);
        if (group.size() == 1) {
            return first.isRanked() ? first.withRank(null) : first;
        }

        Map<Column, OptionalDouble> metrics = new EnumMap<>(Column.class);
        for (Column column : config.getMetricColumns()) {
            metrics.put(column, meanOfPresent(group, column));
        }

        List<Integer> sourceRows = new ArrayList<>();
        for (ResultRecord record : group) {
            sourceRows.addAll(record.getSourceRows());
        }

        logger.debug("Merged {} runs of '{}' ({})", group.size(), first.getModel(), first.getCategory());
        return first.withMetrics(metrics, sourceRows);
    }

    private static OptionalDouble meanOfPresent(List<ResultRecord> group, Column column) {
        double[] values = group.stream()
            .map(r -> r.getMetric(column))
            .filter(OptionalDouble::isPresent)
            .mapToDouble(OptionalDouble::getAsDouble)
            .toArray();

        if (values.length == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(new Mean().evaluate(values));
    }
}
