package org.energybench.leaderboard.pipeline;

import org.energybench.leaderboard.model.Column;
import org.energybench.leaderboard.model.ProjectedView;
import org.energybench.leaderboard.model.ResultRecord;
import org.energybench.leaderboard.model.TaskConfig;
import org.energybench.leaderboard.model.TaskDataset;
import org.energybench.leaderboard.model.ViewCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Category filter and column projection.
 *
 * <p>An empty accepted-category set yields an empty result, never "show all". Projection
 * always keeps the identity columns so every row stays traceable to its model; when no
 * metric column survives the view is still valid and flagged
 * {@link ViewCondition#NO_METRIC_COLUMNS}.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class FilterProjector {
    private static final Logger logger = LoggerFactory.getLogger(FilterProjector.class);

    /**
     * Keeps records whose category is accepted.
     *
     * @param dataset aggregated (optionally ranked) dataset
     * @param acceptedCategories canonical category labels to keep
     * @return a new dataset, possibly empty, in input order
     */
    public TaskDataset filter(TaskDataset dataset, Collection<String> acceptedCategories) {
        Objects.requireNonNull(dataset, "Dataset cannot be null");
        Objects.requireNonNull(acceptedCategories, "Accepted categories cannot be null");

        Set<String> accepted = new HashSet<>(acceptedCategories);
        List<ResultRecord> kept = dataset.getRecords().stream()
            .filter(r -> accepted.contains(r.getCategory()))
            .collect(Collectors.toList());

        logger.debug("Category filter {} kept {} of {} {} records", accepted, kept.size(),
            dataset.size(), dataset.getTask().getDisplayName());
        return dataset.withRecords(kept);
    }

    /**
     * Restricts the visible columns.
     *
     * @param config task configuration providing the column universe and display order
     * @param dataset filtered dataset
     * @param acceptedColumns column names (enum names or header labels) the caller wants shown
     * @return the projected view
     */
    public ProjectedView project(TaskConfig config, TaskDataset dataset, Collection<String> acceptedColumns) {
        Objects.requireNonNull(config, "Config cannot be null");
        Objects.requireNonNull(dataset, "Dataset cannot be null");
        Objects.requireNonNull(acceptedColumns, "Accepted columns cannot be null");

        Set<Column> requested = EnumSet.noneOf(Column.class);
        for (String name : acceptedColumns) {
            Optional<Column> column = Column.fromName(name);
            if (column.isPresent() && config.getAvailableColumns().contains(column.get())) {
                requested.add(column.get());
            } else {
                logger.warn("Ignoring column '{}': not available for {}", name, config.getTask().getDisplayName());
            }
        }
        return projectColumns(config, dataset, requested);
    }

    /**
     * Typed variant of {@link #project(TaskConfig, TaskDataset, Collection)}.
     */
    public ProjectedView projectColumns(TaskConfig config, TaskDataset dataset, Set<Column> acceptedColumns) {
        List<Column> visible = config.getAvailableColumns().stream()
            .filter(c -> c.isIdentity() || acceptedColumns.contains(c))
            .collect(Collectors.toList());

        Set<ViewCondition> conditions = EnumSet.noneOf(ViewCondition.class);
        if (visible.stream().noneMatch(Column::isMetric)) {
            conditions.add(ViewCondition.NO_METRIC_COLUMNS);
        }
        if (dataset.isEmpty()) {
            conditions.add(ViewCondition.EMPTY_FILTER_RESULT);
        }
        return new ProjectedView(dataset.getTask(), visible, dataset.getRecords(), conditions);
    }

    /**
     * Re-applies a column set to an existing view. Projecting with the view's own columns
     * returns an equal view.
     */
    public ProjectedView reproject(ProjectedView view, Set<Column> acceptedColumns) {
        List<Column> visible = view.getColumns().stream()
            .filter(c -> c.isIdentity() || acceptedColumns.contains(c))
            .collect(Collectors.toList());

        Set<ViewCondition> conditions = EnumSet.noneOf(ViewCondition.class);
        conditions.addAll(view.getConditions());
        conditions.remove(ViewCondition.NO_METRIC_COLUMNS);
        if (visible.stream().noneMatch(Column::isMetric)) {
            conditions.add(ViewCondition.NO_METRIC_COLUMNS);
        }
        return new ProjectedView(view.getTask(), visible, view.getRecords(), conditions);
    }
}
