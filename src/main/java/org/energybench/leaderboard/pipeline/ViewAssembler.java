package org.energybench.leaderboard.pipeline;

import org.energybench.leaderboard.exceptions.ValidationException;
import org.energybench.leaderboard.model.*;
import org.energybench.leaderboard.util.ValueFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs one task's render from raw rows to the sorted view.
 *
 * <p>An assembler is single use: it moves through {@link PipelineStage}s strictly forward,
 * ranking being the only optional step. Calling a stage out of order throws
 * {@link IllegalStateException}; to start over, create a new assembler from the raw rows.
 * Only the terminal {@link LeaderboardView} leaves the assembler.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class ViewAssembler {
    private static final Logger logger = LoggerFactory.getLogger(ViewAssembler.class);

    private final TaskConfig config;
    private final List<RawRow> rawRows;
    private final RecordNormalizer normalizer;
    private final Aggregator aggregator;
    private final Ranker ranker;
    private final FilterProjector filterProjector;
    private final Sorter sorter;

    private PipelineStage stage = PipelineStage.RAW;
    private TaskDataset dataset;
    private List<CategoryOption> categoryOptions;
    private ProjectedView view;

    public ViewAssembler(TaskConfig config, List<RawRow> rawRows) {
        this(config, rawRows, new RecordNormalizer(), new Aggregator(), new Ranker(),
            new FilterProjector(), new Sorter());
    }

    public ViewAssembler(TaskConfig config, List<RawRow> rawRows, RecordNormalizer normalizer,
                         Aggregator aggregator, Ranker ranker, FilterProjector filterProjector, Sorter sorter) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.rawRows = Objects.requireNonNull(rawRows, "Raw rows cannot be null");
        this.normalizer = normalizer;
        this.aggregator = aggregator;
        this.ranker = ranker;
        this.filterProjector = filterProjector;
        this.sorter = sorter;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public ViewAssembler normalize() throws ValidationException {
        advance(PipelineStage.NORMALIZED);
        dataset = normalizer.normalize(config, rawRows);
        categoryOptions = new ArrayList<>(dataset.getCategoryOrder().size());
        for (String label : dataset.getCategoryOrder()) {
            categoryOptions.add(CategoryOption.of(label));
        }
        return this;
    }

    /**
     * The task's category options, captured before any filtering.
     *
     * @throws IllegalStateException if the rows have not been normalized yet
     */
    public List<CategoryOption> getCategoryOptions() {
        if (categoryOptions == null) {
            throw new IllegalStateException(config.getTask() + " render has not been normalized");
        }
        return Collections.unmodifiableList(categoryOptions);
    }

    public ViewAssembler aggregate() {
        advance(PipelineStage.AGGREGATED);
        dataset = aggregator.aggregate(config, dataset);
        return this;
    }

    public ViewAssembler rank() {
        advance(PipelineStage.RANKED);
        dataset = ranker.rank(config, dataset);
        return this;
    }

    public ViewAssembler filter(Collection<String> acceptedCategories) {
        advance(PipelineStage.FILTERED);
        dataset = filterProjector.filter(dataset, acceptedCategories);
        return this;
    }

    public ViewAssembler project(Collection<String> acceptedColumns) {
        advance(PipelineStage.PROJECTED);
        view = filterProjector.project(config, dataset, acceptedColumns);
        return this;
    }

    /**
     * Sorts the projected rows and returns the display-ready view.
     *
     * @param order requested ordering
     * @return the terminal view
     */
    public LeaderboardView sort(SortOrder order) {
        advance(PipelineStage.SORTED);
        ProjectedView sorted = sorter.sort(view, order);

        List<Map<Column, String>> rows = new ArrayList<>(sorted.getRecords().size());
        for (ResultRecord record : sorted.getRecords()) {
            rows.add(ValueFormatter.formatRow(record, sorted.getColumns()));
        }
        return new LeaderboardView(sorted.getTask(), sorted.getColumns(), sorted.getRecords(), rows,
            sorted.getConditions(), order, categoryOptions);
    }

    /**
     * Runs every stage in order. Ranking runs when the task enables it.
     *
     * @param acceptedCategories category labels to keep
     * @param acceptedColumns column names to show
     * @param order requested ordering, or {@code null} for the task default
     * @return the terminal view
     * @throws ValidationException if the raw rows cannot be normalized
     */
    public LeaderboardView assemble(Collection<String> acceptedCategories, Collection<String> acceptedColumns,
                                    SortOrder order) throws ValidationException {
        normalize();
        return finish(acceptedCategories, acceptedColumns, order);
    }

    /**
     * Runs every stage with every category the rows contain, the default columns and the
     * default ordering. The rows are normalized once.
     *
     * @return the terminal view
     * @throws ValidationException if the raw rows cannot be normalized
     */
    public LeaderboardView assembleDefault() throws ValidationException {
        normalize();
        List<String> categories = new ArrayList<>(dataset.getCategoryOrder());
        List<String> columns = new ArrayList<>(config.getDefaultColumns().size());
        for (Column column : config.getDefaultColumns()) {
            columns.add(column.name());
        }
        return finish(categories, columns, null);
    }

    private LeaderboardView finish(Collection<String> acceptedCategories, Collection<String> acceptedColumns,
                                   SortOrder order) {
        aggregate();
        if (config.isRankingEnabled()) {
            rank();
        }
        LeaderboardView result = filter(acceptedCategories)
            .project(acceptedColumns)
            .sort(order != null ? order : SortOrder.defaultFor(config));

        logger.debug("Assembled {} view: {}", config.getTask().getDisplayName(), result);
        return result;
    }

    private void advance(PipelineStage next) {
        if (!stage.canAdvanceTo(next)) {
            throw new IllegalStateException(String.format(
                "Cannot move %s render from %s to %s", config.getTask(), stage, next));
        }
        stage = next;
    }
}
