package org.energybench.leaderboard.pipeline;

import org.energybench.leaderboard.exceptions.ValidationException;
import org.energybench.leaderboard.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Stateless entry point of the aggregation and ranking engine.
 *
 * <p>Holds only the immutable per-task configuration, so one engine may serve concurrent
 * renders. Every call builds its own {@link ViewAssembler} and never mutates the rows it
 * is given.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class LeaderboardEngine {
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardEngine.class);

    private final Map<Task, TaskConfig> configs;

    public LeaderboardEngine(Map<Task, TaskConfig> configs) {
        Objects.requireNonNull(configs, "Configs cannot be null");
        Map<Task, TaskConfig> copy = new EnumMap<>(Task.class);
        copy.putAll(configs);
        this.configs = Collections.unmodifiableMap(copy);
        logger.info("LeaderboardEngine initialized for tasks {}", this.configs.keySet());
    }

    public TaskConfig getConfig(Task task) {
        TaskConfig config = configs.get(task);
        if (config == null) {
            throw new IllegalArgumentException("No configuration for task " + task);
        }
        return config;
    }

    public Set<Task> getTasks() {
        return configs.keySet();
    }

    /**
     * Renders one task view with the task's default ordering.
     *
     * @param task the task
     * @param rawRows raw rows of the task's dataset
     * @param acceptedCategories category labels to keep; empty yields an empty view
     * @param acceptedColumns column names to show; identity columns are always shown
     * @return the sorted view
     * @throws ValidationException if the raw rows cannot be normalized
     */
    public LeaderboardView runPipeline(Task task, List<RawRow> rawRows,
                                       Collection<String> acceptedCategories,
                                       Collection<String> acceptedColumns) throws ValidationException {
        return runPipeline(task, rawRows, acceptedCategories, acceptedColumns, null);
    }

    /**
     * Renders one task view with an explicit ordering.
     *
     * @param sortOrder requested ordering, or {@code null} for the task default
     * @see #runPipeline(Task, List, Collection, Collection)
     */
    public LeaderboardView runPipeline(Task task, List<RawRow> rawRows,
                                       Collection<String> acceptedCategories,
                                       Collection<String> acceptedColumns,
                                       SortOrder sortOrder) throws ValidationException {
        TaskConfig config = getConfig(task);
        return new ViewAssembler(config, rawRows).assemble(acceptedCategories, acceptedColumns, sortOrder);
    }

    /**
     * Renders the view a first-time visitor sees: every category, default columns.
     */
    public LeaderboardView runDefaultPipeline(Task task, List<RawRow> rawRows) throws ValidationException {
        return new ViewAssembler(getConfig(task), rawRows).assembleDefault();
    }

    /**
     * The model-type filter choices for a task, in first-seen order.
     *
     * @throws ValidationException if the raw rows cannot be normalized
     */
    public List<CategoryOption> categoryOptions(Task task, List<RawRow> rawRows) throws ValidationException {
        TaskDataset dataset = new RecordNormalizer().normalize(getConfig(task), rawRows);
        return dataset.getCategoryOrder().stream()
            .map(CategoryOption::of)
            .collect(Collectors.toList());
    }
}
