package org.energybench.leaderboard.pipeline;

import org.energybench.leaderboard.exceptions.ValidationException;
import org.energybench.leaderboard.model.*;
import org.energybench.leaderboard.util.ResultCsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Owns the raw datasets loaded once at startup and renders task views on demand.
 *
 * <p>Raw datasets are immutable after {@link #load}; renders only read them, so a service
 * can be shared between concurrent viewers. Each task renders independently: a task whose
 * file failed to load or whose rows fail to normalize does not affect the others.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class LeaderboardService {
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardService.class);

    private final LeaderboardEngine engine;
    private final Map<Task, RawDataset> datasets;
    private final Map<Task, Exception> loadFailures;

    public LeaderboardService(LeaderboardEngine engine, Map<Task, RawDataset> datasets,
                              Map<Task, Exception> loadFailures) {
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        Map<Task, RawDataset> datasetCopy = new EnumMap<>(Task.class);
        datasetCopy.putAll(datasets);
        this.datasets = Collections.unmodifiableMap(datasetCopy);
        Map<Task, Exception> failureCopy = new EnumMap<>(Task.class);
        failureCopy.putAll(loadFailures);
        this.loadFailures = Collections.unmodifiableMap(failureCopy);
    }

    /**
     * Reads every configured task's CSV from a data directory.
     *
     * @param engine engine holding the task configurations
     * @param dataDir directory containing the configured result files
     * @return a service over the loaded datasets; unreadable files are recorded as load failures
     */
    public static LeaderboardService load(LeaderboardEngine engine, Path dataDir) {
        Map<Task, RawDataset> datasets = new EnumMap<>(Task.class);
        Map<Task, Exception> failures = new EnumMap<>(Task.class);

        for (Task task : engine.getTasks()) {
            Path file = dataDir.resolve(engine.getConfig(task).getFileName());
            try {
                datasets.put(task, ResultCsvReader.read(task, file));
            } catch (IOException | RuntimeException e) {
                logger.error("Failed to load {} results from {}: {}", task.getDisplayName(), file, e.getMessage());
                failures.put(task, e);
            }
        }

        logger.info("Loaded {} of {} task datasets from {}", datasets.size(), engine.getTasks().size(), dataDir);
        return new LeaderboardService(engine, datasets, failures);
    }

    public Optional<RawDataset> getDataset(Task task) {
        return Optional.ofNullable(datasets.get(task));
    }

    /**
     * Renders one task with the caller's filter and column selection.
     *
     * @param task the task
     * @param acceptedCategories category labels to keep
     * @param acceptedColumns column names to show
     * @param sortOrder requested ordering, or {@code null} for the task default
     * @return the sorted view
     * @throws ValidationException if the task's rows cannot be normalized
     * @throws IllegalStateException if the task's dataset failed to load
     */
    public LeaderboardView render(Task task, Collection<String> acceptedCategories,
                                  Collection<String> acceptedColumns, SortOrder sortOrder)
            throws ValidationException {
        return engine.runPipeline(task, rawRows(task), acceptedCategories, acceptedColumns, sortOrder);
    }

    /**
     * Renders the default view of every task, isolating failures per task.
     *
     * @return one result per configured task, in task order
     */
    public List<TaskRenderResult> renderAll() {
        List<TaskRenderResult> results = new ArrayList<>();

        for (Task task : engine.getTasks()) {
            try {
                LeaderboardView view = engine.runDefaultPipeline(task, rawRows(task));
                results.add(TaskRenderResult.success(view));
                logger.info("Rendered {}: {} rows", task.getDisplayName(), view.size());
            } catch (ValidationException e) {
                logger.error("{} view failed: {}", task.getDisplayName(), e.getMessage());
                logger.debug(e.getDetailedMessage());
                results.add(TaskRenderResult.failure(task, e));
            } catch (RuntimeException e) {
                logger.error("{} view failed", task.getDisplayName(), e);
                results.add(TaskRenderResult.failure(task, e));
            }
        }

        return results;
    }

    private List<RawRow> rawRows(Task task) {
        RawDataset dataset = datasets.get(task);
        if (dataset == null) {
            Exception cause = loadFailures.get(task);
            throw new IllegalStateException("No data loaded for " + task.getDisplayName()
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
        }
        return dataset.getRows();
    }
}
