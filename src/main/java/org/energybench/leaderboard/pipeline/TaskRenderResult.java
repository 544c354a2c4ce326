package org.energybench.leaderboard.pipeline;

import org.energybench.leaderboard.model.CategoryOption;
import org.energybench.leaderboard.model.LeaderboardView;
import org.energybench.leaderboard.model.Task;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of rendering one task: either a view with its category options, or the failure.
 */
public final class TaskRenderResult {

    private final Task task;
    private final LeaderboardView view;
    private final List<CategoryOption> categoryOptions;
    private final Exception failure;

    private TaskRenderResult(Task task, LeaderboardView view, List<CategoryOption> categoryOptions,
                             Exception failure) {
        this.task = Objects.requireNonNull(task, "Task cannot be null");
        this.view = view;
        this.categoryOptions = categoryOptions;
        this.failure = failure;
    }

    public static TaskRenderResult success(LeaderboardView view) {
        Objects.requireNonNull(view, "View cannot be null");
        return new TaskRenderResult(view.getTask(), view, view.getCategoryOptions(), null);
    }

    public static TaskRenderResult failure(Task task, Exception failure) {
        return new TaskRenderResult(task, null, Collections.emptyList(),
            Objects.requireNonNull(failure, "Failure cannot be null"));
    }

    public Task getTask() {
        return task;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<LeaderboardView> getView() {
        return Optional.ofNullable(view);
    }

    public List<CategoryOption> getCategoryOptions() {
        return categoryOptions;
    }

    public Optional<Exception> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "TaskRenderResult{" + task + ", " + view + "}"
            : "TaskRenderResult{" + task + ", failed: " + failure.getMessage() + "}";
    }
}
