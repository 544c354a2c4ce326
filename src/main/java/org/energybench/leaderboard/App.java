package org.energybench.leaderboard;

import org.energybench.leaderboard.model.LeaderboardView;
import org.energybench.leaderboard.pipeline.LeaderboardEngine;
import org.energybench.leaderboard.pipeline.LeaderboardService;
import org.energybench.leaderboard.pipeline.TaskRenderResult;
import org.energybench.leaderboard.util.LeaderboardCsvWriter;
import org.energybench.leaderboard.util.LeaderboardTableFormatter;
import org.energybench.leaderboard.util.TaskConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Main application class for the Energy Bench Leaderboard.
 * Renders the default view of every task from a directory of result files.
 *
 * <p>Usage: {@code App [dataDir] [outputDir]}. The data directory defaults to the working
 * directory; when an output directory is given each view is also exported as CSV.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        logger.info("Starting Energy Bench Leaderboard");

        Path dataDir = Paths.get(args.length > 0 ? args[0] : ".");
        Path outputDir = args.length > 1 ? Paths.get(args[1]) : null;

        try {
            int rendered = run(dataDir, outputDir);
            if (rendered == 0) {
                logger.error("No task could be rendered");
                System.exit(1);
            }
        } catch (Exception e) {
            logger.error("Critical error in application execution", e);
            System.exit(1);
        }
    }

    /**
     * Loads configuration and data, renders every task and prints the tables.
     *
     * @param dataDir directory holding the task result files
     * @param outputDir export directory, or {@code null} to skip CSV export
     * @return number of tasks rendered successfully
     */
    static int run(Path dataDir, Path outputDir) {
        LeaderboardEngine engine = new LeaderboardEngine(new TaskConfigLoader().loadAll());
        LeaderboardService service = LeaderboardService.load(engine, dataDir);

        List<TaskRenderResult> results = service.renderAll();
        int rendered = 0;
        for (TaskRenderResult result : results) {
            if (!result.isSuccess()) {
                System.out.println("=== " + result.getTask().getTabTitle() + " ===");
                System.out.println("Unavailable: " + result.getFailure().map(Exception::getMessage).orElse("unknown error"));
                System.out.println();
                continue;
            }

            LeaderboardView view = result.getView().orElseThrow();
            System.out.println(LeaderboardTableFormatter.format(view, result.getCategoryOptions()));
            rendered++;

            if (outputDir != null) {
                try {
                    LeaderboardCsvWriter.write(view, outputDir);
                } catch (IOException e) {
                    logger.error("Failed to export {} view to {}", result.getTask().getDisplayName(), outputDir, e);
                }
            }
        }

        logger.info("Rendered {} of {} tasks", rendered, results.size());
        return rendered;
    }
}
