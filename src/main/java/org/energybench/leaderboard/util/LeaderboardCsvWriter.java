package org.energybench.leaderboard.util;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.energybench.leaderboard.model.Column;
import org.energybench.leaderboard.model.LeaderboardView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Exports sorted leaderboard views as CSV, one file per task, header row first.
 * Values are written exactly as displayed.
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public final class LeaderboardCsvWriter {
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardCsvWriter.class);

    private static final String FILE_SUFFIX = "_leaderboard.csv";

    private LeaderboardCsvWriter() {
        // Utility class
    }

    /**
     * File name used for a task's export.
     */
    public static String fileNameFor(LeaderboardView view) {
        return view.getTask().getKey() + FILE_SUFFIX;
    }

    /**
     * Writes a view into the output directory, replacing any previous export of the task.
     *
     * @param view the sorted view
     * @param outputDir directory to write into; created if absent
     * @return path of the written file
     * @throws IOException if writing fails
     */
    public static Path write(LeaderboardView view, Path outputDir) throws IOException {
        Objects.requireNonNull(view, "View cannot be null");
        Objects.requireNonNull(outputDir, "Output directory cannot be null");

        Files.createDirectories(outputDir);
        Path path = outputDir.resolve(fileNameFor(view));

        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(view.getHeaderLabels().toArray(new String[0]))
            .setRecordSeparator("\n")
            .build();

        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {

            for (Map<Column, String> row : view.getRows()) {
                List<String> record = new ArrayList<>(view.getColumns().size());
                for (Column column : view.getColumns()) {
                    record.add(row.get(column));
                }
                printer.printRecord(record);
            }

            printer.flush();
        }

        logger.info("Wrote {} {} rows to {}", view.size(), view.getTask().getDisplayName(), path);
        return path;
    }
}
