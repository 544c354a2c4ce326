package org.energybench.leaderboard.util;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.energybench.leaderboard.model.RawDataset;
import org.energybench.leaderboard.model.RawRow;
import org.energybench.leaderboard.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads a task's benchmark result CSV into a raw dataset. Cells are kept as text;
 * interpretation is left to the record normalizer.
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public final class ResultCsvReader {
    private static final Logger logger = LoggerFactory.getLogger(ResultCsvReader.class);

    private static final CSVFormat INPUT_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setTrim(true)
        .setAllowMissingColumnNames(true)
        .build();

    private ResultCsvReader() {
        // Utility class
    }

    /**
     * Reads all records from a CSV file.
     *
     * @param task task the file belongs to
     * @param filePath path to the CSV file
     * @return the raw dataset
     * @throws IOException if the file is missing or cannot be parsed
     */
    public static RawDataset read(Task task, Path filePath) throws IOException {
        Objects.requireNonNull(task, "Task cannot be null");
        Objects.requireNonNull(filePath, "File path cannot be null");

        if (!Files.exists(filePath)) {
            throw new IOException("Results file not found: " + filePath);
        }

        try (Reader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            RawDataset dataset = read(task, reader);
            logger.info("Loaded {} {} rows from {}", dataset.size(), task.getDisplayName(), filePath);
            return dataset;
        }
    }

    /**
     * Reads all records from a CSV stream. The reader is not closed.
     *
     * @param task task the data belongs to
     * @param reader CSV text with a header row
     * @return the raw dataset
     * @throws IOException if the CSV cannot be parsed
     */
    public static RawDataset read(Task task, Reader reader) throws IOException {
        try {
            return parse(task, reader);
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            throw new IOException("Unreadable " + task.getDisplayName() + " CSV: " + e.getMessage(), e);
        }
    }

    private static RawDataset parse(Task task, Reader reader) throws IOException {
        CSVParser parser = INPUT_FORMAT.parse(reader);
        List<String> headers = new ArrayList<>();
        for (String header : parser.getHeaderNames()) {
            headers.add(stripBom(header).trim());
        }

        List<RawRow> rows = new ArrayList<>();
        int rowNumber = 0;
        for (CSVRecord record : parser) {
            rowNumber++;
            Map<String, String> cells = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                // Short rows leave trailing cells absent
                cells.put(headers.get(i), i < record.size() ? record.get(i) : null);
            }
            if (record.size() > headers.size()) {
                logger.warn("{} row {} has {} cells for {} headers; extra cells ignored",
                    task.getDisplayName(), rowNumber, record.size(), headers.size());
            }
            rows.add(new RawRow(rowNumber, cells));
        }

        return new RawDataset(task, headers, rows);
    }

    private static String stripBom(String header) {
        return header.startsWith("\uFEFF") ? header.substring(1) : header;
    }
}
