package org.energybench.leaderboard.util;

import org.energybench.leaderboard.model.Column;
import org.energybench.leaderboard.model.GroupingKey;
import org.energybench.leaderboard.model.MetricDirection;
import org.energybench.leaderboard.model.Task;
import org.energybench.leaderboard.model.TaskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Loads per-task leaderboard settings from {@value #DEFAULT_CONFIG_FILE}.
 * Provides centralized configuration management for the task tables.
 *
 * <p>Keys follow {@code task.<key>.<setting>} where {@code <key>} is {@link Task#getKey()}.</p>
 *
 * @version 1.0.0
 * @since 2026-10-19
 */
public class TaskConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(TaskConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "leaderboard.properties";
    private static final String TASKS_ENABLED_KEY = "tasks.enabled";

    private final Properties config;

    /**
     * Creates a loader reading {@value #DEFAULT_CONFIG_FILE} from the classpath.
     *
     * @throws IllegalStateException if configuration cannot be loaded
     */
    public TaskConfigLoader() {
        this(DEFAULT_CONFIG_FILE);
    }

    /**
     * Creates a loader reading the given classpath resource.
     *
     * @param resourceName classpath resource name
     * @throws IllegalStateException if configuration cannot be loaded
     */
    public TaskConfigLoader(String resourceName) {
        this.config = loadConfiguration(resourceName);
    }

    /**
     * Creates a loader over already-loaded properties.
     */
    public TaskConfigLoader(Properties properties) {
        this.config = new Properties();
        this.config.putAll(Objects.requireNonNull(properties, "Properties cannot be null"));
    }

    private Properties loadConfiguration(String resourceName) {
        Properties props = new Properties();

        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new IllegalStateException("Configuration file " + resourceName + " not found in classpath");
            }

            try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
            logger.info("Successfully loaded configuration from {}", resourceName);

        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration from " + resourceName, e);
        }

        return props;
    }

    /**
     * Gets the list of enabled tasks from configuration, in configured order.
     *
     * @return enabled tasks
     * @throws IllegalArgumentException if a listed task key is unknown
     */
    public List<Task> getEnabledTasks() {
        String enabled = config.getProperty(TASKS_ENABLED_KEY, "");

        if (enabled.trim().isEmpty()) {
            logger.warn("No tasks enabled in configuration");
            return new ArrayList<>();
        }

        return splitList(enabled).stream()
            .map(Task::fromKey)
            .distinct()
            .collect(Collectors.toList());
    }

    /**
     * Builds configurations for all enabled tasks.
     *
     * @return task to configuration, in enabled order
     * @throws IllegalArgumentException if any enabled task is misconfigured
     */
    public Map<Task, TaskConfig> loadAll() {
        Map<Task, TaskConfig> configs = new LinkedHashMap<>();
        for (Task task : getEnabledTasks()) {
            configs.put(task, getTaskConfig(task));
        }
        logger.info("Loaded configuration for {} tasks", configs.size());
        return configs;
    }

    /**
     * Builds the configuration of one task.
     *
     * @param task the task
     * @return its configuration
     * @throws IllegalArgumentException if a required key is missing or a value is invalid
     */
    public TaskConfig getTaskConfig(Task task) {
        String prefix = "task." + task.getKey() + ".";

        try {
            TaskConfig taskConfig = TaskConfig.builder(task)
                .fileName(required(prefix + "file"))
                .groupingKeys(parseGroupingKeys(required(prefix + "grouping")))
                .metricColumns(parseColumns(required(prefix + "metrics")))
                .primaryMetric(parseColumn(required(prefix + "primary")))
                .direction(MetricDirection.valueOf(required(prefix + "direction").trim().toUpperCase(Locale.ROOT)))
                .rankingEnabled(Boolean.parseBoolean(config.getProperty(prefix + "ranking", "false").trim()))
                .categoryOptional(Boolean.parseBoolean(config.getProperty(prefix + "category.optional", "true").trim()))
                .availableColumns(parseColumns(required(prefix + "columns.available")))
                .defaultColumns(parseColumns(required(prefix + "columns.default")))
                .build();

            logger.debug("Loaded task configuration: {}", taskConfig);
            return taskConfig;

        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid configuration for task " + task.getKey() + ": " + e.getMessage(), e);
        }
    }

    private String required(String key) {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Missing configuration key " + key);
        }
        return value.trim();
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    private static Column parseColumn(String name) {
        return Column.fromName(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown column " + name));
    }

    private static List<Column> parseColumns(String value) {
        return splitList(value).stream()
            .map(TaskConfigLoader::parseColumn)
            .collect(Collectors.toList());
    }

    private static Set<GroupingKey> parseGroupingKeys(String value) {
        Set<GroupingKey> keys = EnumSet.noneOf(GroupingKey.class);
        for (String name : splitList(value)) {
            keys.add(GroupingKey.valueOf(name.toUpperCase(Locale.ROOT)));
        }
        return keys;
    }
}
