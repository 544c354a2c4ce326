package org.energybench.leaderboard.unit;

import org.energybench.leaderboard.exceptions.MalformedMetricException;
import org.energybench.leaderboard.exceptions.ValidationException;
import org.energybench.leaderboard.model.*;
import org.energybench.leaderboard.pipeline.LeaderboardEngine;
import org.energybench.leaderboard.util.TaskConfigLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LeaderboardEngineTest {

    private LeaderboardEngine engine;

    @BeforeEach
    void setUp() {
        engine = new LeaderboardEngine(new TaskConfigLoader().loadAll());
    }

    private static List<String> models(LeaderboardView view) {
        List<String> models = new ArrayList<>();
        for (ResultRecord record : view.getRecords()) {
            models.add(record.getModel());
        }
        return models;
    }

    @Test
    void testAnomalyDuplicatesAveragedAndRanked() throws ValidationException {
        List<RawRow> rows = List.of(
            Fixtures.anomalyRow(1, "M1", "ML/DL", "0.9", "0.8", "0.7"),
            Fixtures.anomalyRow(2, "M2", "Zero-shot", "0.85", "0.8", "0.9"),
            Fixtures.anomalyRow(3, "M1", "ML/DL", "0.7", "0.6", "0.5"));

        LeaderboardView view = engine.runPipeline(Task.ANOMALY_DETECTION, rows,
            List.of("ML/DL", "Zero-shot"), List.of("RANK", "F1_SCORE", "PRECISION"));

        assertEquals(List.of("M2", "M1"), models(view));
        assertEquals("0.8500", view.getRows().get(0).get(Column.F1_SCORE));
        assertEquals("0.8000", view.getRows().get(1).get(Column.F1_SCORE));
        assertEquals("0.7000", view.getRows().get(1).get(Column.PRECISION));
        assertEquals("1", view.getRows().get(0).get(Column.RANK));
        assertEquals("2", view.getRows().get(1).get(Column.RANK));
    }

    @Test
    void testEmptyCategorySelectionYieldsEmptyView() throws ValidationException {
        List<RawRow> rows = List.of(Fixtures.anomalyRow(1, "M1", "ML/DL", "0.9", "0.8", "0.7"));

        LeaderboardView view = engine.runPipeline(Task.ANOMALY_DETECTION, rows, List.of(), List.of("F1_SCORE"));

        assertTrue(view.isEmpty());
        assertEquals(List.of(Column.ICON, Column.MODEL, Column.F1_SCORE), view.getColumns());
        assertTrue(view.hasCondition(ViewCondition.EMPTY_FILTER_RESULT));
    }

    @Test
    void testImputationKeepsMaskAndSortsByMae() throws ValidationException {
        List<RawRow> rows = List.of(
            Fixtures.row(1, "Model", "Mean", "Type", "baseline", "Mask", "10", "MAE", "0.31234", "MSE", "-"),
            Fixtures.row(2, "Model", "SAITS", "Type", "ML/DL", "Mask", "10", "MAE", "0.12", "MSE", "0.05"),
            Fixtures.row(3, "Model", "SAITS", "Type", "ML/DL", "Mask", "20", "MAE", "0.2", "MSE", "0.07"));

        LeaderboardView view = engine.runDefaultPipeline(Task.IMPUTATION, rows);

        assertEquals(List.of(Column.ICON, Column.MODEL, Column.MASK, Column.MAE, Column.MSE), view.getColumns());
        assertEquals(3, view.size());
        Map<Column, String> best = view.getRows().get(0);
        assertEquals("SAITS", best.get(Column.MODEL));
        assertEquals("10", best.get(Column.MASK));
        assertEquals("0.1200", best.get(Column.MAE));
        Map<Column, String> last = view.getRows().get(2);
        assertEquals("0.3123", last.get(Column.MAE));
        assertEquals("-", last.get(Column.MSE));
        assertEquals("⚪", last.get(Column.ICON));
    }

    @Test
    void testForecastingWithoutTypeColumn() throws ValidationException {
        List<RawRow> rows = List.of(
            Fixtures.row(1, "Model", "Chronos", "Out-of-distribution(OOD)_Commercial", "0.5",
                "Out-of-distribution(OOD)_Residential", "0.6"),
            Fixtures.row(2, "Model", "Moirai", "Out-of-distribution(OOD)_Commercial", "0.3",
                "Out-of-distribution(OOD)_Residential", "0.9"));

        LeaderboardView view = engine.runDefaultPipeline(Task.FORECASTING, rows);

        assertEquals(List.of("Moirai", "Chronos"), models(view));
        assertEquals(ModelCategory.NOT_APPLICABLE_LABEL, view.getRecords().get(0).getCategory());
        assertEquals("-", view.getRows().get(0).get(Column.ID_COMMERCIAL));
        assertFalse(view.getColumns().contains(Column.RANK));
    }

    @Test
    void testClassificationDefaultShowsRank() throws ValidationException {
        List<RawRow> rows = List.of(
            Fixtures.row(1, "Model", "A", "Type", "Fine-tuned", "F1-score", "0.6"),
            Fixtures.row(2, "Model", "B", "Type", "Fine-tuned", "F1-score", "0.6"),
            Fixtures.row(3, "Model", "C", "Type", "Pre-trained", "F1-score", "0.4"));

        LeaderboardView view = engine.runDefaultPipeline(Task.CLASSIFICATION, rows);

        assertTrue(view.getColumns().contains(Column.RANK));
        assertEquals("1", view.getRows().get(0).get(Column.RANK));
        assertEquals("1", view.getRows().get(1).get(Column.RANK));
        assertEquals("3", view.getRows().get(2).get(Column.RANK));
    }

    @Test
    void testCategoryOptionsInFirstSeenOrder() throws ValidationException {
        List<RawRow> rows = List.of(
            Fixtures.anomalyRow(1, "A", "zero-shot", "0.1", "0.1", "0.1"),
            Fixtures.anomalyRow(2, "B", "ML/DL", "0.1", "0.1", "0.1"),
            Fixtures.anomalyRow(3, "C", "Zero-Shot", "0.1", "0.1", "0.1"),
            Fixtures.anomalyRow(4, "D", "", "0.1", "0.1", "0.1"));

        List<CategoryOption> options = engine.categoryOptions(Task.ANOMALY_DETECTION, rows);

        assertEquals(3, options.size());
        assertEquals("Zero-shot", options.get(0).getLabel());
        assertEquals("🔴 Zero-shot", options.get(0).getCaption());
        assertEquals("ML/DL", options.get(1).getLabel());
        assertEquals(ModelCategory.UNKNOWN_LABEL, options.get(2).getLabel());
        assertNull(options.get(2).getDescription());
    }

    @Test
    void testMalformedCellFailsRender() {
        List<RawRow> rows = List.of(Fixtures.anomalyRow(1, "A", "ML/DL", "abc", "0.1", "0.1"));

        assertThrows(MalformedMetricException.class, () -> engine.runDefaultPipeline(Task.ANOMALY_DETECTION, rows));
    }

    @Test
    void testUnconfiguredTaskIsRejected() {
        LeaderboardEngine single = new LeaderboardEngine(Map.of(Task.ANOMALY_DETECTION, Fixtures.anomalyConfig()));

        assertThrows(IllegalArgumentException.class, () -> single.getConfig(Task.IMPUTATION));
        assertEquals(1, single.getTasks().size());
    }

    @Test
    void testNegativeZeroCellRanksWithZero() throws ValidationException {
        List<RawRow> rows = List.of(
            Fixtures.row(1, "Model", "A", "Type", "ML/DL", "F1-score", "0.0"),
            Fixtures.row(2, "Model", "B", "Type", "ML/DL", "F1-score", "-0.0"));

        LeaderboardView view = engine.runDefaultPipeline(Task.CLASSIFICATION, rows);

        assertEquals(List.of("A", "B"), models(view));
        assertEquals("1", view.getRows().get(0).get(Column.RANK));
        assertEquals("1", view.getRows().get(1).get(Column.RANK));
        assertEquals("0.0000", view.getRows().get(1).get(Column.F1_SCORE));
    }
}
