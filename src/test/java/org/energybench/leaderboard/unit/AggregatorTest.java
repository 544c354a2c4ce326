package org.energybench.leaderboard.unit;

import org.energybench.leaderboard.exceptions.ValidationException;
import org.energybench.leaderboard.model.*;
import org.energybench.leaderboard.pipeline.Aggregator;
import org.energybench.leaderboard.pipeline.RecordNormalizer;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AggregatorTest {

    private final RecordNormalizer normalizer = new RecordNormalizer();
    private final Aggregator aggregator = new Aggregator();

    @Test
    void testDuplicateRunsAreAveraged() throws ValidationException {
        TaskConfig config = Fixtures.anomalyConfig();
        TaskDataset dataset = normalizer.normalize(config, List.of(
            Fixtures.anomalyRow(1, "M1", "ML/DL", "0.9", "0.5", "0.5"),
            Fixtures.anomalyRow(2, "M1", "ML/DL", "0.7", "0.5", "0.5")));

        TaskDataset aggregated = aggregator.aggregate(config, dataset);

        assertEquals(1, aggregated.size());
        ResultRecord record = aggregated.getRecords().get(0);
        assertEquals("M1", record.getModel());
        assertEquals("ML/DL", record.getCategory());
        assertEquals(0.8, record.getMetric(Column.F1_SCORE).getAsDouble(), 1e-9);
        assertEquals(List.of(1, 2), record.getSourceRows());
    }

    @Test
    void testMissingValuesAreExcludedFromMean() throws ValidationException {
        TaskConfig config = Fixtures.imputationConfig();
        TaskDataset dataset = normalizer.normalize(config, List.of(
            Fixtures.row(1, "Model", "M1", "Type", "Baseline", "Mask", "5", "MAE", "-", "MSE", "-"),
            Fixtures.row(2, "Model", "M1", "Type", "Baseline", "Mask", "5", "MAE", "0.4", "MSE", "-")));

        ResultRecord record = aggregator.aggregate(config, dataset).getRecords().get(0);

        assertEquals(0.4, record.getMetric(Column.MAE).getAsDouble(), 1e-12);
        assertTrue(record.getMetric(Column.MSE).isEmpty(), "all-missing metric must stay missing");
    }

    @Test
    void testSentinelRowStillAppears() throws ValidationException {
        TaskConfig config = Fixtures.imputationConfig();
        TaskDataset dataset = normalizer.normalize(config, List.of(
            Fixtures.row(1, "Model", "M1", "Type", "Baseline", "Mask", "5", "MAE", "-", "MSE", "0.2")));

        TaskDataset aggregated = aggregator.aggregate(config, dataset);

        assertEquals(1, aggregated.size());
        assertTrue(aggregated.getRecords().get(0).getMetric(Column.MAE).isEmpty());
    }

    @Test
    void testSameModelDifferentCategoriesStaySeparate() throws ValidationException {
        TaskConfig config = Fixtures.anomalyConfig();
        TaskDataset dataset = normalizer.normalize(config, List.of(
            Fixtures.anomalyRow(1, "M1", "Zero-shot", "0.4", "0.4", "0.4"),
            Fixtures.anomalyRow(2, "M1", "fine-tuned", "0.6", "0.6", "0.6"),
            Fixtures.anomalyRow(3, "M1", "Fine-Tuned", "0.8", "0.8", "0.8")));

        TaskDataset aggregated = aggregator.aggregate(config, dataset);

        assertEquals(2, aggregated.size());
        assertEquals("Zero-shot", aggregated.getRecords().get(0).getCategory());
        assertEquals("Fine-tuned", aggregated.getRecords().get(1).getCategory());
        assertEquals(0.7, aggregated.getRecords().get(1).getMetric(Column.F1_SCORE).getAsDouble(), 1e-9);
    }

    @Test
    void testWithoutCategoryColumnGroupsByModel() throws ValidationException {
        TaskConfig config = Fixtures.anomalyConfig();
        TaskDataset dataset = normalizer.normalize(config, List.of(
            Fixtures.row(1, "Model", "M1", "F1-score", "0.2"),
            Fixtures.row(2, "Model", "M1", "F1-score", "0.4")));

        TaskDataset aggregated = aggregator.aggregate(config, dataset);

        assertEquals(1, aggregated.size());
        assertEquals(ModelCategory.NOT_APPLICABLE_LABEL, aggregated.getRecords().get(0).getCategory());
    }

    @Test
    void testMaskLevelsAreNotMerged() throws ValidationException {
        TaskConfig config = Fixtures.imputationConfig();
        TaskDataset dataset = normalizer.normalize(config, List.of(
            Fixtures.row(1, "Model", "M1", "Type", "ML/DL", "Mask", "5", "MAE", "0.1", "MSE", "0.01"),
            Fixtures.row(2, "Model", "M1", "Type", "ML/DL", "Mask", "10", "MAE", "0.2", "MSE", "0.02"),
            Fixtures.row(3, "Model", "M1", "Type", "ML/DL", "Mask", "5", "MAE", "0.3", "MSE", "0.03")));

        TaskDataset aggregated = aggregator.aggregate(config, dataset);

        assertEquals(2, aggregated.size());
        assertEquals(5.0, aggregated.getRecords().get(0).getMetric(Column.MASK).getAsDouble(), 1e-12);
        assertEquals(0.2, aggregated.getRecords().get(0).getMetric(Column.MAE).getAsDouble(), 1e-9);
        assertEquals(10.0, aggregated.getRecords().get(1).getMetric(Column.MASK).getAsDouble(), 1e-12);
    }

    @Test
    void testFirstOccurrenceOrderIsKept() throws ValidationException {
        TaskConfig config = Fixtures.anomalyConfig();
        TaskDataset dataset = normalizer.normalize(config, List.of(
            Fixtures.anomalyRow(1, "B", "ML/DL", "0.1", "0.1", "0.1"),
            Fixtures.anomalyRow(2, "A", "ML/DL", "0.9", "0.9", "0.9"),
            Fixtures.anomalyRow(3, "B", "ML/DL", "0.3", "0.3", "0.3")));

        TaskDataset aggregated = aggregator.aggregate(config, dataset);

        assertEquals("B", aggregated.getRecords().get(0).getModel());
        assertEquals("A", aggregated.getRecords().get(1).getModel());
    }

    @Test
    void testAggregationIsIdempotentAndUnique() throws ValidationException {
        TaskConfig config = Fixtures.anomalyConfig();
        TaskDataset dataset = normalizer.normalize(config, List.of(
            Fixtures.anomalyRow(1, "A", "ML/DL", "0.1", "0.2", "-"),
            Fixtures.anomalyRow(2, "A", "ML/DL", "0.3", "-", "-"),
            Fixtures.anomalyRow(3, "B", "Zero-shot", "0.5", "0.5", "0.5"),
            Fixtures.anomalyRow(4, "A", "Zero-shot", "0.7", "0.7", "0.7")));

        TaskDataset once = aggregator.aggregate(config, dataset);
        TaskDataset twice = aggregator.aggregate(config, once);

        assertEquals(once, twice);

        Set<List<Object>> identities = new HashSet<>();
        for (ResultRecord record : once.getRecords()) {
            assertTrue(identities.add(record.groupingIdentity(config.getGroupingKeys())),
                "duplicate grouping identity for " + record);
        }
    }
}
