package org.energybench.leaderboard.unit;

import org.energybench.leaderboard.exceptions.MalformedMetricException;
import org.energybench.leaderboard.exceptions.ValidationException;
import org.energybench.leaderboard.model.*;
import org.energybench.leaderboard.pipeline.LeaderboardEngine;
import org.energybench.leaderboard.pipeline.LeaderboardService;
import org.energybench.leaderboard.pipeline.TaskRenderResult;
import org.energybench.leaderboard.util.TaskConfigLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LeaderboardServiceTest {

    @TempDir
    Path dataDir;

    private LeaderboardEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        engine = new LeaderboardEngine(new TaskConfigLoader().loadAll());

        write("Forecasting.csv",
            "Model,Type,Out-of-distribution(OOD)_Commercial,Out-of-distribution(OOD)_Residential\n"
                + "Chronos,Zero-shot,0.42,0.51\n"
                + "Mean,Baseline,0.90,0.95\n");
        write("Anomaly_Detection_Results.csv",
            "Model,Type,F1-score,Precision,Recall\n"
                + "LSTM,ML/DL,0.61,0.55,0.70\n"
                + "LSTM,ML/DL,0.63,0.57,0.72\n");
        write("Imputation_Results.csv",
            "Model,Type,Mask,MAE,MSE\n"
                + "SAITS,ML/DL,10,0.12,oops\n");
        // Classification_Results.csv deliberately absent
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(dataDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    void testFailuresAreIsolatedPerTask() {
        LeaderboardService service = LeaderboardService.load(engine, dataDir);

        List<TaskRenderResult> results = service.renderAll();

        assertEquals(4, results.size());
        assertEquals(Task.FORECASTING, results.get(0).getTask());
        assertTrue(results.get(0).isSuccess());
        assertTrue(results.get(1).isSuccess());

        TaskRenderResult classification = results.get(2);
        assertFalse(classification.isSuccess());
        assertTrue(classification.getView().isEmpty());
        assertTrue(classification.getFailure().orElseThrow() instanceof IllegalStateException);

        TaskRenderResult imputation = results.get(3);
        assertFalse(imputation.isSuccess());
        assertTrue(imputation.getFailure().orElseThrow() instanceof MalformedMetricException);
    }

    @Test
    void testSuccessfulResultCarriesViewAndOptions() {
        TaskRenderResult anomaly = LeaderboardService.load(engine, dataDir).renderAll().get(1);

        LeaderboardView view = anomaly.getView().orElseThrow();
        assertEquals(1, view.size());
        assertEquals("0.6200", view.getRows().get(0).get(Column.F1_SCORE));
        assertEquals(1, anomaly.getCategoryOptions().size());
        assertEquals("ML/DL", anomaly.getCategoryOptions().get(0).getLabel());
        assertEquals(view.getCategoryOptions(), anomaly.getCategoryOptions());
    }

    @Test
    void testRenderWithSelection() throws ValidationException {
        LeaderboardService service = LeaderboardService.load(engine, dataDir);

        LeaderboardView view = service.render(Task.FORECASTING, List.of("Baseline"),
            List.of("TYPE", "OOD_COMMERCIAL"), null);

        assertEquals(1, view.size());
        assertEquals("Mean", view.getRows().get(0).get(Column.MODEL));
        assertEquals("Baseline", view.getRows().get(0).get(Column.TYPE));
    }

    @Test
    void testRenderOfUnloadedTaskFails() {
        LeaderboardService service = LeaderboardService.load(engine, dataDir);

        assertTrue(service.getDataset(Task.CLASSIFICATION).isEmpty());
        assertTrue(service.getDataset(Task.FORECASTING).isPresent());
        IllegalStateException ex = assertThrows(IllegalStateException.class,
            () -> service.render(Task.CLASSIFICATION, List.of(), List.of(), null));
        assertTrue(ex.getMessage().contains("Results file not found"));
    }
}
