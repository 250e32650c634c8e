package com.herzen.irt;

import com.herzen.irt.analysis.AnalysisModels.AnalysisResult;
import com.herzen.irt.estimation.ModelEstimationClient;
import com.herzen.irt.estimation.ModelType;
import com.herzen.irt.jobs.AnalysisJobService;
import com.herzen.irt.jobs.JobModels.JobStatus;
import com.herzen.irt.jobs.JobModels.StatusRecord;
import com.herzen.irt.jobs.JobModels.StoredDataset;
import com.herzen.irt.repository.AnalysisResultJdbcRepository;
import com.herzen.irt.repository.DatasetJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@SpringBootTest
class AnalysisJobServiceTest {
    @Autowired
    private AnalysisJobService jobService;

    @Autowired
    private DatasetJdbcRepository datasets;

    @Autowired
    private AnalysisResultJdbcRepository results;

    @MockBean
    private ModelEstimationClient estimationClient;

    private String storeDataset(String content) {
        String sessionId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        datasets.save(new StoredDataset(sessionId, "responses.csv", content, now, now.plus(Duration.ofHours(1))));
        return sessionId;
    }

    @Test
    void completedJobStoresResultAndStatus() throws Exception {
        when(estimationClient.isAvailable()).thenReturn(true);
        when(estimationClient.fit(any(), eq(ModelType.RICH), anyLong(), anyInt())).thenReturn(TestData.richModel());
        String sessionId = storeDataset(TestData.csv(TestData.mixedRows(12)));

        AnalysisResult result = jobService.submit(sessionId).get(10, TimeUnit.SECONDS);

        assertEquals(12, result.dataSummary().nStudents());
        StatusRecord status = results.findStatus(sessionId, Instant.now()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, status.status());
        assertEquals("IRT analysis completed successfully", status.message());

        AnalysisResult stored = results.findResult(sessionId, Instant.now()).orElseThrow();
        assertEquals(ModelType.RICH, stored.analysisType());
        assertEquals(result.itemParameters(), stored.itemParameters());
    }

    @Test
    void unavailableEngineMarksJobFailed() {
        when(estimationClient.isAvailable()).thenReturn(false);
        String sessionId = storeDataset(TestData.csv(TestData.mixedRows(12)));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> jobService.submit(sessionId).get(10, TimeUnit.SECONDS));
        assertTrue(e.getCause().getMessage().contains("not available"));

        StatusRecord status = results.findStatus(sessionId, Instant.now()).orElseThrow();
        assertEquals(JobStatus.ERROR, status.status());
        assertTrue(status.message().startsWith("Analysis failed: "));
        assertTrue(results.findResult(sessionId, Instant.now()).isEmpty());
        verify(estimationClient, never()).fit(any(), any(), anyLong(), anyInt());
    }

    @Test
    void insufficientDataMarksJobFailed() {
        when(estimationClient.isAvailable()).thenReturn(true);
        String sessionId = storeDataset(TestData.csv(TestData.mixedRows(4)));

        assertThrows(ExecutionException.class, () -> jobService.submit(sessionId).get(10, TimeUnit.SECONDS));

        StatusRecord status = results.findStatus(sessionId, Instant.now()).orElseThrow();
        assertEquals(JobStatus.ERROR, status.status());
        assertTrue(status.message().contains("Not enough valid response patterns"));
    }

    @Test
    void missingDatasetMarksJobFailed() {
        String sessionId = UUID.randomUUID().toString();

        assertThrows(ExecutionException.class, () -> jobService.submit(sessionId).get(10, TimeUnit.SECONDS));

        assertEquals(JobStatus.ERROR, results.findStatus(sessionId, Instant.now()).orElseThrow().status());
    }

    @Test
    void deadlineNoticeLeavesFinishedJobsAlone() {
        Instant now = Instant.now();
        String finished = UUID.randomUUID().toString();
        String running = UUID.randomUUID().toString();
        results.saveStatus(finished, JobStatus.COMPLETED, "IRT analysis completed successfully", now, now.plus(Duration.ofHours(1)));
        results.saveStatus(running, JobStatus.PENDING, "Analysis queued", now, now.plus(Duration.ofHours(1)));

        assertFalse(results.markStillRunning(finished, "Analysis is still running; result not yet available", now));
        assertTrue(results.markStillRunning(running, "Analysis is still running; result not yet available", now));

        StatusRecord done = results.findStatus(finished, now).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals("IRT analysis completed successfully", done.message());
        StatusRecord stillRunning = results.findStatus(running, now).orElseThrow();
        assertEquals(JobStatus.PROCESSING, stillRunning.status());
        assertEquals("Analysis is still running; result not yet available", stillRunning.message());
    }
}
