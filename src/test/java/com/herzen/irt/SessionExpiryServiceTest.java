package com.herzen.irt;

import com.herzen.irt.estimation.ModelEstimationClient;
import com.herzen.irt.estimation.ModelType;
import com.herzen.irt.fitting.ModelCache;
import com.herzen.irt.jobs.JobModels.JobStatus;
import com.herzen.irt.jobs.JobModels.StoredDataset;
import com.herzen.irt.jobs.SessionExpiryService;
import com.herzen.irt.repository.AnalysisResultJdbcRepository;
import com.herzen.irt.repository.DatasetJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@SpringBootTest
class SessionExpiryServiceTest {
    @Autowired
    private SessionExpiryService expiryService;

    @Autowired
    private DatasetJdbcRepository datasets;

    @Autowired
    private AnalysisResultJdbcRepository results;

    @Autowired
    private ModelCache modelCache;

    @MockBean
    private ModelEstimationClient estimationClient;

    @Test
    void purgesExpiredSessionsAndTheirModels() {
        when(estimationClient.fit(any(), eq(ModelType.RICH), anyLong(), anyInt())).thenReturn(TestData.richModel());
        Instant now = Instant.now();
        String expired = UUID.randomUUID().toString();
        String live = UUID.randomUUID().toString();
        String csv = TestData.csv(TestData.mixedRows(12));

        datasets.save(new StoredDataset(expired, "old.csv", csv, now.minus(Duration.ofHours(2)), now.minusSeconds(1)));
        datasets.save(new StoredDataset(live, "new.csv", csv, now, now.plus(Duration.ofHours(1))));
        results.saveStatus(expired, JobStatus.COMPLETED, "done", now.minus(Duration.ofHours(2)), now.minusSeconds(1));
        modelCache.getOrFit(expired, TestData.matrix(12));
        modelCache.getOrFit(live, TestData.matrix(12));

        List<String> purged = expiryService.purgeExpired();

        assertTrue(purged.contains(expired));
        assertFalse(purged.contains(live));
        assertFalse(modelCache.contains(expired));
        assertTrue(modelCache.contains(live));
        assertTrue(datasets.find(expired, now.minus(Duration.ofHours(1))).isEmpty());
        assertTrue(datasets.find(live, now).isPresent());
        assertTrue(results.findStatus(expired, now.minus(Duration.ofHours(1))).isEmpty());
    }

    @Test
    void expiredRowsAreInvisibleBeforePurge() {
        Instant now = Instant.now();
        String sessionId = UUID.randomUUID().toString();
        datasets.save(new StoredDataset(sessionId, "a.csv", "q1,q2\n0,1\n", now.minus(Duration.ofHours(2)), now.minusSeconds(5)));
        results.saveStatus(sessionId, JobStatus.PENDING, "queued", now, now.minusSeconds(5));

        assertTrue(datasets.find(sessionId, now).isEmpty());
        assertTrue(results.findStatus(sessionId, now).isEmpty());
    }
}
