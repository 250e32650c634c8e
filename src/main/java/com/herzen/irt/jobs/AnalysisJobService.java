package com.herzen.irt.jobs;

import com.herzen.irt.analysis.AnalysisModels.AnalysisResult;
import com.herzen.irt.analysis.AnalysisService;
import com.herzen.irt.analysis.SessionNotFoundException;
import com.herzen.irt.config.IrtProperties;
import com.herzen.irt.domain.ResponseModels.RawResponseTable;
import com.herzen.irt.estimation.EstimationException;
import com.herzen.irt.estimation.ModelEstimationClient;
import com.herzen.irt.jobs.JobModels.JobStatus;
import com.herzen.irt.jobs.JobModels.StoredDataset;
import com.herzen.irt.parser.ResponseCsvParser;
import com.herzen.irt.repository.AnalysisResultJdbcRepository;
import com.herzen.irt.repository.DatasetJdbcRepository;
import com.herzen.irt.validation.ResponseMatrixValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs analyses in the background and records their progress. A job that outlives its deadline
 * keeps running; its status only reports that the result is not yet available.
 */
@Service
public class AnalysisJobService {
    private static final Logger log = LoggerFactory.getLogger(AnalysisJobService.class);
    static final String STILL_RUNNING_MESSAGE = "Analysis is still running; result not yet available";

    private final DatasetJdbcRepository datasets;
    private final AnalysisResultJdbcRepository results;
    private final AnalysisService analysisService;
    private final ResponseCsvParser parser;
    private final ResponseMatrixValidator validator;
    private final ModelEstimationClient estimationClient;
    private final TaskExecutor executor;
    private final Clock clock;
    private final Duration ttl;
    private final Duration deadline;

    public AnalysisJobService(DatasetJdbcRepository datasets,
                              AnalysisResultJdbcRepository results,
                              AnalysisService analysisService,
                              ResponseCsvParser parser,
                              ResponseMatrixValidator validator,
                              ModelEstimationClient estimationClient,
                              @Qualifier("analysisJobExecutor") TaskExecutor executor,
                              Clock clock,
                              IrtProperties properties) {
        this.datasets = datasets;
        this.results = results;
        this.analysisService = analysisService;
        this.parser = parser;
        this.validator = validator;
        this.estimationClient = estimationClient;
        this.executor = executor;
        this.clock = clock;
        this.ttl = properties.sessions().ttl();
        this.deadline = properties.jobs().deadline();
    }

    public CompletableFuture<AnalysisResult> submit(String sessionId) {
        updateStatus(sessionId, JobStatus.PENDING, "Analysis queued");
        CompletableFuture<AnalysisResult> job = CompletableFuture.supplyAsync(() -> run(sessionId), executor);
        job.copy()
                .orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    if (unwrap(e) instanceof TimeoutException && !job.isDone()
                            && results.markStillRunning(sessionId, STILL_RUNNING_MESSAGE, clock.instant())) {
                        log.info("Analysis for {} exceeded its {} deadline and is still running", sessionId, deadline);
                    }
                    return null;
                });
        return job;
    }

    AnalysisResult run(String sessionId) {
        log.info("Starting analysis task for session {}", sessionId);
        try {
            updateStatus(sessionId, JobStatus.PROCESSING, "Reading and validating data...");
            StoredDataset dataset = datasets.find(sessionId, clock.instant())
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            RawResponseTable table = validator.dropInvariantItems(parser.parse(dataset.content()));

            if (!estimationClient.isAvailable()) {
                throw new EstimationException("Estimation service is not available. Please try again later.");
            }
            updateStatus(sessionId, JobStatus.PROCESSING, "Data loaded. " + table.rows().size() + " students, "
                    + table.itemCount() + " items. Starting 3PL analysis with 2PL fallback...");

            AnalysisResult result = analysisService.analyze(sessionId, table);
            Instant now = clock.instant();
            results.saveResult(sessionId, result, now, now.plus(ttl));
            updateStatus(sessionId, JobStatus.COMPLETED, "IRT analysis completed successfully");
            log.info("Analysis completed for session {}: {} items, {} students, {} model",
                    sessionId, result.dataSummary().nItems(), result.dataSummary().nStudents(), result.analysisType().label());
            return result;
        } catch (RuntimeException e) {
            log.error("Analysis failed for session {}: {}", sessionId, e.getMessage());
            updateStatus(sessionId, JobStatus.ERROR, "Analysis failed: " + e.getMessage());
            throw e;
        }
    }

    private void updateStatus(String sessionId, JobStatus status, String message) {
        Instant now = clock.instant();
        results.saveStatus(sessionId, status, message, now, now.plus(ttl));
    }

    private Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }
}
