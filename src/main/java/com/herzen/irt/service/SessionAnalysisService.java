package com.herzen.irt.service;

import com.herzen.irt.analysis.AnalysisModels.*;
import com.herzen.irt.analysis.AnalysisService;
import com.herzen.irt.analysis.InvalidRequestException;
import com.herzen.irt.analysis.ResultCsvExporter;
import com.herzen.irt.analysis.ResultJsonExporter;
import com.herzen.irt.analysis.SessionNotFoundException;
import com.herzen.irt.config.IrtProperties;
import com.herzen.irt.domain.ResponseModels.RawResponseTable;
import com.herzen.irt.jobs.AnalysisJobService;
import com.herzen.irt.jobs.JobModels.JobStatus;
import com.herzen.irt.jobs.JobModels.StatusRecord;
import com.herzen.irt.jobs.JobModels.StoredDataset;
import com.herzen.irt.jobs.JobModels.UploadResponse;
import com.herzen.irt.parser.ResponseCsvParser;
import com.herzen.irt.repository.AnalysisResultJdbcRepository;
import com.herzen.irt.repository.DatasetJdbcRepository;
import com.herzen.irt.validation.ResponseMatrixValidator;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Session-scoped facade used by the HTTP layer: uploads start background analyses, curve requests
 * resolve the stored dataset and call the analysis core with the session id as dataset key.
 */
@Service
public class SessionAnalysisService {
    static final String UPLOAD_MESSAGE = "File uploaded successfully. Analysis started.";

    private final ResponseCsvParser parser;
    private final ResponseMatrixValidator validator;
    private final DatasetJdbcRepository datasets;
    private final AnalysisResultJdbcRepository results;
    private final AnalysisService analysisService;
    private final AnalysisJobService jobService;
    private final ResultCsvExporter exporter;
    private final ResultJsonExporter jsonExporter;
    private final Clock clock;
    private final Duration ttl;

    public SessionAnalysisService(ResponseCsvParser parser,
                                  ResponseMatrixValidator validator,
                                  DatasetJdbcRepository datasets,
                                  AnalysisResultJdbcRepository results,
                                  AnalysisService analysisService,
                                  AnalysisJobService jobService,
                                  ResultCsvExporter exporter,
                                  ResultJsonExporter jsonExporter,
                                  Clock clock,
                                  IrtProperties properties) {
        this.parser = parser;
        this.validator = validator;
        this.datasets = datasets;
        this.results = results;
        this.analysisService = analysisService;
        this.jobService = jobService;
        this.exporter = exporter;
        this.jsonExporter = jsonExporter;
        this.clock = clock;
        this.ttl = properties.sessions().ttl();
    }

    public UploadResponse upload(String fileName, String content) {
        if (fileName == null || !fileName.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new InvalidRequestException("Only CSV files are supported");
        }
        RawResponseTable table = parser.parse(content);
        if (table.itemCount() < 2) {
            throw new InvalidRequestException("CSV must contain at least 2 item columns");
        }
        // rejects uploads left with fewer than two varying items
        validator.dropInvariantItems(table);

        String sessionId = UUID.randomUUID().toString();
        String taskId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        datasets.save(new StoredDataset(sessionId, fileName, content, now, now.plus(ttl)));
        jobService.submit(sessionId);
        return new UploadResponse(taskId, sessionId, JobStatus.PENDING, UPLOAD_MESSAGE);
    }

    public StatusRecord status(String sessionId) {
        return results.findStatus(sessionId, clock.instant())
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Stored result, or empty while the session is known but its analysis has not finished.
     */
    public Optional<AnalysisResult> result(String sessionId) {
        Instant now = clock.instant();
        Optional<AnalysisResult> result = results.findResult(sessionId, now);
        if (result.isEmpty() && results.findStatus(sessionId, now).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        return result;
    }

    public ResponseCurveResponse itemCurve(String sessionId, String itemId) {
        return analysisService.itemCurve(sessionId, table(sessionId), itemId);
    }

    public ItemInformationResponse itemInformation(String sessionId) {
        return analysisService.itemInformationFunction(sessionId, table(sessionId));
    }

    public TestInformationResponse testInformation(String sessionId) {
        return analysisService.testInformationFunction(sessionId, table(sessionId));
    }

    public String exportCsv(String sessionId) {
        AnalysisResult result = results.findResult(sessionId, clock.instant())
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return exporter.toCsv(result);
    }

    public String exportJson(String sessionId) {
        Instant now = clock.instant();
        AnalysisResult result = results.findResult(sessionId, now)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return jsonExporter.toJson(sessionId, result, now);
    }

    private RawResponseTable table(String sessionId) {
        return datasets.find(sessionId, clock.instant())
                .map(d -> validator.dropInvariantItems(parser.parse(d.content())))
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
