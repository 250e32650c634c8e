package com.herzen.irt.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.irt.analysis.AnalysisModels.AnalysisResult;
import com.herzen.irt.analysis.AnalysisModels.ExportMetadata;
import com.herzen.irt.analysis.AnalysisModels.ResultExport;
import com.herzen.irt.analysis.AnalysisModels.SessionInfo;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class ResultJsonExporter {
    static final String EXPORT_VERSION = "1.0";
    static final String SOFTWARE = "IRT Analysis Platform";

    private final ObjectMapper objectMapper;

    public ResultJsonExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(String sessionId, AnalysisResult result, Instant exportedAt) {
        ResultExport export = new ResultExport(
                new ExportMetadata(EXPORT_VERSION, exportedAt, SOFTWARE),
                new SessionInfo(sessionId, result.analysisType()),
                result.dataSummary(),
                result.modelInfo(),
                result.modelFit(),
                result.itemParameters(),
                result.testInformation());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize analysis result for " + sessionId, e);
        }
    }
}
