package com.herzen.irt.analysis;

import com.herzen.irt.curves.CurveModels.ItemCurveResult;
import com.herzen.irt.error.AnalysisException;
import com.herzen.irt.error.ErrorKind;
import com.herzen.irt.estimation.ModelType;
import com.herzen.irt.parameters.ItemParameter;

import java.time.Instant;
import java.util.List;

public class AnalysisModels {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public record ModelInfo(ModelType type, boolean converged, int iterations, Double logLikelihood) {}

    public record DataSummary(int nStudents, int nItems, int originalStudents, double responseRate, List<String> itemLabels) {}

    public record ModelFit(Double m2,
                           Integer m2Df,
                           Double m2P,
                           Double tli,
                           Double rmsea,
                           Double reliability,
                           Double logLikelihood,
                           Double aic,
                           Double bic,
                           boolean converged) {}

    public record TestInformation(List<Double> theta, List<Double> information) {}

    public record AnalysisResult(String status,
                                 ModelType analysisType,
                                 ModelInfo modelInfo,
                                 DataSummary dataSummary,
                                 List<ItemParameter> itemParameters,
                                 ModelFit modelFit,
                                 TestInformation testInformation) {}

    public record ResponseCurveResponse(String status, List<ItemCurveResult> curves) {}

    public record ItemInformationResponse(String status, List<ItemCurveResult> curves) {}

    public record TestInformationResponse(String status, List<Double> theta, List<Double> information) {}

    public record ExportMetadata(String exportVersion, Instant exportTimestamp, String software) {}

    public record SessionInfo(String sessionId, ModelType analysisType) {}

    public record ResultExport(ExportMetadata metadata,
                               SessionInfo sessionInfo,
                               DataSummary dataSummary,
                               ModelInfo modelInfo,
                               ModelFit modelFit,
                               List<ItemParameter> itemParameters,
                               TestInformation testInformation) {}

    public record ErrorResponse(String status, String error, ErrorKind kind) {
        public static ErrorResponse of(AnalysisException e) {
            return new ErrorResponse(ERROR, e.getMessage(), e.kind());
        }
    }
}
