package com.herzen.irt.analysis;

import com.herzen.irt.analysis.AnalysisModels.*;
import com.herzen.irt.curves.CurveEngine;
import com.herzen.irt.curves.CurveModels.Curve;
import com.herzen.irt.curves.CurveModels.ItemCurveResult;
import com.herzen.irt.domain.ResponseModels.RawResponseTable;
import com.herzen.irt.domain.ResponseModels.ValidatedResponses;
import com.herzen.irt.domain.Rounding;
import com.herzen.irt.estimation.EstimationModels.GoodnessOfFit;
import com.herzen.irt.estimation.FittedModel;
import com.herzen.irt.fitting.FitResult;
import com.herzen.irt.fitting.ModelCache;
import com.herzen.irt.parameters.ItemParameter;
import com.herzen.irt.parameters.ParameterExtractor;
import com.herzen.irt.validation.ResponseMatrixValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.herzen.irt.analysis.AnalysisModels.SUCCESS;

/**
 * Entry point of the analysis core. Every operation validates the raw table again and reuses the
 * model cached under the dataset key.
 */
@Service
public class AnalysisService {
    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);
    private static final Pattern ITEM_ID = Pattern.compile("^(?:item_)?(\\d+)$");
    private static final int STAT_PLACES = 6;

    private final ResponseMatrixValidator validator;
    private final ModelCache modelCache;
    private final ParameterExtractor extractor;
    private final CurveEngine curveEngine;

    public AnalysisService(ResponseMatrixValidator validator,
                           ModelCache modelCache,
                           ParameterExtractor extractor,
                           CurveEngine curveEngine) {
        this.validator = validator;
        this.modelCache = modelCache;
        this.extractor = extractor;
        this.curveEngine = curveEngine;
    }

    public AnalysisResult analyze(String datasetKey, RawResponseTable table) {
        ValidatedResponses validated = validator.validate(table);
        log.info("After filtering: {} of {} rows are valid for {}", validated.cleaned().rowCount(), validated.originalRows(), datasetKey);

        FitResult fit = modelCache.getOrFit(datasetKey, validated.cleaned());
        FittedModel model = fit.model();
        if (!model.converged()) {
            log.warn("Model for {} did not converge properly", datasetKey);
        }

        List<ItemParameter> parameters = extractor.extractAndClean(model, fit.type());
        Curve testInformation = curveEngine.testInformation(model);
        Double logLikelihood = Rounding.roundOrNull(model.logLikelihood(), STAT_PLACES);

        return new AnalysisResult(
                SUCCESS,
                fit.type(),
                new ModelInfo(fit.type(), model.converged(), model.iterations(), logLikelihood),
                new DataSummary(validated.cleaned().rowCount(), validated.cleaned().itemCount(),
                        validated.originalRows(), Rounding.round(validated.cleaned().responseRate(), STAT_PLACES),
                        table.itemLabels()),
                parameters,
                modelFit(model),
                new AnalysisModels.TestInformation(testInformation.theta(), testInformation.values()));
    }

    public ResponseCurveResponse itemCurve(String datasetKey, RawResponseTable table, String itemId) {
        FittedModel model = fittedModel(datasetKey, table);
        if (itemId == null || itemId.isBlank()) {
            return new ResponseCurveResponse(SUCCESS, curveEngine.responseCurves(model));
        }
        int index = itemIndex(itemId, model.itemCount());
        return new ResponseCurveResponse(SUCCESS, List.of(curveEngine.responseCurve(model, index)));
    }

    public ItemInformationResponse itemInformationFunction(String datasetKey, RawResponseTable table) {
        List<ItemCurveResult> curves = curveEngine.itemInformation(fittedModel(datasetKey, table));
        return new ItemInformationResponse(SUCCESS, curves);
    }

    public TestInformationResponse testInformationFunction(String datasetKey, RawResponseTable table) {
        Curve curve = curveEngine.testInformation(fittedModel(datasetKey, table));
        return new TestInformationResponse(SUCCESS, curve.theta(), curve.values());
    }

    private FittedModel fittedModel(String datasetKey, RawResponseTable table) {
        ValidatedResponses validated = validator.validate(table);
        return modelCache.getOrFit(datasetKey, validated.cleaned()).model();
    }

    int itemIndex(String itemId, int itemCount) {
        Matcher m = ITEM_ID.matcher(itemId.trim());
        if (!m.matches()) {
            throw new InvalidRequestException("Invalid item id: " + itemId);
        }
        int number;
        try {
            number = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Unknown item id: " + itemId + " (model has " + itemCount + " items)");
        }
        if (number < 1 || number > itemCount) {
            throw new InvalidRequestException("Unknown item id: " + itemId + " (model has " + itemCount + " items)");
        }
        return number - 1;
    }

    private ModelFit modelFit(FittedModel model) {
        GoodnessOfFit gof = optional("M2", model::goodnessOfFit);
        return new ModelFit(
                gof == null ? null : round(gof.m2()),
                gof == null ? null : gof.df(),
                gof == null ? null : round(gof.p()),
                gof == null ? null : round(gof.tli()),
                gof == null ? null : round(gof.rmsea()),
                round(optional("reliability", model::reliability)),
                round(optional("log-likelihood", model::logLikelihood)),
                round(optional("AIC", model::aic)),
                round(optional("BIC", model::bic)),
                model.converged());
    }

    private <T> T optional(String name, Supplier<T> statistic) {
        try {
            return statistic.get();
        } catch (RuntimeException e) {
            log.debug("{} not available: {}", name, e.getMessage());
            return null;
        }
    }

    private Double round(Double value) {
        return value == null ? null : Rounding.roundOrNull(value, STAT_PLACES);
    }
}
