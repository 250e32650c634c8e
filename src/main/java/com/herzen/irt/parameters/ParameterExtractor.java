package com.herzen.irt.parameters;

import com.herzen.irt.domain.Rounding;
import com.herzen.irt.estimation.EstimationModels.ItemCoefficients;
import com.herzen.irt.estimation.FittedModel;
import com.herzen.irt.estimation.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ParameterExtractor {
    private static final Logger log = LoggerFactory.getLogger(ParameterExtractor.class);

    static final int PLACES = 4;
    static final double MAX_DISCRIMINATION = 4.0;
    static final double MIN_DISCRIMINATION = 0.1;
    static final double MAX_ABS_DIFFICULTY = 4.0;
    static final double MAX_GUESSING = 0.5;

    public List<ItemParameter> extractAndClean(FittedModel model, ModelType modelType) {
        List<ItemCoefficients> standardErrors;
        try {
            standardErrors = model.standardErrors();
            if (standardErrors == null) {
                log.warn("Standard errors not available, using zeros");
            }
        } catch (RuntimeException e) {
            log.warn("Standard error extraction failed, using zeros: {}", e.getMessage());
            standardErrors = null;
        }
        return clean(extract(model.coefficients(), standardErrors, modelType));
    }

    public List<ItemParameter> extract(List<ItemCoefficients> coefficients,
                                       List<ItemCoefficients> standardErrors,
                                       ModelType modelType) {
        List<ItemParameter> out = new ArrayList<>(coefficients.size());
        for (int i = 0; i < coefficients.size(); i++) {
            ItemCoefficients c = coefficients.get(i);
            ItemCoefficients se = standardErrors != null && i < standardErrors.size() ? standardErrors.get(i) : null;

            double a = present(c.discrimination()) ? Rounding.round(c.discrimination(), PLACES) : 1.0;
            double b = present(c.difficulty()) ? Rounding.round(c.difficulty(), PLACES) : 0.0;
            double g = modelType.hasGuessing() && present(c.guessing()) ? Rounding.round(c.guessing(), PLACES) : 0.0;

            double seA = se != null && present(se.discrimination()) ? Rounding.round(se.discrimination(), PLACES) : 0.0;
            double seB = se != null && present(se.difficulty()) ? Rounding.round(se.difficulty(), PLACES) : 0.0;
            double seG = modelType.hasGuessing() && se != null && present(se.guessing()) ? Rounding.round(se.guessing(), PLACES) : 0.0;

            out.add(new ItemParameter(ItemParameter.itemId(i), a, b, g, seA, seB, seG, modelType));
        }
        return out;
    }

    public List<ItemParameter> clean(List<ItemParameter> parameters) {
        return parameters.stream().map(this::clean).toList();
    }

    ItemParameter clean(ItemParameter p) {
        ItemParameter out = p;
        if (out.discrimination() < 0) {
            log.debug("Fixed negative discrimination for {} from {} to {}", out.itemId(), out.discrimination(), Math.abs(out.discrimination()));
            out = out.withDiscrimination(Math.abs(out.discrimination()));
        }
        if (out.discrimination() > MAX_DISCRIMINATION) {
            log.debug("Capped discrimination for {} from {} to {}", out.itemId(), out.discrimination(), MAX_DISCRIMINATION);
            out = out.withDiscrimination(MAX_DISCRIMINATION);
        }
        if (out.discrimination() < MIN_DISCRIMINATION) {
            out = out.withDiscrimination(MIN_DISCRIMINATION);
        }
        if (out.difficulty() < -MAX_ABS_DIFFICULTY) {
            out = out.withDifficulty(-MAX_ABS_DIFFICULTY);
        }
        if (out.difficulty() > MAX_ABS_DIFFICULTY) {
            out = out.withDifficulty(MAX_ABS_DIFFICULTY);
        }
        if (out.modelType().hasGuessing()) {
            if (out.guessing() < 0) {
                out = out.withGuessing(0.0);
            }
            if (out.guessing() > MAX_GUESSING) {
                out = out.withGuessing(MAX_GUESSING);
            }
        }
        return out;
    }

    private boolean present(Double value) {
        return value != null && Double.isFinite(value);
    }
}
