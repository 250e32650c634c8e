package com.herzen.irt.fitting;

import com.herzen.irt.config.IrtProperties;
import com.herzen.irt.domain.ResponseModels.ResponseMatrix;
import com.herzen.irt.estimation.EstimationException;
import com.herzen.irt.estimation.EstimationModels.ItemCoefficients;
import com.herzen.irt.estimation.FittedModel;
import com.herzen.irt.estimation.ModelEstimationClient;
import com.herzen.irt.estimation.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits a 3PL model and falls back to a 2PL model when the 3PL fit fails, does not converge
 * or produces implausible coefficients. The 2PL result is always accepted.
 */
@Component
public class ModelFitter {
    private static final Logger log = LoggerFactory.getLogger(ModelFitter.class);

    static final double MIN_DISCRIMINATION = 0.01;
    static final double MAX_DISCRIMINATION = 10.0;
    static final double MAX_ABS_DIFFICULTY = 10.0;
    static final double MAX_GUESSING = 0.5;

    private final ModelEstimationClient client;
    private final long seed;
    private final int iterationBudget;

    @Autowired
    public ModelFitter(ModelEstimationClient client, IrtProperties properties) {
        this(client, properties.estimation().seed(), properties.estimation().maxCycles());
    }

    public ModelFitter(ModelEstimationClient client, long seed, int iterationBudget) {
        this.client = client;
        this.seed = seed;
        this.iterationBudget = iterationBudget;
    }

    public FitResult fit(ResponseMatrix matrix) {
        List<FitState> path = new ArrayList<>();
        FitState state = FitState.ATTEMPTING_RICH;
        FittedModel rich = null;
        FittedModel simple = null;
        path.add(state);

        while (!state.isTerminal()) {
            state = switch (state) {
                case ATTEMPTING_RICH -> {
                    rich = attemptRich(matrix);
                    yield rich != null && plausible(rich) ? FitState.RICH_ACCEPTED : FitState.RICH_REJECTED;
                }
                case RICH_REJECTED -> FitState.ATTEMPTING_SIMPLE;
                case ATTEMPTING_SIMPLE -> {
                    simple = attemptSimple(matrix);
                    yield FitState.SIMPLE_ACCEPTED;
                }
                default -> throw new IllegalStateException("Unexpected fitter state " + state);
            };
            path.add(state);
        }

        if (state == FitState.RICH_ACCEPTED) {
            log.info("3PL model accepted after {} iterations", rich.iterations());
            return new FitResult(rich, ModelType.RICH, path);
        }
        return new FitResult(simple, ModelType.SIMPLE, path);
    }

    private FittedModel attemptRich(ResponseMatrix matrix) {
        log.info("Attempting 3PL fit on {} rows x {} items", matrix.rowCount(), matrix.itemCount());
        FittedModel model;
        try {
            model = client.fit(matrix, ModelType.RICH, seed, iterationBudget);
        } catch (RuntimeException e) {
            log.warn("3PL fit failed, falling back to 2PL: {}", e.getMessage());
            return null;
        }
        if (model == null || !model.converged()) {
            log.warn("3PL fit did not converge, falling back to 2PL");
            return null;
        }
        return model;
    }

    private FittedModel attemptSimple(ResponseMatrix matrix) {
        log.info("Fitting 2PL model as fallback");
        FittedModel model;
        try {
            model = client.fit(matrix, ModelType.SIMPLE, seed, iterationBudget);
        } catch (EstimationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EstimationException("2PL fit failed: " + e.getMessage(), e);
        }
        if (model == null) {
            throw new EstimationException("2PL fit returned no model");
        }
        if (!model.converged()) {
            log.warn("2PL model did not converge; keeping it as the final fallback");
        }
        return model;
    }

    boolean plausible(FittedModel model) {
        List<ItemCoefficients> coefficients = model.coefficients();
        for (int i = 0; i < coefficients.size(); i++) {
            ItemCoefficients c = coefficients.get(i);
            if (!inRange(c.discrimination(), MIN_DISCRIMINATION, MAX_DISCRIMINATION, false)
                    || !inRange(c.difficulty(), -MAX_ABS_DIFFICULTY, MAX_ABS_DIFFICULTY, true)
                    || !inRange(c.guessing(), 0.0, MAX_GUESSING, true)) {
                log.info("3PL model has extreme parameters at item {} (a={}, b={}, g={}), falling back to 2PL",
                        i + 1, c.discrimination(), c.difficulty(), c.guessing());
                return false;
            }
        }
        return true;
    }

    private boolean inRange(Double value, double low, double high, boolean lowInclusive) {
        if (value == null || !Double.isFinite(value)) return false;
        return (lowInclusive ? value >= low : value > low) && value <= high;
    }
}
