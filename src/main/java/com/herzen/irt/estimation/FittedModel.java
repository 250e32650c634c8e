package com.herzen.irt.estimation;

import com.herzen.irt.estimation.EstimationModels.GoodnessOfFit;
import com.herzen.irt.estimation.EstimationModels.ItemCoefficients;

import java.util.List;

/**
 * Read-only handle on a model produced by the estimation engine.
 *
 * <p>Statistics the engine could not compute are signalled with an {@link EstimationException};
 * callers decide whether that is fatal. Curve evaluation methods return one value per ability
 * point and use 0-based item indexes.
 */
public interface FittedModel {
    ModelType modelType();

    boolean converged();

    int iterations();

    double logLikelihood();

    int itemCount();

    List<ItemCoefficients> coefficients();

    /**
     * Standard errors in item order, or {@code null} when the engine did not compute them.
     */
    List<ItemCoefficients> standardErrors();

    GoodnessOfFit goodnessOfFit();

    double reliability();

    double aic();

    double bic();

    double[] probability(int itemIndex, double[] theta);

    double[] itemInformation(int itemIndex, double[] theta);

    double[] testInformation(double[] theta);
}
