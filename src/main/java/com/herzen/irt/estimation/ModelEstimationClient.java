package com.herzen.irt.estimation;

import com.herzen.irt.domain.ResponseModels.ResponseMatrix;

/**
 * Boundary to the maximum-likelihood estimation engine. Calls may block for minutes and
 * cannot be cancelled once started.
 */
public interface ModelEstimationClient {
    FittedModel fit(ResponseMatrix matrix, ModelType modelType, long seed, int iterationBudget);

    default boolean isAvailable() {
        return true;
    }
}
