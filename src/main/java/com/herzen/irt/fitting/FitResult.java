package com.herzen.irt.fitting;

import com.herzen.irt.estimation.FittedModel;
import com.herzen.irt.estimation.ModelType;

import java.util.List;

/**
 * Outcome of one fit: the accepted model, its type and the states the fitter went through.
 */
public record FitResult(FittedModel model, ModelType type, List<FitState> path) {
    public FitResult {
        path = List.copyOf(path);
    }

    public boolean fellBack() {
        return path.contains(FitState.RICH_REJECTED);
    }
}
