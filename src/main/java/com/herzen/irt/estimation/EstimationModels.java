package com.herzen.irt.estimation;

public class EstimationModels {
    /** One row of a coefficient or standard-error table; {@code null} means not reported. */
    public record ItemCoefficients(Double discrimination, Double difficulty, Double guessing) {}

    public record GoodnessOfFit(Double m2, Integer df, Double p, Double tli, Double rmsea) {}

    public record FitReport(boolean converged,
                            int iterations,
                            double logLikelihood,
                            GoodnessOfFit goodnessOfFit,
                            Double reliability,
                            Double aic,
                            Double bic) {}
}
