package com.herzen.irt.estimation;

import com.herzen.irt.estimation.EstimationModels.FitReport;
import com.herzen.irt.estimation.EstimationModels.GoodnessOfFit;
import com.herzen.irt.estimation.EstimationModels.ItemCoefficients;

import java.util.List;

/**
 * Unidimensional logistic model (scaling constant D = 1) backed by the coefficient table
 * reported by the engine. For 2PL models the guessing coefficient is always 0.
 */
public class LogisticFittedModel implements FittedModel {
    private static final double PROBABILITY_FLOOR = 1e-9;

    private final ModelType modelType;
    private final List<ItemCoefficients> coefficients;
    private final List<ItemCoefficients> standardErrors;
    private final FitReport report;

    public LogisticFittedModel(ModelType modelType,
                               List<ItemCoefficients> coefficients,
                               List<ItemCoefficients> standardErrors,
                               FitReport report) {
        this.modelType = modelType;
        this.coefficients = List.copyOf(coefficients);
        this.standardErrors = standardErrors == null ? null : List.copyOf(standardErrors);
        this.report = report;
    }

    @Override
    public ModelType modelType() {
        return modelType;
    }

    @Override
    public boolean converged() {
        return report.converged();
    }

    @Override
    public int iterations() {
        return report.iterations();
    }

    @Override
    public double logLikelihood() {
        return report.logLikelihood();
    }

    @Override
    public int itemCount() {
        return coefficients.size();
    }

    @Override
    public List<ItemCoefficients> coefficients() {
        return coefficients;
    }

    @Override
    public List<ItemCoefficients> standardErrors() {
        return standardErrors;
    }

    @Override
    public GoodnessOfFit goodnessOfFit() {
        if (report.goodnessOfFit() == null) {
            throw new EstimationException("Goodness-of-fit statistic was not reported by the estimation engine");
        }
        return report.goodnessOfFit();
    }

    @Override
    public double reliability() {
        return required(report.reliability(), "reliability");
    }

    @Override
    public double aic() {
        return required(report.aic(), "AIC");
    }

    @Override
    public double bic() {
        return required(report.bic(), "BIC");
    }

    @Override
    public double[] probability(int itemIndex, double[] theta) {
        Item item = item(itemIndex);
        double[] out = new double[theta.length];
        for (int i = 0; i < theta.length; i++) {
            out[i] = item.g + (1.0 - item.g) * item.logistic(theta[i]);
        }
        return out;
    }

    @Override
    public double[] itemInformation(int itemIndex, double[] theta) {
        Item item = item(itemIndex);
        double[] out = new double[theta.length];
        for (int i = 0; i < theta.length; i++) {
            double l = item.logistic(theta[i]);
            double p = Math.min(Math.max(item.g + (1.0 - item.g) * l, PROBABILITY_FLOOR), 1.0 - PROBABILITY_FLOOR);
            double slope = item.a * (1.0 - item.g) * l * (1.0 - l);
            out[i] = slope * slope / (p * (1.0 - p));
        }
        return out;
    }

    @Override
    public double[] testInformation(double[] theta) {
        double[] total = new double[theta.length];
        for (int j = 0; j < coefficients.size(); j++) {
            double[] info = itemInformation(j, theta);
            for (int i = 0; i < theta.length; i++) {
                total[i] += info[i];
            }
        }
        return total;
    }

    private Item item(int itemIndex) {
        if (itemIndex < 0 || itemIndex >= coefficients.size()) {
            throw new EstimationException("Item index " + itemIndex + " is outside the fitted model");
        }
        ItemCoefficients c = coefficients.get(itemIndex);
        double a = c.discrimination() == null ? 1.0 : c.discrimination();
        double b = c.difficulty() == null ? 0.0 : c.difficulty();
        double g = modelType.hasGuessing() && c.guessing() != null ? c.guessing() : 0.0;
        return new Item(a, b, g);
    }

    private double required(Double value, String name) {
        if (value == null) {
            throw new EstimationException(name + " was not reported by the estimation engine");
        }
        return value;
    }

    private record Item(double a, double b, double g) {
        double logistic(double theta) {
            return 1.0 / (1.0 + Math.exp(-a * (theta - b)));
        }
    }
}
