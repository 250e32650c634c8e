package com.herzen.irt.analysis;

import com.herzen.irt.analysis.AnalysisModels.AnalysisResult;
import com.herzen.irt.analysis.AnalysisModels.ModelFit;
import com.herzen.irt.parameters.ItemParameter;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class ResultCsvExporter {
    private static final String PARAMETER_HEADER =
            "item_id,discrimination,difficulty,guessing,se_discrimination,se_difficulty,se_guessing,model_type";

    public String toCsv(AnalysisResult result) {
        StringBuilder sb = new StringBuilder(PARAMETER_HEADER).append('\n');
        for (ItemParameter p : result.itemParameters()) {
            sb.append(String.join(",",
                    p.itemId(),
                    number(p.discrimination()),
                    number(p.difficulty()),
                    number(p.guessing()),
                    number(p.seDiscrimination()),
                    number(p.seDifficulty()),
                    number(p.seGuessing()),
                    p.modelType().label())).append('\n');
        }

        ModelFit fit = result.modelFit();
        if (fit != null) {
            sb.append('\n').append("statistic,value").append('\n');
            row(sb, "m2", fit.m2());
            row(sb, "m2_df", fit.m2Df());
            row(sb, "m2_p", fit.m2P());
            row(sb, "tli", fit.tli());
            row(sb, "rmsea", fit.rmsea());
            row(sb, "reliability", fit.reliability());
            row(sb, "log_likelihood", fit.logLikelihood());
            row(sb, "aic", fit.aic());
            row(sb, "bic", fit.bic());
            sb.append("converged,").append(fit.converged()).append('\n');
        }
        return sb.toString();
    }

    private void row(StringBuilder sb, String name, Number value) {
        sb.append(name).append(',').append(value == null ? "NA" : value.toString()).append('\n');
    }

    private String number(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
