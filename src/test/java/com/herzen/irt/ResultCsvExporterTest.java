package com.herzen.irt;

import com.herzen.irt.analysis.AnalysisModels.*;
import com.herzen.irt.analysis.ResultCsvExporter;
import com.herzen.irt.estimation.ModelType;
import com.herzen.irt.parameters.ItemParameter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.herzen.irt.analysis.AnalysisModels.SUCCESS;
import static org.junit.jupiter.api.Assertions.*;

class ResultCsvExporterTest {
    private final ResultCsvExporter exporter = new ResultCsvExporter();

    @Test
    void writesParameterTableAndFitStatistics() {
        AnalysisResult result = new AnalysisResult(SUCCESS, ModelType.SIMPLE,
                new ModelInfo(ModelType.SIMPLE, true, 10, -120.5),
                new DataSummary(10, 2, 12, 0.55, List.of("q1", "q2")),
                List.of(new ItemParameter("item_1", 1.25, -0.5, 0.0, 0.1, 0.2, 0.0, ModelType.SIMPLE),
                        new ItemParameter("item_2", 0.8, 1.0, 0.0, 0.0, 0.0, 0.0, ModelType.SIMPLE)),
                new ModelFit(null, null, null, null, null, 0.65, -120.5, 245.0, 250.1, true),
                new TestInformation(List.of(), List.of()));

        String[] lines = exporter.toCsv(result).split("\n", -1);

        assertEquals("item_id,discrimination,difficulty,guessing,se_discrimination,se_difficulty,se_guessing,model_type", lines[0]);
        assertEquals("item_1,1.2500,-0.5000,0.0000,0.1000,0.2000,0.0000,2PL", lines[1]);
        assertEquals("item_2,0.8000,1.0000,0.0000,0.0000,0.0000,0.0000,2PL", lines[2]);
        assertEquals("", lines[3]);
        assertEquals("statistic,value", lines[4]);
        assertEquals("m2,NA", lines[5]);
        assertEquals("m2_df,NA", lines[6]);
        assertEquals("reliability,0.65", lines[10]);
        assertEquals("converged,true", lines[14]);
    }
}
