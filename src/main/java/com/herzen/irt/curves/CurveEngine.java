package com.herzen.irt.curves;

import com.herzen.irt.curves.CurveModels.Curve;
import com.herzen.irt.curves.CurveModels.ItemCurveResult;
import com.herzen.irt.domain.Rounding;
import com.herzen.irt.estimation.FittedModel;
import com.herzen.irt.parameters.ItemParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

@Component
public class CurveEngine {
    private static final Logger log = LoggerFactory.getLogger(CurveEngine.class);

    static final int VALUE_PLACES = 8;

    public ItemCurveResult responseCurve(FittedModel model, int itemIndex) {
        String itemId = ItemParameter.itemId(itemIndex);
        try {
            return ItemCurveResult.success(itemId, toCurve(model.probability(itemIndex, AbilityGrid.values())));
        } catch (RuntimeException e) {
            throw new CurveComputationException("Response curve failed for " + itemId + ": " + e.getMessage(), e);
        }
    }

    public List<ItemCurveResult> responseCurves(FittedModel model) {
        return IntStream.range(0, model.itemCount())
                .mapToObj(i -> responseCurve(model, i))
                .toList();
    }

    public ItemCurveResult itemInformation(FittedModel model, int itemIndex) {
        String itemId = ItemParameter.itemId(itemIndex);
        try {
            return ItemCurveResult.success(itemId, toCurve(model.itemInformation(itemIndex, AbilityGrid.values())));
        } catch (RuntimeException e) {
            log.warn("Item information failed for {}: {}", itemId, e.getMessage());
            return ItemCurveResult.failure(itemId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    public List<ItemCurveResult> itemInformation(FittedModel model) {
        List<ItemCurveResult> out = new ArrayList<>(model.itemCount());
        for (int i = 0; i < model.itemCount(); i++) {
            out.add(itemInformation(model, i));
        }
        long failed = out.stream().filter(ItemCurveResult::failed).count();
        if (failed > 0) {
            log.warn("{} of {} item information curves could not be computed", failed, out.size());
        }
        return out;
    }

    public Curve testInformation(FittedModel model) {
        try {
            return toCurve(model.testInformation(AbilityGrid.values()));
        } catch (RuntimeException e) {
            log.warn("Test information failed: {}", e.getMessage());
            return Curve.placeholder();
        }
    }

    private Curve toCurve(double[] values) {
        if (values == null || values.length != AbilityGrid.POINTS) {
            throw new IllegalStateException("Expected " + AbilityGrid.POINTS + " values but got "
                    + (values == null ? 0 : values.length));
        }
        List<Double> rounded = new ArrayList<>(values.length);
        for (double v : values) {
            rounded.add(Rounding.roundOrNull(v, VALUE_PLACES));
        }
        return new Curve(AbilityGrid.rounded(), Collections.unmodifiableList(rounded));
    }
}
