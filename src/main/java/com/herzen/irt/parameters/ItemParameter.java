package com.herzen.irt.parameters;

import com.herzen.irt.estimation.ModelType;

public record ItemParameter(String itemId,
                            double discrimination,
                            double difficulty,
                            double guessing,
                            double seDiscrimination,
                            double seDifficulty,
                            double seGuessing,
                            ModelType modelType) {

    public static String itemId(int index) {
        return "item_" + (index + 1);
    }

    ItemParameter withDiscrimination(double value) {
        return new ItemParameter(itemId, value, difficulty, guessing, seDiscrimination, seDifficulty, seGuessing, modelType);
    }

    ItemParameter withDifficulty(double value) {
        return new ItemParameter(itemId, discrimination, value, guessing, seDiscrimination, seDifficulty, seGuessing, modelType);
    }

    ItemParameter withGuessing(double value) {
        return new ItemParameter(itemId, discrimination, difficulty, value, seDiscrimination, seDifficulty, seGuessing, modelType);
    }
}
