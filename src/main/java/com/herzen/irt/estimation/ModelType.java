package com.herzen.irt.estimation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelType {
    RICH("3PL"),
    SIMPLE("2PL");

    private final String label;

    ModelType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean hasGuessing() {
        return this == RICH;
    }
}
