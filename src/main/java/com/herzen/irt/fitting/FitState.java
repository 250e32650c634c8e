package com.herzen.irt.fitting;

public enum FitState {
    ATTEMPTING_RICH,
    RICH_ACCEPTED,
    RICH_REJECTED,
    ATTEMPTING_SIMPLE,
    SIMPLE_ACCEPTED;

    public boolean isTerminal() {
        return this == RICH_ACCEPTED || this == SIMPLE_ACCEPTED;
    }
}
