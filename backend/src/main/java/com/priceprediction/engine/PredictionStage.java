package com.priceprediction.engine;

/** Lifecycle of one item: RECEIVED, FORM_RESOLVED, VALIDATED, PRICED; any live stage may go to REJECTED. */
public enum PredictionStage {
    RECEIVED,
    FORM_RESOLVED,
    VALIDATED,
    PRICED,
    REJECTED;

    public boolean isTerminal() {
        return this == PRICED || this == REJECTED;
    }

    public boolean canAdvanceTo(PredictionStage next) {
        if (isTerminal()) {
            return false;
        }
        return next == REJECTED || next.ordinal() == ordinal() + 1;
    }
}
