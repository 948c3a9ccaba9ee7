package com.priceprediction.engine;

/** Stage tracker of a single item; transitions only move forward. */
final class PredictionContext {

    private PredictionStage stage = PredictionStage.RECEIVED;

    PredictionStage stage() {
        return stage;
    }

    void advance(PredictionStage next) {
        if (!stage.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal prediction transition " + stage + " -> " + next);
        }
        stage = next;
    }
}
