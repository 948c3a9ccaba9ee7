package com.priceprediction.engine;

public record PredictionWarning(WarningKind kind, String message) {

    public static PredictionWarning of(WarningKind kind, String message) {
        return new PredictionWarning(kind, message);
    }

    public boolean isAdvisory() {
        return kind.isAdvisory();
    }
}
