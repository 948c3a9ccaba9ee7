package com.priceprediction.engine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Either a priced result or a rejection; exactly one is non-null. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PredictionOutcome {
    PredictionResult result;
    Rejection        rejection;

    public static PredictionOutcome priced(PredictionResult result) {
        return new PredictionOutcome(result, null);
    }

    public static PredictionOutcome rejected(Rejection rejection) {
        return new PredictionOutcome(null, rejection);
    }

    public boolean isPriced() {
        return result != null;
    }
}
