package com.priceprediction.engine;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/** Why an item could not be priced, and the last stage it reached. */
@Value
public class Rejection {
    PredictionStage stage;
    String          errorCode;
    String          reason;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    RuntimeException cause;
}
