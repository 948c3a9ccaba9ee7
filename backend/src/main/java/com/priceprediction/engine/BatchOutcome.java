package com.priceprediction.engine;

import lombok.Value;

import java.util.List;

@Value
public class BatchOutcome {
    List<PredictionOutcome> outcomes;
    BatchSummary            summary;
}
