package com.priceprediction.exception;

public class BatchSizeExceededException extends PricePredictionException {
    public BatchSizeExceededException(int size, int max) {
        super("BATCH_SIZE_EXCEEDED",
              "Batch of " + size + " properties exceeds the maximum of " + max + " per request.");
    }
}
