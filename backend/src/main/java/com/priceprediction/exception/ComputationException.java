package com.priceprediction.exception;

public class ComputationException extends PricePredictionException {
    public ComputationException(String message) {
        super("COMPUTATION_ERROR", message);
    }
}
