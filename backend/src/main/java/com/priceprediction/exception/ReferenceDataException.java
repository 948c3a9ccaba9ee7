package com.priceprediction.exception;

/** Reference tables that are missing, unreadable or violate their invariants. */
public class ReferenceDataException extends PricePredictionException {
    public ReferenceDataException(String message) {
        super("REFERENCE_DATA_ERROR", message);
    }
    public ReferenceDataException(String message, Throwable cause) {
        super("REFERENCE_DATA_ERROR", message, cause);
    }
}
