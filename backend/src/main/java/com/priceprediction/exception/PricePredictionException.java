package com.priceprediction.exception;

import lombok.Getter;

@Getter
public abstract class PricePredictionException extends RuntimeException {
    private final String errorCode;
    protected PricePredictionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected PricePredictionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
