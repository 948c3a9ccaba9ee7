package com.priceprediction.exception;

public class MlApiUnavailableException extends PricePredictionException {
    public MlApiUnavailableException(Throwable cause) {
        super("ML_API_UNAVAILABLE",
              "The price model service is currently unavailable. Please try again later.",
              cause);
    }
}
