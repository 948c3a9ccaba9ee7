package com.priceprediction.engine;

/**
 * The regression model. Implementations may block; failures are reported as
 * {@link com.priceprediction.exception.PricePredictionException} subtypes and are
 * never retried by the caller.
 */
public interface PriceModel {

    double predict(FeatureVector features, String requestId);
}
