package com.priceprediction.exception;

public class SizeRangeNotFoundException extends PricePredictionException {
    public SizeRangeNotFoundException(int bedrooms) {
        super("SIZE_RANGE_NOT_FOUND", "No typical size range is known for " + bedrooms + " bedrooms.");
    }
}
