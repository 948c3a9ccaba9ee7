package com.priceprediction.reference;

public enum AutoFillStrategy {
    /** Suggest area_size as the average size of the request's bedroom bucket. */
    SIZE_RANGE_AVERAGE
}
