package com.priceprediction.reference;

import com.priceprediction.exception.ReferenceDataException;

/** Typical property size, in square metres, of one bedroom bucket. */
public record SizeRange(double minTypical, double maxTypical, double average, double median) {

    public SizeRange {
        if (!(minTypical > 0) || !(maxTypical > 0) || !(average > 0) || !(median > 0)) {
            throw new ReferenceDataException("Size range values must be positive");
        }
        if (minTypical > median || median > maxTypical) {
            throw new ReferenceDataException(
                "Size range must satisfy min_typical <= median <= max_typical, got ["
                    + minTypical + ", " + median + ", " + maxTypical + "]");
        }
    }
}
