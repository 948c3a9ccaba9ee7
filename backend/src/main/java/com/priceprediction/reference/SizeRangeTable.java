package com.priceprediction.reference;

import com.priceprediction.exception.ReferenceDataException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typical sizes per bedroom bucket ("Studio", "1BR", "2BR", ...), plus the
 * tolerance factors applied to the bounds before a size is reported as atypical.
 */
public final class SizeRangeTable {

    public static final String STUDIO = "Studio";

    private final Map<String, SizeRange> ranges;
    private final double lowerTolerance;
    private final double upperTolerance;

    public SizeRangeTable(Map<String, SizeRange> ranges, double lowerTolerance, double upperTolerance) {
        if (!(lowerTolerance > 0) || lowerTolerance > 1.0) {
            throw new ReferenceDataException("Lower size tolerance must be in (0, 1], got " + lowerTolerance);
        }
        if (upperTolerance < 1.0) {
            throw new ReferenceDataException("Upper size tolerance must be >= 1, got " + upperTolerance);
        }
        this.ranges = Collections.unmodifiableMap(new LinkedHashMap<>(ranges));
        this.lowerTolerance = lowerTolerance;
        this.upperTolerance = upperTolerance;
    }

    public static String bucketOf(int bedrooms) {
        return bedrooms == 0 ? STUDIO : bedrooms + "BR";
    }

    public Optional<SizeRange> forBedrooms(int bedrooms) {
        return Optional.ofNullable(ranges.get(bucketOf(bedrooms)));
    }

    public boolean isBelowTypical(SizeRange range, double areaSize) {
        return areaSize < range.minTypical() * lowerTolerance;
    }

    public boolean isAboveTypical(SizeRange range, double areaSize) {
        return areaSize > range.maxTypical() * upperTolerance;
    }

    public Map<String, SizeRange> ranges() {
        return ranges;
    }

    public double lowerTolerance() {
        return lowerTolerance;
    }

    public double upperTolerance() {
        return upperTolerance;
    }
}
