package com.priceprediction.engine;

import com.priceprediction.exception.ComputationException;

import java.util.List;

/**
 * Applies the location multiplier to a base model price and grades the
 * result. No rounding happens here.
 */
public class PriceAdjuster {

    private final AreaTierLookup areaTiers;

    public PriceAdjuster(AreaTierLookup areaTiers) {
        this.areaTiers = areaTiers;
    }

    public AreaTierMatch lookup(String areaName) {
        return areaTiers.lookup(areaName);
    }

    public PriceAdjustment adjust(double basePrice, double multiplier, double areaSize,
                                  List<PredictionWarning> warnings) {
        if (!(areaSize > 0) || Double.isInfinite(areaSize)) {
            throw new ComputationException("Price per unit area is undefined for area_size " + areaSize);
        }
        if (!Double.isFinite(basePrice)) {
            throw new ComputationException("Base price is not a finite number: " + basePrice);
        }
        if (!(multiplier > 0) || Double.isInfinite(multiplier)) {
            throw new ComputationException("Multiplier must be positive, got " + multiplier);
        }
        double adjusted = basePrice * multiplier;
        return new PriceAdjustment(basePrice, multiplier, adjusted, adjusted / areaSize, confidenceFor(warnings));
    }

    /** High without warnings, Medium with advisory warnings only, Low otherwise. */
    public static ConfidenceLevel confidenceFor(List<PredictionWarning> warnings) {
        if (warnings == null || warnings.isEmpty()) {
            return ConfidenceLevel.HIGH;
        }
        return warnings.stream().allMatch(PredictionWarning::isAdvisory)
            ? ConfidenceLevel.MEDIUM
            : ConfidenceLevel.LOW;
    }
}
