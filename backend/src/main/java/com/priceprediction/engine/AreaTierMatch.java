package com.priceprediction.engine;

import com.priceprediction.reference.AreaTier;

/** Outcome of an area lookup; {@code matched} is false when the neutral fallback was used. */
public record AreaTierMatch(AreaTier tier, double multiplier, boolean matched) {

    public static final double NEUTRAL_MULTIPLIER = 1.0;

    static AreaTierMatch fallback() {
        return new AreaTierMatch(AreaTier.AVERAGE, NEUTRAL_MULTIPLIER, false);
    }
}
