package com.priceprediction.reference;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse pricing category of a location, declared from the most to the least
 * expensive. {@link #rank()} grows with price.
 */
public enum AreaTier {
    ULTRA_LUXURY("Ultra Luxury", 2.0),
    LUXURY("Luxury", 1.5),
    PREMIUM("Premium", 1.2),
    AVERAGE("Average", 1.0),
    BUDGET("Budget", 0.9);

    private final String label;
    private final double defaultMultiplier;

    AreaTier(String label, double defaultMultiplier) {
        this.label = label;
        this.defaultMultiplier = defaultMultiplier;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public double getDefaultMultiplier() {
        return defaultMultiplier;
    }

    public int rank() {
        return values().length - ordinal();
    }

    @JsonCreator
    public static AreaTier fromLabel(String value) {
        String key = value.toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        for (AreaTier tier : values()) {
            if (tier.name().replace("_", "").equals(key)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown area tier '" + value + "'");
    }
}
