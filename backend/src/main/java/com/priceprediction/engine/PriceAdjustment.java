package com.priceprediction.engine;

public record PriceAdjustment(double basePrice,
                              double multiplier,
                              double adjustedPrice,
                              double pricePerUnitArea,
                              ConfidenceLevel confidenceLevel) {
}
