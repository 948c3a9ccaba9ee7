package com.priceprediction.reference;

public record AreaTierEntry(String areaName, AreaTier tier, double multiplier) {
}
