package com.priceprediction.reference;

import com.priceprediction.exception.ReferenceDataException;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Area name to pricing tier. Keys are trimmed and upper-cased; lookups are
 * therefore case-insensitive. Multipliers must not contradict tier order.
 */
public final class AreaTierTable {

    private final Map<String, AreaTierEntry> entries;

    public AreaTierTable(Collection<AreaTierEntry> entries) {
        Map<String, AreaTierEntry> byName = new LinkedHashMap<>();
        for (AreaTierEntry entry : entries) {
            if (entry.areaName() == null || entry.areaName().isBlank()) {
                throw new ReferenceDataException("Area tier entry without an area name");
            }
            if (entry.tier() == null) {
                throw new ReferenceDataException("Area '" + entry.areaName() + "' has no tier");
            }
            if (!(entry.multiplier() > 0) || Double.isInfinite(entry.multiplier())) {
                throw new ReferenceDataException(
                    "Area '" + entry.areaName() + "' has a non-positive multiplier " + entry.multiplier());
            }
            String key = normalize(entry.areaName());
            if (byName.putIfAbsent(key, new AreaTierEntry(key, entry.tier(), entry.multiplier())) != null) {
                throw new ReferenceDataException("Area '" + key + "' is listed more than once");
            }
        }
        assertTierOrdering(byName.values());
        this.entries = Collections.unmodifiableMap(byName);
    }

    public Optional<AreaTierEntry> find(String areaName) {
        if (areaName == null || areaName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(normalize(areaName)));
    }

    public Collection<AreaTierEntry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    public static String normalize(String areaName) {
        return areaName.trim().toUpperCase(Locale.ROOT);
    }

    // every multiplier of a tier must be >= every multiplier of any cheaper tier
    private static void assertTierOrdering(Collection<AreaTierEntry> entries) {
        Map<AreaTier, double[]> bounds = new EnumMap<>(AreaTier.class);
        for (AreaTierEntry e : entries) {
            bounds.merge(e.tier(), new double[] {e.multiplier(), e.multiplier()},
                (a, b) -> new double[] {Math.min(a[0], b[0]), Math.max(a[1], b[1])});
        }
        AreaTier previous = null;
        for (AreaTier tier : AreaTier.values()) {
            double[] current = bounds.get(tier);
            if (current == null) {
                continue;
            }
            if (previous != null && bounds.get(previous)[0] < current[1]) {
                throw new ReferenceDataException(String.format(Locale.ROOT,
                    "Multiplier ordering violated: %s minimum %.3f is below %s maximum %.3f",
                    previous.getLabel(), bounds.get(previous)[0], tier.getLabel(), current[1]));
            }
            previous = tier;
        }
    }
}
