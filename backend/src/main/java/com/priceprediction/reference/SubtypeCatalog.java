package com.priceprediction.reference;

import com.priceprediction.engine.PropertyType;
import com.priceprediction.engine.PropertyUsage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Known subtypes per property type and usage, and per-subtype profiles. Names compare case-insensitively. */
public final class SubtypeCatalog {

    private final Map<PropertyType, List<String>> subtypesByType;
    private final Map<PropertyUsage, List<String>> subtypesByUsage;
    private final Map<String, SubtypeProfile> profiles;

    public SubtypeCatalog(Map<PropertyType, List<String>> subtypesByType,
                          Map<PropertyUsage, List<String>> subtypesByUsage,
                          List<SubtypeProfile> profiles) {
        this.subtypesByType = Map.copyOf(subtypesByType);
        this.subtypesByUsage = Map.copyOf(subtypesByUsage);
        Map<String, SubtypeProfile> byKey = new LinkedHashMap<>();
        profiles.forEach(p -> byKey.put(key(p.name()), p));
        this.profiles = Map.copyOf(byKey);
    }

    /** True when the type has no catalogued subtypes, or the subtype is one of them. */
    public boolean isKnownFor(PropertyType type, String subtype) {
        List<String> known = subtypesByType.get(type);
        if (known == null || known.isEmpty()) {
            return true;
        }
        String k = key(subtype);
        return known.stream().anyMatch(s -> key(s).equals(k));
    }

    public Optional<SubtypeProfile> profile(String subtype) {
        if (subtype == null || subtype.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(key(subtype)));
    }

    /** Subtypes offered for a usage/type pair: the usage list filtered by the type list when both exist. */
    public List<String> optionsFor(PropertyUsage usage, PropertyType type) {
        List<String> byType = type != null ? subtypesByType.getOrDefault(type, List.of()) : List.of();
        List<String> byUsage = usage != null ? subtypesByUsage.getOrDefault(usage, List.of()) : List.of();
        if (byUsage.isEmpty()) {
            return byType.isEmpty() ? allSubtypes() : byType;
        }
        if (byType.isEmpty()) {
            return byUsage;
        }
        List<String> filtered = byUsage.stream().filter(byType::contains).toList();
        return filtered.isEmpty() ? byType : filtered;
    }

    public List<String> allSubtypes() {
        Set<String> all = new LinkedHashSet<>();
        subtypesByType.values().forEach(all::addAll);
        List<String> sorted = new ArrayList<>(all);
        sorted.sort(String.CASE_INSENSITIVE_ORDER);
        return sorted;
    }

    public Map<PropertyType, List<String>> subtypesByType() {
        return subtypesByType;
    }

    public Map<String, SubtypeProfile> profiles() {
        return profiles;
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
