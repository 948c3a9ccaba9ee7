package com.priceprediction.reference;

import java.util.List;

/**
 * Observed characteristics of a property subtype. {@code minSize}/{@code maxSize}
 * are null when no size range was derived for the subtype.
 */
public record SubtypeProfile(String name,
                             List<Integer> typicalBedrooms,
                             boolean bedroomsApplicable,
                             Double minSize,
                             Double maxSize) {

    public SubtypeProfile {
        typicalBedrooms = typicalBedrooms == null ? List.of() : List.copyOf(typicalBedrooms);
    }

    public boolean hasSizeRange() {
        return minSize != null && maxSize != null;
    }
}
