package com.priceprediction.engine;

import com.priceprediction.reference.AreaTierTable;

/**
 * Case-insensitive area lookup. Unknown or missing areas resolve silently to
 * the Average tier with a neutral multiplier.
 */
public class AreaTierLookup {

    private final AreaTierTable table;

    public AreaTierLookup(AreaTierTable table) {
        this.table = table;
    }

    public AreaTierMatch lookup(String areaName) {
        return table.find(areaName)
            .map(entry -> new AreaTierMatch(entry.tier(), entry.multiplier(), true))
            .orElseGet(AreaTierMatch::fallback);
    }
}
