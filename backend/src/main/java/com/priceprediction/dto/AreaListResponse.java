package com.priceprediction.dto;

import com.priceprediction.reference.AreaTier;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AreaListResponse {
    int        totalAreas;
    List<Area> areas;

    @Value
    @Builder
    public static class Area {
        String   name;
        AreaTier tier;
        double   multiplier;
    }
}
