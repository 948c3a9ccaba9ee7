package com.priceprediction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.priceprediction.engine.PredictionStage;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchPredictionResponse {
    List<Item> predictions;
    Summary    summary;
    String     requestId;

    public enum ItemStatus { PRICED, REJECTED }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {
        int                index;
        ItemStatus         status;
        PredictionResponse prediction;
        RejectionDetail    rejection;
    }

    @Value
    @Builder
    public static class RejectionDetail {
        PredictionStage stage;
        String          code;
        String          reason;
    }

    @Value
    @Builder
    public static class Summary {
        int    totalItems;
        int    count;
        int    rejectedCount;
        Double averagePrice;
        double totalValue;
        Double minPrice;
        Double maxPrice;
    }
}
