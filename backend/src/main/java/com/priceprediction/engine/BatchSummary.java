package com.priceprediction.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Aggregates over the priced items of a batch; price statistics are null when nothing was priced. */
@Value
@Builder
public class BatchSummary {
    int    totalItems;
    int    count;
    int    rejectedCount;
    Double averageAdjustedPrice;
    double totalValue;
    Double minAdjustedPrice;
    Double maxAdjustedPrice;

    public static BatchSummary of(List<PredictionOutcome> outcomes) {
        double[] prices = outcomes.stream()
            .filter(PredictionOutcome::isPriced)
            .mapToDouble(o -> o.getResult().getAdjustedPrice())
            .toArray();
        double total = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double price : prices) {
            total += price;
            min = Math.min(min, price);
            max = Math.max(max, price);
        }
        boolean any = prices.length > 0;
        return BatchSummary.builder()
            .totalItems(outcomes.size())
            .count(prices.length)
            .rejectedCount(outcomes.size() - prices.length)
            .averageAdjustedPrice(any ? total / prices.length : null)
            .totalValue(total)
            .minAdjustedPrice(any ? min : null)
            .maxAdjustedPrice(any ? max : null)
            .build();
    }
}
