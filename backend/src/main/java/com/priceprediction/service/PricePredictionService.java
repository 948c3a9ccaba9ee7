package com.priceprediction.service;

import com.priceprediction.dto.BatchPredictionResponse;
import com.priceprediction.dto.PredictionResponse;
import com.priceprediction.dto.PropertyRequest;
import com.priceprediction.engine.BatchOutcome;
import com.priceprediction.engine.BatchSummary;
import com.priceprediction.engine.PredictionOutcome;
import com.priceprediction.engine.PredictionResult;
import com.priceprediction.engine.Rejection;
import com.priceprediction.exception.BatchSizeExceededException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PricePredictionService {

    private final PredictionEngineRegistry registry;

    @Value("${prediction.max-batch-size:256}")
    private int maxBatchSize;

    @Value("${prediction.batch-parallelism:4}")
    private int batchParallelism;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, batchParallelism));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    /** Prices one property; a rejection is rethrown so the caller sees its own error type. */
    public PredictionResponse predict(PropertyRequest request, String requestId) {
        PredictionOutcome outcome = registry.current().orchestrator().predictOne(request, requestId);
        if (!outcome.isPriced()) {
            throw outcome.getRejection().getCause();
        }
        PredictionResult result = outcome.getResult();
        log.info("Prediction priced | adjusted={} | tier={} | confidence={} | warnings={} | requestId={}",
            result.getAdjustedPrice(), result.getTier(), result.getConfidenceLevel(),
            result.getWarnings().size(), requestId);
        return toResponse(result, requestId);
    }

    public BatchPredictionResponse predictBatch(List<PropertyRequest> requests, String requestId) {
        if (requests.size() > maxBatchSize) {
            throw new BatchSizeExceededException(requests.size(), maxBatchSize);
        }
        BatchOutcome outcome = registry.current().orchestrator().predictBatch(requests, requestId, executor);

        List<BatchPredictionResponse.Item> items = new ArrayList<>(outcome.getOutcomes().size());
        for (int i = 0; i < outcome.getOutcomes().size(); i++) {
            items.add(toItem(i, outcome.getOutcomes().get(i), requestId));
        }
        return BatchPredictionResponse.builder()
            .predictions(items)
            .summary(toSummary(outcome.getSummary()))
            .requestId(requestId)
            .build();
    }

    private BatchPredictionResponse.Item toItem(int index, PredictionOutcome outcome, String requestId) {
        if (outcome.isPriced()) {
            return BatchPredictionResponse.Item.builder()
                .index(index)
                .status(BatchPredictionResponse.ItemStatus.PRICED)
                .prediction(toResponse(outcome.getResult(), requestId))
                .build();
        }
        Rejection rejection = outcome.getRejection();
        return BatchPredictionResponse.Item.builder()
            .index(index)
            .status(BatchPredictionResponse.ItemStatus.REJECTED)
            .rejection(BatchPredictionResponse.RejectionDetail.builder()
                .stage(rejection.getStage())
                .code(rejection.getErrorCode())
                .reason(rejection.getReason())
                .build())
            .build();
    }

    private static BatchPredictionResponse.Summary toSummary(BatchSummary s) {
        return BatchPredictionResponse.Summary.builder()
            .totalItems(s.getTotalItems())
            .count(s.getCount())
            .rejectedCount(s.getRejectedCount())
            .averagePrice(s.getAverageAdjustedPrice() != null ? PriceFormat.round2(s.getAverageAdjustedPrice()) : null)
            .totalValue(PriceFormat.round2(s.getTotalValue()))
            .minPrice(s.getMinAdjustedPrice() != null ? PriceFormat.round2(s.getMinAdjustedPrice()) : null)
            .maxPrice(s.getMaxAdjustedPrice() != null ? PriceFormat.round2(s.getMaxAdjustedPrice()) : null)
            .build();
    }

    static PredictionResponse toResponse(PredictionResult r, String requestId) {
        double adjusted = r.getAdjustedPrice();
        double lower = adjusted * (1 - PriceFormat.RANGE_SPREAD);
        double upper = adjusted * (1 + PriceFormat.RANGE_SPREAD);
        return PredictionResponse.builder()
            .basePrice(PriceFormat.round2(r.getBasePrice()))
            .multiplier(r.getMultiplier())
            .adjustedPrice(PriceFormat.round2(adjusted))
            .pricePerSqm(PriceFormat.round2(r.getPricePerUnitArea()))
            .priceRange(PredictionResponse.PriceRange.builder()
                .lowerBound(PriceFormat.round2(lower))
                .upperBound(PriceFormat.round2(upper))
                .build())
            .adjustedPriceFormatted(PriceFormat.grouped(adjusted))
            .priceRangeFormatted(PriceFormat.compact(lower) + " - " + PriceFormat.compact(upper) + " AED")
            .confidenceLevel(r.getConfidenceLevel())
            .tier(r.getTier())
            .areaMatched(r.isAreaMatched())
            .warnings(r.warningMessages())
            .inputFeatures(r.getRequest())
            .requestId(requestId)
            .build();
    }
}
