package com.priceprediction.engine;

import com.priceprediction.dto.PropertyRequest;
import com.priceprediction.exception.MlApiException;
import com.priceprediction.exception.PricePredictionException;
import com.priceprediction.exception.StructuralException;
import com.priceprediction.reference.ReferenceData;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs each request through form resolution, validation, the external model
 * and price adjustment. Holds no mutable state; one instance serves any number
 * of concurrent callers.
 */
@Slf4j
public class PredictionOrchestrator {

    private final FormDependencyResolver resolver;
    private final RequestNormalizer normalizer;
    private final PropertyValidator validator;
    private final PriceAdjuster adjuster;
    private final FeatureEncoder encoder;
    private final PriceModel model;
    private final boolean warnUnknownArea;

    public PredictionOrchestrator(FormDependencyResolver resolver,
                                  RequestNormalizer normalizer,
                                  PropertyValidator validator,
                                  PriceAdjuster adjuster,
                                  FeatureEncoder encoder,
                                  PriceModel model,
                                  boolean warnUnknownArea) {
        this.resolver = resolver;
        this.normalizer = normalizer;
        this.validator = validator;
        this.adjuster = adjuster;
        this.encoder = encoder;
        this.model = model;
        this.warnUnknownArea = warnUnknownArea;
    }

    public static PredictionOrchestrator create(ReferenceData data, FeatureEncoder encoder, PriceModel model,
                                                boolean warnUnknownArea) {
        return new PredictionOrchestrator(
            new FormDependencyResolver(data.getFormRules(), data.getSubtypes()),
            new RequestNormalizer(data.getSizeRanges(), data.getFormRules()),
            new PropertyValidator(data.getSizeRanges(), data.getSubtypes()),
            new PriceAdjuster(new AreaTierLookup(data.getAreaTiers())),
            encoder,
            model,
            warnUnknownArea);
    }

    public FormDependencyResolver resolver() {
        return resolver;
    }

    public PredictionOutcome predictOne(PropertyRequest request, String requestId) {
        PredictionContext context = new PredictionContext();
        try {
            PredictionResult result = price(request, requestId, context);
            return PredictionOutcome.priced(result);
        } catch (PricePredictionException ex) {
            PredictionStage reached = context.stage();
            context.advance(PredictionStage.REJECTED);
            log.info("Prediction rejected | stage={} | code={} | reason={} | requestId={}",
                reached, ex.getErrorCode(), ex.getMessage(), requestId);
            return PredictionOutcome.rejected(new Rejection(reached, ex.getErrorCode(), ex.getMessage(), ex));
        }
    }

    /**
     * Prices every item independently on the given executor. Results keep the
     * input order, and a rejected item never affects its siblings.
     */
    public BatchOutcome predictBatch(List<PropertyRequest> requests, String requestId, Executor executor) {
        List<CompletableFuture<PredictionOutcome>> futures = new ArrayList<>(requests.size());
        for (PropertyRequest request : requests) {
            futures.add(CompletableFuture.supplyAsync(() -> predictOne(request, requestId), executor));
        }
        List<PredictionOutcome> outcomes = new ArrayList<>(requests.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(join(futures.get(i), i, requestId));
        }
        BatchSummary summary = BatchSummary.of(outcomes);
        log.info("Batch priced | total={} | priced={} | rejected={} | requestId={}",
            summary.getTotalItems(), summary.getCount(), summary.getRejectedCount(), requestId);
        return new BatchOutcome(List.copyOf(outcomes), summary);
    }

    private PredictionResult price(PropertyRequest request, String requestId, PredictionContext context) {
        checkReceived(request);

        FieldPolicy policy = resolver.resolve(request.getUsage(), request.getType(), request.getSubtype());
        NormalizedRequest normalized = normalizer.normalize(request, policy);
        context.advance(PredictionStage.FORM_RESOLVED);

        List<PredictionWarning> warnings = new ArrayList<>(validator.validate(request, policy));
        warnings.addAll(normalized.notes());
        context.advance(PredictionStage.VALIDATED);

        PropertyRequest complete = normalized.request();
        double basePrice = callModel(complete, requestId);
        AreaTierMatch match = adjuster.lookup(request.getAreaName());
        if (!match.matched() && warnUnknownArea) {
            warnings.add(PredictionWarning.of(WarningKind.UNKNOWN_AREA, unknownAreaMessage(request.getAreaName())));
        }
        PriceAdjustment adjustment = adjuster.adjust(basePrice, match.multiplier(), complete.getAreaSize(), warnings);
        context.advance(PredictionStage.PRICED);

        log.debug("Prediction priced | base={} | multiplier={} | adjusted={} | confidence={} | requestId={}",
            basePrice, match.multiplier(), adjustment.adjustedPrice(), adjustment.confidenceLevel(), requestId);
        return PredictionResult.builder()
            .request(complete)
            .basePrice(adjustment.basePrice())
            .multiplier(adjustment.multiplier())
            .adjustedPrice(adjustment.adjustedPrice())
            .pricePerUnitArea(adjustment.pricePerUnitArea())
            .confidenceLevel(adjustment.confidenceLevel())
            .tier(match.tier())
            .areaMatched(match.matched())
            .warnings(List.copyOf(warnings))
            .build();
    }

    private static void checkReceived(PropertyRequest request) {
        Double areaSize = request.getAreaSize();
        if (areaSize != null && (!(areaSize > 0) || Double.isInfinite(areaSize))) {
            throw new StructuralException("area_size must be positive, got " + RequestFields.plain(areaSize));
        }
        if (request.getBedrooms() != null && request.getBedrooms() < 0) {
            throw new StructuralException("bedrooms must be >= 0, got " + request.getBedrooms());
        }
        // holds with or without a form rule for the usage
        if (request.getType() == PropertyType.LAND && request.getBedrooms() != null && request.getBedrooms() > 0) {
            throw new StructuralException("Land cannot have bedrooms");
        }
    }

    private double callModel(PropertyRequest request, String requestId) {
        try {
            return model.predict(encoder.encode(request), requestId);
        } catch (PricePredictionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new MlApiException("Price model failed: " + ex.getMessage(), ex);
        }
    }

    private PredictionOutcome join(CompletableFuture<PredictionOutcome> future, int index, String requestId) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.error("Batch item failed unexpectedly | index={} | requestId={}", index, requestId, cause);
            RuntimeException failure = cause instanceof RuntimeException ? (RuntimeException) cause : ex;
            return PredictionOutcome.rejected(
                new Rejection(PredictionStage.RECEIVED, "INTERNAL_ERROR", "Unexpected failure while pricing item", failure));
        }
    }

    private static String unknownAreaMessage(String areaName) {
        if (areaName == null || areaName.isBlank()) {
            return "area_name not provided; neutral multiplier 1.0 applied";
        }
        return "area_name '" + areaName.trim() + "' is not a known area; neutral multiplier 1.0 applied";
    }
}
