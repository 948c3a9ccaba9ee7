package com.priceprediction.service;

import com.priceprediction.client.LabelFeatureEncoder;
import com.priceprediction.engine.PredictionOrchestrator;
import com.priceprediction.engine.PriceModel;
import com.priceprediction.reference.ReferenceData;
import com.priceprediction.reference.ReferenceDataLoader;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the engine built from the current reference data. A reload builds a
 * complete new engine and swaps it in one step; calls already running keep the
 * snapshot they started with.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionEngineRegistry {

    private final ReferenceDataLoader loader;
    private final PriceModel          priceModel;

    @Value("${prediction.warn-unknown-area:true}")
    private boolean warnUnknownArea;

    private final AtomicReference<EngineSnapshot> current = new AtomicReference<>();

    @PostConstruct
    void init() {
        current.set(build(loader.load()));
    }

    public EngineSnapshot current() {
        return current.get();
    }

    public ReferenceData reload() {
        EngineSnapshot next = build(loader.load());
        EngineSnapshot previous = current.getAndSet(next);
        log.info("Reference data reloaded | previousLoadedAt={} | loadedAt={}",
            previous != null ? previous.data().getLoadedAt() : null, next.data().getLoadedAt());
        return next.data();
    }

    private EngineSnapshot build(ReferenceData data) {
        PredictionOrchestrator orchestrator = PredictionOrchestrator.create(
            data, new LabelFeatureEncoder(data.getVocabulary()), priceModel, warnUnknownArea);
        return new EngineSnapshot(data, orchestrator);
    }

    public record EngineSnapshot(ReferenceData data, PredictionOrchestrator orchestrator) {}
}
