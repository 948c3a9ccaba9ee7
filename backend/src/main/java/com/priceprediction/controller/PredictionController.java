package com.priceprediction.controller;

import com.priceprediction.dto.BatchPredictionRequest;
import com.priceprediction.dto.BatchPredictionResponse;
import com.priceprediction.dto.PredictionResponse;
import com.priceprediction.dto.PropertyRequest;
import com.priceprediction.service.PricePredictionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/predictions")
@RequiredArgsConstructor
public class PredictionController {

    private final PricePredictionService predictionService;

    @PostMapping
    public ResponseEntity<PredictionResponse> predict(
            @Valid @RequestBody PropertyRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIds.resolve(httpRequest);
        log.info("POST /predictions | usage={} | type={} | subtype={} | area={} | requestId={}",
                 request.getUsage(), request.getType(), request.getSubtype(), request.getAreaName(), requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(predictionService.predict(request, requestId));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchPredictionResponse> predictBatch(
            @Valid @RequestBody BatchPredictionRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIds.resolve(httpRequest);
        log.info("POST /predictions/batch | count={} | requestId={}", request.getProperties().size(), requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(predictionService.predictBatch(request.getProperties(), requestId));
    }
}
