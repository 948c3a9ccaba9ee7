package com.priceprediction.controller;

import com.priceprediction.client.MlApiClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/** Operator view of the inference service. */
@RestController
@RequestMapping("/api/v1/ml")
@RequiredArgsConstructor
public class ModelController {

    private final MlApiClient mlApiClient;

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> mlHealth() {
        return mlApiClient.isHealthy().map(healthy -> {
            Map<String, Object> body = Map.of("mlApi", healthy ? "UP" : "DOWN",
                                               "status", healthy ? "ok" : "degraded");
            return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
        });
    }

    @GetMapping("/model-info")
    public Mono<ResponseEntity<Map<String, Object>>> modelInfo() {
        return mlApiClient.getModelInfo().map(ResponseEntity::ok);
    }
}
