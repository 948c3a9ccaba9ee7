package com.priceprediction.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.priceprediction.engine.FeatureVector;
import com.priceprediction.engine.PriceModel;
import com.priceprediction.exception.MlApiException;
import com.priceprediction.exception.MlApiUnavailableException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Client of the Python inference service hosting the regression model.
 * Inference failures are not retried: a rejected feature vector will be
 * rejected again.
 */
@Slf4j
@Component
public class MlApiClient implements PriceModel {

    @Value("${ml.api.base-url}")
    private String baseUrl;

    @Value("${ml.api.timeout-seconds:10}")
    private int timeoutSeconds;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("MlApiClient initialised → {}", baseUrl);
    }

    @Override
    public double predict(FeatureVector features, String requestId) {
        return predictPrice(features, requestId)
            .blockOptional()
            .orElseThrow(() -> new MlApiException("ML API returned an empty prediction response"));
    }

    public Mono<Double> predictPrice(FeatureVector features, String requestId) {
        return webClient.post().uri("/predict")
            .header("X-Request-ID", requestId)
            .bodyValue(buildBody(features))
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new MlApiException("ML API rejected feature vector (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new MlApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toPrice)
            .onErrorMap(WebClientRequestException.class, MlApiUnavailableException::new);
    }

    public Mono<Boolean> isHealthy() {
        return webClient.get().uri("/health").retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> {
                String status = json.path("status").asText();
                return "ok".equals(status) || "healthy".equals(status);
            })
            .onErrorReturn(false);
    }

    public Mono<Map<String, Object>> getModelInfo() {
        return webClient.get().uri("/model/info").retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> mapper.convertValue(json, new TypeReference<Map<String, Object>>() {}))
            .onErrorMap(WebClientRequestException.class, MlApiUnavailableException::new);
    }

    private double toPrice(JsonNode json) {
        if (json == null || !json.hasNonNull("predicted_price")) {
            throw new MlApiException("ML API response missing 'predicted_price': " + json);
        }
        JsonNode price = json.get("predicted_price");
        if (!price.isNumber() || !Double.isFinite(price.asDouble())) {
            throw new MlApiException("ML API returned a non-numeric price: " + price);
        }
        return price.asDouble();
    }

    private ObjectNode buildBody(FeatureVector features) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode names = node.putArray("feature_names");
        features.names().forEach(names::add);
        ArrayNode row = node.putArray("features");
        features.values().forEach(row::add);
        return node;
    }
}
