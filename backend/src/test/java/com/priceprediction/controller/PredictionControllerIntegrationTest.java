package com.priceprediction.controller;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.list;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class PredictionControllerIntegrationTest {

    private static WireMockServer wireMock;

    @Autowired TestRestTemplate restTemplate;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().port(9090));
        wireMock.start();
        WireMock.configureFor("localhost", 9090);
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    private Map<String, Object> flat(double areaSize, int bedrooms, String areaName) {
        Map<String, Object> body = new HashMap<>();
        body.put("usage", "Residential");
        body.put("type", "Unit");
        body.put("subtype", "Flat");
        body.put("areaSize", areaSize);
        body.put("bedrooms", bedrooms);
        body.put("areaName", areaName);
        return body;
    }

    private Map<String, Object> landWithBedrooms() {
        Map<String, Object> body = new HashMap<>();
        body.put("usage", "Residential");
        body.put("type", "Land");
        body.put("areaSize", 250);
        body.put("bedrooms", 2);
        body.put("areaName", "PALM JUMEIRAH");
        return body;
    }

    private void stubMlPredict(double price) {
        stubFor(post(urlEqualTo("/predict")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"predicted_price\": " + price + ", \"status\": \"success\"}")));
    }

    @Test
    void predict_typicalFlat_returnsAdjustedPrice() {
        stubMlPredict(1_745_000);
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions",
            flat(100, 2, "DUBAI MARINA"), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) resp.getBody().get("adjustedPrice")).doubleValue()).isEqualTo(2_094_000.0);
        assertThat(((Number) resp.getBody().get("pricePerSqm")).doubleValue()).isEqualTo(20_940.0);
        assertThat(resp.getBody().get("tier")).isEqualTo("Premium");
        assertThat(resp.getBody().get("confidenceLevel")).isEqualTo("High");
        assertThat(resp.getBody().get("warnings")).asInstanceOf(list(String.class)).isEmpty();
        assertThat(resp.getBody()).containsKeys("priceRange", "priceRangeFormatted", "inputFeatures");
    }

    @Test
    void predict_echoesRequestId() {
        stubMlPredict(1_000_000);
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "my-trace-id");
        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/predictions", HttpMethod.POST,
            new HttpEntity<>(flat(100, 2, "DUBAI MARINA"), headers), Map.class);
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("my-trace-id");
        assertThat(resp.getBody().get("requestId")).isEqualTo("my-trace-id");
        wireMock.verify(postRequestedFor(urlEqualTo("/predict")).withHeader("X-Request-ID", equalTo("my-trace-id")));
    }

    @Test
    void predict_undersizedFlat_returnsWarningAndMediumConfidence() {
        stubMlPredict(600_000);
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions",
            flat(20, 2, "BUSINESS BAY"), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("warnings")).asInstanceOf(list(String.class))
            .containsExactly("area_size 20 below typical range [106,143] for 2BR");
        assertThat(resp.getBody().get("confidenceLevel")).isEqualTo("Medium");
    }

    @Test
    void predict_unknownArea_usesAverageTier() {
        stubMlPredict(800_000);
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions",
            flat(100, 2, "UNKNOWN AREA"), Map.class);
        assertThat(resp.getBody().get("tier")).isEqualTo("Average");
        assertThat(resp.getBody().get("areaMatched")).isEqualTo(false);
        assertThat(((Number) resp.getBody().get("adjustedPrice")).doubleValue()).isEqualTo(800_000.0);
    }

    @Test
    void predict_landWithBedrooms_returns422() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions", landWithBedrooms(), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("code")).isEqualTo("STRUCTURAL_ERROR");
        assertThat(resp.getBody().get("message")).isEqualTo("Land cannot have bedrooms");
        wireMock.verify(0, postRequestedFor(urlEqualTo("/predict")));
    }

    @Test
    void predict_shopWithBedrooms_isPricedWithLowConfidence() {
        stubMlPredict(900_000);
        Map<String, Object> shop = new HashMap<>();
        shop.put("usage", "Commercial");
        shop.put("type", "Unit");
        shop.put("subtype", "Shop");
        shop.put("areaSize", 80);
        shop.put("bedrooms", 1);
        shop.put("areaName", "BUSINESS BAY");

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions", shop, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("warnings")).asInstanceOf(list(String.class))
            .containsExactly("bedrooms is not applicable to Commercial Unit and was ignored");
        assertThat(resp.getBody().get("confidenceLevel")).isEqualTo("Low");
        assertThat(((Map<String, Object>) resp.getBody().get("inputFeatures")).get("bedrooms")).isEqualTo(0);
    }

    @Test
    void predict_negativeBedrooms_returns422WithFieldErrors() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions",
            flat(100, -1, "DUBAI MARINA"), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("fieldErrors");
    }

    @Test
    void predict_unknownUsage_returns400() {
        Map<String, Object> body = flat(100, 2, "DUBAI MARINA");
        body.put("usage", "Spaceport");
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions", body, Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void predict_mlApiDown_returns503() {
        stubFor(post(urlEqualTo("/predict")).willReturn(aResponse().withStatus(500).withBody("error")));
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions",
            flat(100, 2, "DUBAI MARINA"), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void predict_mlApiRejectsVector_returns502() {
        stubFor(post(urlEqualTo("/predict")).willReturn(aResponse().withStatus(400).withBody("bad vector")));
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions",
            flat(100, 2, "DUBAI MARINA"), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(resp.getBody().get("code")).isEqualTo("ML_API_ERROR");
    }

    @Test
    void predictBatch_isolatesRejectedItem() {
        stubMlPredict(1_000_000);
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions/batch",
            Map.of("properties", List.of(flat(100, 2, "DUBAI MARINA"), landWithBedrooms(),
                flat(90, 1, "INTERNATIONAL CITY"))), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> items = (List<Map<String, Object>>) resp.getBody().get("predictions");
        assertThat(items).extracting(i -> i.get("status")).containsExactly("PRICED", "REJECTED", "PRICED");
        assertThat(((Map<String, Object>) items.get(1).get("rejection")).get("reason"))
            .isEqualTo("Land cannot have bedrooms");
        Map<String, Object> summary = (Map<String, Object>) resp.getBody().get("summary");
        assertThat(summary.get("count")).isEqualTo(2);
        assertThat(summary.get("rejectedCount")).isEqualTo(1);
        assertThat(((Number) summary.get("totalValue")).doubleValue()).isEqualTo(2_100_000.0);
    }

    @Test
    void predictBatch_negativeBedroomsItem_isRejectedAlone() {
        stubMlPredict(1_000_000);
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions/batch",
            Map.of("properties", List.of(flat(100, -1, "DUBAI MARINA"), flat(100, 2, "DUBAI MARINA"))), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> summary = (Map<String, Object>) resp.getBody().get("summary");
        assertThat(summary.get("count")).isEqualTo(1);
    }

    @Test
    void predictBatch_tooLarge_returns413() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions/batch",
            Map.of("properties", Collections.nCopies(6, flat(100, 2, "DUBAI MARINA"))), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @Test
    void predictBatch_empty_returns422() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/predictions/batch",
            Map.of("properties", List.of()), Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void mlHealth_returnsOkWhenModelServiceUp() {
        stubFor(get(urlEqualTo("/health")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"status\":\"healthy\",\"model_loaded\":true}")));
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/ml/health", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("mlApi")).isEqualTo("UP");
    }

    @Test
    void modelInfo_returnsProxyPayload() {
        stubFor(get(urlEqualTo("/model/info")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"model_type\":\"RandomForestRegressor\",\"n_features\":7}")));
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/ml/model-info", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("n_features")).isEqualTo(7);
    }
}
