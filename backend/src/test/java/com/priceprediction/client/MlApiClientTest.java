package com.priceprediction.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.priceprediction.engine.FeatureVector;
import com.priceprediction.exception.MlApiException;
import com.priceprediction.exception.MlApiUnavailableException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.list;

class MlApiClientTest {

    private static WireMockServer wireMock;

    private MlApiClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void setUp() {
        client = new MlApiClient();
        ReflectionTestUtils.setField(client, "baseUrl", "http://localhost:" + wireMock.port());
        ReflectionTestUtils.setField(client, "timeoutSeconds", 2);
        client.init();
    }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    private FeatureVector features() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("procedure_area", 100.0);
        values.put("bedrooms", 2.0);
        return new FeatureVector(values);
    }

    @Test
    void predictPrice_sendsNamedVectorAndReadsPrice() {
        wireMock.stubFor(post(urlEqualTo("/predict")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"predicted_price\": 1745000.0, \"status\": \"success\"}")));

        StepVerifier.create(client.predictPrice(features(), "req-1"))
            .assertNext(price -> assertThat(price).isEqualTo(1_745_000.0))
            .verifyComplete();

        wireMock.verify(postRequestedFor(urlEqualTo("/predict"))
            .withHeader("X-Request-ID", equalTo("req-1"))
            .withRequestBody(equalToJson(
                "{\"feature_names\": [\"procedure_area\", \"bedrooms\"], \"features\": [100.0, 2.0]}")));
    }

    @Test
    void predict_missingPrice_throwsMlApiException() {
        wireMock.stubFor(post(urlEqualTo("/predict")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"status\": \"success\"}")));

        assertThatThrownBy(() -> client.predict(features(), "req-2"))
            .isInstanceOf(MlApiException.class)
            .hasMessageContaining("predicted_price");
    }

    @Test
    void predictPrice_clientError_isNotRetried() {
        wireMock.stubFor(post(urlEqualTo("/predict")).willReturn(aResponse()
            .withStatus(422).withBody("feature count mismatch")));

        StepVerifier.create(client.predictPrice(features(), "req-3"))
            .expectError(MlApiException.class)
            .verify();
        wireMock.verify(1, postRequestedFor(urlEqualTo("/predict")));
    }

    @Test
    void predictPrice_serverError_isUnavailable() {
        wireMock.stubFor(post(urlEqualTo("/predict")).willReturn(aResponse().withStatus(500).withBody("error")));

        StepVerifier.create(client.predictPrice(features(), "req-4"))
            .expectError(MlApiUnavailableException.class)
            .verify();
    }

    @Test
    void isHealthy_readsStatus() {
        wireMock.stubFor(get(urlEqualTo("/health")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"status\": \"healthy\", \"model_loaded\": true}")));

        StepVerifier.create(client.isHealthy()).expectNext(true).verifyComplete();
    }

    @Test
    void isHealthy_serverDown_isFalse() {
        wireMock.stubFor(get(urlEqualTo("/health")).willReturn(aResponse().withStatus(503)));

        StepVerifier.create(client.isHealthy()).expectNext(false).verifyComplete();
    }

    @Test
    void getModelInfo_returnsTypedMap() {
        wireMock.stubFor(get(urlEqualTo("/model/info")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"model_type\": \"RandomForestRegressor\", \"n_features\": 7, \"features\": [\"bedrooms\"]}")));

        StepVerifier.create(client.getModelInfo())
            .assertNext(info -> {
                assertThat(info).containsEntry("model_type", "RandomForestRegressor")
                    .containsEntry("n_features", 7);
                assertThat(info.get("features")).asInstanceOf(list(String.class)).containsExactly("bedrooms");
            })
            .verifyComplete();
    }
}
