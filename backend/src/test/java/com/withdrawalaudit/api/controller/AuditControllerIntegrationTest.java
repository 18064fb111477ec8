package com.withdrawalaudit.api.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * POST /audits/evaluate and GET /audits/config against the full application context.
 */
@SpringBootTest
@AutoConfigureWebTestClient
class AuditControllerIntegrationTest {

    @Autowired
    WebTestClient webTestClient;

    @Test
    @DisplayName("POST /audits/evaluate scores a cross-currency withdrawal")
    void evaluateCrossCurrency() {
        String body = """
                {"measurement":{
                  "appliedAmount":5000,"receivedAmount":3050,
                  "appliedCurrency":"CNY","receivedCurrency":"MYR","referenceRate":0.62,
                  "startTimestamp":0,"endTimestamp":5400,
                  "kycStatus":"sms","settlementStatus":"success"}}
                """;
        webTestClient.post().uri("/api/v1/audits/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.speed.code").isEqualTo("normal")
                .jsonPath("$.fx.code").isEqualTo("moderate")
                .jsonPath("$.fx.tags[0]").isEqualTo("存在汇损")
                .jsonPath("$.kyc.code").isEqualTo("light_friction")
                .jsonPath("$.settlement.code").isEqualTo("success")
                .jsonPath("$.totalScore").isEqualTo(1)
                .jsonPath("$.overallCode").isEqualTo("low_risk")
                .jsonPath("$.overallColor").isEqualTo("green")
                .jsonPath("$.formattedDuration").isEqualTo("1.5小时")
                .jsonPath("$.crossCurrencyFx.appliedCurrency").isEqualTo("CNY")
                .jsonPath("$.crossCurrencyFx.hasCrossCurrency").isEqualTo(true)
                .jsonPath("$.crossCurrencyFx.deviationPct").exists()
                .jsonPath("$.sameCurrencyFx").doesNotExist();
    }

    @Test
    @DisplayName("per-request override applies on top of the deployment thresholds")
    void evaluateWithOverride() {
        String body = """
                {"measurement":{"durationMinutes":"20","settlementStatus":"pending"},
                 "config":{"instant":25}}
                """;
        webTestClient.post().uri("/api/v1/audits/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.speed.code").isEqualTo("instant")
                .jsonPath("$.settlement.code").isEqualTo("needs_review")
                .jsonPath("$.fx.code").isEqualTo("unknown")
                .jsonPath("$.sameCurrencyFx.error").isEqualTo("INVALID_INPUT");
    }

    @Test
    @DisplayName("FX data entry error is reported in the figures, not as a request failure")
    void dataEntryErrorIsAValue() {
        String body = """
                {"measurement":{"appliedAmount":1000,"receivedAmount":1100,
                  "appliedCurrency":"USDT","receivedCurrency":"USDT",
                  "durationMinutes":3,"kycStatus":"none","settlementStatus":"success"}}
                """;
        webTestClient.post().uri("/api/v1/audits/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sameCurrencyFx.error").isEqualTo("DATA_ENTRY_ERROR")
                .jsonPath("$.sameCurrencyFx.errorReason").isEqualTo("received_exceeds_applied")
                .jsonPath("$.sameCurrencyFx.lossAmount").doesNotExist()
                .jsonPath("$.fx.code").isEqualTo("unknown");
    }

    @Test
    @DisplayName("negative duration returns 400 INVALID_DURATION with the auditor message")
    void invalidDuration() {
        String body = """
                {"measurement":{"durationMinutes":"-5"}}
                """;
        webTestClient.post().uri("/api/v1/audits/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_DURATION")
                .jsonPath("$.message").isEqualTo("提款耗时不能为负数，请检查填写的时间")
                .jsonPath("$.timestamp").exists();
    }

    @Test
    @DisplayName("non-numeric duration returns 400 INVALID_DURATION")
    void nonNumericDuration() {
        String body = """
                {"measurement":{"durationMinutes":"soon"}}
                """;
        webTestClient.post().uri("/api/v1/audits/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_DURATION")
                .jsonPath("$.message").isEqualTo("提款耗时必须为数字（分钟）");
    }

    @Test
    @DisplayName("full-width digit duration returns 400 INVALID_DURATION")
    void fullWidthDuration() {
        String body = """
                {"measurement":{"durationMinutes":"１０"}}
                """;
        webTestClient.post().uri("/api/v1/audits/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_DURATION")
                .jsonPath("$.message").isEqualTo("提款耗时必须为数字（分钟）");
    }

    @Test
    @DisplayName("missing measurement returns 400 INVALID_REQUEST")
    void missingMeasurement() {
        webTestClient.post().uri("/api/v1/audits/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("malformed JSON returns 400 INVALID_REQUEST")
    void malformedBody() {
        webTestClient.post().uri("/api/v1/audits/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"measurement\":")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("GET /audits/config returns the active thresholds")
    void getConfig() {
        webTestClient.get().uri("/api/v1/audits/config")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.instant").isEqualTo(5.0)
                .jsonPath("$.fast").isEqualTo(30.0)
                .jsonPath("$.slow").isEqualTo(240.0)
                .jsonPath("$.severeLossThreshold").exists();
    }
}
