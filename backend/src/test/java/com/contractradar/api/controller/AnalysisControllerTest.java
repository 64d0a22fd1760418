package com.contractradar.api.controller;

import com.contractradar.analysis.AnalysisStreamService;
import com.contractradar.domain.StepEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;


import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * GET /api/v1/analyze validation and streaming; GET /api/v1/ai/status.
 */
@SpringBootTest(properties = {
        "contractradar.ai.api-keys[0]=test-key",
        "contractradar.ai.models[0]=model-a"
})
@AutoConfigureWebTestClient
class AnalysisControllerTest {

    private static final String ADDRESS = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    AnalysisStreamService analysisStreamService;

    @Test
    @DisplayName("malformed address returns 400 INVALID_ADDRESS and no analysis starts")
    void invalidAddress() {
        webTestClient.get().uri("/api/v1/analyze?address=abc")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS")
                .jsonPath("$.message").isEqualTo("Invalid Solana address format")
                .jsonPath("$.timestamp").exists();

        verify(analysisStreamService, never()).analyze(anyString());
    }

    @Test
    @DisplayName("missing address returns 400 ADDRESS_REQUIRED")
    void missingAddress() {
        webTestClient.get().uri("/api/v1/analyze")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("ADDRESS_REQUIRED");

        verify(analysisStreamService, never()).analyze(anyString());
    }

    @Test
    @DisplayName("valid address streams one NDJSON line per event")
    void streamsNdjson() {
        when(analysisStreamService.analyze(ADDRESS)).thenReturn(Flux.just(
                StepEvent.stepStart("account_type", "Determining Account Type"),
                StepEvent.failed(ADDRESS, "Account not found")));

        webTestClient.get().uri(uri -> uri.path("/api/v1/analyze").queryParam("address", ADDRESS).build())
                .accept(MediaType.APPLICATION_NDJSON)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_NDJSON)
                .expectBody(String.class)
                .value(body -> {
                    assertThat(body.lines()).hasSize(2);
                    assertThat(body.lines().findFirst().orElseThrow())
                            .contains("\"type\":\"step_start\"")
                            .contains("\"stepId\":\"account_type\"")
                            .doesNotContain("\"error\"");
                    assertThat(body).contains("\"type\":\"complete\"").contains("Account not found");
                });
    }

    @Test
    @DisplayName("AI status reports key count and models but never keys")
    void aiStatus() {
        webTestClient.get().uri("/api/v1/ai/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.configured").isEqualTo(true)
                .jsonPath("$.provider").isEqualTo("OpenRouter")
                .jsonPath("$.keyCount").isEqualTo(1)
                .jsonPath("$.models[0]").isEqualTo("model-a")
                .consumeWith(result -> assertThat(new String(result.getResponseBodyContent()))
                        .doesNotContain("test-key"));
    }
}
