package com.contractradar.domain;

import com.contractradar.ai.AiInsight;
import com.contractradar.analysis.AnalysisUpdate;
import com.contractradar.detection.CancellationToken;
import com.contractradar.detection.DetectionRun;
import com.contractradar.detection.StepDefinition;
import com.contractradar.detection.StepOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionResultJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static DetectionResult dexResult() {
        Map<String, ParameterState> on = new LinkedHashMap<>();
        on.put("programUpgradeVulns", new ParameterState(true, true, "Auth1"));
        on.put("sandwichAttacks", new ParameterState(true, false, null));
        RiskIndicator indicator = new RiskIndicator("upgradeable_program", "program", "Upgradeable Program",
                RiskSeverity.HIGH, "Auth1", "Program can be modified by upgrade authority", ParamType.ON_CHAIN);
        return new DetectionResult("Prog111", DetectionMode.DEX, 2, 1, 2, 1, 0, 0, 0, List.of(indicator),
                30, RiskGrade.B, RiskLevel.HIGH, on, Map.of(), null,
                DexData.builder().programId("Prog111").upgradeable(true).build());
    }

    @Test
    @DisplayName("enums serialize in their wire form and the absent payload is omitted")
    void wireShape() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(dexResult()));

        assertThat(json.path("detectionMode").asText()).isEqualTo("dex");
        assertThat(json.path("grade").asText()).isEqualTo("B");
        assertThat(json.path("overallRisk").asText()).isEqualTo("high");
        assertThat(json.path("riskIndicators").get(0).path("severity").asText()).isEqualTo("high");
        assertThat(json.path("riskIndicators").get(0).path("paramType").asText()).isEqualTo("on-chain");
        assertThat(json.has("tokenData")).isFalse();
        assertThat(json.path("dexData").path("upgradeable").asBoolean()).isTrue();
        assertThat(json.path("onChainParams").path("sandwichAttacks").has("value")).isFalse();
        assertThat(json.path("onChainParams").fieldNames()).toIterable()
                .containsExactly("programUpgradeVulns", "sandwichAttacks");
    }

    @Test
    @DisplayName("a serialized result reads back equal, keeping triggered state and evidence value")
    void readsBackEqual() throws Exception {
        DetectionRun<TokenOnChainParam, TokenOffChainParam> run = new DetectionRun<>("Mint1", DetectionMode.TOKEN,
                TokenOnChainParam.class, TokenOffChainParam.class, null, new CancellationToken());
        StepDefinition basicInfo = new StepDefinition("basic_info", "Fetching Token Info",
                List.of(TokenOnChainParam.MASSIVE_MINTS, TokenOnChainParam.ASSET_FREEZES));
        run.runStep(basicInfo, () -> {
            run.raise(TokenOnChainParam.MASSIVE_MINTS, "mint_authority_active", "token", "Mint Authority Active",
                    RiskSeverity.CRITICAL, "Auth1", "Token supply can be inflated");
            return StepOutcome.of(null, Map.of());
        });
        DetectionResult original = run.finish(TokenData.builder().mintAuthority("Auth1").build(), null);

        DetectionResult back = mapper.readValue(mapper.writeValueAsString(original), DetectionResult.class);

        assertThat(back.onChainParams().get("massiveMints")).isEqualTo(new ParameterState(true, true, "Auth1"));
        assertThat(back.onChainParams().get("assetFreezes")).isEqualTo(new ParameterState(true, false, null));
        assertThat(back.detectionMode()).isEqualTo(DetectionMode.TOKEN);
        assertThat(back.riskIndicators().get(0).paramType()).isEqualTo(ParamType.ON_CHAIN);
        assertThat(back).isEqualTo(original);
    }

    @Test
    @DisplayName("data_update payload flattens the result next to the AI insight")
    void analysisUpdateUnwrapped() throws Exception {
        AiInsight insight = new AiInsight("m1", "Summary.", null, List.of("f1"), List.of());
        JsonNode json = mapper.readTree(mapper.writeValueAsString(new AnalysisUpdate(dexResult(), insight)));

        assertThat(json.path("address").asText()).isEqualTo("Prog111");
        assertThat(json.path("riskScore").asInt()).isEqualTo(30);
        assertThat(json.path("aiInsight").path("summary").asText()).isEqualTo("Summary.");
        assertThat(json.has("result")).isFalse();
    }

    @Test
    @DisplayName("step events use snake_case types and skip unset fields")
    void stepEventShape() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(
                StepEvent.stepError("dex_pairs", "Analyzing DEX Pairs (DexScreener)", 12, "DexScreener unavailable", 3, 1)
                        .withDetectionMode(DetectionMode.DEX)));

        assertThat(json.path("type").asText()).isEqualTo("step_error");
        assertThat(json.path("detectionMode").asText()).isEqualTo("dex");
        assertThat(json.has("data")).isFalse();
        assertThat(json.path("paramsChecked").asInt()).isEqualTo(3);
    }

    @Test
    @DisplayName("a result must carry exactly the payload of its mode")
    void payloadMatchesMode() {
        assertThatThrownBy(() -> new DetectionResult("Mint1", DetectionMode.TOKEN, 0, 0, 0, 0, 0, 0, 0, List.of(),
                0, RiskGrade.A, RiskLevel.LOW, Map.of(), Map.of(), null, DexData.builder().build()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
