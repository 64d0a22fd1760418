package com.contractradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final, immutable outcome of one analysis run. Carries exactly one mode payload:
 * {@code tokenData} for TOKEN, {@code dexData} for DEX.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionResult(
        String address,
        DetectionMode detectionMode,
        int totalParamsChecked,
        int totalParamsTriggered,
        int onChainParamsChecked,
        int onChainParamsTriggered,
        int offChainParamsChecked,
        int offChainParamsTriggered,
        int placeholderParamsChecked,
        List<RiskIndicator> riskIndicators,
        int riskScore,
        RiskGrade grade,
        RiskLevel overallRisk,
        Map<String, ParameterState> onChainParams,
        Map<String, ParameterState> offChainParams,
        TokenData tokenData,
        DexData dexData
) {

    public DetectionResult {
        if (detectionMode == DetectionMode.TOKEN && (tokenData == null || dexData != null)) {
            throw new IllegalArgumentException("Token result must carry tokenData only");
        }
        if (detectionMode == DetectionMode.DEX && (dexData == null || tokenData != null)) {
            throw new IllegalArgumentException("Dex result must carry dexData only");
        }
        riskIndicators = riskIndicators == null ? List.of() : List.copyOf(riskIndicators);
        onChainParams = orderedCopy(onChainParams);
        offChainParams = orderedCopy(offChainParams);
    }

    private static Map<String, ParameterState> orderedCopy(Map<String, ParameterState> source) {
        if (source == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
