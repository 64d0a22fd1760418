package com.contractradar.ai;

import java.util.List;

/**
 * Narrative summary of a detection result. Advisory only; never feeds back into the score.
 */
public record AiInsight(
        String model,
        String summary,
        String riskAssessment,
        List<String> keyFindings,
        List<String> recommendations
) {

    public AiInsight {
        keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
