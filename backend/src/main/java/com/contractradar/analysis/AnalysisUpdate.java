package com.contractradar.analysis;

import com.contractradar.ai.AiInsight;
import com.contractradar.domain.DetectionResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Payload of the data_update event: the detection result, plus the AI insight when one was generated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisUpdate(@JsonUnwrapped DetectionResult result, AiInsight aiInsight) {
}
