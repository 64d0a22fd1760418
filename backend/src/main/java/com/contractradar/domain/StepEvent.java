package com.contractradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One progress event on the analysis stream. Only the fields relevant to the event type are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepEvent(
        StepEventType type,
        String stepId,
        String stepName,
        Long duration,
        Object data,
        String error,
        Integer paramsChecked,
        Integer paramsTriggered,
        DetectionMode detectionMode
) {

    public static StepEvent stepStart(String stepId, String stepName) {
        return stepStart(stepId, stepName, null, null);
    }

    public static StepEvent stepStart(String stepId, String stepName, Integer paramsChecked, Integer paramsTriggered) {
        return new StepEvent(StepEventType.STEP_START, stepId, stepName, null, null, null,
                paramsChecked, paramsTriggered, null);
    }

    public static StepEvent stepComplete(String stepId, String stepName, long duration, Object data,
                                         Integer paramsChecked, Integer paramsTriggered) {
        return new StepEvent(StepEventType.STEP_COMPLETE, stepId, stepName, duration, data, null,
                paramsChecked, paramsTriggered, null);
    }

    public static StepEvent stepError(String stepId, String stepName, long duration, String error,
                                      Integer paramsChecked, Integer paramsTriggered) {
        return new StepEvent(StepEventType.STEP_ERROR, stepId, stepName, duration, null, error,
                paramsChecked, paramsTriggered, null);
    }

    public static StepEvent dataUpdate(Object data) {
        return new StepEvent(StepEventType.DATA_UPDATE, null, null, null, data, null, null, null, null);
    }

    public static StepEvent complete(DetectionResult result, long duration) {
        return new StepEvent(StepEventType.COMPLETE, null, null, duration, result, null,
                result.totalParamsChecked(), result.totalParamsTriggered(), result.detectionMode());
    }

    /** Terminal event for a run that could not start analysis. */
    public static StepEvent failed(String address, String error) {
        return new StepEvent(StepEventType.COMPLETE, null, null, null,
                Map.of("error", error, "address", address), null, null, null, null);
    }

    public StepEvent withDetectionMode(DetectionMode mode) {
        return new StepEvent(type, stepId, stepName, duration, data, error, paramsChecked, paramsTriggered, mode);
    }
}
