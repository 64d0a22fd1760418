package com.contractradar.detection;

import java.util.Map;

/**
 * What a step body hands back: the facts threaded into later steps and the data shown on step_complete.
 */
public record StepOutcome<T>(T facts, Map<String, Object> data) {

    public static <T> StepOutcome<T> of(T facts, Map<String, Object> data) {
        return new StepOutcome<>(facts, data);
    }
}
