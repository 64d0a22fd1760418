package com.contractradar.detection;

import com.contractradar.domain.DetectionParameter;

import java.util.List;

/**
 * A detector step and the parameters it owns. Owned parameters are marked checked as soon as the step starts.
 */
public record StepDefinition(String id, String name, List<DetectionParameter> params) {

    public StepDefinition {
        params = List.copyOf(params);
    }

    public static StepDefinition of(String id, String name, DetectionParameter... params) {
        return new StepDefinition(id, name, List.of(params));
    }
}
