package com.contractradar.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall risk level of a detection result (low, medium, high, critical).
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
