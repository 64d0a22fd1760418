package com.contractradar.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a single risk indicator. Weight is the score contribution of one indicator.
 */
public enum RiskSeverity {
    LOW(5),
    MEDIUM(15),
    HIGH(30),
    CRITICAL(50);

    private final int weight;

    RiskSeverity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
