package com.contractradar.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepEventType {
    STEP_START,
    STEP_COMPLETE,
    STEP_ERROR,
    DATA_UPDATE,
    COMPLETE;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
