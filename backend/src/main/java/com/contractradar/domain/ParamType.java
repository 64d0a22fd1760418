package com.contractradar.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParamType {
    ON_CHAIN("on-chain"),
    OFF_CHAIN("off-chain");

    private final String value;

    ParamType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
