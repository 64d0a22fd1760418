package com.contractradar.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which analyzer ran: TOKEN for SPL mints, DEX for everything else (programs and other accounts).
 */
public enum DetectionMode {
    TOKEN("token"),
    DEX("dex");

    private final String value;

    DetectionMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
