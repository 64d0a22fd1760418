package com.contractradar.reputation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bucketed RugCheck score: 80 and above is safe, 50..79 caution, below 50 danger.
 */
public enum SafetyRating {
    SAFE,
    CAUTION,
    DANGER;

    public static SafetyRating fromScore(int score) {
        if (score >= 80) return SAFE;
        if (score >= 50) return CAUTION;
        return DANGER;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
