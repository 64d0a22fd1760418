package com.contractradar.reputation;

public record SafetyScore(int score, SafetyRating rating, int riskCount) {

    public static SafetyScore of(int score, int riskCount) {
        return new SafetyScore(score, SafetyRating.fromScore(score), riskCount);
    }
}
