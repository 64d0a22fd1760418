package com.contractradar.domain;

/**
 * One raised risk, created when a parameter triggers.
 */
public record RiskIndicator(
        String id,
        String category,
        String name,
        RiskSeverity severity,
        String value,
        String description,
        ParamType paramType
) {
}
