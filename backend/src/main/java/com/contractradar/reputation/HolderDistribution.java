package com.contractradar.reputation;

import com.contractradar.domain.RiskSeverity;

/**
 * Concentration summary over the top SolanaFM holders. Percentages are 0..100.
 */
public record HolderDistribution(
        double topHolderPercent,
        double top5Percent,
        double top10Percent,
        int holderCount,
        RiskSeverity concentrationRisk
) {

    public static RiskSeverity classify(double topHolderPercent, double top5Percent) {
        if (topHolderPercent > 50) return RiskSeverity.CRITICAL;
        if (topHolderPercent > 25 || top5Percent > 70) return RiskSeverity.HIGH;
        if (topHolderPercent > 10 || top5Percent > 50) return RiskSeverity.MEDIUM;
        return RiskSeverity.LOW;
    }
}
