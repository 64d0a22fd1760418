package com.contractradar.detection;

import com.contractradar.domain.RiskGrade;
import com.contractradar.domain.RiskIndicator;
import com.contractradar.domain.RiskLevel;
import com.contractradar.domain.RiskSeverity;

import java.util.Collection;

/**
 * Pure scoring over a ledger. Order of indicators does not matter.
 */
public final class RiskScorer {

    public static final int MAX_SCORE = 100;

    private RiskScorer() {
    }

    /**
     * Sum of severity weights (low 5, medium 15, high 30, critical 50), clamped to 0..100.
     */
    public static int score(Collection<RiskIndicator> indicators) {
        if (indicators == null) {
            return 0;
        }
        long sum = 0;
        for (RiskIndicator i : indicators) {
            sum += i.severity().weight();
        }
        return (int) Math.max(0, Math.min(MAX_SCORE, sum));
    }

    public static RiskGrade grade(int score) {
        if (score <= 20) return RiskGrade.A;
        if (score <= 40) return RiskGrade.B;
        if (score <= 60) return RiskGrade.C;
        if (score <= 80) return RiskGrade.D;
        return RiskGrade.F;
    }

    /**
     * Any critical indicator makes the overall risk critical regardless of score.
     */
    public static RiskLevel overallRisk(int score, boolean hasCritical) {
        if (hasCritical || score >= 50) return RiskLevel.CRITICAL;
        if (score >= 30) return RiskLevel.HIGH;
        if (score >= 10) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    public static RiskLevel overallRisk(Collection<RiskIndicator> indicators) {
        boolean hasCritical = indicators != null
                && indicators.stream().anyMatch(i -> i.severity() == RiskSeverity.CRITICAL);
        return overallRisk(score(indicators), hasCritical);
    }
}
