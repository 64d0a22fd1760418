package com.contractradar.detection;

import com.contractradar.domain.RiskIndicator;
import com.contractradar.domain.RiskSeverity;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only, ordered list of indicators raised during one run.
 */
public final class RiskLedger {

    private final List<RiskIndicator> indicators = new ArrayList<>();

    public void add(RiskIndicator indicator) {
        indicators.add(indicator);
    }

    public List<RiskIndicator> indicators() {
        return List.copyOf(indicators);
    }

    public boolean hasCritical() {
        return indicators.stream().anyMatch(i -> i.severity() == RiskSeverity.CRITICAL);
    }
}
