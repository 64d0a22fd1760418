package com.contractradar.domain;

/**
 * Off-chain checks for SPL token mints (13).
 */
public enum TokenOffChainParam implements DetectionParameter {
    KEY_LEAK_INDICATORS("keyLeakIndicators", false),
    DAO_ENGAGEMENT_ALERTS("daoEngagementAlerts", false),
    ECONOMIC_MODEL_STRESS("economicModelStress", true),
    AUDIT_GAP_WARNINGS("auditGapWarnings", false),
    CENTRALIZATION_WARNINGS("centralizationWarnings", true),
    PHISHING_TX_CLUSTERS("phishingTxClusters", true),
    MALWARE_APP_INDICATORS("malwareAppIndicators", false),
    AI_PACKAGE_ALERTS("aiPackageAlerts", false),
    RUG_PULL_METRICS("rugPullMetrics", true),
    DEEPFAKE_SIGNALS("deepfakeSignals", false),
    SOCIAL_MEDIA_SIGNALS("socialMediaSignals", true),
    USER_REPORT_AGGREGATION("userReportAggregation", false),
    VICTIM_REPORT_ANALYSIS("victimReportAnalysis", false);

    private final String key;
    private final boolean evidenceBacked;

    TokenOffChainParam(String key, boolean evidenceBacked) {
        this.key = key;
        this.evidenceBacked = evidenceBacked;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public ParamType type() {
        return ParamType.OFF_CHAIN;
    }

    @Override
    public boolean evidenceBacked() {
        return evidenceBacked;
    }
}
