package com.contractradar.domain;

/**
 * Off-chain checks for programs and other non-mint accounts (12).
 */
public enum DexOffChainParam implements DetectionParameter {
    VALIDATOR_CLIENT_MONITORING("validatorClientMonitoring", false),
    SOCIAL_MEDIA_SIGNALS("socialMediaSignals", false),
    BLOCK_ENGINE_LOGS("blockEngineLogs", false),
    RPC_PROVIDER_ANOMALIES("rpcProviderAnomalies", false),
    NEWS_RESEARCH_BUZZ("newsResearchBuzz", false),
    AUDIT_SIMULATION_RESULTS("auditSimulationResults", true),
    FORUM_VALIDATOR_DISCUSSIONS("forumValidatorDiscussions", false),
    BOT_CONFIG_ALERTS("botConfigAlerts", false),
    DEPENDENCY_SCANS("dependencyScans", false),
    RESEARCH_REPORTS("researchReports", false),
    SIMULATION_TOOLS("simulationTools", false),
    VALIDATOR_COMMUNICATIONS("validatorCommunications", false);

    private final String key;
    private final boolean evidenceBacked;

    DexOffChainParam(String key, boolean evidenceBacked) {
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
