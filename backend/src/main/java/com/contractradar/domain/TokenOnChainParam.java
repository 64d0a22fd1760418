package com.contractradar.domain;

/**
 * On-chain checks for SPL token mints (18).
 */
public enum TokenOnChainParam implements DetectionParameter {
    MASSIVE_MINTS("massiveMints", true),
    GOVERNANCE_EXPLOITS("governanceExploits", false),
    BONDING_CURVE_DISTORTIONS("bondingCurveDistortions", false),
    ASSET_FREEZES("assetFreezes", true),
    WALLET_DRAINS("walletDrains", true),
    OVER_BORROWING("overBorrowing", false),
    ZK_PROOF_ANOMALIES("zkProofAnomalies", false),
    RACE_CONDITIONS("raceConditions", true),
    SIGNER_CHECK_FAILURES("signerCheckFailures", false),
    TREASURY_DRAINS("treasuryDrains", false),
    UNAUTHORIZED_WITHDRAWALS("unauthorizedWithdrawals", false),
    SLOW_DRAIN_PATTERNS("slowDrainPatterns", true),
    VICTIM_WALLET_SPIKES("victimWalletSpikes", true),
    TOKEN_SUPPLY_INFLATION("tokenSupplyInflation", false),
    APPROVAL_HIJACKING("approvalHijacking", true),
    FAILED_PROJECT_SIGNATURES("failedProjectSignatures", true),
    ACCOUNT_IMPERSONATION("accountImpersonation", false),
    HARDWARE_WALLET_BREACHES("hardwareWalletBreaches", false);

    private final String key;
    private final boolean evidenceBacked;

    TokenOnChainParam(String key, boolean evidenceBacked) {
        this.key = key;
        this.evidenceBacked = evidenceBacked;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public ParamType type() {
        return ParamType.ON_CHAIN;
    }

    @Override
    public boolean evidenceBacked() {
        return evidenceBacked;
    }
}
