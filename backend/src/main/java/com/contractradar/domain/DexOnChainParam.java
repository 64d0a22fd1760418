package com.contractradar.domain;

/**
 * On-chain checks for programs and other non-mint accounts (19).
 */
public enum DexOnChainParam implements DetectionParameter {
    FLASH_LOAN_PATTERNS("flashLoanPatterns", false),
    ORACLE_FEED_DISCREPANCIES("oracleFeedDiscrepancies", false),
    UNAUTHORIZED_ADMIN_WITHDRAWALS("unauthorizedAdminWithdrawals", false),
    PRICE_PUMPS("pricePumps", true),
    BRIDGE_TRANSFER_ANOMALIES("bridgeTransferAnomalies", false),
    TICK_ACCOUNT_CREATIONS("tickAccountCreations", false),
    WALLET_APPROVAL_SPIKES("walletApprovalSpikes", false),
    LARGE_VAULT_WITHDRAWALS("largeVaultWithdrawals", true),
    TRANSACTION_VOLUME_SURGES("transactionVolumeSurges", false),
    SANDWICH_ATTACKS("sandwichAttacks", false),
    ROUNDING_ERRORS("roundingErrors", false),
    HOT_WALLET_DRAINS("hotWalletDrains", false),
    INSIDER_WALLET_CLUSTERS("insiderWalletClusters", false),
    RUG_PULL_SIGNATURES("rugPullSignatures", false),
    MALICIOUS_TX_APPROVALS("maliciousTxApprovals", false),
    MEV_BOT_EXPLOITATION("mevBotExploitation", false),
    CROSS_CHAIN_BRIDGE_ANOMALIES("crossChainBridgeAnomalies", false),
    FEE_RECOVERY_FAILURES("feeRecoveryFailures", false),
    PROGRAM_UPGRADE_VULNS("programUpgradeVulns", true);

    private final String key;
    private final boolean evidenceBacked;

    DexOnChainParam(String key, boolean evidenceBacked) {
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
