package com.contractradar.reputation;

import java.util.List;

/**
 * Patterns found in the most recent transfers of a mint.
 */
public record TransferAnomalies(
        int transferCount,
        int uniqueSenders,
        int uniqueReceivers,
        int failedTransfers,
        int largeTransfers,
        List<String> suspiciousPatterns
) {

    public TransferAnomalies {
        suspiciousPatterns = suspiciousPatterns == null ? List.of() : List.copyOf(suspiciousPatterns);
    }

    public boolean suspicious() {
        return !suspiciousPatterns.isEmpty();
    }
}
