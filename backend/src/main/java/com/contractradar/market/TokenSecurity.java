package com.contractradar.market;

/**
 * Birdeye token security report. Percentages are 0..100.
 */
public record TokenSecurity(
        String creatorAddress,
        Double creatorPercentage,
        Boolean lpBurned,
        Double lpBurnedPercent,
        Double top10HolderPercent
) {

    public boolean lpConfirmedBurned() {
        return Boolean.TRUE.equals(lpBurned);
    }
}
