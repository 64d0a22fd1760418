package com.contractradar.market;

/**
 * Result of the buy/sell quote round trip. Slippage values are price impact in percent.
 */
public record SlippageReport(
        double buySlippagePercent,
        double sellSlippagePercent,
        boolean honeypot,
        String honeypotReason,
        boolean tradeable,
        String tradeableReason
) {
}
