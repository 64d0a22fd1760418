package com.contractradar.chain;

import java.math.BigDecimal;

/**
 * Parsed SPL mint state. {@code rawSupply} is in base units; authorities are null when revoked.
 */
public record MintInfo(int decimals, String rawSupply, String mintAuthority, String freezeAuthority) {

    /** Supply in whole tokens. */
    public double uiSupply() {
        return toUiAmount(rawSupply, decimals);
    }

    public static double toUiAmount(String rawAmount, int decimals) {
        if (rawAmount == null || rawAmount.isBlank()) {
            return 0d;
        }
        try {
            return new BigDecimal(rawAmount).movePointLeft(decimals).doubleValue();
        } catch (NumberFormatException e) {
            return 0d;
        }
    }
}
