package com.contractradar.chain;

/**
 * Entry of {@code getTokenLargestAccounts}; amount is the raw base-unit string.
 */
public record TokenAccountBalance(String address, String amount, int decimals) {
}
