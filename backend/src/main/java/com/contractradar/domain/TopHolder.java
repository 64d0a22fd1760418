package com.contractradar.domain;

/**
 * One of the largest token accounts of a mint. Amount is the raw base-unit string from RPC.
 */
public record TopHolder(int rank, String address, String amount, double amountFormatted, double percentage) {
}
