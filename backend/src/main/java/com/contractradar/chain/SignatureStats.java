package com.contractradar.chain;

/**
 * Failure tally over the most recent signatures of an address.
 */
public record SignatureStats(int total, int failed) {

    /** Failed share in percent; 0 when there are no signatures. */
    public double failureRatePercent() {
        return total == 0 ? 0d : failed * 100.0 / total;
    }
}
