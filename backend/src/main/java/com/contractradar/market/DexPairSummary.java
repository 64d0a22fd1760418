package com.contractradar.market;

import java.util.List;

/**
 * Aggregate over every DexScreener pair of an address.
 *
 * @param createdAt         earliest pair creation (epoch ms), null when unknown
 * @param maxPriceChange1h  largest absolute 1h price change over all pairs
 * @param pairs             top pairs by liquidity, at most 10
 */
public record DexPairSummary(
        int totalPairs,
        double totalLiquidity,
        double totalVolume24h,
        double price,
        double priceChange24h,
        double marketCap,
        List<String> dexes,
        Long createdAt,
        double maxPriceChange1h,
        List<DexPair> pairs
) {

    public static DexPairSummary none() {
        return new DexPairSummary(0, 0, 0, 0, 0, 0, List.of(), null, 0, List.of());
    }

    public boolean hasPairs() {
        return totalPairs > 0;
    }
}
