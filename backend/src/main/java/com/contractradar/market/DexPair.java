package com.contractradar.market;

public record DexPair(
        String dexId,
        String pairAddress,
        double liquidityUsd,
        double volume24h,
        double priceChange1h,
        String quoteSymbol
) {
}
