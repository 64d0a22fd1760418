package com.contractradar.market;

/**
 * Birdeye token overview. Numeric fields are null when the provider omitted them.
 */
public record MarketOverview(
        Double price,
        Double marketCap,
        Double liquidity,
        Long holders,
        Double volume24hUsd,
        Double priceChange24hPercent
) {
}
