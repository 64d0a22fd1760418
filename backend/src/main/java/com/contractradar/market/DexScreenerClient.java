package com.contractradar.market;

import com.contractradar.common.ProviderHttpClient;
import com.contractradar.common.TokenBucketLimiter;
import com.contractradar.config.CaffeineConfig;
import com.contractradar.market.config.MarketConfig;
import com.contractradar.market.config.MarketProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * DexScreener pairs for a token (or any address DexScreener indexes).
 * Empty means the provider could not be reached; an address without pairs yields {@link DexPairSummary#none()}.
 */
@Component
public class DexScreenerClient {

    private static final String PROVIDER = "DexScreener";
    private static final int MAX_PAIRS_KEPT = 10;

    private final ProviderHttpClient http;
    private final MarketProperties properties;
    private final TokenBucketLimiter rateLimiter;

    public DexScreenerClient(ProviderHttpClient http,
                             MarketProperties properties,
                             @Qualifier(MarketConfig.DEXSCREENER_LIMITER) TokenBucketLimiter rateLimiter) {
        this.http = http;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
    }

    @Cacheable(cacheNames = CaffeineConfig.DEX_PAIRS_CACHE, key = "#address", unless = "#result == null")
    public Optional<DexPairSummary> pairs(String address) {
        String url = properties.getDexscreener().getBaseUrl() + "/latest/dex/tokens/" + address;
        return http.getJson(PROVIDER, url, Map.of(),
                        Duration.ofSeconds(properties.getDexscreener().getTimeoutSeconds()), rateLimiter)
                .map(DexScreenerClient::summarize);
    }

    static DexPairSummary summarize(JsonNode root) {
        JsonNode pairsNode = root.path("pairs");
        if (!pairsNode.isArray() || pairsNode.isEmpty()) {
            return DexPairSummary.none();
        }
        List<DexPair> all = new ArrayList<>();
        Set<String> dexes = new LinkedHashSet<>();
        double totalLiquidity = 0;
        double totalVolume = 0;
        double maxChange1h = 0;
        Long createdAt = null;
        JsonNode main = null;
        double mainLiquidity = -1;
        for (JsonNode p : pairsNode) {
            double liquidity = p.path("liquidity").path("usd").asDouble(0);
            double volume = p.path("volume").path("h24").asDouble(0);
            double change1h = p.path("priceChange").path("h1").asDouble(0);
            String dexId = p.path("dexId").asText("unknown");
            dexes.add(dexId);
            totalLiquidity += liquidity;
            totalVolume += volume;
            maxChange1h = Math.max(maxChange1h, Math.abs(change1h));
            if (p.path("pairCreatedAt").isNumber()) {
                long created = p.path("pairCreatedAt").asLong();
                createdAt = createdAt == null ? created : Math.min(createdAt, created);
            }
            if (liquidity > mainLiquidity) {
                mainLiquidity = liquidity;
                main = p;
            }
            all.add(new DexPair(dexId, p.path("pairAddress").asText(), liquidity, volume, change1h,
                    p.path("quoteToken").path("symbol").asText("")));
        }
        all.sort(Comparator.comparingDouble(DexPair::liquidityUsd).reversed());
        return new DexPairSummary(
                pairsNode.size(),
                totalLiquidity,
                totalVolume,
                parseDouble(main.path("priceUsd").asText("0")),
                main.path("priceChange").path("h24").asDouble(0),
                main.path("marketCap").asDouble(0),
                List.copyOf(dexes),
                createdAt,
                maxChange1h,
                List.copyOf(all.subList(0, Math.min(MAX_PAIRS_KEPT, all.size()))));
    }

    private static double parseDouble(String s) {
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return 0d;
        }
    }
}
