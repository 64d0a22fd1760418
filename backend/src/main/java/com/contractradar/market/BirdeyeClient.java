package com.contractradar.market;

import com.contractradar.common.ProviderHttpClient;
import com.contractradar.common.TokenBucketLimiter;
import com.contractradar.config.CaffeineConfig;
import com.contractradar.config.ProviderEndpointProperties;
import com.contractradar.market.config.MarketConfig;
import com.contractradar.market.config.MarketProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Birdeye token overview and token security. Without an API key both calls return empty.
 */
@Component
@Slf4j
public class BirdeyeClient {

    private static final String PROVIDER = "Birdeye";

    private final ProviderHttpClient http;
    private final MarketProperties properties;
    private final TokenBucketLimiter rateLimiter;

    public BirdeyeClient(ProviderHttpClient http,
                         MarketProperties properties,
                         @Qualifier(MarketConfig.BIRDEYE_LIMITER) TokenBucketLimiter rateLimiter) {
        this.http = http;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
    }

    @Cacheable(cacheNames = CaffeineConfig.MARKET_OVERVIEW_CACHE, key = "#mint", unless = "#result == null")
    public Optional<MarketOverview> overview(String mint) {
        return fetch("/defi/token_overview?address=" + mint).flatMap(BirdeyeClient::parseOverview);
    }

    @Cacheable(cacheNames = CaffeineConfig.TOKEN_SECURITY_CACHE, key = "#mint", unless = "#result == null")
    public Optional<TokenSecurity> security(String mint) {
        return fetch("/defi/token_security?address=" + mint).flatMap(BirdeyeClient::parseSecurity);
    }

    private Optional<JsonNode> fetch(String path) {
        ProviderEndpointProperties birdeye = properties.getBirdeye();
        if (!birdeye.hasApiKey()) {
            log.debug("Birdeye API key not configured, skipping {}", path);
            return Optional.empty();
        }
        Map<String, String> headers = Map.of("X-API-KEY", birdeye.getApiKey(), "x-chain", "solana");
        return http.getJson(PROVIDER, birdeye.getBaseUrl() + path, headers,
                Duration.ofSeconds(birdeye.getTimeoutSeconds()), rateLimiter);
    }

    static Optional<MarketOverview> parseOverview(JsonNode root) {
        JsonNode data = root.path("data");
        if (!data.isObject() || data.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new MarketOverview(
                number(data, "price"),
                number(data, "mc"),
                number(data, "liquidity"),
                data.path("holder").isNumber() ? data.path("holder").asLong() : null,
                number(data, "v24hUSD"),
                number(data, "priceChange24hPercent")));
    }

    static Optional<TokenSecurity> parseSecurity(JsonNode root) {
        JsonNode data = root.path("data");
        if (!data.isObject() || data.isEmpty()) {
            return Optional.empty();
        }
        JsonNode lp = data.path("isLpBurned");
        return Optional.of(new TokenSecurity(
                data.path("creatorAddress").isTextual() ? data.path("creatorAddress").asText() : null,
                number(data, "creatorPercentage"),
                lp.isBoolean() ? lp.asBoolean() : null,
                number(data, "lpBurnedPercent"),
                number(data, "top10HolderPercent")));
    }

    private static Double number(JsonNode parent, String field) {
        JsonNode n = parent.path(field);
        return n.isNumber() ? n.asDouble() : null;
    }
}
