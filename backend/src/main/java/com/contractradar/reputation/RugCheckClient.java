package com.contractradar.reputation;

import com.contractradar.common.ProviderHttpClient;
import com.contractradar.common.TokenBucketLimiter;
import com.contractradar.config.CaffeineConfig;
import com.contractradar.reputation.config.ReputationConfig;
import com.contractradar.reputation.config.ReputationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * RugCheck token report, reduced to a score and its rating bucket.
 */
@Component
public class RugCheckClient {

    private static final String PROVIDER = "RugCheck";

    private final ProviderHttpClient http;
    private final ReputationProperties properties;
    private final TokenBucketLimiter rateLimiter;

    public RugCheckClient(ProviderHttpClient http,
                          ReputationProperties properties,
                          @Qualifier(ReputationConfig.RUGCHECK_LIMITER) TokenBucketLimiter rateLimiter) {
        this.http = http;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
    }

    @Cacheable(cacheNames = CaffeineConfig.SAFETY_SCORE_CACHE, key = "#mint", unless = "#result == null")
    public Optional<SafetyScore> safetyScore(String mint) {
        String url = properties.getRugcheck().getBaseUrl() + "/tokens/" + mint + "/report";
        return http.getJson(PROVIDER, url, Map.of(),
                        Duration.ofSeconds(properties.getRugcheck().getTimeoutSeconds()), rateLimiter)
                .flatMap(RugCheckClient::parseReport);
    }

    static Optional<SafetyScore> parseReport(JsonNode root) {
        JsonNode score = root.path("score");
        if (!score.isNumber()) {
            return Optional.empty();
        }
        JsonNode risks = root.path("risks");
        return Optional.of(SafetyScore.of(score.asInt(), risks.isArray() ? risks.size() : 0));
    }
}
