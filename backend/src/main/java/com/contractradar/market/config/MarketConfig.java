package com.contractradar.market.config;

import com.contractradar.common.TokenBucketLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Market provider throttles, one bucket per provider.
 */
@Configuration
@EnableConfigurationProperties(MarketProperties.class)
public class MarketConfig {

    public static final String BIRDEYE_LIMITER = "birdeyeRateLimiter";
    public static final String DEXSCREENER_LIMITER = "dexScreenerRateLimiter";
    public static final String JUPITER_LIMITER = "jupiterRateLimiter";

    @Bean(name = BIRDEYE_LIMITER)
    public TokenBucketLimiter birdeyeRateLimiter(MarketProperties properties) {
        return new TokenBucketLimiter("birdeye", properties.getBirdeye().getRequestsPerMinute());
    }

    @Bean(name = DEXSCREENER_LIMITER)
    public TokenBucketLimiter dexScreenerRateLimiter(MarketProperties properties) {
        return new TokenBucketLimiter("dexscreener", properties.getDexscreener().getRequestsPerMinute());
    }

    @Bean(name = JUPITER_LIMITER)
    public TokenBucketLimiter jupiterRateLimiter(MarketProperties properties) {
        return new TokenBucketLimiter("jupiter", properties.getJupiter().getRequestsPerMinute());
    }
}
