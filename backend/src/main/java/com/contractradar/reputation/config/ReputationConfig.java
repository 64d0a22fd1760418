package com.contractradar.reputation.config;

import com.contractradar.common.TokenBucketLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ReputationProperties.class)
public class ReputationConfig {

    public static final String RUGCHECK_LIMITER = "rugCheckRateLimiter";
    public static final String SOLANAFM_LIMITER = "solanaFmRateLimiter";

    @Bean(name = RUGCHECK_LIMITER)
    public TokenBucketLimiter rugCheckRateLimiter(ReputationProperties properties) {
        return new TokenBucketLimiter("rugcheck", properties.getRugcheck().getRequestsPerMinute());
    }

    @Bean(name = SOLANAFM_LIMITER)
    public TokenBucketLimiter solanaFmRateLimiter(ReputationProperties properties) {
        return new TokenBucketLimiter("solanafm", properties.getSolanafm().getRequestsPerMinute());
    }
}
