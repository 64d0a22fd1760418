package com.contractradar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine caches for provider responses. Detection results are never cached.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String ASSET_METADATA_CACHE = "assetMetadataCache";
    public static final String MARKET_OVERVIEW_CACHE = "marketOverviewCache";
    public static final String TOKEN_SECURITY_CACHE = "tokenSecurityCache";
    public static final String DEX_PAIRS_CACHE = "dexPairsCache";
    public static final String SAFETY_SCORE_CACHE = "safetyScoreCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        // metadata rarely changes
        manager.registerCustomCache(ASSET_METADATA_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(5_000)
                .build());
        manager.registerCustomCache(MARKET_OVERVIEW_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(TOKEN_SECURITY_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(DEX_PAIRS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(SAFETY_SCORE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(2_000)
                .build());
        return manager;
    }
}
