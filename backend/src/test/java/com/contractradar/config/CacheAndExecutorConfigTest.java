package com.contractradar.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.ANALYSIS_EXECUTOR)
    Executor analysisExecutor;

    @Autowired
    Clock clock;

    @Test
    @DisplayName("all 5 Caffeine caches are created and usable")
    void cachesCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.ASSET_METADATA_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.MARKET_OVERVIEW_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.TOKEN_SECURITY_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.DEX_PAIRS_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.SAFETY_SCORE_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.DEX_PAIRS_CACHE).put("key1", "value1");
        assertThat(cacheManager.getCache(CaffeineConfig.DEX_PAIRS_CACHE).get("key1").get()).isEqualTo("value1");
    }

    @Test
    @DisplayName("analysis executor uses the default pool sizes")
    void executorCreated() {
        assertThat(analysisExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) analysisExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(4);
        assertThat(e.getMaxPoolSize()).isEqualTo(16);
        assertThat(e.getThreadNamePrefix()).isEqualTo("analysis-");
        assertThat(clock).isNotNull();
    }
}
