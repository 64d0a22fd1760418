package com.contractradar.config;

import com.contractradar.analysis.config.AnalysisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Named thread pool for analysis runs. Detectors call collaborators synchronously, so runs must stay
 * off the Netty event loop.
 */
@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class AsyncConfig {

    public static final String ANALYSIS_EXECUTOR = "analysis-executor";

    @Bean(name = ANALYSIS_EXECUTOR)
    public Executor analysisExecutor(AnalysisProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(properties.getCorePoolSize());
        e.setMaxPoolSize(Math.max(properties.getCorePoolSize(), properties.getMaxPoolSize()));
        e.setQueueCapacity(properties.getQueueCapacity());
        e.setThreadNamePrefix("analysis-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
