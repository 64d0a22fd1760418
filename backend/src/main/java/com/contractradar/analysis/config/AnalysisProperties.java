package com.contractradar.analysis.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizing of the analysis-executor pool. A full queue rejects new runs instead of blocking the event loop.
 */
@ConfigurationProperties(prefix = "contractradar.analysis")
@Getter
@Setter
public class AnalysisProperties {

    private int corePoolSize = 4;

    private int maxPoolSize = 16;

    private int queueCapacity = 100;
}
