package com.contractradar.ai.config;

import com.contractradar.ai.CredentialPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(AiProperties.class)
public class AiConfig {

    public static final String AI_CREDENTIALS = "aiCredentialPool";

    @Bean(name = AI_CREDENTIALS)
    public CredentialPool aiCredentialPool(AiProperties properties) {
        CredentialPool pool = new CredentialPool("openrouter", properties.getApiKeys());
        log.info("Credential pool {} loaded with {} key(s)", pool.getName(), pool.size());
        return pool;
    }
}
