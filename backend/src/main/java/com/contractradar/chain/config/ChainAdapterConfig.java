package com.contractradar.chain.config;

import com.contractradar.chain.adapter.RpcEndpointRotator;
import com.contractradar.chain.adapter.solana.SolanaRpcClient;
import com.contractradar.chain.adapter.solana.WebClientSolanaRpcClient;
import com.contractradar.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Wires the Solana RPC transport, endpoint rotators and the shared local rate limiter.
 */
@Configuration
@EnableConfigurationProperties(SolanaRpcProperties.class)
public class ChainAdapterConfig {

    public static final String RPC_ROTATOR = "solanaRpcEndpointRotator";
    public static final String DAS_ROTATOR = "solanaDasEndpointRotator";
    public static final String RPC_RATE_LIMITER = "solanaRpcRateLimiter";

    private static RetryPolicy retryPolicy(SolanaRpcProperties properties) {
        SolanaRpcProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    private static List<String> rpcUrls(SolanaRpcProperties properties) {
        List<String> urls = nonBlank(properties.getUrls());
        return urls.isEmpty() ? List.of(SolanaRpcProperties.DEFAULT_RPC_URL) : urls;
    }

    private static List<String> nonBlank(List<String> urls) {
        return urls == null ? List.of() : urls.stream().filter(u -> u != null && !u.isBlank()).map(String::strip).toList();
    }

    @Bean(name = RPC_ROTATOR)
    public RpcEndpointRotator solanaRpcEndpointRotator(SolanaRpcProperties properties) {
        return new RpcEndpointRotator("solana-rpc", rpcUrls(properties), retryPolicy(properties));
    }

    /** DAS endpoints when configured, otherwise the plain RPC endpoints. */
    @Bean(name = DAS_ROTATOR)
    public RpcEndpointRotator solanaDasEndpointRotator(SolanaRpcProperties properties) {
        List<String> das = nonBlank(properties.getDasUrls());
        List<String> urls = das.isEmpty() ? rpcUrls(properties) : das;
        return new RpcEndpointRotator("solana-das", urls, retryPolicy(properties));
    }

    @Bean(name = RPC_RATE_LIMITER)
    public RateLimiter solanaRpcRateLimiter(SolanaRpcProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("solana-rpc", config);
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientSolanaRpcClient(webClientBuilder);
    }
}
