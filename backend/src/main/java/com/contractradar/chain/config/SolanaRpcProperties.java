package com.contractradar.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Solana RPC access. Documented in application.yml under contractradar.solana.
 */
@ConfigurationProperties(prefix = "contractradar.solana")
@NoArgsConstructor
@Getter
@Setter
public class SolanaRpcProperties {

    public static final String DEFAULT_RPC_URL = "https://api.mainnet-beta.solana.com";

    /** JSON-RPC endpoints, rotated round-robin. Falls back to the public mainnet endpoint when empty. */
    private List<String> urls = new ArrayList<>();

    /**
     * Endpoints that serve the DAS API (getAsset), e.g. a Helius URL with api-key. When empty, {@link #urls}
     * are tried, and metadata is simply unavailable on endpoints without DAS.
     */
    private List<String> dasUrls = new ArrayList<>();

    /** Local throttle shared by every analysis run. */
    private int maxRequestsPerSecond = 10;

    /** Max wait for a local limiter permit before the call fails. */
    private long limiterTimeoutMs = 5_000L;

    /** Per-call response timeout. */
    private int timeoutSeconds = 15;

    /** Commitment used for signature queries. */
    private String commitment = "confirmed";

    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        /** Base delay in ms for first retry; doubles each attempt. */
        private long baseDelayMs = 500L;
        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.2;
        /** Total attempts per call, including the first. */
        private int maxAttempts = 3;
    }
}
