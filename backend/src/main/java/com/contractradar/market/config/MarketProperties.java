package com.contractradar.market.config;

import com.contractradar.config.ProviderEndpointProperties;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Market data providers. Documented in application.yml under contractradar.market.
 */
@ConfigurationProperties(prefix = "contractradar.market")
@Getter
@Setter
public class MarketProperties {

    /** Birdeye public API; requires an API key, otherwise market and security data are unavailable. */
    private ProviderEndpointProperties birdeye = new ProviderEndpointProperties("https://public-api.birdeye.so", 60);

    /** DexScreener; no key required. */
    private ProviderEndpointProperties dexscreener = new ProviderEndpointProperties("https://api.dexscreener.com", 300);

    private Jupiter jupiter = new Jupiter();

    @Getter
    @Setter
    public static class Jupiter extends ProviderEndpointProperties {

        public Jupiter() {
            super("https://api.jup.ag/swap/v1", 60);
        }

        /** Quote currency for the round-trip simulation. */
        private String usdcMint = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

        /** Buy leg input: 100 USDC in base units. */
        private String buyAmount = "100000000";

        /** Sell leg input in token base units. */
        private String sellAmount = "1000000000";

        private int slippageBps = 50;
    }
}
