package com.contractradar.reputation.config;

import com.contractradar.config.ProviderEndpointProperties;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Off-chain reputation sources and local registries. Documented in application.yml under contractradar.reputation.
 */
@ConfigurationProperties(prefix = "contractradar.reputation")
@Getter
@Setter
public class ReputationProperties {

    private ProviderEndpointProperties rugcheck = new ProviderEndpointProperties("https://api.rugcheck.xyz/v1", 60);

    private ProviderEndpointProperties solanafm = new ProviderEndpointProperties("https://api.solana.fm/v0", 60);

    /** Holders fetched for the concentration check. */
    private int holderSampleSize = 20;

    /** Transfers fetched for anomaly detection. */
    private int transferSampleSize = 100;

    /**
     * Known drainer and rug-pull addresses (base58, matched exactly). A mint authority on this list
     * raises a critical indicator.
     */
    private List<String> drainerBlocklist = new ArrayList<>();

    /**
     * Extra program id to display name entries, merged over the built-in registry of major Solana DEX programs.
     */
    private Map<String, String> knownPrograms = new LinkedHashMap<>();
}
