package com.contractradar.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Connection settings shared by every third-party HTTP provider.
 */
@NoArgsConstructor
@Getter
@Setter
public class ProviderEndpointProperties {

    private String baseUrl;

    /** Sent as the provider's API key header when non-blank. */
    private String apiKey = "";

    /** Local token-bucket throttle. */
    private int requestsPerMinute = 60;

    private int timeoutSeconds = 10;

    public ProviderEndpointProperties(String baseUrl, int requestsPerMinute) {
        this.baseUrl = baseUrl;
        this.requestsPerMinute = requestsPerMinute;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
