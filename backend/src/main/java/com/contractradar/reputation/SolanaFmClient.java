package com.contractradar.reputation;

import com.contractradar.common.ProviderHttpClient;
import com.contractradar.common.TokenBucketLimiter;
import com.contractradar.config.ProviderEndpointProperties;
import com.contractradar.reputation.config.ReputationConfig;
import com.contractradar.reputation.config.ReputationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SolanaFM holder distribution and transfer anomaly detection.
 */
@Component
public class SolanaFmClient {

    private static final String PROVIDER = "SolanaFM";
    /** Raw base units; decimals are not known here. */
    private static final double LARGE_TRANSFER_RAW_AMOUNT = 1e9;

    private final ProviderHttpClient http;
    private final ReputationProperties properties;
    private final TokenBucketLimiter rateLimiter;

    public SolanaFmClient(ProviderHttpClient http,
                          ReputationProperties properties,
                          @Qualifier(ReputationConfig.SOLANAFM_LIMITER) TokenBucketLimiter rateLimiter) {
        this.http = http;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
    }

    public Optional<HolderDistribution> holderDistribution(String mint) {
        return fetch("/tokens/" + mint + "/holders?limit=" + properties.getHolderSampleSize())
                .map(SolanaFmClient::parseHolderDistribution);
    }

    public Optional<TransferAnomalies> transferAnomalies(String mint) {
        return fetch("/tokens/" + mint + "/transfers?limit=" + properties.getTransferSampleSize())
                .map(SolanaFmClient::parseTransferAnomalies);
    }

    private Optional<JsonNode> fetch(String path) {
        ProviderEndpointProperties solanafm = properties.getSolanafm();
        Map<String, String> headers = solanafm.hasApiKey() ? Map.of("ApiKey", solanafm.getApiKey()) : Map.of();
        return http.getJson(PROVIDER, solanafm.getBaseUrl() + path, headers,
                Duration.ofSeconds(solanafm.getTimeoutSeconds()), rateLimiter);
    }

    static HolderDistribution parseHolderDistribution(JsonNode root) {
        List<Double> percentages = new ArrayList<>();
        for (JsonNode holder : root.path("result")) {
            percentages.add(holder.path("percentage").asDouble(0));
        }
        if (percentages.isEmpty()) {
            return new HolderDistribution(0, 0, 0, 0, HolderDistribution.classify(0, 0));
        }
        double top = percentages.get(0);
        double top5 = percentages.stream().limit(5).mapToDouble(Double::doubleValue).sum();
        double top10 = percentages.stream().limit(10).mapToDouble(Double::doubleValue).sum();
        return new HolderDistribution(top, top5, top10, percentages.size(), HolderDistribution.classify(top, top5));
    }

    static TransferAnomalies parseTransferAnomalies(JsonNode root) {
        Set<String> senders = new HashSet<>();
        Set<String> receivers = new HashSet<>();
        Map<String, Integer> receiverCounts = new HashMap<>();
        int total = 0;
        int failed = 0;
        int large = 0;
        for (JsonNode t : root.path("result")) {
            total++;
            String source = t.path("source").asText("");
            String destination = t.path("destination").asText("");
            senders.add(source);
            receivers.add(destination);
            receiverCounts.merge(destination, 1, Integer::sum);
            if (!t.path("success").asBoolean(true)) {
                failed++;
            }
            if (parseAmount(t.path("amount").asText("0")) > LARGE_TRANSFER_RAW_AMOUNT) {
                large++;
            }
        }
        List<String> patterns = new ArrayList<>();
        if (senders.size() > 10 && receivers.size() < 3) {
            patterns.add("Funneling pattern: Many senders to few receivers");
        }
        int topReceiver = receiverCounts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        if (total > 0 && topReceiver > total * 0.5) {
            patterns.add("Single receiver dominance: >50% of transfers to one address");
        }
        if (total > 10 && (double) failed / total > 0.2) {
            patterns.add("High transfer failure rate: >20% failed");
        }
        return new TransferAnomalies(total, senders.size(), receivers.size(), failed, large, patterns);
    }

    private static double parseAmount(String amount) {
        try {
            return Double.parseDouble(amount);
        } catch (NumberFormatException e) {
            return 0d;
        }
    }
}
