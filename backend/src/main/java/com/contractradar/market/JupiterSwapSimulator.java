package com.contractradar.market;

import com.contractradar.common.TokenBucketLimiter;
import com.contractradar.market.config.MarketConfig;
import com.contractradar.market.config.MarketProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Honeypot probe through Jupiter quotes: a USDC buy and a token sell, without executing anything.
 * Jupiter answers HTTP 400 when no route exists; that is evidence, not an outage.
 */
@Component
@Slf4j
public class JupiterSwapSimulator {

    static final double HONEYPOT_SELL_SLIPPAGE = 50.0;
    static final double ASYMMETRY_FACTOR = 3.0;
    static final double ASYMMETRY_MIN_SELL_SLIPPAGE = 10.0;

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final MarketProperties properties;
    private final TokenBucketLimiter rateLimiter;

    public JupiterSwapSimulator(WebClient.Builder webClientBuilder,
                                ObjectMapper objectMapper,
                                MarketProperties properties,
                                @Qualifier(MarketConfig.JUPITER_LIMITER) TokenBucketLimiter rateLimiter) {
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
    }

    enum QuoteStatus { ROUTE, NO_ROUTE, UNAVAILABLE }

    record Quote(QuoteStatus status, double priceImpactPercent) {

        static Quote unavailable() {
            return new Quote(QuoteStatus.UNAVAILABLE, 0);
        }

        static Quote noRoute() {
            return new Quote(QuoteStatus.NO_ROUTE, 0);
        }
    }

    /**
     * @return empty when Jupiter could not be reached for either leg
     */
    public Optional<SlippageReport> simulate(String mint) {
        MarketProperties.Jupiter jupiter = properties.getJupiter();
        Quote buy = quote(jupiter.getUsdcMint(), mint, jupiter.getBuyAmount());
        Quote sell = quote(mint, jupiter.getUsdcMint(), jupiter.getSellAmount());
        if (buy.status() == QuoteStatus.UNAVAILABLE && sell.status() == QuoteStatus.UNAVAILABLE) {
            return Optional.empty();
        }
        return Optional.of(evaluate(buy, sell));
    }

    static SlippageReport evaluate(Quote buy, Quote sell) {
        double buySlippage = buy.status() == QuoteStatus.ROUTE ? buy.priceImpactPercent() : 0;
        boolean tradeable = true;
        String tradeableReason = null;
        boolean honeypot = false;
        String honeypotReason = null;
        if (buy.status() != QuoteStatus.ROUTE) {
            tradeable = false;
            tradeableReason = "No buy route available";
        }
        double sellSlippage = 0;
        if (sell.status() != QuoteStatus.ROUTE) {
            if (buy.status() == QuoteStatus.ROUTE && sell.status() == QuoteStatus.NO_ROUTE) {
                honeypot = true;
                honeypotReason = "Can buy but cannot sell (no sell route)";
            }
            tradeable = false;
            if (tradeableReason == null) {
                tradeableReason = "No sell route available";
            }
        } else {
            sellSlippage = sell.priceImpactPercent();
            if (sellSlippage > HONEYPOT_SELL_SLIPPAGE) {
                honeypot = true;
                honeypotReason = String.format(Locale.ROOT, "Extreme sell slippage: %.1f%%", sellSlippage);
            } else if (sellSlippage > buySlippage * ASYMMETRY_FACTOR && sellSlippage > ASYMMETRY_MIN_SELL_SLIPPAGE) {
                honeypot = true;
                honeypotReason = String.format(Locale.ROOT, "Sell slippage (%.1f%%) much higher than buy (%.1f%%)",
                        sellSlippage, buySlippage);
            }
        }
        return new SlippageReport(buySlippage, sellSlippage, honeypot, honeypotReason, tradeable, tradeableReason);
    }

    private Quote quote(String inputMint, String outputMint, String amount) {
        MarketProperties.Jupiter jupiter = properties.getJupiter();
        String url = jupiter.getBaseUrl() + "/quote?inputMint=" + inputMint + "&outputMint=" + outputMint
                + "&amount=" + amount + "&slippageBps=" + jupiter.getSlippageBps();
        try {
            rateLimiter.acquire();
            String body = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .headers(h -> {
                        if (jupiter.hasApiKey()) {
                            h.set("x-api-key", jupiter.getApiKey());
                        }
                    })
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(jupiter.getTimeoutSeconds()));
            return parseQuote(objectMapper.readTree(body));
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 400) {
                log.debug("Jupiter has no route {} -> {}", inputMint, outputMint);
                return Quote.noRoute();
            }
            log.warn("Jupiter quote failed {} -> {}: HTTP {}", inputMint, outputMint, e.getStatusCode().value());
            return Quote.unavailable();
        } catch (Exception e) {
            log.warn("Jupiter quote error {} -> {}: {}", inputMint, outputMint, e.getMessage());
            return Quote.unavailable();
        }
    }

    static Quote parseQuote(JsonNode root) {
        if (root == null || !root.hasNonNull("outAmount")) {
            return Quote.noRoute();
        }
        try {
            return new Quote(QuoteStatus.ROUTE, Double.parseDouble(root.path("priceImpactPct").asText("0")));
        } catch (NumberFormatException e) {
            return new Quote(QuoteStatus.ROUTE, 0);
        }
    }
}
