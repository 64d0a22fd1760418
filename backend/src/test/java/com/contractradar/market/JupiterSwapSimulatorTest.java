package com.contractradar.market;

import com.contractradar.market.JupiterSwapSimulator.Quote;
import com.contractradar.market.JupiterSwapSimulator.QuoteStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JupiterSwapSimulatorTest {

    private static Quote route(double impact) {
        return new Quote(QuoteStatus.ROUTE, impact);
    }

    @Test
    @DisplayName("normal round trip is tradeable and not a honeypot")
    void normalRoundTrip() {
        SlippageReport report = JupiterSwapSimulator.evaluate(route(0.5), route(0.8));

        assertThat(report.honeypot()).isFalse();
        assertThat(report.tradeable()).isTrue();
        assertThat(report.sellSlippagePercent()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("buy route without sell route is a honeypot")
    void noSellRoute() {
        SlippageReport report = JupiterSwapSimulator.evaluate(route(1), Quote.noRoute());

        assertThat(report.honeypot()).isTrue();
        assertThat(report.honeypotReason()).isEqualTo("Can buy but cannot sell (no sell route)");
        assertThat(report.tradeable()).isFalse();
    }

    @Test
    @DisplayName("unreachable sell leg is not evidence of a honeypot")
    void sellUnavailable() {
        SlippageReport report = JupiterSwapSimulator.evaluate(route(1), Quote.unavailable());

        assertThat(report.honeypot()).isFalse();
        assertThat(report.tradeable()).isFalse();
    }

    @Test
    @DisplayName("sell slippage above 50% is a honeypot")
    void extremeSellSlippage() {
        SlippageReport report = JupiterSwapSimulator.evaluate(route(1), route(62.5));

        assertThat(report.honeypot()).isTrue();
        assertThat(report.honeypotReason()).isEqualTo("Extreme sell slippage: 62.5%");
    }

    @Test
    @DisplayName("sell slippage far above buy slippage is a honeypot")
    void asymmetricSlippage() {
        SlippageReport report = JupiterSwapSimulator.evaluate(route(2), route(15));

        assertThat(report.honeypot()).isTrue();
        assertThat(report.honeypotReason()).startsWith("Sell slippage (15.0%)");
        assertThat(JupiterSwapSimulator.evaluate(route(2), route(8)).honeypot()).isFalse();
    }

    @Test
    @DisplayName("quote without outAmount means no route")
    void parseQuote() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertThat(JupiterSwapSimulator.parseQuote(mapper.readTree("{\"error\":\"No routes found\"}")).status())
                .isEqualTo(QuoteStatus.NO_ROUTE);
        Quote quote = JupiterSwapSimulator.parseQuote(
                mapper.readTree("{\"outAmount\":\"990000\",\"priceImpactPct\":\"1.25\"}"));
        assertThat(quote.status()).isEqualTo(QuoteStatus.ROUTE);
        assertThat(quote.priceImpactPercent()).isEqualTo(1.25);
    }
}
