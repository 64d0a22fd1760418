package com.contractradar.market;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BirdeyeClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parseOverview_readsMarketFields() throws Exception {
        MarketOverview overview = BirdeyeClient.parseOverview(mapper.readTree("""
                {"success":true,"data":{"price":1.2,"mc":1200000,"liquidity":50000,"holder":321,
                 "v24hUSD":8000.5,"priceChange24hPercent":-3.5}}
                """)).orElseThrow();

        assertThat(overview.price()).isEqualTo(1.2);
        assertThat(overview.holders()).isEqualTo(321L);
        assertThat(overview.volume24hUsd()).isEqualTo(8000.5);
        assertThat(overview.priceChange24hPercent()).isEqualTo(-3.5);
    }

    @Test
    void parseOverview_emptyData_returnsEmpty() throws Exception {
        assertThat(BirdeyeClient.parseOverview(mapper.readTree("{\"success\":false,\"data\":{}}"))).isEmpty();
    }

    @Test
    void parseSecurity_unknownLpStateIsNull() throws Exception {
        TokenSecurity security = BirdeyeClient.parseSecurity(mapper.readTree("""
                {"data":{"creatorAddress":"C1","creatorPercentage":12.5,"top10HolderPercent":40}}
                """)).orElseThrow();

        assertThat(security.creatorAddress()).isEqualTo("C1");
        assertThat(security.lpBurned()).isNull();
        assertThat(security.lpConfirmedBurned()).isFalse();
        assertThat(security.top10HolderPercent()).isEqualTo(40d);
    }
}
