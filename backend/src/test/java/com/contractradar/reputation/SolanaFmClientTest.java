package com.contractradar.reputation;

import com.contractradar.domain.RiskSeverity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SolanaFmClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parseHolderDistribution_sumsTopBuckets() throws Exception {
        HolderDistribution d = SolanaFmClient.parseHolderDistribution(mapper.readTree("""
                {"result":[{"percentage":55},{"percentage":10},{"percentage":5},{"percentage":5},
                           {"percentage":5},{"percentage":2}]}
                """));

        assertThat(d.topHolderPercent()).isEqualTo(55d);
        assertThat(d.top5Percent()).isEqualTo(80d);
        assertThat(d.top10Percent()).isEqualTo(82d);
        assertThat(d.holderCount()).isEqualTo(6);
        assertThat(d.concentrationRisk()).isEqualTo(RiskSeverity.CRITICAL);
    }

    @Test
    void parseHolderDistribution_empty_isLowRisk() throws Exception {
        HolderDistribution d = SolanaFmClient.parseHolderDistribution(mapper.readTree("{\"result\":[]}"));

        assertThat(d.holderCount()).isZero();
        assertThat(d.concentrationRisk()).isEqualTo(RiskSeverity.LOW);
    }

    @Test
    void classify_thresholds() {
        assertThat(HolderDistribution.classify(30, 40)).isEqualTo(RiskSeverity.HIGH);
        assertThat(HolderDistribution.classify(5, 75)).isEqualTo(RiskSeverity.HIGH);
        assertThat(HolderDistribution.classify(12, 20)).isEqualTo(RiskSeverity.MEDIUM);
        assertThat(HolderDistribution.classify(5, 20)).isEqualTo(RiskSeverity.LOW);
    }

    @Test
    void parseTransferAnomalies_funnelingAndDominance() throws Exception {
        StringBuilder json = new StringBuilder("{\"result\":[");
        for (int i = 0; i < 12; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"source\":\"S").append(i).append("\",\"destination\":\"R1\",\"success\":true,\"amount\":\"10\"}");
        }
        json.append("]}");

        TransferAnomalies anomalies = SolanaFmClient.parseTransferAnomalies(mapper.readTree(json.toString()));

        assertThat(anomalies.transferCount()).isEqualTo(12);
        assertThat(anomalies.uniqueSenders()).isEqualTo(12);
        assertThat(anomalies.uniqueReceivers()).isEqualTo(1);
        assertThat(anomalies.suspiciousPatterns()).containsExactly(
                "Funneling pattern: Many senders to few receivers",
                "Single receiver dominance: >50% of transfers to one address");
        assertThat(anomalies.suspicious()).isTrue();
    }

    @Test
    void parseTransferAnomalies_failuresAndLargeTransfers() throws Exception {
        StringBuilder json = new StringBuilder("{\"result\":[");
        for (int i = 0; i < 11; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"source\":\"S").append(i % 2).append("\",\"destination\":\"R").append(i)
                    .append("\",\"success\":").append(i < 3 ? "false" : "true")
                    .append(",\"amount\":\"").append(i == 0 ? "5000000000" : "1").append("\"}");
        }
        json.append("]}");

        TransferAnomalies anomalies = SolanaFmClient.parseTransferAnomalies(mapper.readTree(json.toString()));

        assertThat(anomalies.failedTransfers()).isEqualTo(3);
        assertThat(anomalies.largeTransfers()).isEqualTo(1);
        assertThat(anomalies.suspiciousPatterns()).containsExactly("High transfer failure rate: >20% failed");
    }
}
