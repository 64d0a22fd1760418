package com.contractradar.detection;

import com.contractradar.chain.AccountInfo;
import com.contractradar.chain.ProgramDataInfo;
import com.contractradar.chain.SignatureStats;
import com.contractradar.chain.SolanaChainClient;
import com.contractradar.detection.config.DetectionProperties;
import com.contractradar.domain.DetectionMode;
import com.contractradar.domain.DetectionResult;
import com.contractradar.domain.RiskIndicator;
import com.contractradar.domain.StepEvent;
import com.contractradar.domain.StepEventType;
import com.contractradar.market.DexPairSummary;
import com.contractradar.market.DexScreenerClient;
import com.contractradar.reputation.KnownProgramRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DexDetectorTest {

    private static final String PROGRAM = "675kPX9MHTjS2zt1qfr1NYHuzeLXfQM9H24wFSUt1Mp8";
    private static final String PROGRAM_DATA = "2sUbZ7ThFqBNF3bZx2FDY4gRDZknMzCcfMYQnV1bfW5k";
    private static final String LOADER = "BPFLoaderUpgradeab1e11111111111111111111111";

    @Mock
    private SolanaChainClient chain;
    @Mock
    private DexScreenerClient dexScreener;
    @Mock
    private KnownProgramRegistry programs;

    private DexDetector detector;
    private final List<StepEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        when(programs.getProgramName(anyString())).thenReturn(Optional.empty());
        detector = new DexDetector(chain, dexScreener, programs, new DetectionProperties());
    }

    private static AccountInfo program(String programData) {
        return new AccountInfo(PROGRAM, LOADER, true, 1_141_440L, "program", null, programData);
    }

    @Test
    @DisplayName("upgradeable unknown program with failing transactions and a price pump")
    void riskyProgram() {
        when(chain.getProgramData(PROGRAM_DATA)).thenReturn(Optional.of(
                new ProgramDataInfo(PROGRAM_DATA, "UpgradeAuth1", 250_000_000L)));
        when(chain.getSignatureStats(eq(PROGRAM), anyInt())).thenReturn(Optional.of(new SignatureStats(1000, 70)));
        when(dexScreener.pairs(PROGRAM)).thenReturn(Optional.of(new DexPairSummary(2, 10_000, 30_000, 1, 0, 0,
                List.of("raydium"), null, 75, List.of())));

        DetectionResult result = detector.detect(program(PROGRAM_DATA), events::add, new CancellationToken());

        assertThat(result.detectionMode()).isEqualTo(DetectionMode.DEX);
        assertThat(result.riskIndicators()).extracting(RiskIndicator::id).containsExactly(
                "upgradeable_program", "high_error_rate", "high_volume_to_liquidity", "price_pump",
                "unknown_program");
        assertThat(result.riskIndicators()).extracting(RiskIndicator::value).containsExactly(
                "UpgradeAuth1", "7.0%", "300%", "75.0% in 1h", "Unknown");
        assertThat(result.riskIndicators().get(1).description()).isEqualTo("More than 5% of transactions failing");
        // upgradeable_program and high_error_rate share programUpgradeVulns
        assertThat(result.onChainParams().get("programUpgradeVulns").value()).isEqualTo("UpgradeAuth1");
        assertThat(result.totalParamsChecked()).isEqualTo(31);
        assertThat(result.totalParamsTriggered()).isEqualTo(4);
        assertThat(result.dexData().upgradeable()).isTrue();
        assertThat(result.dexData().tvl()).isEqualTo(10_000d);
        assertThat(result.tokenData()).isNull();
    }

    @Test
    @DisplayName("known immutable program with no failed transactions raises nothing")
    void knownImmutableProgram() {
        when(programs.getProgramName(PROGRAM)).thenReturn(Optional.of("Raydium AMM V4"));
        when(chain.getSignatureStats(eq(PROGRAM), anyInt())).thenReturn(Optional.of(new SignatureStats(1000, 0)));
        when(dexScreener.pairs(PROGRAM)).thenReturn(Optional.of(DexPairSummary.none()));

        DetectionResult result = detector.detect(program(null), events::add, new CancellationToken());

        assertThat(result.riskIndicators()).isEmpty();
        assertThat(result.riskScore()).isZero();
        assertThat(result.onChainParamsChecked()).isEqualTo(19);
        assertThat(result.offChainParamsChecked()).isEqualTo(12);
        assertThat(result.totalParamsTriggered()).isZero();
        assertThat(result.dexData().programName()).isEqualTo("Raydium AMM V4");
        assertThat(result.dexData().upgradeable()).isFalse();
        verify(chain, never()).getProgramData(anyString());
    }

    @Test
    @DisplayName("six steps each end in exactly one complete or error event")
    void stepEventsPaired() {
        detector.detect(program(PROGRAM_DATA), events::add, new CancellationToken());

        assertThat(events).hasSize(12);
        assertThat(events).filteredOn(e -> e.type() == StepEventType.STEP_START)
                .extracting(StepEvent::stepId)
                .containsExactly("program_info", "tx_volume", "dex_pairs", "mev_analysis", "account_activity",
                        "off_chain");
        assertThat(DexDetector.STEPS).extracting(StepDefinition::id)
                .containsExactly("program_info", "tx_volume", "dex_pairs", "mev_analysis", "account_activity",
                        "off_chain");
        assertThat(events).filteredOn(e -> e.type() == StepEventType.STEP_ERROR)
                .extracting(StepEvent::stepId)
                .containsExactly("program_info", "tx_volume", "dex_pairs");
    }

    @Test
    @DisplayName("checked counts never decrease across the stream")
    void countsMonotonic() {
        detector.detect(program(null), events::add, new CancellationToken());

        int last = 0;
        for (StepEvent event : events) {
            assertThat(event.paramsChecked()).isGreaterThanOrEqualTo(last);
            last = event.paramsChecked();
        }
        assertThat(last).isEqualTo(31);
    }
}
