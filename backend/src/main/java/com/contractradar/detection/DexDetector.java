package com.contractradar.detection;

import com.contractradar.chain.AccountInfo;
import com.contractradar.chain.ProgramDataInfo;
import com.contractradar.chain.SignatureStats;
import com.contractradar.chain.SolanaChainClient;
import com.contractradar.detection.config.DetectionProperties;
import com.contractradar.domain.DetectionMode;
import com.contractradar.domain.DetectionResult;
import com.contractradar.domain.DexData;
import com.contractradar.domain.DexOffChainParam;
import com.contractradar.domain.DexOnChainParam;
import com.contractradar.domain.RiskSeverity;
import com.contractradar.domain.StepEvent;
import com.contractradar.market.DexPairSummary;
import com.contractradar.market.DexScreenerClient;
import com.contractradar.reputation.KnownProgramRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Six-step analysis of a program (or any non-mint account). MEV and account-activity steps have no
 * collaborator behind them yet and only mark their parameters checked.
 */
@Component
@Slf4j
public class DexDetector {

    static final StepDefinition PROGRAM_INFO = StepDefinition.of("program_info", "Analyzing Program Info",
            DexOnChainParam.PROGRAM_UPGRADE_VULNS, DexOnChainParam.UNAUTHORIZED_ADMIN_WITHDRAWALS,
            DexOnChainParam.TICK_ACCOUNT_CREATIONS);
    static final StepDefinition TX_VOLUME = StepDefinition.of("tx_volume", "Analyzing Transaction Volume",
            DexOnChainParam.TRANSACTION_VOLUME_SURGES, DexOnChainParam.FLASH_LOAN_PATTERNS,
            DexOnChainParam.ROUNDING_ERRORS, DexOnChainParam.FEE_RECOVERY_FAILURES);
    static final StepDefinition DEX_PAIRS = StepDefinition.of("dex_pairs", "Analyzing DEX Pairs (DexScreener)",
            DexOnChainParam.LARGE_VAULT_WITHDRAWALS, DexOnChainParam.RUG_PULL_SIGNATURES,
            DexOnChainParam.PRICE_PUMPS, DexOnChainParam.ORACLE_FEED_DISCREPANCIES);
    static final StepDefinition MEV_ANALYSIS = StepDefinition.of("mev_analysis", "Analyzing MEV Activity (Jito)",
            DexOnChainParam.SANDWICH_ATTACKS, DexOnChainParam.MEV_BOT_EXPLOITATION,
            DexOnChainParam.HOT_WALLET_DRAINS, DexOnChainParam.INSIDER_WALLET_CLUSTERS,
            DexOnChainParam.MALICIOUS_TX_APPROVALS, DexOffChainParam.BLOCK_ENGINE_LOGS,
            DexOffChainParam.VALIDATOR_CLIENT_MONITORING);
    static final StepDefinition ACCOUNT_ACTIVITY = StepDefinition.of("account_activity", "Analyzing Account Activity",
            DexOnChainParam.BRIDGE_TRANSFER_ANOMALIES, DexOnChainParam.WALLET_APPROVAL_SPIKES,
            DexOnChainParam.CROSS_CHAIN_BRIDGE_ANOMALIES, DexOffChainParam.RPC_PROVIDER_ANOMALIES);
    static final StepDefinition OFF_CHAIN = StepDefinition.of("off_chain", "Running Off-Chain Analysis",
            DexOffChainParam.SOCIAL_MEDIA_SIGNALS, DexOffChainParam.NEWS_RESEARCH_BUZZ,
            DexOffChainParam.AUDIT_SIMULATION_RESULTS, DexOffChainParam.FORUM_VALIDATOR_DISCUSSIONS,
            DexOffChainParam.BOT_CONFIG_ALERTS, DexOffChainParam.DEPENDENCY_SCANS,
            DexOffChainParam.RESEARCH_REPORTS, DexOffChainParam.SIMULATION_TOOLS,
            DexOffChainParam.VALIDATOR_COMMUNICATIONS);

    static final List<StepDefinition> STEPS = List.of(
            PROGRAM_INFO, TX_VOLUME, DEX_PAIRS, MEV_ANALYSIS, ACCOUNT_ACTIVITY, OFF_CHAIN);

    record ProgramFacts(boolean upgradeable, String upgradeAuthority, String programName) {
    }

    private final SolanaChainClient chain;
    private final DexScreenerClient dexScreener;
    private final KnownProgramRegistry programs;
    private final DetectionProperties.Dex thresholds;

    public DexDetector(SolanaChainClient chain,
                       DexScreenerClient dexScreener,
                       KnownProgramRegistry programs,
                       DetectionProperties properties) {
        this.chain = chain;
        this.dexScreener = dexScreener;
        this.programs = programs;
        this.thresholds = properties.getDex();
    }

    public DetectionResult detect(AccountInfo account, Consumer<StepEvent> sink, CancellationToken cancellation) {
        String address = account.address();
        DetectionRun<DexOnChainParam, DexOffChainParam> run = new DetectionRun<>(
                address, DetectionMode.DEX, DexOnChainParam.class, DexOffChainParam.class, sink, cancellation);
        log.info("Program analysis started for {} (owner {})", address, account.owner());

        Optional<ProgramFacts> program = run.runStep(PROGRAM_INFO, () -> programInfo(run, account));
        Optional<SignatureStats> volume = run.runStep(TX_VOLUME, () -> transactionVolume(run, address));
        Optional<DexPairSummary> pairs = run.runStep(DEX_PAIRS, () -> dexPairs(run, address));
        run.runStep(MEV_ANALYSIS, () -> StepOutcome.of(null, DetectionRun.data("sandwichesDetected", 0)));
        run.runStep(ACCOUNT_ACTIVITY, () -> StepOutcome.of(null, DetectionRun.data("analysisComplete", true)));
        run.runStep(OFF_CHAIN, () -> offChain(run, address));

        DexData.DexDataBuilder b = DexData.builder()
                .programId(address)
                .ownerProgram(account.owner())
                .programName(programs.getProgramName(address).orElse(null));
        program.ifPresent(p -> b.upgradeable(p.upgradeable()).upgradeAuthority(p.upgradeAuthority()));
        volume.ifPresent(v -> b.transactionCount(v.total()).recentErrorRate(v.failureRatePercent()));
        pairs.ifPresent(p -> {
            b.pairs(p.totalPairs());
            if (p.hasPairs()) {
                b.tvl(p.totalLiquidity()).volume24h(p.totalVolume24h()).maxPriceChange1h(p.maxPriceChange1h());
            }
        });
        return run.finish(null, b.build());
    }

    private StepOutcome<ProgramFacts> programInfo(DetectionRun<?, ?> run, AccountInfo account) {
        String authority = null;
        if (account.programDataAddress() != null) {
            ProgramDataInfo programData = chain.getProgramData(account.programDataAddress())
                    .orElseThrow(() -> new CollaboratorUnavailableException("Solana RPC programData"));
            authority = programData.upgradeAuthority();
        }
        boolean upgradeable = authority != null;
        if (upgradeable) {
            run.raise(DexOnChainParam.PROGRAM_UPGRADE_VULNS, "upgradeable_program", "program", "Upgradeable Program",
                    RiskSeverity.HIGH, authority, "Program can be modified by upgrade authority");
        }
        ProgramFacts facts = new ProgramFacts(upgradeable, authority, programs.getProgramName(account.address()).orElse(null));
        return StepOutcome.of(facts, DetectionRun.data(
                "isUpgradeable", upgradeable,
                "upgradeAuthority", upgradeable ? authority : "Immutable",
                "programName", facts.programName()));
    }

    private StepOutcome<SignatureStats> transactionVolume(DetectionRun<?, ?> run, String address) {
        SignatureStats stats = chain.getSignatureStats(address, thresholds.getSignatureSample())
                .orElseThrow(() -> new CollaboratorUnavailableException("Solana RPC signatures"));
        double errorRate = stats.failureRatePercent();
        if (errorRate > thresholds.getErrorRatePercent()) {
            run.raise(DexOnChainParam.PROGRAM_UPGRADE_VULNS, "high_error_rate", "program", "High Program Error Rate",
                    RiskSeverity.HIGH, String.format(Locale.ROOT, "%.1f%%", errorRate),
                    "More than " + plain(thresholds.getErrorRatePercent()) + "% of transactions failing");
        }
        return StepOutcome.of(stats, DetectionRun.data(
                "transactions", stats.total(),
                "errorRate", String.format(Locale.ROOT, "%.1f%%", errorRate)));
    }

    private StepOutcome<DexPairSummary> dexPairs(DetectionRun<?, ?> run, String address) {
        DexPairSummary summary = dexScreener.pairs(address)
                .orElseThrow(() -> new CollaboratorUnavailableException("DexScreener"));
        if (summary.hasPairs()) {
            double liquidity = summary.totalLiquidity();
            double volume = summary.totalVolume24h();
            if (liquidity > 0 && volume > liquidity * thresholds.getVolumeToLiquidityRatio()) {
                run.raise(DexOnChainParam.LARGE_VAULT_WITHDRAWALS, "high_volume_to_liquidity", "holder",
                        "Unusual Volume to Liquidity Ratio", RiskSeverity.MEDIUM,
                        String.format(Locale.ROOT, "%.0f%%", volume / liquidity * 100),
                        "Trading volume significantly exceeds liquidity");
            }
            if (summary.maxPriceChange1h() > thresholds.getPricePumpPercent()) {
                run.raise(DexOnChainParam.PRICE_PUMPS, "price_pump", "activity", "Significant Price Movement",
                        RiskSeverity.HIGH, String.format(Locale.ROOT, "%.1f%% in 1h", summary.maxPriceChange1h()),
                        "Price moved significantly in short time");
            }
        }
        return StepOutcome.of(summary, DetectionRun.data(
                "pairs", summary.totalPairs(),
                "tvl", summary.hasPairs() ? summary.totalLiquidity() : null,
                "volume24h", summary.hasPairs() ? summary.totalVolume24h() : null));
    }

    private StepOutcome<Void> offChain(DetectionRun<?, ?> run, String address) {
        Optional<String> name = programs.getProgramName(address);
        if (name.isEmpty()) {
            run.raise(DexOffChainParam.AUDIT_SIMULATION_RESULTS, "unknown_program", "program", "Unidentified Program",
                    RiskSeverity.MEDIUM, "Unknown", "Program is not recognized as a known DEX");
        }
        return StepOutcome.of(null, DetectionRun.data(
                "offChainChecks", DexOffChainParam.values().length,
                "programName", name.orElse(null)));
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
