package com.contractradar.detection;

import com.contractradar.chain.AccountInfo;
import com.contractradar.chain.AssetMetadata;
import com.contractradar.chain.MintInfo;
import com.contractradar.chain.SignatureStats;
import com.contractradar.chain.SolanaChainClient;
import com.contractradar.chain.TokenAccountBalance;
import com.contractradar.detection.config.DetectionProperties;
import com.contractradar.domain.DetectionMode;
import com.contractradar.domain.DetectionResult;
import com.contractradar.domain.RiskSeverity;
import com.contractradar.domain.StepEvent;
import com.contractradar.domain.TokenData;
import com.contractradar.domain.TokenOffChainParam;
import com.contractradar.domain.TokenOnChainParam;
import com.contractradar.domain.TopHolder;
import com.contractradar.market.BirdeyeClient;
import com.contractradar.market.DexPairSummary;
import com.contractradar.market.DexScreenerClient;
import com.contractradar.market.JupiterSwapSimulator;
import com.contractradar.market.MarketOverview;
import com.contractradar.market.SlippageReport;
import com.contractradar.market.TokenSecurity;
import com.contractradar.reputation.DrainerBlocklist;
import com.contractradar.reputation.HolderDistribution;
import com.contractradar.reputation.RugCheckClient;
import com.contractradar.reputation.SafetyRating;
import com.contractradar.reputation.SafetyScore;
import com.contractradar.reputation.SolanaFmClient;
import com.contractradar.reputation.TransferAnomalies;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Eight-step analysis of an SPL mint. Each step owns a slice of the 31 token parameters; a failing step
 * leaves its parameters checked but untriggered and the next step still runs.
 */
@Component
@Slf4j
public class TokenDetector {

    static final StepDefinition BASIC_INFO = StepDefinition.of("basic_info", "Analyzing Token Basic Info",
            TokenOnChainParam.MASSIVE_MINTS, TokenOnChainParam.ASSET_FREEZES);
    static final StepDefinition MARKET_DATA = StepDefinition.of("market_data", "Fetching Market Data (Birdeye)",
            TokenOnChainParam.FAILED_PROJECT_SIGNATURES, TokenOnChainParam.TOKEN_SUPPLY_INFLATION,
            TokenOffChainParam.RUG_PULL_METRICS);
    static final StepDefinition SECURITY_INFO = StepDefinition.of("security_info", "Fetching Security Info (Birdeye)",
            TokenOnChainParam.TREASURY_DRAINS, TokenOnChainParam.UNAUTHORIZED_WITHDRAWALS,
            TokenOnChainParam.APPROVAL_HIJACKING, TokenOffChainParam.CENTRALIZATION_WARNINGS);
    static final StepDefinition DEX_PAIRS = StepDefinition.of("dex_pairs", "Fetching DEX Pairs (DexScreener)",
            TokenOnChainParam.BONDING_CURVE_DISTORTIONS, TokenOnChainParam.SLOW_DRAIN_PATTERNS,
            TokenOffChainParam.SOCIAL_MEDIA_SIGNALS);
    static final StepDefinition SLIPPAGE = StepDefinition.of("slippage", "Analyzing Slippage (Jupiter)",
            TokenOnChainParam.WALLET_DRAINS, TokenOffChainParam.ECONOMIC_MODEL_STRESS);
    static final StepDefinition HOLDERS = StepDefinition.of("holders", "Analyzing Token Holders",
            TokenOnChainParam.VICTIM_WALLET_SPIKES, TokenOnChainParam.ACCOUNT_IMPERSONATION);
    static final StepDefinition TRANSACTIONS = StepDefinition.of("transactions", "Analyzing Recent Transactions",
            TokenOnChainParam.RACE_CONDITIONS, TokenOnChainParam.GOVERNANCE_EXPLOITS,
            TokenOnChainParam.OVER_BORROWING, TokenOnChainParam.ZK_PROOF_ANOMALIES,
            TokenOnChainParam.SIGNER_CHECK_FAILURES, TokenOnChainParam.HARDWARE_WALLET_BREACHES);
    static final StepDefinition OFF_CHAIN = StepDefinition.of("off_chain", "Running Off-Chain Analysis",
            TokenOffChainParam.KEY_LEAK_INDICATORS, TokenOffChainParam.DAO_ENGAGEMENT_ALERTS,
            TokenOffChainParam.AUDIT_GAP_WARNINGS, TokenOffChainParam.PHISHING_TX_CLUSTERS,
            TokenOffChainParam.MALWARE_APP_INDICATORS, TokenOffChainParam.AI_PACKAGE_ALERTS,
            TokenOffChainParam.DEEPFAKE_SIGNALS, TokenOffChainParam.USER_REPORT_AGGREGATION,
            TokenOffChainParam.VICTIM_REPORT_ANALYSIS);

    static final List<StepDefinition> STEPS = List.of(
            BASIC_INFO, MARKET_DATA, SECURITY_INFO, DEX_PAIRS, SLIPPAGE, HOLDERS, TRANSACTIONS, OFF_CHAIN);

    private static final long HOUR_MS = 60 * 60 * 1000L;

    record HolderFacts(List<TopHolder> topHolders, double topHolderPercent) {
    }

    record ReputationFacts(SafetyScore safety, HolderDistribution distribution, TransferAnomalies transfers) {
    }

    private final SolanaChainClient chain;
    private final BirdeyeClient birdeye;
    private final DexScreenerClient dexScreener;
    private final JupiterSwapSimulator jupiter;
    private final RugCheckClient rugCheck;
    private final SolanaFmClient solanaFm;
    private final DrainerBlocklist drainers;
    private final DetectionProperties.Token thresholds;
    private final Clock clock;

    public TokenDetector(SolanaChainClient chain,
                         BirdeyeClient birdeye,
                         DexScreenerClient dexScreener,
                         JupiterSwapSimulator jupiter,
                         RugCheckClient rugCheck,
                         SolanaFmClient solanaFm,
                         DrainerBlocklist drainers,
                         DetectionProperties properties,
                         Clock clock) {
        this.chain = chain;
        this.birdeye = birdeye;
        this.dexScreener = dexScreener;
        this.jupiter = jupiter;
        this.rugCheck = rugCheck;
        this.solanaFm = solanaFm;
        this.drainers = drainers;
        this.thresholds = properties.getToken();
        this.clock = clock;
    }

    /**
     * @param mintAccount account already classified as a mint
     * @param metadata    DAS metadata from the coordinator, may be null
     */
    public DetectionResult detect(AccountInfo mintAccount, AssetMetadata metadata,
                                  Consumer<StepEvent> sink, CancellationToken cancellation) {
        String mint = mintAccount.address();
        DetectionRun<TokenOnChainParam, TokenOffChainParam> run = new DetectionRun<>(
                mint, DetectionMode.TOKEN, TokenOnChainParam.class, TokenOffChainParam.class, sink, cancellation);
        log.info("Token analysis started for {}", mint);

        Optional<MintInfo> mintInfo = run.runStep(BASIC_INFO, () -> basicInfo(run, mintAccount));
        Optional<MarketOverview> market = run.runStep(MARKET_DATA, () -> marketData(run, mint));
        Optional<TokenSecurity> security = run.runStep(SECURITY_INFO, () -> securityInfo(run, mint));
        Optional<DexPairSummary> pairs = run.runStep(DEX_PAIRS, () -> dexPairs(run, mint));
        Optional<SlippageReport> slippage = run.runStep(SLIPPAGE, () -> slippage(run, mint));
        Optional<HolderFacts> holders = run.runStep(HOLDERS, () -> holders(run, mint, mintInfo.orElse(null)));
        Optional<SignatureStats> transactions = run.runStep(TRANSACTIONS, () -> transactions(run, mint));
        Optional<ReputationFacts> reputation = run.runStep(OFF_CHAIN,
                () -> offChain(run, mint, mintInfo.map(MintInfo::mintAuthority).orElse(null)));

        TokenData tokenData = assemble(mintAccount, metadata, mintInfo.orElse(null), market.orElse(null),
                security.orElse(null), pairs.orElse(null), slippage.orElse(null), holders.orElse(null),
                transactions.orElse(null), reputation.orElse(null));
        return run.finish(tokenData, null);
    }

    private StepOutcome<MintInfo> basicInfo(DetectionRun<?, ?> run, AccountInfo account) {
        MintInfo mint = account.mint();
        if (mint == null) {
            throw new IllegalStateException("Account has no parsed mint data");
        }
        if (mint.mintAuthority() != null) {
            run.raise(TokenOnChainParam.MASSIVE_MINTS, "mint_authority_active", "authority", "Active Mint Authority",
                    RiskSeverity.CRITICAL, mint.mintAuthority(), "Token has active mint authority - unlimited supply possible");
        }
        if (mint.freezeAuthority() != null) {
            run.raise(TokenOnChainParam.ASSET_FREEZES, "freeze_authority_active", "authority", "Active Freeze Authority",
                    RiskSeverity.HIGH, mint.freezeAuthority(), "Token accounts can be frozen by authority");
        }
        return StepOutcome.of(mint, DetectionRun.data(
                "supply", mint.uiSupply(),
                "mintAuthority", mint.mintAuthority() != null ? "Active" : "Revoked",
                "freezeAuthority", mint.freezeAuthority() != null ? "Active" : "Revoked"));
    }

    private StepOutcome<MarketOverview> marketData(DetectionRun<?, ?> run, String mint) {
        MarketOverview overview = birdeye.overview(mint)
                .orElseThrow(() -> new CollaboratorUnavailableException("Birdeye market data"));
        Double change = overview.priceChange24hPercent();
        if (change != null && change < -thresholds.getFailedProjectDropPercent()) {
            run.raise(TokenOnChainParam.FAILED_PROJECT_SIGNATURES, "failed_project", "activity",
                    "Failed Project Signature", RiskSeverity.CRITICAL, percent(change),
                    "Price dropped >95% - potential rug or failed project");
        }
        Double volume = overview.volume24hUsd();
        if (volume != null && volume < thresholds.getLowVolumeUsd()) {
            run.raise(TokenOffChainParam.RUG_PULL_METRICS, "no_volume", "activity", "No Trading Volume",
                    RiskSeverity.HIGH, usd(volume), "24h trading volume is extremely low");
        }
        return StepOutcome.of(overview, DetectionRun.data(
                "price", overview.price(),
                "marketCap", overview.marketCap(),
                "liquidity", overview.liquidity()));
    }

    private StepOutcome<TokenSecurity> securityInfo(DetectionRun<?, ?> run, String mint) {
        TokenSecurity security = birdeye.security(mint)
                .orElseThrow(() -> new CollaboratorUnavailableException("Birdeye security data"));
        Double creator = security.creatorPercentage();
        if (creator != null && creator > thresholds.getCreatorHoldingsCriticalPercent()) {
            run.raise(TokenOnChainParam.APPROVAL_HIJACKING, "high_creator_holdings", "holder",
                    "Critical Creator Holdings", RiskSeverity.CRITICAL, percent(creator),
                    "Creator holds " + percent(creator) + " of supply");
        } else if (creator != null && creator > thresholds.getCreatorHoldingsHighPercent()) {
            run.raise(TokenOnChainParam.APPROVAL_HIJACKING, "high_creator_holdings", "holder",
                    "High Creator Holdings", RiskSeverity.HIGH, percent(creator),
                    "Creator holds " + percent(creator) + " of supply");
        }
        // an unknown LP state counts as not burned
        if (!security.lpConfirmedBurned()) {
            run.raise(TokenOffChainParam.RUG_PULL_METRICS, "lp_not_burned", "holder", "Unlocked LP Tokens",
                    RiskSeverity.HIGH, "Not Burned", "Liquidity pool tokens are not burned - rug pull risk");
        }
        Double top10 = security.top10HolderPercent();
        if (top10 != null && top10 > thresholds.getTop10ConcentrationPercent()) {
            run.raise(TokenOffChainParam.CENTRALIZATION_WARNINGS, "top10_concentration", "holder",
                    "High Top 10 Concentration", RiskSeverity.HIGH, percent(top10),
                    "Top 10 holders control majority of supply");
        }
        return StepOutcome.of(security, DetectionRun.data(
                "creatorPercent", creator,
                "lpBurned", security.lpBurned()));
    }

    private StepOutcome<DexPairSummary> dexPairs(DetectionRun<?, ?> run, String mint) {
        DexPairSummary summary = dexScreener.pairs(mint)
                .orElseThrow(() -> new CollaboratorUnavailableException("DexScreener"));
        if (summary.hasPairs()) {
            double liquidity = summary.totalLiquidity();
            if (liquidity < thresholds.getCriticalLiquidityUsd()) {
                run.raise(TokenOnChainParam.SLOW_DRAIN_PATTERNS, "critical_low_liquidity", "holder",
                        "Critically Low Liquidity", RiskSeverity.CRITICAL, usd(liquidity),
                        "Total liquidity is below $1,000");
            } else if (liquidity < thresholds.getLowLiquidityUsd()) {
                run.raise(TokenOnChainParam.SLOW_DRAIN_PATTERNS, "low_liquidity", "holder", "Low Liquidity",
                        RiskSeverity.HIGH, usd(liquidity), "Total liquidity is below $10,000");
            }
            Double ageHours = ageHours(summary.createdAt());
            if (ageHours != null && ageHours < thresholds.getNewTokenHours()) {
                run.raise(TokenOffChainParam.SOCIAL_MEDIA_SIGNALS, "very_new_token", "activity", "Very New Token",
                        RiskSeverity.HIGH, String.format(Locale.ROOT, "%.1f hours", ageHours),
                        "Token was created less than 24 hours ago");
            }
        }
        return StepOutcome.of(summary, DetectionRun.data(
                "pairs", summary.totalPairs(),
                "liquidity", summary.totalLiquidity(),
                "dexes", summary.dexes().isEmpty() ? "N/A" : String.join(", ", summary.dexes())));
    }

    private StepOutcome<SlippageReport> slippage(DetectionRun<?, ?> run, String mint) {
        SlippageReport report = jupiter.simulate(mint)
                .orElseThrow(() -> new CollaboratorUnavailableException("Jupiter"));
        if (report.honeypot()) {
            String reason = report.honeypotReason() != null ? report.honeypotReason() : "Detected";
            run.raise(TokenOnChainParam.WALLET_DRAINS, "honeypot", "activity", "Potential Honeypot",
                    RiskSeverity.CRITICAL, reason, "Token shows honeypot characteristics - may not be sellable");
        }
        double sell = report.sellSlippagePercent();
        if (sell > thresholds.getSellSlippageCriticalPercent()) {
            run.raise(TokenOffChainParam.ECONOMIC_MODEL_STRESS, "critical_sell_slippage", "activity",
                    "Critical Sell Slippage", RiskSeverity.CRITICAL, percent(sell), "Selling has extreme price impact");
        } else if (sell > thresholds.getSellSlippageHighPercent()) {
            run.raise(TokenOffChainParam.ECONOMIC_MODEL_STRESS, "high_sell_slippage", "activity",
                    "High Sell Slippage", RiskSeverity.HIGH, percent(sell), "Selling has high price impact");
        } else if (sell > thresholds.getSellSlippageModeratePercent()) {
            run.raise(TokenOffChainParam.ECONOMIC_MODEL_STRESS, "moderate_sell_slippage", "activity",
                    "Moderate Sell Slippage", RiskSeverity.MEDIUM, percent(sell), "Selling has moderate price impact");
        }
        return StepOutcome.of(report, DetectionRun.data(
                "buySlippage", String.format(Locale.ROOT, "%.2f%%", report.buySlippagePercent()),
                "sellSlippage", String.format(Locale.ROOT, "%.2f%%", sell),
                "honeypot", report.honeypot()));
    }

    private StepOutcome<HolderFacts> holders(DetectionRun<?, ?> run, String mint, MintInfo mintInfo) {
        List<TokenAccountBalance> largest = chain.getTokenLargestAccounts(mint)
                .orElseThrow(() -> new CollaboratorUnavailableException("Solana RPC largest accounts"));
        HolderFacts facts = toHolderFacts(largest, mintInfo, thresholds.getTopHolders());
        if (!facts.topHolders().isEmpty()) {
            double top = facts.topHolderPercent();
            if (top > thresholds.getExtremeConcentrationPercent()) {
                run.raise(TokenOnChainParam.VICTIM_WALLET_SPIKES, "extreme_concentration", "holder",
                        "Extreme Holder Concentration", RiskSeverity.CRITICAL, percent(top),
                        "Top holder has " + percent(top) + " of supply");
            } else if (top > thresholds.getHighConcentrationPercent()) {
                run.raise(TokenOnChainParam.VICTIM_WALLET_SPIKES, "high_concentration", "holder",
                        "High Holder Concentration", RiskSeverity.HIGH, percent(top),
                        "Top holder has " + percent(top) + " of supply");
            }
        }
        return StepOutcome.of(facts, DetectionRun.data(
                "topHolders", largest.size(),
                "topHolderPercent", facts.topHolders().isEmpty() ? null : percent(facts.topHolderPercent())));
    }

    /**
     * Ranks the largest accounts against total supply. A zero supply is treated as 1 so percentages stay finite.
     */
    static HolderFacts toHolderFacts(List<TokenAccountBalance> largest, MintInfo mintInfo, int limit) {
        double supply = mintInfo != null ? mintInfo.uiSupply() : 0;
        double denominator = supply > 0 ? supply : 1;
        List<TopHolder> top = new ArrayList<>();
        for (int i = 0; i < largest.size() && i < limit; i++) {
            TokenAccountBalance balance = largest.get(i);
            int decimals = mintInfo != null ? mintInfo.decimals() : balance.decimals();
            double amount = MintInfo.toUiAmount(balance.amount(), decimals);
            top.add(new TopHolder(i + 1, balance.address(), balance.amount(), amount, amount / denominator * 100));
        }
        double topPercent = top.isEmpty() ? 0 : top.get(0).percentage();
        return new HolderFacts(List.copyOf(top), topPercent);
    }

    private StepOutcome<SignatureStats> transactions(DetectionRun<?, ?> run, String mint) {
        SignatureStats stats = chain.getSignatureStats(mint, thresholds.getSignatureSample())
                .orElseThrow(() -> new CollaboratorUnavailableException("Solana RPC signatures"));
        double failureRate = stats.failureRatePercent();
        if (failureRate > thresholds.getFailureRatePercent()) {
            run.raise(TokenOnChainParam.RACE_CONDITIONS, "high_failure_rate", "activity",
                    "High Transaction Failure Rate", RiskSeverity.MEDIUM, percent(failureRate),
                    "Many transactions are failing");
        }
        return StepOutcome.of(stats, DetectionRun.data(
                "total", stats.total(),
                "failed", stats.failed(),
                "failureRate", percent(failureRate)));
    }

    private StepOutcome<ReputationFacts> offChain(DetectionRun<?, ?> run, String mint, String mintAuthority) {
        // mint authority stands in for the creator
        if (mintAuthority != null && drainers.isKnownDrainer(mintAuthority)) {
            run.raise(TokenOffChainParam.PHISHING_TX_CLUSTERS, "known_drainer", "security", "Known Drainer Creator",
                    RiskSeverity.CRITICAL, mintAuthority, "Token creator is associated with known drainer addresses");
        }

        Optional<SafetyScore> safety = rugCheck.safetyScore(mint);
        Optional<HolderDistribution> distribution = solanaFm.holderDistribution(mint);
        Optional<TransferAnomalies> transfers = solanaFm.transferAnomalies(mint);
        if (safety.isEmpty() && distribution.isEmpty() && transfers.isEmpty()) {
            throw new CollaboratorUnavailableException("RugCheck and SolanaFM");
        }

        safety.ifPresent(s -> {
            String value = "Score: " + s.score() + "/100";
            if (s.rating() == SafetyRating.DANGER) {
                run.raise(TokenOffChainParam.RUG_PULL_METRICS, "rugcheck_danger", "security", "RugCheck Danger Rating",
                        RiskSeverity.CRITICAL, value, "Token flagged as dangerous by RugCheck safety analysis");
            } else if (s.rating() == SafetyRating.CAUTION) {
                run.raise(TokenOffChainParam.RUG_PULL_METRICS, "rugcheck_caution", "security", "RugCheck Caution Rating",
                        RiskSeverity.MEDIUM, value, "Token requires caution according to RugCheck");
            }
        });
        distribution.filter(d -> d.holderCount() > 0 && d.concentrationRisk() == RiskSeverity.CRITICAL)
                .ifPresent(d -> run.raise(TokenOffChainParam.CENTRALIZATION_WARNINGS, "solanafm_concentration",
                        "holder", "Critical Centralization", RiskSeverity.CRITICAL,
                        "Top 10 hold " + percent(d.top10Percent()),
                        "Extreme token concentration detected via SolanaFM"));
        transfers.filter(TransferAnomalies::suspicious).ifPresent(t -> {
            List<String> patterns = t.suspiciousPatterns();
            run.raise(TokenOffChainParam.ECONOMIC_MODEL_STRESS, "transfer_anomalies", "activity",
                    "Transfer Anomalies Detected", patterns.size() >= 2 ? RiskSeverity.HIGH : RiskSeverity.MEDIUM,
                    patterns.size() + " issues", String.join("; ", patterns));
        });

        ReputationFacts facts = new ReputationFacts(safety.orElse(null), distribution.orElse(null), transfers.orElse(null));
        return StepOutcome.of(facts, DetectionRun.data(
                "offChainChecks", TokenOffChainParam.values().length,
                "rugCheckScore", safety.map(SafetyScore::score).orElse(null),
                "concentrationRisk", distribution.map(d -> d.concentrationRisk().jsonValue()).orElse(null)));
    }

    private TokenData assemble(AccountInfo account, AssetMetadata metadata, MintInfo mint, MarketOverview market,
                               TokenSecurity security, DexPairSummary pairs, SlippageReport slippage,
                               HolderFacts holders, SignatureStats transactions, ReputationFacts reputation) {
        TokenData.TokenDataBuilder b = TokenData.builder().ownerProgram(account.owner());
        if (metadata != null) {
            b.name(metadata.name()).symbol(metadata.symbol()).imageUrl(metadata.imageUrl());
        }
        if (mint != null) {
            b.decimals(mint.decimals()).supply(mint.uiSupply())
                    .mintAuthority(mint.mintAuthority()).freezeAuthority(mint.freezeAuthority());
        }
        if (market != null) {
            b.price(market.price()).marketCap(market.marketCap()).liquidity(market.liquidity())
                    .holders(market.holders()).volume24h(market.volume24hUsd())
                    .priceChange24h(market.priceChange24hPercent());
        }
        if (security != null) {
            b.creatorAddress(security.creatorAddress()).creatorPercentage(security.creatorPercentage())
                    .lpBurned(security.lpBurned()).lpBurnedPercent(security.lpBurnedPercent())
                    .top10HolderPercent(security.top10HolderPercent());
        }
        if (pairs != null) {
            b.dexPairs(pairs.totalPairs()).dexNames(pairs.dexes());
            if (pairs.createdAt() != null) {
                b.createdAt(pairs.createdAt()).ageInDays(ageHours(pairs.createdAt()) / 24);
            }
            if (market == null && pairs.hasPairs()) {
                b.price(pairs.price()).marketCap(pairs.marketCap()).liquidity(pairs.totalLiquidity())
                        .volume24h(pairs.totalVolume24h()).priceChange24h(pairs.priceChange24h());
            }
        }
        if (slippage != null) {
            b.buySlippage(slippage.buySlippagePercent()).sellSlippage(slippage.sellSlippagePercent())
                    .honeypot(slippage.honeypot());
        }
        if (holders != null) {
            b.topHolders(holders.topHolders());
        }
        if (transactions != null) {
            b.transactionsSampled(transactions.total()).failureRate(transactions.failureRatePercent());
        }
        if (reputation != null && reputation.safety() != null) {
            b.safetyScore(reputation.safety().score()).safetyRating(reputation.safety().rating().jsonValue());
        }
        return b.build();
    }

    private Double ageHours(Long createdAt) {
        if (createdAt == null) {
            return null;
        }
        return (clock.millis() - createdAt) / (double) HOUR_MS;
    }

    static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    static String usd(double value) {
        return String.format(Locale.ROOT, "$%.2f", value);
    }
}
