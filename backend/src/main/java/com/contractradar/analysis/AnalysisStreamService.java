package com.contractradar.analysis;

import com.contractradar.ai.AiInsight;
import com.contractradar.ai.OpenRouterInsightClient;
import com.contractradar.chain.AccountInfo;
import com.contractradar.chain.AssetMetadata;
import com.contractradar.chain.SolanaChainClient;
import com.contractradar.chain.adapter.RpcException;
import com.contractradar.config.AsyncConfig;
import com.contractradar.detection.AccountClassifier;
import com.contractradar.detection.CancellationToken;
import com.contractradar.detection.DetectionRun;
import com.contractradar.detection.DexDetector;
import com.contractradar.detection.TokenDetector;
import com.contractradar.domain.DetectionMode;
import com.contractradar.domain.DetectionResult;
import com.contractradar.domain.StepEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Runs one analysis per subscription on the analysis executor and pushes its events as they happen.
 * Every stream ends with exactly one complete event; cancelling the subscription stops the run at the
 * next step boundary.
 */
@Service
@Slf4j
public class AnalysisStreamService {

    public static final String ACCOUNT_NOT_FOUND = "Account not found";
    static final int TOTAL_PARAMS = 31;

    private final SolanaChainClient chain;
    private final AccountClassifier classifier;
    private final TokenDetector tokenDetector;
    private final DexDetector dexDetector;
    private final OpenRouterInsightClient insights;
    private final Executor executor;

    public AnalysisStreamService(SolanaChainClient chain,
                                 AccountClassifier classifier,
                                 TokenDetector tokenDetector,
                                 DexDetector dexDetector,
                                 OpenRouterInsightClient insights,
                                 @Qualifier(AsyncConfig.ANALYSIS_EXECUTOR) Executor executor) {
        this.chain = chain;
        this.classifier = classifier;
        this.tokenDetector = tokenDetector;
        this.dexDetector = dexDetector;
        this.insights = insights;
        this.executor = executor;
    }

    public Flux<StepEvent> analyze(String address) {
        return Flux.create(sink -> {
            CancellationToken cancellation = new CancellationToken();
            sink.onCancel(() -> {
                log.info("Client cancelled analysis of {}", address);
                cancellation.cancel();
            });
            try {
                executor.execute(() -> run(address, sink, cancellation));
            } catch (RejectedExecutionException e) {
                log.warn("Analysis executor saturated, rejecting {}", address);
                sink.next(StepEvent.failed(address, "Analysis capacity exhausted, retry later"));
                sink.complete();
            }
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    void run(String address, FluxSink<StepEvent> sink, CancellationToken cancellation) {
        Consumer<StepEvent> emit = event -> {
            if (!cancellation.isCancelled()) {
                sink.next(event);
            }
        };
        long start = System.currentTimeMillis();
        try {
            Optional<AccountInfo> lookup;
            try {
                lookup = chain.getAccountInfo(address);
            } catch (RpcException e) {
                log.warn("Account lookup for {} failed: {}", address, e.getMessage());
                emit.accept(StepEvent.failed(address, "Account lookup failed: " + e.getMessage()));
                return;
            }
            if (lookup.isEmpty()) {
                log.info("Account {} not found", address);
                emit.accept(StepEvent.failed(address, ACCOUNT_NOT_FOUND));
                return;
            }
            AccountInfo account = lookup.get();
            DetectionMode mode = classifier.classify(account);
            emitAccountType(account, mode, emit);

            DetectionResult result;
            if (mode == DetectionMode.TOKEN) {
                AssetMetadata metadata = cancellation.isCancelled() ? null : tokenMetadata(address, emit);
                result = tokenDetector.detect(account, metadata, emit, cancellation);
            } else {
                result = dexDetector.detect(account, emit, cancellation);
            }
            if (cancellation.isCancelled()) {
                log.info("Analysis of {} stopped after cancellation", address);
                return;
            }

            AiInsight insight = insights.isConfigured() ? aiInsight(result, mode, emit) : null;
            long duration = System.currentTimeMillis() - start;
            emit.accept(StepEvent.dataUpdate(new AnalysisUpdate(result, insight)).withDetectionMode(mode));
            emit.accept(StepEvent.complete(result, duration));
            log.info("Analysis of {} finished in {} ms: score {} ({})", address, duration,
                    result.riskScore(), result.overallRisk().name());
        } catch (RuntimeException e) {
            log.error("Analysis of {} failed", address, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            emit.accept(StepEvent.failed(address, message));
        } finally {
            sink.complete();
        }
    }

    private void emitAccountType(AccountInfo account, DetectionMode mode, Consumer<StepEvent> emit) {
        long start = System.currentTimeMillis();
        emit.accept(StepEvent.stepStart("account_type", "Determining Account Type").withDetectionMode(mode));
        emit.accept(StepEvent.stepComplete("account_type", "Determining Account Type",
                System.currentTimeMillis() - start,
                DetectionRun.data(
                        "accountType", classifier.accountType(account),
                        "detectionMode", mode.value(),
                        "totalParams", TOTAL_PARAMS,
                        "ownerProgram", account.owner(),
                        "ownerKind", classifier.ownerKind(account).name()),
                0, 0).withDetectionMode(mode));
    }

    private AssetMetadata tokenMetadata(String mint, Consumer<StepEvent> emit) {
        long start = System.currentTimeMillis();
        emit.accept(StepEvent.stepStart("token_metadata", "Fetching Token Metadata")
                .withDetectionMode(DetectionMode.TOKEN));
        Optional<AssetMetadata> metadata = chain.getAsset(mint);
        long duration = System.currentTimeMillis() - start;
        if (metadata.isEmpty()) {
            emit.accept(StepEvent.stepError("token_metadata", "Fetching Token Metadata", duration,
                    "DAS metadata unavailable", 0, 0).withDetectionMode(DetectionMode.TOKEN));
            return null;
        }
        AssetMetadata m = metadata.get();
        emit.accept(StepEvent.stepComplete("token_metadata", "Fetching Token Metadata", duration,
                DetectionRun.data("name", m.name(), "symbol", m.symbol(), "image", m.imageUrl()),
                0, 0).withDetectionMode(DetectionMode.TOKEN));
        return m;
    }

    private AiInsight aiInsight(DetectionResult result, DetectionMode mode, Consumer<StepEvent> emit) {
        long start = System.currentTimeMillis();
        int checked = result.totalParamsChecked();
        int triggered = result.totalParamsTriggered();
        emit.accept(StepEvent.stepStart("ai_insight", "Generating AI Insight", checked, triggered)
                .withDetectionMode(mode));
        Optional<AiInsight> insight;
        try {
            insight = insights.generate(result);
        } catch (RuntimeException e) {
            log.warn("AI insight for {} failed", result.address(), e);
            insight = Optional.empty();
        }
        long duration = System.currentTimeMillis() - start;
        if (insight.isEmpty()) {
            emit.accept(StepEvent.stepError("ai_insight", "Generating AI Insight", duration,
                    "AI insight unavailable", checked, triggered).withDetectionMode(mode));
            return null;
        }
        emit.accept(StepEvent.stepComplete("ai_insight", "Generating AI Insight", duration,
                DetectionRun.data("model", insight.get().model()), checked, triggered).withDetectionMode(mode));
        return insight.get();
    }
}
