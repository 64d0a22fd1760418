package com.contractradar.detection;

import com.contractradar.domain.DetectionMode;
import com.contractradar.domain.DetectionParameter;
import com.contractradar.domain.DetectionResult;
import com.contractradar.domain.DexData;
import com.contractradar.domain.ParamCount;
import com.contractradar.domain.ParameterSet;
import com.contractradar.domain.RiskIndicator;
import com.contractradar.domain.RiskSeverity;
import com.contractradar.domain.StepEvent;
import com.contractradar.domain.TokenData;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Mutable state of one analysis run: both parameter sets, the ledger, the event sink and the cancellation flag.
 * Created per request and confined to the analysis thread.
 */
@Slf4j
public final class DetectionRun<ON extends Enum<ON> & DetectionParameter, OFF extends Enum<OFF> & DetectionParameter> {

    private final String address;
    private final DetectionMode mode;
    private final ParameterSet<ON> onChain;
    private final ParameterSet<OFF> offChain;
    private final RiskLedger ledger = new RiskLedger();
    private final Consumer<StepEvent> sink;
    private final CancellationToken cancellation;

    public DetectionRun(String address, DetectionMode mode, Class<ON> onChainClass, Class<OFF> offChainClass,
                        Consumer<StepEvent> sink, CancellationToken cancellation) {
        this.address = address;
        this.mode = mode;
        this.onChain = new ParameterSet<>(onChainClass);
        this.offChain = new ParameterSet<>(offChainClass);
        this.sink = sink != null ? sink : e -> { };
        this.cancellation = cancellation != null ? cancellation : CancellationToken.none();
    }

    /**
     * Runs one step: step_start, owned parameters marked checked, body, then exactly one of
     * step_complete or step_error. Returns the step's facts, or empty when it failed or the run was cancelled.
     */
    public <T> Optional<T> runStep(StepDefinition step, Supplier<StepOutcome<T>> body) {
        if (cancellation.isCancelled()) {
            log.debug("Run for {} cancelled before step {}", address, step.id());
            return Optional.empty();
        }
        ParamCount before = counts();
        emit(StepEvent.stepStart(step.id(), step.name(), before.checked(), before.triggered()));
        long start = System.currentTimeMillis();
        step.params().forEach(this::check);
        try {
            StepOutcome<T> outcome = body.get();
            long duration = System.currentTimeMillis() - start;
            ParamCount after = counts();
            emit(StepEvent.stepComplete(step.id(), step.name(), duration,
                    outcome.data() != null ? outcome.data() : Map.of(), after.checked(), after.triggered()));
            log.info("{} {} completed in {} ms ({} checked, {} triggered)",
                    mode.value(), step.id(), duration, after.checked(), after.triggered());
            return Optional.ofNullable(outcome.facts());
        } catch (CollaboratorUnavailableException e) {
            stepFailed(step, start, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("{} step {} failed for {}", mode.value(), step.id(), address, e);
            stepFailed(step, start, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    private void stepFailed(StepDefinition step, long start, String error) {
        long duration = System.currentTimeMillis() - start;
        ParamCount after = counts();
        log.warn("{} {} errored after {} ms: {}", mode.value(), step.id(), duration, error);
        emit(StepEvent.stepError(step.id(), step.name(), duration, error, after.checked(), after.triggered()));
    }

    public void check(DetectionParameter parameter) {
        if (onChain.owns(parameter)) {
            onChain.markChecked(onChain.parameterClass().cast(parameter));
        } else if (offChain.owns(parameter)) {
            offChain.markChecked(offChain.parameterClass().cast(parameter));
        } else {
            throw new IllegalArgumentException(parameter + " is not a " + mode.value() + " parameter");
        }
    }

    /**
     * Triggers the parameter and appends the matching indicator. The indicator's paramType follows the parameter.
     */
    public void raise(DetectionParameter parameter, String id, String category, String name,
                      RiskSeverity severity, String value, String description) {
        if (onChain.owns(parameter)) {
            onChain.trigger(onChain.parameterClass().cast(parameter), value);
        } else if (offChain.owns(parameter)) {
            offChain.trigger(offChain.parameterClass().cast(parameter), value);
        } else {
            throw new IllegalArgumentException(parameter + " is not a " + mode.value() + " parameter");
        }
        ledger.add(new RiskIndicator(id, category, name, severity, value, description, parameter.type()));
        log.debug("{} triggered {} ({}): {}", mode.value(), parameter.key(), severity.jsonValue(), value);
    }

    public ParamCount counts() {
        return onChain.count().plus(offChain.count());
    }

    public DetectionResult finish(TokenData tokenData, DexData dexData) {
        ParamCount on = onChain.count();
        ParamCount off = offChain.count();
        List<RiskIndicator> indicators = ledger.indicators();
        int score = RiskScorer.score(indicators);
        DetectionResult result = new DetectionResult(
                address,
                mode,
                on.checked() + off.checked(),
                on.triggered() + off.triggered(),
                on.checked(),
                on.triggered(),
                off.checked(),
                off.triggered(),
                onChain.placeholderChecked() + offChain.placeholderChecked(),
                indicators,
                score,
                RiskScorer.grade(score),
                RiskScorer.overallRisk(score, ledger.hasCritical()),
                onChain.snapshot(),
                offChain.snapshot(),
                tokenData,
                dexData);
        log.info("{} analysis of {}: {}/{} checked, {} triggered, score {} ({}), {} indicators",
                mode.value(), address, result.totalParamsChecked(), on.total() + off.total(),
                result.totalParamsTriggered(), score, result.grade(), indicators.size());
        return result;
    }

    private void emit(StepEvent event) {
        sink.accept(event.withDetectionMode(mode));
    }

    /**
     * Step data map from key/value pairs, skipping null values.
     */
    public static Map<String, Object> data(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return Collections.unmodifiableMap(out);
    }
}
