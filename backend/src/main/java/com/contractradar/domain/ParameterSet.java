package com.contractradar.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed mapping from every constant of one parameter registry to its current state.
 * Owned by a single detection run; not thread-safe.
 */
public final class ParameterSet<P extends Enum<P> & DetectionParameter> {

    private final Class<P> parameterClass;
    private final EnumMap<P, ParameterState> states;

    public ParameterSet(Class<P> parameterClass) {
        this.parameterClass = parameterClass;
        this.states = new EnumMap<>(parameterClass);
        for (P p : parameterClass.getEnumConstants()) {
            states.put(p, ParameterState.UNCHECKED);
        }
    }

    public Class<P> parameterClass() {
        return parameterClass;
    }

    public boolean owns(DetectionParameter parameter) {
        return parameterClass.isInstance(parameter);
    }

    public ParameterState get(P parameter) {
        return states.get(parameter);
    }

    public void markChecked(P parameter) {
        states.compute(parameter, (p, s) -> s.withChecked());
    }

    public void trigger(P parameter, String value) {
        states.compute(parameter, (p, s) -> s.withTriggered(value));
    }

    public ParamCount count() {
        int checked = 0;
        int triggered = 0;
        for (ParameterState s : states.values()) {
            if (s.checked()) checked++;
            if (s.triggered()) triggered++;
        }
        return new ParamCount(checked, triggered, states.size());
    }

    /** Checked parameters that have no evidence source behind them. */
    public int placeholderChecked() {
        int n = 0;
        for (Map.Entry<P, ParameterState> e : states.entrySet()) {
            if (e.getValue().checked() && !e.getKey().evidenceBacked()) n++;
        }
        return n;
    }

    /** Registry-ordered copy keyed by camelCase parameter name. */
    public Map<String, ParameterState> snapshot() {
        Map<String, ParameterState> out = new LinkedHashMap<>();
        states.forEach((p, s) -> out.put(p.key(), s));
        return Collections.unmodifiableMap(out);
    }
}
