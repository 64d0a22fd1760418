package com.contractradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * State of one named parameter within a single run. Immutable; {@link ParameterSet} swaps in new
 * states as evidence arrives. A triggered parameter is always checked.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterState(boolean checked, boolean triggered, String value) {

    public static final ParameterState UNCHECKED = new ParameterState(false, false, null);

    public ParameterState {
        if (triggered && !checked) {
            throw new IllegalArgumentException("A triggered parameter must be checked");
        }
    }

    public ParameterState withChecked() {
        return checked ? this : new ParameterState(true, triggered, value);
    }

    /**
     * Marks triggered with the given evidence value. An already-triggered state keeps its first value
     * unless it had none.
     */
    public ParameterState withTriggered(String evidence) {
        if (triggered) {
            return value != null || evidence == null ? this : new ParameterState(true, true, evidence);
        }
        return new ParameterState(true, true, evidence);
    }
}
