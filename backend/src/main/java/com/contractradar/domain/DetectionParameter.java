package com.contractradar.domain;

/**
 * A named risk check in one of the four parameter registries.
 */
public interface DetectionParameter {

    /** camelCase key used in serialized parameter maps, e.g. {@code massiveMints}. */
    String key();

    ParamType type();

    /**
     * False when no collaborator feeds this check yet: it is marked checked when its step runs
     * but can never trigger. Reported separately as placeholder coverage.
     */
    boolean evidenceBacked();
}
