package com.contractradar.domain;

/**
 * Checked/triggered tallies over one parameter registry.
 */
public record ParamCount(int checked, int triggered, int total) {

    public ParamCount plus(ParamCount other) {
        return new ParamCount(checked + other.checked, triggered + other.triggered, total + other.total);
    }
}
