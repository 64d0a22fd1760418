package com.contractradar.domain;

/**
 * Letter grade derived from the 0..100 risk score. A is safest.
 */
public enum RiskGrade {
    A, B, C, D, F
}
