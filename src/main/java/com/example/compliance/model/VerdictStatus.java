package com.example.compliance.model;

public enum VerdictStatus {
    COMPLIANT,
    NON_COMPLIANT,
    INCONCLUSIVE,
    NO_EVIDENCE
}
