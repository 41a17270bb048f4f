package com.example.compliance.model;

/**
 * Lifecycle of a regulation clause through the four pipeline stages.
 * FAILED is reachable from any state and is reset to PENDING on the next run.
 */
public enum ClauseStatus {
    PENDING,
    NEED_CHECKED,
    SKIPPED,
    PLANNED,
    SEARCHED,
    JUDGED,
    FAILED
}
