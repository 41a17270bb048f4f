package com.example.compliance.model;

import java.util.Locale;

/**
 * Per-task sub-verdict produced by the judge.
 */
public enum TaskFinding {
    SUPPORTED,
    GAP,
    AMBIGUOUS,
    NO_EVIDENCE;

    /** Maps a free-form label from the model to a finding; unknown labels are AMBIGUOUS. */
    public static TaskFinding fromLabel(String label) {
        if (label == null) return AMBIGUOUS;
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        return switch (normalized) {
            case "SUPPORTED", "PASS", "COMPLIANT", "MET" -> SUPPORTED;
            case "GAP", "FAIL", "NON_COMPLIANT", "NOT_MET", "MISSING" -> GAP;
            case "NO_EVIDENCE", "NOEVIDENCE" -> NO_EVIDENCE;
            default -> AMBIGUOUS;
        };
    }
}
