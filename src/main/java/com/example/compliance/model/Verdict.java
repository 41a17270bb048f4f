package com.example.compliance.model;

import java.util.List;

/**
 * Final judgment for a clause.
 *
 * @param status           aggregated verdict
 * @param compliant        true for COMPLIANT, false for NON_COMPLIANT, null otherwise
 * @param confidence       model confidence (0.0-1.0), 1.0 for deterministic outcomes
 * @param description      explanation of the verdict
 * @param suggestions      suggested corrective action, may be null
 * @param evidenceChunkIds chunks the verdict was based on, in prompt order
 */
public record Verdict(
        VerdictStatus status,
        Boolean compliant,
        double confidence,
        String description,
        String suggestions,
        List<String> evidenceChunkIds
) {
    public Verdict {
        evidenceChunkIds = evidenceChunkIds == null ? List.of() : List.copyOf(evidenceChunkIds);
        if (confidence < 0.0) confidence = 0.0;
        if (confidence > 1.0) confidence = 1.0;
    }

    public static Verdict noEvidence() {
        return new Verdict(VerdictStatus.NO_EVIDENCE, null, 1.0,
                "No procedure excerpt was retrieved for any audit task of this clause.",
                "Document a procedure that addresses this clause.", List.of());
    }
}
