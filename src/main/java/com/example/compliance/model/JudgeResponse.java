package com.example.compliance.model;

import java.util.List;

/**
 * Judge answer for one clause.
 *
 * @param compliant    overall judgment of the model
 * @param description  what the evidence shows or lacks
 * @param suggestions  corrective action, may be null when compliant
 * @param confidence   0.0-1.0
 * @param taskFindings per-task findings
 */
public record JudgeResponse(
        Boolean compliant,
        String description,
        String suggestions,
        Double confidence,
        List<TaskAssessment> taskFindings
) {

    /**
     * @param taskId    audit task id as given in the prompt
     * @param finding   SUPPORTED, GAP or AMBIGUOUS
     * @param rationale short justification citing evidence labels
     */
    public record TaskAssessment(String taskId, String finding, String rationale) {
    }
}
