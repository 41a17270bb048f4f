package com.example.compliance.model;

import java.util.List;

/**
 * Audit plan answer: ordered search sentences for one clause.
 */
public record AuditPlanResponse(List<PlannedTask> tasks) {

    public record PlannedTask(String sentence) {
    }
}
