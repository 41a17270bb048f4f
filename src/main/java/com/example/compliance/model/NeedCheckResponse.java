package com.example.compliance.model;

/**
 * Need-check answer.
 *
 * @param requiresProcedure whether the clause must be backed by a documented procedure
 * @param reasoning         one or two sentences explaining the decision
 */
public record NeedCheckResponse(Boolean requiresProcedure, String reasoning) {
}
