package com.example.compliance.model;

import java.util.List;

/**
 * One atomic requirement of the external regulation and everything the pipeline derived from it.
 *
 * @param id             clause identifier from the regulation file
 * @param title          optional clause title
 * @param text           clause text
 * @param parentId       id of the enclosing clause for flattened sub-clauses
 * @param textHash       SHA-256 of {@code text}; a change resets the clause
 * @param needsProcedure NeedCheck result, null while unset
 * @param status         lifecycle state
 * @param tasks          audit tasks in plan order
 * @param verdict        final verdict, null until judged
 * @param error          last stage error, set together with {@link ClauseStatus#FAILED}
 */
public record RegulationClause(
        String id,
        String title,
        String text,
        String parentId,
        String textHash,
        Boolean needsProcedure,
        ClauseStatus status,
        List<AuditTask> tasks,
        Verdict verdict,
        String error
) {
    public RegulationClause {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        if (status == null) status = ClauseStatus.PENDING;
    }

    public static RegulationClause pending(String id, String title, String text, String parentId, String textHash) {
        return new RegulationClause(id, title, text, parentId, textHash, null, ClauseStatus.PENDING,
                List.of(), null, null);
    }

    public RegulationClause withStatus(ClauseStatus newStatus) {
        return new RegulationClause(id, title, text, parentId, textHash, needsProcedure, newStatus, tasks, verdict, null);
    }

    public RegulationClause withNeedsProcedure(boolean needs) {
        return new RegulationClause(id, title, text, parentId, textHash, needs, ClauseStatus.NEED_CHECKED,
                List.of(), null, null);
    }

    public RegulationClause withPlan(List<AuditTask> newTasks) {
        return new RegulationClause(id, title, text, parentId, textHash, needsProcedure, ClauseStatus.PLANNED,
                newTasks, null, null);
    }

    public RegulationClause withTasks(List<AuditTask> newTasks) {
        return new RegulationClause(id, title, text, parentId, textHash, needsProcedure, status, newTasks, verdict, error);
    }

    public RegulationClause withVerdict(Verdict newVerdict, List<AuditTask> judgedTasks) {
        return new RegulationClause(id, title, text, parentId, textHash, needsProcedure, ClauseStatus.JUDGED,
                judgedTasks, newVerdict, null);
    }

    public RegulationClause withSource(String newTitle, String newParentId) {
        return new RegulationClause(id, newTitle, text, newParentId, textHash, needsProcedure, status, tasks, verdict, error);
    }

    /** Marks the clause FAILED, keeping whatever was derived so far for inspection. */
    public RegulationClause failed(String message) {
        return new RegulationClause(id, title, text, parentId, textHash, needsProcedure, ClauseStatus.FAILED,
                tasks, verdict, message);
    }

    /** Drops search and judge results and moves a searched or judged clause back to PLANNED. */
    public RegulationClause backToPlanned() {
        List<AuditTask> cleared = tasks.stream().map(AuditTask::cleared).toList();
        ClauseStatus newStatus = (status == ClauseStatus.SEARCHED || status == ClauseStatus.JUDGED)
                ? ClauseStatus.PLANNED : status;
        return new RegulationClause(id, title, text, parentId, textHash, needsProcedure, newStatus, cleared, null, error);
    }

    public boolean allTasksSearchedWith(String buildId, int k) {
        return !tasks.isEmpty() && tasks.stream().allMatch(t -> t.searchedWith(buildId, k));
    }

    /** JUDGED and SKIPPED are the only end states of a successful run. */
    public boolean settled() {
        return status == ClauseStatus.JUDGED || status == ClauseStatus.SKIPPED;
    }
}
