package com.example.compliance.model;

import java.util.List;

/**
 * Searchable sub-question derived from a clause. Owned by exactly one clause.
 *
 * @param id           task id, {@code <clauseId>-T01} style
 * @param sentence     search sentence
 * @param matches      top-K retrieved chunks, null until searched
 * @param indexBuildId index build the matches come from
 * @param searchK      K the matches were retrieved with
 * @param finding      judge sub-verdict, null until judged
 * @param rationale    judge rationale for the finding
 */
public record AuditTask(
        String id,
        String sentence,
        List<MatchResult> matches,
        String indexBuildId,
        int searchK,
        TaskFinding finding,
        String rationale
) {
    public AuditTask {
        matches = matches == null ? null : List.copyOf(matches);
    }

    public static AuditTask planned(String id, String sentence) {
        return new AuditTask(id, sentence, null, null, 0, null, null);
    }

    /** True when the task has matches produced by {@code buildId} with {@code k}. */
    public boolean searchedWith(String buildId, int k) {
        return matches != null && buildId != null && buildId.equals(indexBuildId) && searchK == k;
    }

    public boolean hasEvidence() {
        return matches != null && !matches.isEmpty();
    }

    public AuditTask withMatches(List<MatchResult> newMatches, String buildId, int k) {
        return new AuditTask(id, sentence, newMatches, buildId, k, null, null);
    }

    public AuditTask withFinding(TaskFinding newFinding, String newRationale) {
        return new AuditTask(id, sentence, matches, indexBuildId, searchK, newFinding, newRationale);
    }

    /** Drops retrieval and judgment results. */
    public AuditTask cleared() {
        return planned(id, sentence);
    }
}
