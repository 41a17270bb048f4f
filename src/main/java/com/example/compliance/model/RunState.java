package com.example.compliance.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Aggregate root persisted as {@code run.json}: every clause result of one project
 * plus the document fingerprints the current vector index was built from.
 *
 * @param schemaVersion layout version of the persisted document
 * @param projectId     owning project
 * @param clauses       clauses in regulation order, keyed by id
 * @param documents     procedure document fingerprints keyed by path
 * @param indexBuildId  id of the vector index build the task matches refer to
 * @param completed     true when the last run settled every clause
 * @param warnings      run-level conditions that qualify the results, such as unreadable procedure documents
 */
public record RunState(
        int schemaVersion,
        String projectId,
        Map<String, RegulationClause> clauses,
        Map<String, DocumentRecord> documents,
        String indexBuildId,
        boolean completed,
        List<String> warnings
) {
    public static final int SCHEMA_VERSION = 1;

    public RunState {
        clauses = clauses == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(clauses));
        documents = documents == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(documents));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static RunState empty(String projectId) {
        return new RunState(SCHEMA_VERSION, projectId, Map.of(), Map.of(), null, false, List.of());
    }

    /**
     * Merges freshly loaded regulation clauses into a prior state. The regulation file is the
     * master list: clauses missing from it are dropped, new ones start PENDING, clauses whose text
     * changed or that FAILED in the previous run start over.
     */
    public static RunState merge(RunState prior, String projectId, List<RegulationClause> loaded) {
        Map<String, RegulationClause> merged = new LinkedHashMap<>();
        Map<String, RegulationClause> previous = prior != null ? prior.clauses() : Map.of();
        for (RegulationClause fresh : loaded) {
            RegulationClause old = previous.get(fresh.id());
            if (old == null || !fresh.textHash().equals(old.textHash()) || old.status() == ClauseStatus.FAILED) {
                merged.put(fresh.id(), fresh);
            } else {
                merged.put(fresh.id(), old.withSource(fresh.title(), fresh.parentId()));
            }
        }
        Map<String, DocumentRecord> documents = prior != null ? prior.documents() : Map.of();
        String buildId = prior != null ? prior.indexBuildId() : null;
        return new RunState(SCHEMA_VERSION, projectId, merged, documents, buildId, false, List.of());
    }

    public RegulationClause clause(String id) {
        return clauses.get(id);
    }

    public RunState withClause(RegulationClause clause) {
        Map<String, RegulationClause> copy = new LinkedHashMap<>(clauses);
        copy.put(clause.id(), clause);
        return new RunState(schemaVersion, projectId, copy, documents, indexBuildId, completed, warnings);
    }

    public RunState mapClauses(UnaryOperator<RegulationClause> op) {
        Map<String, RegulationClause> copy = new LinkedHashMap<>();
        clauses.forEach((id, c) -> copy.put(id, op.apply(c)));
        return new RunState(schemaVersion, projectId, copy, documents, indexBuildId, completed, warnings);
    }

    public RunState withIndex(Map<String, DocumentRecord> newDocuments, String newBuildId) {
        return new RunState(schemaVersion, projectId, clauses, newDocuments, newBuildId, completed, warnings);
    }

    public RunState withCompleted(boolean done) {
        return new RunState(schemaVersion, projectId, clauses, documents, indexBuildId, done, warnings);
    }

    public RunState withWarnings(List<String> newWarnings) {
        return new RunState(schemaVersion, projectId, clauses, documents, indexBuildId, completed, newWarnings);
    }

    /**
     * Warnings derived from the document fingerprints: when every procedure document failed
     * ingestion, NO_EVIDENCE verdicts say nothing about the procedures themselves.
     */
    public List<String> ingestionWarnings() {
        List<String> failed = documents.values().stream()
                .filter(d -> d.status() == DocumentStatus.INGESTION_FAILED)
                .map(DocumentRecord::path)
                .toList();
        if (failed.isEmpty()) {
            return List.of();
        }
        if (failed.size() == documents.size()) {
            return List.of("No procedure document could be ingested (" + failed.size()
                    + " failed); NO_EVIDENCE verdicts reflect unreadable input, not missing procedures");
        }
        return List.of(failed.size() + " of " + documents.size() + " procedure document(s) failed ingestion: "
                + String.join(", ", failed));
    }

    public List<RegulationClause> clausesIn(ClauseStatus status) {
        return clauses.values().stream().filter(c -> c.status() == status).toList();
    }

    public boolean allSettled() {
        return clauses.values().stream().allMatch(RegulationClause::settled);
    }

    public long count(ClauseStatus status) {
        return clauses.values().stream().filter(c -> c.status() == status).count();
    }
}
