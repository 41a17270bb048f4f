package com.example.compliance.model;

import com.example.compliance.service.Hashes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RunStateTest {

    private static RegulationClause clause(String id, String text) {
        return RegulationClause.pending(id, null, text, null, Hashes.sha256(text));
    }

    private static RegulationClause judged(String id, String text) {
        AuditTask task = AuditTask.planned(id + "-T01", "sentence").withMatches(List.of(), "b1", 5)
                .withFinding(TaskFinding.NO_EVIDENCE, "none");
        return clause(id, text).withNeedsProcedure(true)
                .withPlan(List.of(AuditTask.planned(id + "-T01", "sentence")))
                .withVerdict(Verdict.noEvidence(), List.of(task));
    }

    @Test
    void merge_shouldKeepUnchangedClausesAndResetChangedOnes() {
        RunState prior = new RunState(RunState.SCHEMA_VERSION, "p1",
                Map.of("A", judged("A", "Keep a log."), "B", judged("B", "Old text.")),
                Map.of("proc.md", new DocumentRecord("proc.md", "h", 1L, 2, DocumentStatus.INGESTED, null)),
                "b1", true, List.of("1 of 2 procedure document(s) failed ingestion: old.pdf"));

        RunState merged = RunState.merge(prior, "p1",
                List.of(clause("B", "New text."), clause("A", "Keep a log."), clause("C", "Fresh.")));

        assertThat(merged.warnings()).isEmpty();

        assertThat(merged.clauses().keySet()).containsExactly("B", "A", "C");
        assertThat(merged.clause("A").status()).isEqualTo(ClauseStatus.JUDGED);
        assertThat(merged.clause("B").status()).isEqualTo(ClauseStatus.PENDING);
        assertThat(merged.clause("B").tasks()).isEmpty();
        assertThat(merged.clause("C").status()).isEqualTo(ClauseStatus.PENDING);
        assertThat(merged.indexBuildId()).isEqualTo("b1");
        assertThat(merged.documents()).containsKey("proc.md");
        assertThat(merged.completed()).isFalse();
    }

    @Test
    void merge_shouldDropClausesNoLongerInRegulation() {
        RunState prior = RunState.merge(null, "p1", List.of(clause("A", "x"), clause("Z", "y")));

        RunState merged = RunState.merge(prior, "p1", List.of(clause("A", "x")));

        assertThat(merged.clauses()).containsOnlyKeys("A");
    }

    @Test
    void merge_shouldRetryFailedClauses() {
        RegulationClause failed = clause("A", "x").withNeedsProcedure(true).failed("Audit-plan failed: timeout");
        RunState prior = RunState.merge(null, "p1", List.of(clause("A", "x"))).withClause(failed);

        RunState merged = RunState.merge(prior, "p1", List.of(clause("A", "x")));

        assertThat(merged.clause("A").status()).isEqualTo(ClauseStatus.PENDING);
        assertThat(merged.clause("A").needsProcedure()).isNull();
        assertThat(merged.clause("A").error()).isNull();
    }

    @Test
    void merge_shouldRefreshTitleWithoutResetting() {
        RunState prior = RunState.merge(null, "p1", List.of(judged("A", "x")));
        RegulationClause renamed = RegulationClause.pending("A", "Logging", "x", "ROOT", Hashes.sha256("x"));

        RegulationClause merged = RunState.merge(prior, "p1", List.of(renamed)).clause("A");

        assertThat(merged.status()).isEqualTo(ClauseStatus.JUDGED);
        assertThat(merged.title()).isEqualTo("Logging");
        assertThat(merged.parentId()).isEqualTo("ROOT");
    }

    @Test
    void backToPlanned_shouldDropResultsButKeepPlan() {
        RegulationClause clause = judged("A", "x");

        RegulationClause reset = clause.backToPlanned();

        assertThat(reset.status()).isEqualTo(ClauseStatus.PLANNED);
        assertThat(reset.verdict()).isNull();
        assertThat(reset.tasks()).singleElement().satisfies(t -> {
            assertThat(t.matches()).isNull();
            assertThat(t.finding()).isNull();
            assertThat(t.sentence()).isEqualTo("sentence");
        });
    }

    @Test
    void allSettled_shouldAcceptOnlyJudgedAndSkipped() {
        RunState state = RunState.merge(null, "p1", List.of(judged("A", "x"), clause("B", "y")));

        assertThat(state.allSettled()).isFalse();
        assertThat(state.withClause(state.clause("B").withNeedsProcedure(false).withStatus(ClauseStatus.SKIPPED))
                .allSettled()).isTrue();
    }

    @Test
    void searchedWith_shouldRequireSameBuildAndK() {
        AuditTask task = AuditTask.planned("A-T01", "s").withMatches(List.of(), "b1", 5);

        assertThat(task.searchedWith("b1", 5)).isTrue();
        assertThat(task.searchedWith("b2", 5)).isFalse();
        assertThat(task.searchedWith("b1", 3)).isFalse();
        assertThat(AuditTask.planned("A-T01", "s").searchedWith("b1", 5)).isFalse();
    }

    @Test
    void fromLabel_shouldMapSynonymsAndDefaultToAmbiguous() {
        assertThat(TaskFinding.fromLabel("supported")).isEqualTo(TaskFinding.SUPPORTED);
        assertThat(TaskFinding.fromLabel(" non-compliant ")).isEqualTo(TaskFinding.GAP);
        assertThat(TaskFinding.fromLabel("no evidence")).isEqualTo(TaskFinding.NO_EVIDENCE);
        assertThat(TaskFinding.fromLabel("partially")).isEqualTo(TaskFinding.AMBIGUOUS);
        assertThat(TaskFinding.fromLabel(null)).isEqualTo(TaskFinding.AMBIGUOUS);
    }

    @Test
    void verdict_shouldClampConfidence() {
        assertThat(new Verdict(VerdictStatus.COMPLIANT, true, 1.7, "d", null, null).confidence()).isEqualTo(1.0);
        assertThat(new Verdict(VerdictStatus.COMPLIANT, true, -2, "d", null, null).confidence()).isEqualTo(0.0);
    }
}
