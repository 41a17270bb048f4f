package com.example.compliance.stage;

import com.example.compliance.model.AuditTask;
import com.example.compliance.model.ClauseStatus;
import com.example.compliance.model.JudgeResponse;
import com.example.compliance.model.MatchResult;
import com.example.compliance.model.RegulationClause;
import com.example.compliance.model.TaskFinding;
import com.example.compliance.model.Verdict;
import com.example.compliance.model.VerdictStatus;
import com.example.compliance.progress.ProgressTracker;
import com.example.compliance.service.Hashes;
import com.example.compliance.service.LlmService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.example.compliance.stage.StageTestSupport.cache;
import static com.example.compliance.stage.StageTestSupport.clause;
import static com.example.compliance.stage.StageTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JudgeStageTest {

    @TempDir
    Path dir;

    private final ExecutorService workers = Executors.newFixedThreadPool(2);
    private final LlmService llm = mock(LlmService.class);

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private static MatchResult match(String chunkId, int ordinal, double score, String text) {
        return new MatchResult(chunkId, ordinal, score, "proc.md", ordinal * 10, ordinal * 10 + text.length(),
                "Incidents", text, Hashes.sha256(text));
    }

    private static RegulationClause searched(String id, List<List<MatchResult>> matchesPerTask) {
        List<AuditTask> planned = new ArrayList<>();
        for (int i = 0; i < matchesPerTask.size(); i++) {
            planned.add(AuditTask.planned("%s-T%02d".formatted(id, i + 1), "sentence " + (i + 1)));
        }
        RegulationClause clause = clause(id, "Incidents must be classified into four severity levels.")
                .withNeedsProcedure(true)
                .withPlan(planned);
        List<AuditTask> withMatches = new ArrayList<>();
        for (int i = 0; i < planned.size(); i++) {
            withMatches.add(planned.get(i).withMatches(matchesPerTask.get(i), "b1", 2));
        }
        return clause.withTasks(withMatches).withStatus(ClauseStatus.SEARCHED);
    }

    @Test
    void execute_shouldJudgeGapAsNonCompliant() {
        MatchResult three = match("d-0001", 1, 0.9, "Incidents are classified into three severity levels.");
        when(llm.complete(anyString(), anyString(), eq("judge-model"), eq(JudgeResponse.class), any()))
                .thenReturn(new JudgeResponse(false, "missing level-4 classification", "Add a fourth level.", 0.8,
                        List.of(new JudgeResponse.TaskAssessment("C001-T01", "GAP", "Only three levels [E1]."))));
        RunContext context = context(dir, workers, new ProgressTracker(null),
                searched("C001", List.of(List.of(three))));

        new JudgeStage(llm, cache(dir)).execute(context);

        RegulationClause judged = context.store().snapshot().clause("C001");
        Verdict verdict = judged.verdict();
        assertThat(judged.status()).isEqualTo(ClauseStatus.JUDGED);
        assertThat(verdict.status()).isEqualTo(VerdictStatus.NON_COMPLIANT);
        assertThat(verdict.compliant()).isFalse();
        assertThat(verdict.description()).isEqualTo("missing level-4 classification");
        assertThat(verdict.evidenceChunkIds()).containsExactly("d-0001");
        assertThat(judged.tasks().get(0).finding()).isEqualTo(TaskFinding.GAP);
    }

    @Test
    void execute_shouldSkipModelWhenNothingWasRetrieved() {
        RunContext context = context(dir, workers, new ProgressTracker(null),
                searched("C001", List.of(List.of(), List.of())));

        new JudgeStage(llm, cache(dir)).execute(context);

        RegulationClause judged = context.store().snapshot().clause("C001");
        assertThat(judged.verdict().status()).isEqualTo(VerdictStatus.NO_EVIDENCE);
        assertThat(judged.verdict().compliant()).isNull();
        assertThat(judged.tasks()).allSatisfy(t -> assertThat(t.finding()).isEqualTo(TaskFinding.NO_EVIDENCE));
        verify(llm, never()).complete(anyString(), anyString(), anyString(), eq(JudgeResponse.class), any());
    }

    @Test
    void execute_shouldLabelPooledEvidenceBestFirst() {
        MatchResult a = match("d-0000", 0, 0.40, "Access is reviewed.");
        MatchResult b = match("d-0001", 1, 0.75, "Incidents are classified.");
        when(llm.complete(anyString(), anyString(), anyString(), eq(JudgeResponse.class), any()))
                .thenReturn(new JudgeResponse(true, "covered", null, 0.9, List.of()));
        RunContext context = context(dir, workers, new ProgressTracker(null),
                searched("C001", List.of(List.of(a, b), List.of(match("d-0001", 1, 0.95, "Incidents are classified.")))));

        new JudgeStage(llm, cache(dir)).execute(context);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llm).complete(anyString(), prompt.capture(), anyString(), eq(JudgeResponse.class), any());
        assertThat(prompt.getValue())
                .contains("CLAUSE C001")
                .contains("[E1] source: proc.md")
                .contains("C001-T02: sentence 2 (evidence: E1)");
        assertThat(prompt.getValue().indexOf("Incidents are classified."))
                .isLessThan(prompt.getValue().indexOf("Access is reviewed."));
        RegulationClause judged = context.store().snapshot().clause("C001");
        assertThat(judged.verdict().evidenceChunkIds()).containsExactly("d-0001", "d-0000");
        assertThat(judged.verdict().status()).isEqualTo(VerdictStatus.COMPLIANT);
    }

    @Test
    void execute_shouldNotReportCompliantWhenOverallFlagIsNegative() {
        MatchResult three = match("d-0001", 1, 0.9, "Incidents are classified into three severity levels.");
        when(llm.complete(anyString(), anyString(), eq("judge-model"), eq(JudgeResponse.class), any()))
                .thenReturn(new JudgeResponse(false, "missing level-4 classification",
                        "add a level-4 incident category", 0.8,
                        List.of(new JudgeResponse.TaskAssessment("C001-T01", "SUPPORTED", "Levels exist [E1]."))));
        RunContext context = context(dir, workers, new ProgressTracker(null),
                searched("C001", List.of(List.of(three))));

        new JudgeStage(llm, cache(dir)).execute(context);

        Verdict verdict = context.store().snapshot().clause("C001").verdict();
        assertThat(verdict.status()).isEqualTo(VerdictStatus.INCONCLUSIVE);
        assertThat(verdict.compliant()).isNull();
        assertThat(verdict.description()).isEqualTo("missing level-4 classification");
    }

    @Test
    void applyFindings_shouldFallBackToOverallFlag() {
        MatchResult m = match("d-0000", 0, 0.5, "text");
        List<AuditTask> tasks = List.of(
                AuditTask.planned("C-T01", "s1").withMatches(List.of(m), "b", 1),
                AuditTask.planned("C-T02", "s2").withMatches(List.of(m), "b", 1),
                AuditTask.planned("C-T03", "s3").withMatches(List.of(), "b", 1));
        JudgeResponse response = new JudgeResponse(true, "d", null, null,
                List.of(new JudgeResponse.TaskAssessment("c-t01", "ambiguous", "unclear")));

        List<AuditTask> judged = JudgeStage.applyFindings(tasks, response);

        assertThat(judged).extracting(AuditTask::finding)
                .containsExactly(TaskFinding.AMBIGUOUS, TaskFinding.SUPPORTED, TaskFinding.NO_EVIDENCE);
    }

    @Test
    void violation_shouldRequireFlagOrFindings() {
        assertThat(JudgeStage.violation(new JudgeResponse(null, "d", null, null, List.of()))).isNotNull();
        assertThat(JudgeStage.violation(new JudgeResponse(false, "d", null, null, null))).isNull();
    }
}
