package com.example.compliance.orchestrator;

import com.example.compliance.config.AiConfig;
import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.exception.RunInProgressException;
import com.example.compliance.fixtures.FakeEmbeddingService;
import com.example.compliance.fixtures.FakeLlmService;
import com.example.compliance.model.AuditPlanResponse;
import com.example.compliance.model.AuditTask;
import com.example.compliance.model.ClauseStatus;
import com.example.compliance.model.JudgeResponse;
import com.example.compliance.model.NeedCheckResponse;
import com.example.compliance.model.PipelineSettings;
import com.example.compliance.model.ProjectConfig;
import com.example.compliance.model.RegulationClause;
import com.example.compliance.model.RunState;
import com.example.compliance.model.VerdictStatus;
import com.example.compliance.progress.PipelineStage;
import com.example.compliance.progress.ProgressEvent;
import com.example.compliance.progress.ProgressListener;
import com.example.compliance.repository.ProjectRegistry;
import com.example.compliance.repository.RunStateStore;
import com.example.compliance.service.ContentCache;
import com.example.compliance.service.DocumentChunker;
import com.example.compliance.service.DocumentIngestionService;
import com.example.compliance.service.DocumentNormalizer;
import com.example.compliance.service.RegulationLoader;
import com.example.compliance.service.VectorIndexService;
import com.example.compliance.stage.AuditPlanStage;
import com.example.compliance.stage.CancellationToken;
import com.example.compliance.stage.JudgeStage;
import com.example.compliance.stage.NeedCheckStage;
import com.example.compliance.stage.SearchStage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.compliance.fixtures.FakeLlmService.judged;
import static com.example.compliance.fixtures.FakeLlmService.needs;
import static com.example.compliance.fixtures.FakeLlmService.plan;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineOrchestratorTest {

    private static final String REGULATION = """
            {"name": "Security regulation", "clauses": [
              {"id": "C001", "title": "Incident classification",
               "text": "Incidents must be classified into four severity levels."},
              {"id": "C002", "text": "'Incident' means any event compromising the security of systems."},
              {"id": "C003", "text": "Access rights must be reviewed every quarter."}
            ]}
            """;

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new AiConfig().objectMapper();
    private final ExecutorService pipelineExecutor = Executors.newCachedThreadPool();
    private FakeLlmService llm;
    private FakeEmbeddingService embeddings;
    private Path regulation;
    private Path incidentDoc;
    private Path accessDoc;

    /** Thrown by a fake provider to simulate the process dying mid-stage. */
    static final class SimulatedCrash extends Error {
        SimulatedCrash() {
            super("simulated crash");
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        regulation = dir.resolve("regulation.json");
        Files.writeString(regulation, REGULATION);
        incidentDoc = dir.resolve("incident.md");
        Files.writeString(incidentDoc, """
                # Incident Classification

                Incidents are classified into three severity levels: low, medium and high.
                """);
        accessDoc = dir.resolve("access.md");
        Files.writeString(accessDoc, """
                # Access Control

                Access rights are reviewed every quarter by the system owner.
                """);

        embeddings = new FakeEmbeddingService();
        llm = new FakeLlmService()
                .onNeedCheck((id, prompt) -> needs(!"C002".equals(id)))
                .onAuditPlan((id, prompt) -> "C001".equals(id)
                        ? plan("The procedure defines four incident severity levels.")
                        : plan("Access rights are reviewed quarterly by the owner."))
                .onJudge(PipelineOrchestratorTest::judge);
    }

    @AfterEach
    void tearDown() {
        pipelineExecutor.shutdownNow();
    }

    private static JudgeResponse judge(String clauseId, String prompt) {
        if ("C001".equals(clauseId)) {
            return prompt.contains("three severity levels")
                    ? judged(false, "missing level-4 classification", "C001-T01", "GAP")
                    : judged(true, "four levels documented", "C001-T01", "SUPPORTED");
        }
        return judged(true, "quarterly access review documented", clauseId + "-T01", "SUPPORTED");
    }

    private PipelineOrchestrator orchestrator(Path cacheDir) {
        ContentCache cache = new ContentCache(cacheDir, objectMapper);
        ProjectRegistry registry = new ProjectRegistry(dir.resolve("projects.json"), dir.resolve("projects"),
                objectMapper);
        SearchStage search = new SearchStage(
                new DocumentIngestionService(new ComplianceProperties(null, null, null)),
                new DocumentNormalizer(), new DocumentChunker(), new VectorIndexService(), embeddings, cache);
        return new PipelineOrchestrator(new RegulationLoader(objectMapper),
                new NeedCheckStage(llm, cache), new AuditPlanStage(llm, cache), search, new JudgeStage(llm, cache),
                registry, objectMapper, pipelineExecutor);
    }

    private PipelineOrchestrator orchestrator() {
        return orchestrator(dir.resolve("cache"));
    }

    private ProjectConfig project(String workDir, List<Path> procedures) {
        return new ProjectConfig("p1", "Audit", regulation.toString(),
                procedures.stream().map(Path::toString).toList(), dir.resolve(workDir).toString());
    }

    private ProjectConfig project() {
        return project("work", List.of(incidentDoc, accessDoc));
    }

    private static PipelineSettings settings(int workers) {
        return new PipelineSettings("check-model", "plan-model", "judge-model", "embed-model",
                2, 400, 4, workers, 0, Duration.ZERO);
    }

    private RunState run(PipelineOrchestrator orchestrator, ProjectConfig project, int workers) {
        return orchestrator.run(project, settings(workers), ProgressListener.NONE, new CancellationToken());
    }

    @Test
    void run_shouldJudgeEveryClause() {
        List<ProgressEvent> events = new CopyOnWriteArrayList<>();
        PipelineOrchestrator orchestrator = orchestrator();

        RunState state = orchestrator.run(project(), settings(2), events::add, new CancellationToken());

        assertThat(state.completed()).isTrue();
        RegulationClause c001 = state.clause("C001");
        assertThat(c001.verdict().status()).isEqualTo(VerdictStatus.NON_COMPLIANT);
        assertThat(c001.verdict().compliant()).isFalse();
        assertThat(c001.verdict().description()).isEqualTo("missing level-4 classification");
        assertThat(c001.tasks()).singleElement().satisfies(t -> {
            assertThat(t.matches()).hasSize(2);
            assertThat(t.matches().get(0).sourcePath()).isEqualTo(incidentDoc.toString());
            assertThat(t.matches().get(0).section()).isEqualTo("Incident Classification");
        });
        assertThat(state.clause("C002").status()).isEqualTo(ClauseStatus.SKIPPED);
        assertThat(state.clause("C003").verdict().status()).isEqualTo(VerdictStatus.COMPLIANT);
        assertThat(state.documents()).hasSize(2);
        assertThat(state.indexBuildId()).isNotNull();

        assertThat(new RunStateStore(dir.resolve("work"), objectMapper).readExisting()).contains(state);
        assertThat(events.get(0).getStage()).isEqualTo(PipelineStage.LOAD);
        ProgressEvent done = events.get(events.size() - 1);
        assertThat(done.getStage()).isEqualTo(PipelineStage.DONE);
        assertThat(done.getStatus()).isEqualTo("COMPLETED");
        assertThat(done.getPercentComplete()).isEqualTo(100);
        assertThat(done.getDetails()).containsKeys("llmCalls", "embeddingCalls", "promptTokens", "completionTokens");
        assertThat(state.warnings()).isEmpty();
        assertThat(orchestrator.progress("p1", 0)).hasSameSizeAs(events);
    }

    @Test
    void rerun_shouldBeIdempotentWithoutProviderCalls() {
        PipelineOrchestrator orchestrator = orchestrator();
        RunState first = run(orchestrator, project(), 2);
        llm.resetCounts();
        embeddings.resetCounts();

        RunState second = run(orchestrator(), project(), 2);

        assertThat(second).isEqualTo(first);
        assertThat(llm.totalCalls()).isZero();
        assertThat(embeddings.calls()).isZero();
    }

    @Test
    void modifiedDocument_shouldRebuildIndexAndRejudgeWithoutReplanning() throws IOException {
        RunState first = run(orchestrator(), project(), 2);
        Files.writeString(accessDoc, """
                # Access Control

                Access rights are reviewed every month by the system owner.
                """);
        llm.resetCounts();
        embeddings.resetCounts();

        RunState second = run(orchestrator(), project(), 2);

        assertThat(second.indexBuildId()).isNotEqualTo(first.indexBuildId());
        assertThat(llm.calls(NeedCheckResponse.class)).isZero();
        assertThat(llm.calls(AuditPlanResponse.class)).isZero();
        assertThat(llm.calls(JudgeResponse.class)).isEqualTo(2);
        assertThat(embeddings.calls()).isEqualTo(1);
        assertThat(embeddings.inputs()).singleElement().asString().contains("every month");
        assertThat(second.clause("C003").tasks().get(0).matches())
                .anySatisfy(m -> assertThat(m.text()).contains("every month"));
        assertThat(second.completed()).isTrue();
    }

    @Test
    void editedClause_shouldOnlyReprocessThatClause() throws IOException {
        run(orchestrator(), project(), 2);
        Files.writeString(regulation, REGULATION.replace("every quarter", "every six months"));
        llm.resetCounts();

        RunState second = run(orchestrator(), project(), 2);

        assertThat(llm.calls(NeedCheckResponse.class)).isEqualTo(1);
        assertThat(llm.calls(AuditPlanResponse.class)).isEqualTo(1);
        assertThat(llm.calls(JudgeResponse.class)).isEqualTo(1);
        assertThat(llm.prompts()).allSatisfy(p -> assertThat(p).contains("CLAUSE C003"));
        assertThat(second.clause("C001").verdict().status()).isEqualTo(VerdictStatus.NON_COMPLIANT);
    }

    @Test
    void crashedRun_shouldResumeWithoutRepeatingFinishedWork() {
        AtomicInteger needChecks = new AtomicInteger();
        llm.onNeedCheck((id, prompt) -> {
            if (needChecks.incrementAndGet() == 2) {
                throw new SimulatedCrash();
            }
            return needs(!"C002".equals(id));
        });

        assertThatThrownBy(() -> run(orchestrator(), project(), 1)).isInstanceOf(SimulatedCrash.class);

        RunState persisted = new RunStateStore(dir.resolve("work"), objectMapper).readExisting().orElseThrow();
        assertThat(persisted.clause("C001").status()).isEqualTo(ClauseStatus.NEED_CHECKED);
        assertThat(persisted.clause("C002").status()).isEqualTo(ClauseStatus.PENDING);
        assertThat(persisted.clause("C003").status()).isEqualTo(ClauseStatus.NEED_CHECKED);

        RunState resumed = run(orchestrator(), project(), 1);

        assertThat(needChecks).hasValue(4);
        assertThat(resumed.completed()).isTrue();
        assertThat(resumed.clause("C002").status()).isEqualTo(ClauseStatus.SKIPPED);
    }

    @Test
    void cancelledRun_shouldStopAndResumeLater() {
        CancellationToken token = new CancellationToken();
        List<ProgressEvent> events = new CopyOnWriteArrayList<>();
        ProgressListener cancelAfterFirstClause = event -> {
            events.add(event);
            if (event.getStage() == PipelineStage.NEED_CHECK && event.getClauseId() != null) {
                token.cancel();
            }
        };

        RunState cancelled = orchestrator().run(project(), settings(1), cancelAfterFirstClause, token);

        assertThat(cancelled.completed()).isFalse();
        assertThat(llm.calls(NeedCheckResponse.class)).isEqualTo(1);
        assertThat(llm.calls(AuditPlanResponse.class)).isZero();
        assertThat(cancelled.count(ClauseStatus.PENDING)).isEqualTo(2);
        assertThat(events.get(events.size() - 1).getStatus()).isEqualTo("CANCELLED");

        RunState resumed = run(orchestrator(), project(), 1);

        assertThat(resumed.completed()).isTrue();
        assertThat(llm.calls(NeedCheckResponse.class)).isEqualTo(3);
    }

    @Test
    void run_shouldJudgeNoEvidenceWithoutModelCall() {
        RunState state = run(orchestrator(), project("empty", List.of()), 2);

        assertThat(state.clause("C001").verdict().status()).isEqualTo(VerdictStatus.NO_EVIDENCE);
        assertThat(state.clause("C003").verdict().status()).isEqualTo(VerdictStatus.NO_EVIDENCE);
        assertThat(state.clause("C001").tasks().get(0).matches()).isEmpty();
        assertThat(llm.calls(JudgeResponse.class)).isZero();
        assertThat(embeddings.calls()).isZero();
        assertThat(state.completed()).isTrue();
    }

    @Test
    void run_shouldRecordUnreadableDocumentAndContinue() throws IOException {
        Path broken = dir.resolve("broken.docx");
        Files.writeString(broken, "not supported");

        RunState state = run(orchestrator(), project("work", List.of(incidentDoc, broken)), 2);

        assertThat(state.documents().get(broken.toString()).error()).contains("Unsupported file type");
        assertThat(state.clause("C001").verdict().status()).isEqualTo(VerdictStatus.NON_COMPLIANT);
        assertThat(state.completed()).isTrue();
        assertThat(state.warnings()).singleElement().asString()
                .startsWith("1 of 2 procedure document(s) failed ingestion")
                .contains(broken.toString());
    }

    @Test
    void run_shouldWarnWhenNoDocumentCouldBeIngested() throws IOException {
        Path broken = dir.resolve("broken.docx");
        Files.writeString(broken, "not supported");
        List<ProgressEvent> events = new CopyOnWriteArrayList<>();

        RunState state = orchestrator().run(project("work", List.of(broken)), settings(2), events::add,
                new CancellationToken());

        assertThat(state.clause("C001").verdict().status()).isEqualTo(VerdictStatus.NO_EVIDENCE);
        assertThat(state.warnings()).singleElement().asString()
                .contains("No procedure document could be ingested");
        assertThat(new RunStateStore(dir.resolve("work"), objectMapper).readExisting().orElseThrow().warnings())
                .isEqualTo(state.warnings());
        assertThat(events.get(events.size() - 1).getDetails().get("warnings")).isEqualTo(state.warnings());
    }

    @Test
    void run_shouldReleaseProjectWhenSetupFails() {
        PipelineOrchestrator orchestrator = orchestrator();
        ProjectConfig unusable = new ProjectConfig("p1", "Audit", regulation.toString(), List.of(), "bad\u0000dir");

        assertThatThrownBy(() -> run(orchestrator, unusable, 2)).isInstanceOf(InvalidPathException.class);

        assertThat(orchestrator.isRunning("p1")).isFalse();
        assertThat(run(orchestrator, project(), 2).completed()).isTrue();
    }

    @Test
    void embeddingOutage_shouldFailClausesAndRecoverOnRerun() {
        embeddings.setFailing(true);

        RunState failed = run(orchestrator(), project(), 2);

        assertThat(failed.completed()).isFalse();
        assertThat(failed.clause("C001").status()).isEqualTo(ClauseStatus.FAILED);
        assertThat(failed.clause("C001").error()).contains("embedding provider unavailable");
        assertThat(failed.clause("C002").status()).isEqualTo(ClauseStatus.SKIPPED);

        embeddings.setFailing(false);
        RunState recovered = run(orchestrator(), project(), 2);

        assertThat(recovered.completed()).isTrue();
        assertThat(recovered.clause("C001").verdict().status()).isEqualTo(VerdictStatus.NON_COMPLIANT);
    }

    @Test
    void results_shouldNotDependOnWorkerCount() {
        RunState sequential = run(orchestrator(dir.resolve("cache-1")), project("work-1", List.of(incidentDoc, accessDoc)), 1);
        RunState parallel = run(orchestrator(dir.resolve("cache-4")), project("work-4", List.of(incidentDoc, accessDoc)), 4);

        assertThat(parallel.clauses()).isEqualTo(sequential.clauses());
        assertThat(parallel.indexBuildId()).isEqualTo(sequential.indexBuildId());
    }

    @Test
    void run_shouldRejectConcurrentRunOfSameProject() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ProgressListener blocking = event -> {
            if (event.getStage() == PipelineStage.LOAD) {
                started.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        PipelineOrchestrator orchestrator = orchestrator();

        CompletableFuture<RunState> first = orchestrator.runAsync(project(), settings(2), blocking,
                new CancellationToken());
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

        assertThat(orchestrator.isRunning("p1")).isTrue();
        assertThatThrownBy(() -> run(orchestrator, project(), 2)).isInstanceOf(RunInProgressException.class);
        assertThat(orchestrator.currentState(project())).isPresent();

        release.countDown();
        assertThat(first.get(30, TimeUnit.SECONDS).completed()).isTrue();
        assertThat(orchestrator.isRunning("p1")).isFalse();
    }

    @Test
    void deleteState_shouldForceFreshRun() {
        PipelineOrchestrator orchestrator = orchestrator();
        run(orchestrator, project(), 2);

        assertThat(orchestrator.deleteState(project())).isTrue();
        assertThat(orchestrator.currentState(project())).isEmpty();

        List<String> order = new ArrayList<>(run(orchestrator, project(), 2).clauses().keySet());
        assertThat(order).containsExactly("C001", "C002", "C003");
    }

    @Test
    void tasks_shouldKeepPlanOrder() {
        llm.onAuditPlan((id, prompt) -> plan("Severity levels are defined.", "Each level has criteria.",
                "Escalation follows the level."));

        RunState state = run(orchestrator(), project(), 4);

        assertThat(state.clause("C001").tasks()).extracting(AuditTask::id)
                .containsExactly("C001-T01", "C001-T02", "C001-T03");
    }
}
