package com.example.compliance.orchestrator;

import com.example.compliance.exception.RunInProgressException;
import com.example.compliance.model.ClauseStatus;
import com.example.compliance.model.PipelineSettings;
import com.example.compliance.model.ProjectConfig;
import com.example.compliance.model.RegulationClause;
import com.example.compliance.model.RunState;
import com.example.compliance.progress.PipelineStage;
import com.example.compliance.progress.ProgressEvent;
import com.example.compliance.progress.ProgressListener;
import com.example.compliance.progress.ProgressTracker;
import com.example.compliance.repository.ProjectRegistry;
import com.example.compliance.repository.RunLock;
import com.example.compliance.repository.RunStateStore;
import com.example.compliance.service.RegulationLoader;
import com.example.compliance.service.TokenUsageAccumulator;
import com.example.compliance.stage.AuditPlanStage;
import com.example.compliance.stage.CancellationToken;
import com.example.compliance.stage.JudgeStage;
import com.example.compliance.stage.NeedCheckStage;
import com.example.compliance.stage.RunContext;
import com.example.compliance.stage.SearchStage;
import com.example.compliance.stage.StageExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Compliance pipeline orchestrator.
 * Pipeline:
 * 1. Need-Check   (LLM, per clause)
 * 2. Audit-Plan   (LLM, per relevant clause)
 * 3. Search       (ingest, chunk, embed, index, top-K per task)
 * 4. Judge        (LLM, per searched clause)
 * <p>
 * Before the stages the regulation is loaded and merged with the persisted run state; every
 * stage persists each result as it completes, so an interrupted run resumes where it stopped.
 * One run per project at a time, enforced in-process and with a lock file in the work directory.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final RegulationLoader regulationLoader;
    private final List<StageExecutor> stages;
    private final ProjectRegistry projectRegistry;
    private final ObjectMapper objectMapper;
    private final ExecutorService pipelineExecutor;
    private final Map<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();
    private final Map<String, ProgressTracker> lastProgress = new ConcurrentHashMap<>();

    public PipelineOrchestrator(RegulationLoader regulationLoader,
                                NeedCheckStage needCheckStage,
                                AuditPlanStage auditPlanStage,
                                SearchStage searchStage,
                                JudgeStage judgeStage,
                                ProjectRegistry projectRegistry,
                                ObjectMapper objectMapper,
                                @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor) {
        this.regulationLoader = regulationLoader;
        this.stages = List.of(needCheckStage, auditPlanStage, searchStage, judgeStage);
        this.projectRegistry = projectRegistry;
        this.objectMapper = objectMapper;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * Runs all four stages for {@code project} on the calling thread.
     *
     * @return the run state after the last flushed update
     * @throws RunInProgressException if the project is already being processed
     */
    public RunState run(ProjectConfig project, PipelineSettings settings, ProgressListener listener,
                        CancellationToken token) {
        ProgressTracker tracker = new ProgressTracker(listener);
        ActiveRun active = new ActiveRun(token);
        if (activeRuns.putIfAbsent(project.id(), active) != null) {
            throw new RunInProgressException(project.id());
        }
        ExecutorService workers = null;
        try {
            lastProgress.put(project.id(), tracker);
            Path workDir = projectRegistry.workDir(project);
            TokenUsageAccumulator usage = TokenUsageAccumulator.start();
            workers = Executors.newFixedThreadPool(settings.workers());
            try (RunLock ignored = RunLock.acquire(workDir, project.id())) {
                RunStateStore store = new RunStateStore(workDir, objectMapper);
                active.store = store;
                RunContext context = new RunContext(project, workDir, settings, store, tracker, token, workers);

                log.info("═══════════════════════════════════════════════");
                log.info("Starting compliance pipeline for project '{}'", project.id());
                log.info("═══════════════════════════════════════════════");

                // ── Load regulation and merge with the persisted state ──
                List<RegulationClause> clauses = regulationLoader.load(Path.of(project.regulationPath()));
                Optional<RunState> prior = store.readExisting();
                store.open(RunState.merge(prior.orElse(null), project.id(), clauses));
                log.info("Loaded {} clause(s); prior run state {}", clauses.size(),
                        prior.isPresent() ? "resumed" : "not found");
                context.publish(ProgressEvent.builder(PipelineStage.LOAD)
                        .status("LOADED")
                        .message(clauses.size() + " clause(s)")
                        .counts(1, 1)
                        .build());

                // ── Stages ──
                for (int i = 0; i < stages.size(); i++) {
                    StageExecutor stage = stages.get(i);
                    if (token.isCancelled()) {
                        log.info("Run cancelled before {}", stage.stage());
                        break;
                    }
                    log.info("[{}/{}] {}...", i + 1, stages.size(), stage.stage());
                    stage.execute(context);
                    log.info("[{}/{}] {} completed", i + 1, stages.size(), stage.stage());
                }

                RunState result = store.update(s -> s.withCompleted(!token.isCancelled() && s.allSettled())
                        .withWarnings(s.ingestionWarnings()));
                result.warnings().forEach(w -> log.warn("Run '{}': {}", project.id(), w));
                context.publish(ProgressEvent.builder(PipelineStage.DONE)
                        .status(token.isCancelled() ? "CANCELLED" : result.completed() ? "COMPLETED" : "INCOMPLETE")
                        .counts(1, 1)
                        .putDetail("judged", result.count(ClauseStatus.JUDGED))
                        .putDetail("skipped", result.count(ClauseStatus.SKIPPED))
                        .putDetail("failed", result.count(ClauseStatus.FAILED))
                        .putDetail("llmCalls", usage.getLlmCalls())
                        .putDetail("embeddingCalls", usage.getEmbeddingCalls())
                        .putDetail("promptTokens", usage.getPromptTokens())
                        .putDetail("completionTokens", usage.getCompletionTokens())
                        .putDetail("warnings", result.warnings())
                        .build());

                log.info("═══════════════════════════════════════════════");
                log.info("Pipeline {} for '{}': {} judged, {} skipped, {} failed, {} pending",
                        token.isCancelled() ? "cancelled" : "finished", project.id(),
                        result.count(ClauseStatus.JUDGED), result.count(ClauseStatus.SKIPPED),
                        result.count(ClauseStatus.FAILED),
                        result.clauses().size() - result.count(ClauseStatus.JUDGED)
                                - result.count(ClauseStatus.SKIPPED) - result.count(ClauseStatus.FAILED));
                log.info("Provider usage: {}", usage);
                log.info("═══════════════════════════════════════════════");
                return result;
            }
        } finally {
            if (workers != null) {
                workers.shutdown();
            }
            TokenUsageAccumulator.clear();
            activeRuns.remove(project.id());
        }
    }

    /** Runs the pipeline on the shared pipeline executor. */
    public CompletableFuture<RunState> runAsync(ProjectConfig project, PipelineSettings settings,
                                               ProgressListener listener, CancellationToken token) {
        if (activeRuns.containsKey(project.id())) {
            return CompletableFuture.failedFuture(new RunInProgressException(project.id()));
        }
        return CompletableFuture.supplyAsync(() -> run(project, settings, listener, token), pipelineExecutor)
                .whenComplete((state, error) -> {
                    if (error != null) {
                        log.error("Pipeline run for '{}' failed", project.id(), error);
                    }
                });
    }

    /** Requests cancellation of the active run; returns false if none is active. */
    public boolean cancel(String projectId) {
        ActiveRun active = activeRuns.get(projectId);
        if (active == null) return false;
        active.token.cancel();
        log.info("Cancellation requested for project '{}'", projectId);
        return true;
    }

    public boolean isRunning(String projectId) {
        return activeRuns.containsKey(projectId);
    }

    /** Progress events of the active or most recent run, after the first {@code offset}. */
    public List<ProgressEvent> progress(String projectId, int offset) {
        ProgressTracker tracker = lastProgress.get(projectId);
        return tracker == null ? List.of() : tracker.since(offset);
    }

    /** Last flushed run state: the live snapshot during a run, otherwise {@code run.json}. */
    public Optional<RunState> currentState(ProjectConfig project) {
        ActiveRun active = activeRuns.get(project.id());
        if (active != null && active.store != null) {
            try {
                return Optional.of(active.store.snapshot());
            } catch (IllegalStateException e) {
                log.debug("Run for '{}' has not opened its state yet", project.id());
            }
        }
        return new RunStateStore(projectRegistry.workDir(project), objectMapper).readExisting();
    }

    /** Deletes the persisted run state of an idle project. */
    public boolean deleteState(ProjectConfig project) {
        if (isRunning(project.id())) {
            throw new RunInProgressException(project.id());
        }
        lastProgress.remove(project.id());
        return new RunStateStore(projectRegistry.workDir(project), objectMapper).delete();
    }

    private static final class ActiveRun {
        final CancellationToken token;
        volatile RunStateStore store;

        ActiveRun(CancellationToken token) {
            this.token = token;
        }
    }
}
