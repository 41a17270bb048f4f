package com.example.compliance.stage;

import com.example.compliance.exception.ProviderException;
import com.example.compliance.exception.ResponseParseException;
import com.example.compliance.model.AuditTask;
import com.example.compliance.model.ClauseStatus;
import com.example.compliance.model.JudgeResponse;
import com.example.compliance.model.MatchResult;
import com.example.compliance.model.RegulationClause;
import com.example.compliance.model.TaskFinding;
import com.example.compliance.model.Verdict;
import com.example.compliance.model.VerdictStatus;
import com.example.compliance.progress.PipelineStage;
import com.example.compliance.service.CacheKeys;
import com.example.compliance.service.ContentCache;
import com.example.compliance.service.Hashes;
import com.example.compliance.service.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Judges every searched clause against the evidence retrieved for its tasks.
 * <p>
 * Evidence is pooled across the clause's tasks, deduplicated by chunk (best score wins) and
 * labelled E1..En. A clause whose tasks retrieved nothing is NO_EVIDENCE without a model call.
 * The clause status follows {@link VerdictAggregator}; the model supplies the per-task findings,
 * the description and the suggestions.
 */
@Service
public class JudgeStage extends AbstractLlmStage {

    private static final Logger log = LoggerFactory.getLogger(JudgeStage.class);

    static final String CACHE_STAGE = "judge-v1";

    private static final Comparator<MatchResult> EVIDENCE_ORDER = Comparator
            .comparingDouble(MatchResult::score).reversed()
            .thenComparingInt(MatchResult::ordinal);

    private static final String SYSTEM_PROMPT = """
            You are an expert compliance auditor.

            TASK:
            Assess whether the organization's procedure excerpts satisfy a regulation clause.
            You receive the clause, the audit tasks derived from it, and labelled evidence excerpts
            (E1, E2, ...) retrieved from the procedure documents.

            RULES:
            - Judge only from the evidence excerpts; do not assume content that is not quoted.
            - For every audit task give a finding:
              SUPPORTED  = the evidence explicitly covers the task;
              GAP        = the evidence explicitly contradicts the task or covers it only partially
                           (e.g. fewer levels, longer deadlines, missing roles);
              AMBIGUOUS  = the evidence touches the topic but is not conclusive.
            - compliant = true only if every task is SUPPORTED.
            - description: what the evidence shows or lacks, citing evidence labels.
            - suggestions: concrete corrective action for the procedure; null when compliant.
            - confidence: 0.0-1.0.
            - Return JSON only, compliant with the provided schema.
            """;

    private static final String CORRECTION = """
            IMPORTANT: return a single JSON object with "compliant" (boolean), "description" (string),
            "suggestions" (string or null), "confidence" (number 0.0-1.0) and "taskFindings" (array of
            {"taskId", "finding": SUPPORTED|GAP|AMBIGUOUS, "rationale"}). No prose outside the JSON.""";

    public JudgeStage(LlmService llmService, ContentCache cache) {
        super(llmService, cache);
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.JUDGE;
    }

    @Override
    public void execute(RunContext context) {
        List<RegulationClause> searched = context.store().snapshot().clausesIn(ClauseStatus.SEARCHED);
        log.info("Judge: {} clause(s) to judge", searched.size());
        RunContext.StageProgress progress = context.progress(stage(), searched.size());
        if (searched.isEmpty()) {
            progress.note("SKIPPED", "No clause awaiting judgment");
            return;
        }
        context.forEach(searched, clause -> judge(context, clause, progress));
    }

    private void judge(RunContext context, RegulationClause clause, RunContext.StageProgress progress) {
        if (clause.tasks().stream().noneMatch(AuditTask::hasEvidence)) {
            List<AuditTask> tasks = clause.tasks().stream()
                    .map(t -> t.withFinding(TaskFinding.NO_EVIDENCE, "No procedure excerpt retrieved."))
                    .toList();
            context.store().updateClause(clause.id(), c -> c.withVerdict(Verdict.noEvidence(), tasks));
            progress.step(clause.id(), null, VerdictStatus.NO_EVIDENCE.name(), "no evidence retrieved");
            return;
        }

        List<MatchResult> evidence = pooledEvidence(clause);
        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < evidence.size(); i++) {
            labels.put(evidence.get(i).chunkId(), "E" + (i + 1));
        }

        String model = context.settings().judgeModel();
        String key = CacheKeys.of(CACHE_STAGE, model, clause.textHash(), promptFingerprint(clause, evidence));
        try {
            JudgeResponse response = cache.get(key, JudgeResponse.class)
                    .filter(r -> violation(r) == null)
                    .orElse(null);
            if (response == null) {
                response = completeWithCorrection(clause.id(), SYSTEM_PROMPT,
                        userPrompt(clause, evidence, labels), CORRECTION, model,
                        context.settings().retryPolicy(), JudgeResponse.class, JudgeStage::violation);
                cache.put(key, response);
            }

            List<AuditTask> tasks = applyFindings(clause.tasks(), response);
            VerdictStatus status = VerdictAggregator.reconcile(
                    VerdictAggregator.aggregate(tasks.stream().map(AuditTask::finding).toList()),
                    response.compliant());
            Verdict verdict = new Verdict(
                    status,
                    status == VerdictStatus.COMPLIANT ? Boolean.TRUE
                            : status == VerdictStatus.NON_COMPLIANT ? Boolean.FALSE : null,
                    response.confidence() != null ? response.confidence() : 0.5,
                    response.description() != null ? response.description().strip() : "",
                    response.suggestions() != null && !response.suggestions().isBlank()
                            ? response.suggestions().strip() : null,
                    new ArrayList<>(labels.keySet()));
            context.store().updateClause(clause.id(), c -> c.withVerdict(verdict, tasks));
            log.debug("Judge {}: {}", clause.id(), status);
            progress.step(clause.id(), null, status.name(), verdict.description());
        } catch (ResponseParseException | ProviderException e) {
            String error = errorMessage("Judge", e);
            log.error("Judge {}: {}", clause.id(), error);
            context.store().updateClause(clause.id(), c -> c.failed(error));
            progress.step(clause.id(), null, ClauseStatus.FAILED.name(), error);
        }
    }

    /** Matches of all tasks, one per chunk with its best score, best first. */
    static List<MatchResult> pooledEvidence(RegulationClause clause) {
        Map<String, MatchResult> best = new LinkedHashMap<>();
        for (AuditTask task : clause.tasks()) {
            if (task.matches() == null) continue;
            for (MatchResult m : task.matches()) {
                best.merge(m.chunkId(), m, (a, b) -> b.score() > a.score() ? b : a);
            }
        }
        return best.values().stream().sorted(EVIDENCE_ORDER).toList();
    }

    /**
     * Findings per task: tasks without matches are NO_EVIDENCE; tasks the model assessed take its
     * finding; the rest follow the overall {@code compliant} flag, or AMBIGUOUS when it is absent.
     */
    static List<AuditTask> applyFindings(List<AuditTask> tasks, JudgeResponse response) {
        Map<String, JudgeResponse.TaskAssessment> byId = new HashMap<>();
        if (response.taskFindings() != null) {
            for (JudgeResponse.TaskAssessment a : response.taskFindings()) {
                if (a != null && a.taskId() != null) {
                    byId.put(a.taskId().strip().toUpperCase(Locale.ROOT), a);
                }
            }
        }
        List<AuditTask> result = new ArrayList<>(tasks.size());
        for (AuditTask task : tasks) {
            if (!task.hasEvidence()) {
                result.add(task.withFinding(TaskFinding.NO_EVIDENCE, "No procedure excerpt retrieved."));
                continue;
            }
            JudgeResponse.TaskAssessment a = byId.get(task.id().toUpperCase(Locale.ROOT));
            if (a != null) {
                result.add(task.withFinding(TaskFinding.fromLabel(a.finding()), a.rationale()));
            } else if (response.compliant() != null) {
                result.add(task.withFinding(response.compliant() ? TaskFinding.SUPPORTED : TaskFinding.GAP,
                        "Follows the overall judgment."));
            } else {
                result.add(task.withFinding(TaskFinding.AMBIGUOUS, "Not assessed by the judge."));
            }
        }
        return result;
    }

    static String violation(JudgeResponse response) {
        boolean noFindings = response.taskFindings() == null || response.taskFindings().isEmpty();
        if (response.compliant() == null && noFindings) {
            return "neither compliant nor taskFindings is present";
        }
        return null;
    }

    private static String promptFingerprint(RegulationClause clause, List<MatchResult> evidence) {
        StringBuilder sb = new StringBuilder();
        for (AuditTask task : clause.tasks()) {
            sb.append(task.id()).append('|').append(task.sentence()).append('|');
            if (task.matches() != null) {
                task.matches().forEach(m -> sb.append(m.chunkId()).append(','));
            }
            sb.append('\n');
        }
        evidence.forEach(m -> sb.append(m.sourcePath()).append('|').append(m.textHash()).append('\n'));
        return Hashes.sha256(sb.toString());
    }

    private static String userPrompt(RegulationClause clause, List<MatchResult> evidence, Map<String, String> labels) {
        StringBuilder tasks = new StringBuilder();
        for (AuditTask task : clause.tasks()) {
            tasks.append("- ").append(task.id()).append(": ").append(task.sentence());
            if (task.hasEvidence()) {
                tasks.append(" (evidence: ")
                        .append(String.join(", ", task.matches().stream().map(m -> labels.get(m.chunkId())).toList()))
                        .append(')');
            } else {
                tasks.append(" (no evidence retrieved)");
            }
            tasks.append('\n');
        }

        StringBuilder excerpts = new StringBuilder();
        for (MatchResult m : evidence) {
            excerpts.append('[').append(labels.get(m.chunkId())).append("] source: ").append(m.sourcePath());
            if (m.section() != null) {
                excerpts.append(", section: ").append(m.section());
            }
            excerpts.append(", characters ").append(m.startOffset()).append('-').append(m.endOffset()).append('\n')
                    .append(m.text()).append("\n\n");
        }

        return """
                Assess the following regulation clause against the procedure evidence.

                CLAUSE %s%s:
                ===BEGIN===
                %s
                ===END===

                AUDIT TASKS:
                %s
                EVIDENCE:
                %s""".formatted(clause.id(), clause.title() != null ? " (" + clause.title() + ")" : "",
                clause.text(), tasks, excerpts);
    }
}
