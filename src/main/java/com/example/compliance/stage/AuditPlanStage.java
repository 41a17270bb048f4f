package com.example.compliance.stage;

import com.example.compliance.exception.ProviderException;
import com.example.compliance.exception.ResponseParseException;
import com.example.compliance.model.AuditPlanResponse;
import com.example.compliance.model.AuditTask;
import com.example.compliance.model.ClauseStatus;
import com.example.compliance.model.RegulationClause;
import com.example.compliance.progress.PipelineStage;
import com.example.compliance.service.CacheKeys;
import com.example.compliance.service.ContentCache;
import com.example.compliance.service.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Expands every clause that needs a procedure into an ordered list of audit tasks (search
 * sentences). Clauses that need no procedure are marked SKIPPED. Tasks are persisted before
 * the Search stage starts.
 */
@Service
public class AuditPlanStage extends AbstractLlmStage {

    private static final Logger log = LoggerFactory.getLogger(AuditPlanStage.class);

    static final String CACHE_STAGE = "audit-plan-v1";

    private static final String SYSTEM_PROMPT = """
            You are a compliance auditor preparing an audit of internal procedure documents.

            TASK:
            Decompose a regulation clause into concrete audit tasks. Each task is one sentence that
            states what a compliant procedure document must contain, phrased so it can be used as a
            semantic search query against the procedure documents.

            RULES:
            - One verifiable obligation per task; keep the order in which the clause states them.
            - Use the vocabulary a procedure document would use (roles, steps, records, time limits).
            - Do not invent obligations the clause does not contain.
            - Between 1 and %d tasks.
            - Return JSON only, compliant with the provided schema.
            """;

    private static final String CORRECTION = """
            IMPORTANT: return a JSON object with a "tasks" array of between 1 and %d items, each with a
            non-empty "sentence" string. No prose outside the JSON.""";

    public AuditPlanStage(LlmService llmService, ContentCache cache) {
        super(llmService, cache);
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.AUDIT_PLAN;
    }

    @Override
    public void execute(RunContext context) {
        List<RegulationClause> checked = context.store().snapshot().clausesIn(ClauseStatus.NEED_CHECKED);
        log.info("AuditPlan: {} clause(s) to plan", checked.size());
        RunContext.StageProgress progress = context.progress(stage(), checked.size());
        if (checked.isEmpty()) {
            progress.note("SKIPPED", "No clause awaiting a plan");
            return;
        }
        context.forEach(checked, clause -> plan(context, clause, progress));
    }

    private void plan(RunContext context, RegulationClause clause, RunContext.StageProgress progress) {
        if (!Boolean.TRUE.equals(clause.needsProcedure())) {
            context.store().updateClause(clause.id(), c -> c.withStatus(ClauseStatus.SKIPPED));
            progress.step(clause.id(), null, ClauseStatus.SKIPPED.name(), "no procedure required");
            return;
        }

        int maxTasks = context.settings().maxTasksPerClause();
        String model = context.settings().auditPlanModel();
        String key = CacheKeys.of(CACHE_STAGE, model, clause.textHash(), "max=" + maxTasks);
        try {
            List<String> sentences = cache.get(key, AuditPlanResponse.class)
                    .map(AuditPlanStage::sentences)
                    .filter(s -> violation(s, maxTasks) == null)
                    .orElse(null);
            if (sentences == null) {
                AuditPlanResponse response = completeWithCorrection(clause.id(),
                        SYSTEM_PROMPT.formatted(maxTasks), userPrompt(clause), CORRECTION.formatted(maxTasks),
                        model, context.settings().retryPolicy(), AuditPlanResponse.class,
                        r -> violation(sentences(r), maxTasks));
                sentences = sentences(response);
                cache.put(key, response);
            }

            List<AuditTask> tasks = new ArrayList<>(sentences.size());
            for (int i = 0; i < sentences.size(); i++) {
                tasks.add(AuditTask.planned(taskId(clause.id(), i + 1), sentences.get(i)));
            }
            context.store().updateClause(clause.id(), c -> c.withPlan(tasks));
            log.debug("AuditPlan {}: {} task(s)", clause.id(), tasks.size());
            progress.step(clause.id(), null, ClauseStatus.PLANNED.name(), tasks.size() + " audit task(s)");
        } catch (ResponseParseException | ProviderException e) {
            String error = errorMessage("Audit-plan", e);
            log.error("AuditPlan {}: {}", clause.id(), error);
            context.store().updateClause(clause.id(), c -> c.failed(error));
            progress.step(clause.id(), null, ClauseStatus.FAILED.name(), error);
        }
    }

    /** Non-blank sentences, trimmed, first occurrence wins (case-insensitive). */
    static List<String> sentences(AuditPlanResponse response) {
        if (response == null || response.tasks() == null) return List.of();
        Set<String> seen = new LinkedHashSet<>();
        List<String> result = new ArrayList<>();
        for (AuditPlanResponse.PlannedTask task : response.tasks()) {
            if (task == null || task.sentence() == null) continue;
            String sentence = task.sentence().strip();
            if (!sentence.isEmpty() && seen.add(sentence.toLowerCase(Locale.ROOT))) {
                result.add(sentence);
            }
        }
        return result;
    }

    static String violation(List<String> sentences, int maxTasks) {
        if (sentences.isEmpty()) return "the plan contains no audit task";
        if (sentences.size() > maxTasks) {
            return "the plan contains " + sentences.size() + " tasks, at most " + maxTasks + " are allowed";
        }
        return null;
    }

    static String taskId(String clauseId, int index) {
        return "%s-T%02d".formatted(clauseId, index);
    }

    private static String userPrompt(RegulationClause clause) {
        return """
                Produce the audit tasks for the following regulation clause.

                CLAUSE %s%s:
                ===BEGIN===
                %s
                ===END===
                """.formatted(clause.id(), clause.title() != null ? " (" + clause.title() + ")" : "", clause.text());
    }
}
