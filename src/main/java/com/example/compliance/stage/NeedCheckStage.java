package com.example.compliance.stage;

import com.example.compliance.exception.ProviderException;
import com.example.compliance.exception.ResponseParseException;
import com.example.compliance.model.ClauseStatus;
import com.example.compliance.model.NeedCheckResponse;
import com.example.compliance.model.RegulationClause;
import com.example.compliance.progress.PipelineStage;
import com.example.compliance.service.CacheKeys;
import com.example.compliance.service.ContentCache;
import com.example.compliance.service.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides for each clause whether it must be backed by a documented internal procedure.
 * Clauses that already carry a decision are left alone.
 */
@Service
public class NeedCheckStage extends AbstractLlmStage {

    private static final Logger log = LoggerFactory.getLogger(NeedCheckStage.class);

    static final String CACHE_STAGE = "need-check-v1";

    private static final String SYSTEM_PROMPT = """
            You are a regulatory compliance analyst.

            TASK:
            Decide whether a regulation clause requires the organization to maintain a documented
            internal procedure (a written process, policy or work instruction) to demonstrate compliance.

            RULES:
            - requiresProcedure = true when the clause imposes an obligation the organization must carry out
              repeatedly or on events (e.g. classify incidents, review access rights, notify authorities).
            - requiresProcedure = false for definitions, scope statements, purpose statements, and
              obligations addressed to someone other than the organization.
            - reasoning: one or two sentences, in the language of the clause.
            - Return JSON only, compliant with the provided schema.
            """;

    private static final String CORRECTION = """
            IMPORTANT: answer with a single JSON object containing the boolean field "requiresProcedure"
            (true or false, never null) and the string field "reasoning". No prose outside the JSON.""";

    public NeedCheckStage(LlmService llmService, ContentCache cache) {
        super(llmService, cache);
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.NEED_CHECK;
    }

    @Override
    public void execute(RunContext context) {
        List<RegulationClause> pending = context.store().snapshot().clauses().values().stream()
                .filter(c -> c.needsProcedure() == null && c.status() == ClauseStatus.PENDING)
                .toList();
        log.info("NeedCheck: {} clause(s) to classify", pending.size());
        RunContext.StageProgress progress = context.progress(stage(), pending.size());
        if (pending.isEmpty()) {
            progress.note("SKIPPED", "All clauses already classified");
            return;
        }
        String model = context.settings().needCheckModel();
        context.forEach(pending, clause -> classify(context, clause, model, progress));
    }

    private void classify(RunContext context, RegulationClause clause, String model,
                          RunContext.StageProgress progress) {
        String key = CacheKeys.of(CACHE_STAGE, model, clause.textHash());
        try {
            NeedCheckResponse response = cache.get(key, NeedCheckResponse.class)
                    .filter(r -> r.requiresProcedure() != null)
                    .orElse(null);
            if (response == null) {
                response = completeWithCorrection(clause.id(), SYSTEM_PROMPT, userPrompt(clause), CORRECTION,
                        model, context.settings().retryPolicy(), NeedCheckResponse.class,
                        r -> r.requiresProcedure() == null ? "requiresProcedure is missing" : null);
                cache.put(key, response);
            }
            boolean needs = response.requiresProcedure();
            context.store().updateClause(clause.id(), c -> c.withNeedsProcedure(needs));
            log.debug("NeedCheck {}: requiresProcedure={}", clause.id(), needs);
            progress.step(clause.id(), null, ClauseStatus.NEED_CHECKED.name(),
                    needs ? "requires a procedure" : "no procedure required");
        } catch (ResponseParseException | ProviderException e) {
            String error = errorMessage("Need-check", e);
            log.error("NeedCheck {}: {}", clause.id(), error);
            context.store().updateClause(clause.id(), c -> c.failed(error));
            progress.step(clause.id(), null, ClauseStatus.FAILED.name(), error);
        }
    }

    private static String userPrompt(RegulationClause clause) {
        return """
                Does the following regulation clause require a documented internal procedure?

                CLAUSE %s%s:
                ===BEGIN===
                %s
                ===END===
                """.formatted(clause.id(), clause.title() != null ? " (" + clause.title() + ")" : "", clause.text());
    }
}
