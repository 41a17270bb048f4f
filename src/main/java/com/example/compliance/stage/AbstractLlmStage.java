package com.example.compliance.stage;

import com.example.compliance.exception.ResponseParseException;
import com.example.compliance.model.RetryPolicy;
import com.example.compliance.service.ContentCache;
import com.example.compliance.service.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Shared LLM plumbing of the NeedCheck, AuditPlan and Judge stages: cache-aware completion with
 * one corrective re-prompt when the answer is malformed.
 */
abstract class AbstractLlmStage implements StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(AbstractLlmStage.class);

    protected final LlmService llmService;
    protected final ContentCache cache;

    protected AbstractLlmStage(LlmService llmService, ContentCache cache) {
        this.llmService = llmService;
        this.cache = cache;
    }

    /**
     * Asks the model, validates the answer, and on a malformed answer asks once more with
     * {@code correction} and the violation appended to the user prompt.
     *
     * @param validator returns a violation message, or null when the answer is acceptable
     * @throws ResponseParseException when the second answer is malformed too
     */
    protected <T> T completeWithCorrection(String itemId, String systemPrompt, String userPrompt, String correction,
                                           String model, RetryPolicy retry, Class<T> type,
                                           Function<T, String> validator) {
        try {
            return validated(llmService.complete(systemPrompt, userPrompt, model, type, retry), validator);
        } catch (ResponseParseException first) {
            log.warn("{} {}: malformed answer ({}), re-prompting with stricter instructions",
                    stage(), itemId, first.getMessage());
            String corrective = userPrompt + "\n\n" + correction
                    + "\nYour previous answer was rejected: " + first.getMessage();
            return validated(llmService.complete(systemPrompt, corrective, model, type, retry), validator);
        }
    }

    private static <T> T validated(T answer, Function<T, String> validator) {
        String violation = validator.apply(answer);
        if (violation != null) {
            throw new ResponseParseException(violation);
        }
        return answer;
    }

    static String errorMessage(String stage, RuntimeException e) {
        return stage + " failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
}
