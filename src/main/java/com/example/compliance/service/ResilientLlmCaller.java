package com.example.compliance.service;

import com.example.compliance.exception.ProviderException;
import com.example.compliance.exception.ResponseParseException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Provider calls with bounded retry and lenient JSON parsing.
 * <p>
 * Provider failures (network, auth, quota, empty answers) are retried up to {@code maxRetries}
 * times with a linearly growing delay and then surface as {@link ProviderException}. Parse
 * failures are not retried here: they surface at once as {@link ResponseParseException} so the
 * caller can re-prompt with a corrective instruction.
 * <p>
 * The lenient mapper tolerates trailing commas, Java comments, single quotes, unquoted field
 * names and unknown fields.
 */
public final class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);

    static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ResilientLlmCaller() {
    }

    /**
     * Calls the model and binds the answer to {@code type}. Format instructions from
     * {@link BeanOutputConverter} are appended to the user prompt.
     */
    public static <T> T callEntity(ChatClient chatClient, String systemPrompt, String userPrompt, String model,
                                   Class<T> type, int maxRetries, Duration backoff) {
        var converter = new BeanOutputConverter<>(type, LENIENT_MAPPER);
        String fullUserPrompt = userPrompt + "\n\n" + converter.getFormat();
        String operation = type.getSimpleName() + "@" + model;

        String content = withRetry(operation, maxRetries, backoff, () -> {
            ChatResponse chatResponse = chatClient.prompt()
                    .system(systemPrompt)
                    .user(fullUserPrompt)
                    .options(ChatOptions.builder().model(model).build())
                    .call()
                    .chatResponse();

            captureTokenUsage(chatResponse, operation);

            String text = (chatResponse != null && chatResponse.getResult() != null)
                    ? chatResponse.getResult().getOutput().getText()
                    : null;
            if (text == null || text.isBlank()) {
                throw new IllegalStateException("Empty or null content in LLM response");
            }
            return text;
        });

        try {
            T value = converter.convert(content);
            if (value == null) {
                throw new ResponseParseException(operation + ": answer bound to null");
            }
            return value;
        } catch (ResponseParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResponseParseException(operation + ": answer does not match the expected schema: "
                    + rootCauseMessage(e), e);
        }
    }

    /**
     * Runs {@code call} up to {@code maxRetries + 1} times. A {@link ResponseParseException}
     * is rethrown immediately; any other failure is retried after {@code attempt * backoff}.
     */
    public static <T> T withRetry(String operation, int maxRetries, Duration backoff, Supplier<T> call) {
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            try {
                return call.get();
            } catch (ResponseParseException e) {
                throw e;
            } catch (RuntimeException e) {
                lastError = e;
                if (attempt <= maxRetries) {
                    long delay = backoff.toMillis() * attempt;
                    log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                            operation, attempt, maxRetries + 1, rootCauseMessage(e), delay);
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        throw new ProviderException("Provider call " + operation + " failed after " + (maxRetries + 1)
                + " attempts: " + rootCauseMessage(lastError), lastError);
    }

    private static void captureTokenUsage(ChatResponse chatResponse, String operation) {
        TokenUsageAccumulator acc = TokenUsageAccumulator.current();
        if (acc == null) return;
        long prompt = 0;
        long completion = 0;
        if (chatResponse != null && chatResponse.getMetadata() != null
                && chatResponse.getMetadata().getUsage() != null) {
            var usage = chatResponse.getMetadata().getUsage();
            prompt = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
            completion = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
        }
        acc.addLlmCall(prompt, completion);
        log.debug("{}: +{} prompt / +{} completion tokens", operation, prompt, completion);
    }

    static String rootCauseMessage(Throwable e) {
        if (e == null) return "unknown error";
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
