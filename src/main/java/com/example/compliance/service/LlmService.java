package com.example.compliance.service;

import com.example.compliance.exception.ProviderException;
import com.example.compliance.exception.ResponseParseException;
import com.example.compliance.model.RetryPolicy;

/**
 * Structured LLM completion.
 */
public interface LlmService {

    /**
     * Sends one prompt and binds the answer to {@code responseType}. Provider failures are
     * retried according to {@code retry}.
     *
     * @throws ProviderException      on network, auth or quota failure after retries
     * @throws ResponseParseException when the answer does not bind to {@code responseType}
     */
    <T> T complete(String systemPrompt, String userPrompt, String model, Class<T> responseType, RetryPolicy retry);
}
