package com.example.compliance.service;

import com.example.compliance.exception.ProviderException;
import com.example.compliance.model.RetryPolicy;

/**
 * Text embedding.
 */
public interface EmbeddingService {

    /**
     * @throws ProviderException on network, auth or quota failure after the retries {@code retry} allows
     */
    float[] embed(String text, String model, RetryPolicy retry);
}
