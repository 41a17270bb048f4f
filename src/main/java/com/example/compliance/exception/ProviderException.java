package com.example.compliance.exception;

/**
 * LLM or embedding provider call failed (network, auth, quota) after the bounded retries.
 */
public class ProviderException extends PipelineException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
