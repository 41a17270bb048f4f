package com.example.compliance.exception;

/**
 * A persisted derived artifact (vector index) is inconsistent with its sources and must be rebuilt.
 */
public class InvalidationException extends PipelineException {

    public InvalidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
