package com.example.compliance.exception;

/**
 * Base type for every failure raised by the compliance pipeline.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
