package com.example.compliance.exception;

/**
 * Durable storage could not be written. Fatal for the current run.
 */
public class PersistenceException extends PipelineException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
