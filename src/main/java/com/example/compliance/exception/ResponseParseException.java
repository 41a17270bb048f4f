package com.example.compliance.exception;

/**
 * The provider answered, but the answer does not match the expected structure.
 */
public class ResponseParseException extends PipelineException {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
