package com.example.compliance.exception;

/**
 * A single input file could not be read, decoded or extracted.
 * Recorded against that document; the run continues with the others.
 */
public class IngestionException extends PipelineException {

    private final String path;

    public IngestionException(String path, String message) {
        super(message);
        this.path = path;
    }

    public IngestionException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
