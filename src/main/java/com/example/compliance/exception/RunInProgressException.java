package com.example.compliance.exception;

/**
 * Another pipeline run already owns the project's run state.
 */
public class RunInProgressException extends PipelineException {

    public RunInProgressException(String projectId) {
        super("A pipeline run is already in progress for project '" + projectId + "'");
    }
}
