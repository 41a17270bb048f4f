package com.example.compliance.stage;

import com.example.compliance.progress.PipelineStage;

/**
 * One pipeline stage. Implementations pick their own work items from the run state, skip
 * items whose results are already present, and persist each result as soon as it exists.
 */
public interface StageExecutor {

    PipelineStage stage();

    void execute(RunContext context);
}
