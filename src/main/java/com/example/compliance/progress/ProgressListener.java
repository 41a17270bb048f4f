package com.example.compliance.progress;

/**
 * Receives an event after every unit of pipeline work. Called from worker threads.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> { };

    void onProgress(ProgressEvent event);
}
