package com.example.compliance.stage;

import com.example.compliance.model.PipelineSettings;
import com.example.compliance.model.ProjectConfig;
import com.example.compliance.progress.PipelineStage;
import com.example.compliance.progress.ProgressEvent;
import com.example.compliance.progress.ProgressListener;
import com.example.compliance.repository.RunStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Everything one run hands to its stages: the project, the immutable settings, the run state
 * store, the progress channel, the cancellation flag and the bounded worker pool.
 */
public final class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final ProjectConfig project;
    private final Path workDir;
    private final PipelineSettings settings;
    private final RunStateStore store;
    private final ProgressListener listener;
    private final CancellationToken token;
    private final ExecutorService workers;

    public RunContext(ProjectConfig project, Path workDir, PipelineSettings settings, RunStateStore store,
                      ProgressListener listener, CancellationToken token, ExecutorService workers) {
        this.project = project;
        this.workDir = workDir;
        this.settings = settings;
        this.store = store;
        this.listener = listener;
        this.token = token;
        this.workers = workers;
    }

    public ProjectConfig project() {
        return project;
    }

    public Path workDir() {
        return workDir;
    }

    public PipelineSettings settings() {
        return settings;
    }

    public RunStateStore store() {
        return store;
    }

    public boolean cancelled() {
        return token.isCancelled();
    }

    /**
     * Runs {@code work} for every item on the worker pool and waits for all of them. Items that
     * start after cancellation are skipped. Item handlers record their own failures; anything
     * they let through (storage failures) is rethrown here once every item has finished.
     */
    public <T> void forEach(List<T> items, Consumer<T> work) {
        CompletableFuture<?>[] futures = items.stream()
                .map(item -> CompletableFuture.runAsync(() -> {
                    if (!token.isCancelled()) {
                        work.accept(item);
                    }
                }, workers))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) throw runtime;
            if (cause instanceof Error error) throw error;
            throw e;
        }
    }

    public StageProgress progress(PipelineStage stage, int total) {
        return new StageProgress(stage, total);
    }

    /** Counts finished items of one stage and publishes an event per item. */
    public final class StageProgress {
        private final PipelineStage stage;
        private final int total;
        private final AtomicInteger completed = new AtomicInteger();

        private StageProgress(PipelineStage stage, int total) {
            this.stage = stage;
            this.total = total;
        }

        public void step(String clauseId, String taskId, String status, String message) {
            publish(ProgressEvent.builder(stage)
                    .clauseId(clauseId)
                    .taskId(taskId)
                    .status(status)
                    .message(message)
                    .counts(completed.incrementAndGet(), total)
                    .build());
        }

        /** An event that does not count as a finished item. */
        public void note(String status, String message) {
            publish(ProgressEvent.builder(stage)
                    .status(status)
                    .message(message)
                    .counts(completed.get(), total)
                    .build());
        }
    }

    public void publish(ProgressEvent event) {
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {}: {}", event, e.getMessage());
        }
    }
}
