package com.example.compliance.stage;

import com.example.compliance.config.AiConfig;
import com.example.compliance.model.PipelineSettings;
import com.example.compliance.model.ProjectConfig;
import com.example.compliance.model.RegulationClause;
import com.example.compliance.model.RunState;
import com.example.compliance.progress.ProgressTracker;
import com.example.compliance.repository.RunStateStore;
import com.example.compliance.service.ContentCache;
import com.example.compliance.service.Hashes;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Builds a {@link RunContext} over a temporary work directory for stage tests.
 */
final class StageTestSupport {

    static final ObjectMapper MAPPER = new AiConfig().objectMapper();

    static final PipelineSettings SETTINGS = new PipelineSettings("check-model", "plan-model", "judge-model",
            "embed-model", 2, 400, 4, 2, 0, Duration.ZERO);

    private StageTestSupport() {
    }

    static RegulationClause clause(String id, String text) {
        return RegulationClause.pending(id, null, text, null, Hashes.sha256(text));
    }

    static ContentCache cache(Path dir) {
        return new ContentCache(dir.resolve("cache"), MAPPER);
    }

    static RunContext context(Path dir, ExecutorService workers, ProgressTracker tracker,
                              RegulationClause... clauses) {
        return context(dir, workers, tracker, List.of(), clauses);
    }

    static RunContext context(Path dir, ExecutorService workers, ProgressTracker tracker,
                              List<String> procedures, RegulationClause... clauses) {
        RunStateStore store = new RunStateStore(dir.resolve("work"), MAPPER);
        store.open(RunState.merge(null, "p1", Arrays.asList(clauses)));
        ProjectConfig project = new ProjectConfig("p1", null, "regulation.json", procedures, null);
        return new RunContext(project, dir.resolve("work"), SETTINGS, store, tracker, new CancellationToken(), workers);
    }
}
