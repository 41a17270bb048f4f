package com.example.compliance.repository;

import com.example.compliance.exception.PersistenceException;
import com.example.compliance.model.AuditTask;
import com.example.compliance.model.RegulationClause;
import com.example.compliance.model.RunState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Owner of one project's {@code run.json}.
 * <p>
 * Every mutation applies a pure function to the in-memory snapshot under the store lock and
 * then flushes the whole snapshot atomically, so the file on disk is always a complete,
 * loadable state. Workers mutate different clauses; the lock serializes the flushes.
 */
public class RunStateStore {

    private static final Logger log = LoggerFactory.getLogger(RunStateStore.class);

    public static final String FILE_NAME = "run.json";

    private final Path file;
    private final ObjectMapper objectMapper;
    private RunState state;

    public RunStateStore(Path workDir, ObjectMapper objectMapper) {
        this.file = workDir.resolve(FILE_NAME);
        this.objectMapper = objectMapper;
    }

    public Path file() {
        return file;
    }

    /**
     * Reads the last flushed state. A file that cannot be parsed or carries a newer schema is
     * moved aside and reported as absent, so the next run starts clean instead of failing.
     */
    public Optional<RunState> readExisting() {
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            RunState loaded = objectMapper.readValue(file.toFile(), RunState.class);
            if (loaded.schemaVersion() > RunState.SCHEMA_VERSION) {
                backUp("unsupported schema version " + loaded.schemaVersion());
                return Optional.empty();
            }
            return Optional.of(loaded);
        } catch (IOException e) {
            backUp(e.getMessage());
            return Optional.empty();
        }
    }

    /** Installs {@code initial} as the current state and flushes it. */
    public synchronized void open(RunState initial) {
        state = initial;
        flush();
    }

    public synchronized RunState snapshot() {
        if (state == null) {
            throw new IllegalStateException("Run state not opened: " + file);
        }
        return state;
    }

    public synchronized RunState update(UnaryOperator<RunState> op) {
        state = op.apply(snapshot());
        flush();
        return state;
    }

    public synchronized RegulationClause updateClause(String clauseId, UnaryOperator<RegulationClause> op) {
        RegulationClause current = snapshot().clause(clauseId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown clause " + clauseId);
        }
        RegulationClause updated = op.apply(current);
        state = state.withClause(updated);
        flush();
        return updated;
    }

    public synchronized AuditTask updateTask(String clauseId, String taskId, UnaryOperator<AuditTask> op) {
        AuditTask[] result = new AuditTask[1];
        updateClause(clauseId, clause -> {
            List<AuditTask> tasks = clause.tasks().stream()
                    .map(t -> {
                        if (!t.id().equals(taskId)) return t;
                        result[0] = op.apply(t);
                        return result[0];
                    })
                    .toList();
            if (result[0] == null) {
                throw new IllegalArgumentException("Unknown task " + taskId + " in clause " + clauseId);
            }
            return clause.withTasks(tasks);
        });
        return result[0];
    }

    /** Removes the persisted state. */
    public synchronized boolean delete() {
        state = null;
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PersistenceException("Unable to delete " + file + ": " + e.getMessage(), e);
        }
    }

    private void flush() {
        try {
            AtomicFiles.write(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state));
        } catch (IOException e) {
            throw new PersistenceException("Unable to write run state " + file + ": " + e.getMessage(), e);
        }
    }

    private void backUp(String reason) {
        Path backup = file.resolveSibling(FILE_NAME + ".corrupt-" + System.currentTimeMillis());
        log.warn("Run state {} is unusable ({}); moving it to {} and starting fresh", file, reason, backup.getFileName());
        try {
            Files.move(file, backup);
        } catch (IOException e) {
            throw new PersistenceException("Unable to move unusable run state aside: " + e.getMessage(), e);
        }
    }
}
