package com.example.compliance.controller;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.exception.RunInProgressException;
import com.example.compliance.model.PipelineSettings;
import com.example.compliance.model.ProjectConfig;
import com.example.compliance.orchestrator.PipelineOrchestrator;
import com.example.compliance.progress.ProgressEvent;
import com.example.compliance.progress.ProgressListener;
import com.example.compliance.repository.ProjectRegistry;
import com.example.compliance.service.ContentCache;
import com.example.compliance.service.DocumentIngestionService;
import com.example.compliance.stage.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for audit projects and their pipeline runs.
 */
@RestController
@RequestMapping("/api")
public class ProjectRunController {

    private static final Logger log = LoggerFactory.getLogger(ProjectRunController.class);

    private final PipelineOrchestrator orchestrator;
    private final ProjectRegistry projectRegistry;
    private final ContentCache contentCache;
    private final DocumentIngestionService ingestionService;
    private final ComplianceProperties properties;

    public ProjectRunController(PipelineOrchestrator orchestrator,
                                ProjectRegistry projectRegistry,
                                ContentCache contentCache,
                                DocumentIngestionService ingestionService,
                                ComplianceProperties properties) {
        this.orchestrator = orchestrator;
        this.projectRegistry = projectRegistry;
        this.contentCache = contentCache;
        this.ingestionService = ingestionService;
        this.properties = properties;
    }

    @GetMapping("/projects")
    public List<ProjectConfig> listProjects() {
        return projectRegistry.findAll();
    }

    /**
     * Registers a project, or replaces the one with the same id.
     *
     * <p>Endpoint: POST /api/projects
     */
    @PostMapping("/projects")
    public ResponseEntity<?> saveProject(@RequestBody ProjectConfig project) {
        if (project.id() == null || project.id().isBlank()) {
            return badRequest("Project id is required.");
        }
        if (project.regulationPath() == null || project.regulationPath().isBlank()) {
            return badRequest("Regulation path is required.");
        }
        if (orchestrator.isRunning(project.id())) {
            return conflict(project.id());
        }
        return ResponseEntity.ok(projectRegistry.save(project));
    }

    @DeleteMapping("/projects/{id}")
    public ResponseEntity<?> deleteProject(@PathVariable String id) {
        if (orchestrator.isRunning(id)) {
            return conflict(id);
        }
        return projectRegistry.remove(id)
                ? ResponseEntity.noContent().build()
                : notFound(id);
    }

    /**
     * Starts a pipeline run in the background.
     *
     * <p>Endpoint: POST /api/projects/{id}/runs
     * <p>Parameter: topK (optional override of the configured K)
     */
    @PostMapping("/projects/{id}/runs")
    public ResponseEntity<?> startRun(@PathVariable String id,
                                      @RequestParam(value = "topK", required = false) Integer topK) {
        Optional<ProjectConfig> project = projectRegistry.findById(id);
        if (project.isEmpty()) {
            return notFound(id);
        }
        if (orchestrator.isRunning(id)) {
            return conflict(id);
        }
        PipelineSettings settings;
        try {
            settings = PipelineSettings.from(properties.pipeline());
            if (topK != null) {
                settings = settings.withTopK(topK);
            }
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }

        log.info("Starting run for project '{}' (K={})", id, settings.topK());
        orchestrator.runAsync(project.get(), settings, ProgressListener.NONE, new CancellationToken());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("projectId", id, "status", "STARTED", "topK", settings.topK()));
    }

    @PostMapping("/projects/{id}/runs/cancel")
    public ResponseEntity<?> cancelRun(@PathVariable String id) {
        if (!orchestrator.cancel(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No active run for project " + id));
        }
        return ResponseEntity.accepted().body(Map.of("projectId", id, "status", "CANCELLING"));
    }

    /**
     * Returns the last flushed run state; during a run this is the live snapshot.
     *
     * <p>Endpoint: GET /api/projects/{id}/run
     */
    @GetMapping("/projects/{id}/run")
    public ResponseEntity<?> runState(@PathVariable String id) {
        Optional<ProjectConfig> project = projectRegistry.findById(id);
        if (project.isEmpty()) {
            return notFound(id);
        }
        return orchestrator.currentState(project.get())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Project " + id + " has no run state")));
    }

    /** Discards the persisted run state so the next run starts over (cache entries survive). */
    @DeleteMapping("/projects/{id}/run")
    public ResponseEntity<?> deleteRunState(@PathVariable String id) {
        Optional<ProjectConfig> project = projectRegistry.findById(id);
        if (project.isEmpty()) {
            return notFound(id);
        }
        try {
            orchestrator.deleteState(project.get());
            return ResponseEntity.noContent().build();
        } catch (RunInProgressException e) {
            return conflict(id);
        }
    }

    @GetMapping("/projects/{id}/progress")
    public List<ProgressEvent> progress(@PathVariable String id,
                                        @RequestParam(value = "since", defaultValue = "0") int since) {
        return orchestrator.progress(id, Math.max(0, since));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        contentCache.clear();
        return ResponseEntity.noContent().build();
    }

    /**
     * Checks the status of the PDF extraction service.
     *
     * <p>Endpoint: GET /api/extraction/health
     */
    @GetMapping("/extraction/health")
    public ResponseEntity<Map<String, Object>> extractionHealth() {
        boolean up = ingestionService.isServiceAvailable();
        return ResponseEntity.ok(Map.of(
                "status", up ? "ok" : "degraded",
                "pdfExtractor", up ? "up" : "down"
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private ResponseEntity<Map<String, String>> notFound(String id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Unknown project " + id));
    }

    private ResponseEntity<Map<String, String>> conflict(String id) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "A run is already in progress for project " + id));
    }
}
