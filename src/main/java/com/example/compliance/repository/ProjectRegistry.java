package com.example.compliance.repository;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.exception.PersistenceException;
import com.example.compliance.model.ProjectConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Project registry persisted as a JSON array of {@link ProjectConfig}.
 */
@Repository
public class ProjectRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProjectRegistry.class);

    private final Path file;
    private final Path projectsDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public ProjectRegistry(ComplianceProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.storage().registryFile()), Path.of(properties.storage().projectsDir()), objectMapper);
    }

    public ProjectRegistry(Path file, Path projectsDir, ObjectMapper objectMapper) {
        this.file = file;
        this.projectsDir = projectsDir;
        this.objectMapper = objectMapper;
    }

    public synchronized List<ProjectConfig> findAll() {
        if (!Files.isRegularFile(file)) return List.of();
        try {
            return objectMapper.readValue(file.toFile(), new TypeReference<List<ProjectConfig>>() {});
        } catch (IOException e) {
            throw new PersistenceException("Unable to read project registry " + file + ": " + e.getMessage(), e);
        }
    }

    public Optional<ProjectConfig> findById(String id) {
        return findAll().stream().filter(p -> p.id().equals(id)).findFirst();
    }

    /** Inserts or replaces the project with the same id. */
    public synchronized ProjectConfig save(ProjectConfig project) {
        if (project.id() == null || project.id().isBlank()) {
            throw new IllegalArgumentException("Project id is required");
        }
        List<ProjectConfig> projects = new ArrayList<>(findAll());
        projects.removeIf(p -> p.id().equals(project.id()));
        projects.add(project);
        write(projects);
        log.info("Saved project '{}'", project.id());
        return project;
    }

    public synchronized boolean remove(String id) {
        List<ProjectConfig> projects = new ArrayList<>(findAll());
        boolean removed = projects.removeIf(p -> p.id().equals(id));
        if (removed) {
            write(projects);
            log.info("Removed project '{}'", id);
        }
        return removed;
    }

    /** Work directory of {@code project}: its own setting, or a folder under the projects directory. */
    public Path workDir(ProjectConfig project) {
        return project.workDir() != null && !project.workDir().isBlank()
                ? Path.of(project.workDir())
                : projectsDir.resolve(project.id());
    }

    private void write(List<ProjectConfig> projects) {
        try {
            AtomicFiles.write(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(projects));
        } catch (IOException e) {
            throw new PersistenceException("Unable to write project registry " + file + ": " + e.getMessage(), e);
        }
    }
}
