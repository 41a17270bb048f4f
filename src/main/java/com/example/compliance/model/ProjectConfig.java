package com.example.compliance.model;

import java.util.List;

/**
 * Registry entry for one audit project.
 *
 * @param id             project identifier
 * @param name           display name
 * @param regulationPath regulation JSON file
 * @param procedurePaths procedure documents to audit
 * @param workDir        directory for run state and index artifacts; null for the default location
 */
public record ProjectConfig(
        String id,
        String name,
        String regulationPath,
        List<String> procedurePaths,
        String workDir
) {
    public ProjectConfig {
        procedurePaths = procedurePaths == null ? List.of() : List.copyOf(procedurePaths);
        if (name == null || name.isBlank()) name = id;
    }
}
