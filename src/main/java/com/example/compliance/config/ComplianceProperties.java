package com.example.compliance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the compliance pipeline.
 */
@ConfigurationProperties(prefix = "compliance")
public record ComplianceProperties(
        Storage storage,
        Pipeline pipeline,
        ExtractionService extractionService
) {

    public ComplianceProperties {
        if (storage == null) storage = new Storage(null, null, null);
        if (pipeline == null) pipeline = new Pipeline(null, null, null, null, 0, 0, 0, 0, null, null);
        if (extractionService == null) extractionService = new ExtractionService(null);
    }

    /**
     * On-disk locations.
     *
     * @param cacheDir     global content cache, shared by all projects
     * @param projectsDir  default parent of per-project work directories
     * @param registryFile JSON file listing the configured projects
     */
    public record Storage(String cacheDir, String projectsDir, String registryFile) {
        public Storage {
            if (cacheDir == null || cacheDir.isBlank()) cacheDir = "data/cache";
            if (projectsDir == null || projectsDir.isBlank()) projectsDir = "data/projects";
            if (registryFile == null || registryFile.isBlank()) registryFile = "data/projects.json";
        }
    }

    /**
     * Defaults for {@link com.example.compliance.model.PipelineSettings}.
     */
    public record Pipeline(
            String needCheckModel,
            String auditPlanModel,
            String judgeModel,
            String embeddingModel,
            int topK,
            int maxChunkTokens,
            int maxTasksPerClause,
            int workers,
            Integer providerMaxRetries,
            Long providerBackoffMs
    ) {
        public Pipeline {
            if (needCheckModel == null) needCheckModel = "gpt-4o-mini";
            if (auditPlanModel == null) auditPlanModel = "gpt-4o";
            if (judgeModel == null) judgeModel = "gpt-4o";
            if (embeddingModel == null) embeddingModel = "text-embedding-3-small";
            if (topK <= 0) topK = 5;
            if (maxChunkTokens <= 0) maxChunkTokens = 400;
            if (maxTasksPerClause <= 0) maxTasksPerClause = 8;
            if (workers <= 0) workers = 4;
            if (providerMaxRetries == null) providerMaxRetries = 2;
            if (providerBackoffMs == null) providerBackoffMs = 2000L;
        }
    }

    /**
     * Text extraction service used for PDF procedure documents.
     *
     * @param baseUrl base URL of the service (e.g. http://localhost:5001); blank disables PDF input
     */
    public record ExtractionService(String baseUrl) {
        public boolean enabled() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }
}
