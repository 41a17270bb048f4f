package com.example.compliance.model;

import com.example.compliance.config.ComplianceProperties;

import java.time.Duration;

/**
 * Immutable parameter object handed to every run. Nothing in the pipeline reads configuration
 * from anywhere else.
 */
public record PipelineSettings(
        String needCheckModel,
        String auditPlanModel,
        String judgeModel,
        String embeddingModel,
        int topK,
        int maxChunkTokens,
        int maxTasksPerClause,
        int workers,
        int providerMaxRetries,
        Duration providerBackoff
) {
    public PipelineSettings {
        requireText(needCheckModel, "needCheckModel");
        requireText(auditPlanModel, "auditPlanModel");
        requireText(judgeModel, "judgeModel");
        requireText(embeddingModel, "embeddingModel");
        if (topK < 1) throw new IllegalArgumentException("topK must be at least 1");
        if (maxChunkTokens < 16) throw new IllegalArgumentException("maxChunkTokens must be at least 16");
        if (maxTasksPerClause < 1) throw new IllegalArgumentException("maxTasksPerClause must be at least 1");
        if (workers < 1) throw new IllegalArgumentException("workers must be at least 1");
        if (providerMaxRetries < 0) throw new IllegalArgumentException("providerMaxRetries must not be negative");
        if (providerBackoff == null || providerBackoff.isNegative()) providerBackoff = Duration.ZERO;
    }

    public static PipelineSettings from(ComplianceProperties.Pipeline p) {
        return new PipelineSettings(p.needCheckModel(), p.auditPlanModel(), p.judgeModel(), p.embeddingModel(),
                p.topK(), p.maxChunkTokens(), p.maxTasksPerClause(), p.workers(),
                p.providerMaxRetries(), Duration.ofMillis(p.providerBackoffMs()));
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(providerMaxRetries, providerBackoff);
    }

    public PipelineSettings withTopK(int k) {
        return new PipelineSettings(needCheckModel, auditPlanModel, judgeModel, embeddingModel, k,
                maxChunkTokens, maxTasksPerClause, workers, providerMaxRetries, providerBackoff);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must be configured");
        }
    }
}
