package com.example.compliance.config;

import com.example.compliance.service.ContentCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * File-backed stores shared across projects.
 */
@Configuration
public class StorageConfig {

    @Bean
    public ContentCache contentCache(ComplianceProperties properties, ObjectMapper objectMapper) {
        return new ContentCache(Path.of(properties.storage().cacheDir()), objectMapper);
    }
}
