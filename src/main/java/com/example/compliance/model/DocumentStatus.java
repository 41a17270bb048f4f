package com.example.compliance.model;

public enum DocumentStatus {
    INGESTED,
    INGESTION_FAILED
}
