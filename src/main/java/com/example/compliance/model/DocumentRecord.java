package com.example.compliance.model;

/**
 * Fingerprint of one procedure document as seen by the last Search stage.
 * Any difference between runs invalidates the vector index.
 */
public record DocumentRecord(
        String path,
        String contentHash,
        long lastModified,
        int chunkCount,
        DocumentStatus status,
        String error
) {
    public static DocumentRecord ingested(RawDoc doc, int chunkCount) {
        return new DocumentRecord(doc.path(), doc.contentHash(), doc.lastModified(), chunkCount,
                DocumentStatus.INGESTED, null);
    }

    public static DocumentRecord failed(String path, String error) {
        return new DocumentRecord(path, null, 0L, 0, DocumentStatus.INGESTION_FAILED, error);
    }
}
