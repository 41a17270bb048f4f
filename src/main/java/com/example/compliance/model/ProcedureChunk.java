package com.example.compliance.model;

/**
 * Retrievable unit of a normalized procedure document.
 *
 * @param chunkId      stable handle, derived from the document hash and the chunk position
 * @param ordinal      insertion order in the corpus, used as similarity tie-break
 * @param documentPath source document
 * @param documentHash SHA-256 of the source document bytes
 * @param text         normalized chunk text
 * @param textHash     SHA-256 of {@code text}
 * @param startOffset  first character of the chunk in the source text
 * @param endOffset    character after the last one of the chunk in the source text
 * @param section      nearest preceding heading, may be null
 * @param tokenCount   token estimate of {@code text}
 */
public record ProcedureChunk(
        String chunkId,
        int ordinal,
        String documentPath,
        String documentHash,
        String text,
        String textHash,
        int startOffset,
        int endOffset,
        String section,
        int tokenCount
) {
}
