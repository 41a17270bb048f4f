package com.example.compliance.model;

/**
 * One retrieved chunk for an audit task. Refers to the chunk by handle and carries
 * enough citation data to quote the source without reopening the index.
 *
 * @param chunkId     handle of the chunk in the index build
 * @param ordinal     insertion position of the chunk in the corpus
 * @param score       cosine similarity to the task sentence
 * @param sourcePath  procedure document the chunk comes from
 * @param startOffset first character of the chunk in the source text
 * @param endOffset   character after the last one of the chunk in the source text
 * @param section     nearest preceding heading, may be null
 * @param text        chunk text
 * @param textHash    SHA-256 of the chunk text
 */
public record MatchResult(
        String chunkId,
        int ordinal,
        double score,
        String sourcePath,
        int startOffset,
        int endOffset,
        String section,
        String text,
        String textHash
) {
    public static MatchResult of(ScoredChunk hit) {
        ProcedureChunk c = hit.chunk();
        return new MatchResult(c.chunkId(), c.ordinal(), hit.score(), c.documentPath(),
                c.startOffset(), c.endOffset(), c.section(), c.text(), c.textHash());
    }
}
