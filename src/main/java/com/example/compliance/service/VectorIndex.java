package com.example.compliance.service;

import com.example.compliance.model.ProcedureChunk;
import com.example.compliance.model.ScoredChunk;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.SimpleVectorStore;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable build of a project's chunk corpus. Chunks are addressed by id and ordinal;
 * the store only holds their embeddings.
 */
public class VectorIndex {

    private static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparingInt(s -> s.chunk().ordinal());

    private final String buildId;
    private final SimpleVectorStore store;
    private final Map<String, ProcedureChunk> chunksById = new LinkedHashMap<>();

    VectorIndex(String buildId, SimpleVectorStore store, List<ProcedureChunk> chunks) {
        this.buildId = buildId;
        this.store = store;
        chunks.forEach(c -> chunksById.put(c.chunkId(), c));
    }

    public String buildId() {
        return buildId;
    }

    public int size() {
        return chunksById.size();
    }

    /**
     * Top {@code k} chunks by descending cosine similarity to {@code sentence}; equal scores keep
     * corpus insertion order. An empty index answers an empty list without embedding the query.
     */
    public List<ScoredChunk> query(String sentence, int k) {
        if (chunksById.isEmpty() || k <= 0) {
            return List.of();
        }
        List<Document> hits = store.similaritySearch(SearchRequest.builder()
                .query(sentence)
                .topK(chunksById.size())
                .similarityThresholdAll()
                .build());
        return hits.stream()
                .map(d -> {
                    ProcedureChunk chunk = chunksById.get(d.getId());
                    return chunk == null ? null : new ScoredChunk(chunk, d.getScore() != null ? d.getScore() : 0.0);
                })
                .filter(Objects::nonNull)
                .sorted(RANKING)
                .limit(k)
                .toList();
    }
}
