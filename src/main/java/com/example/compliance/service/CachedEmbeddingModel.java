package com.example.compliance.service;

import com.example.compliance.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring AI {@link EmbeddingModel} that answers from the {@link ContentCache} and falls back to
 * the {@link EmbeddingService} on a miss. The vector store only ever sees this model, so chunk
 * and query embeddings are computed at most once per (text, model).
 * <p>
 * Input text is stripped before hashing: the vector store may surround document text with
 * formatting whitespace.
 */
public class CachedEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(CachedEmbeddingModel.class);

    static final String STAGE = "embedding";

    private final EmbeddingService delegate;
    private final ContentCache cache;
    private final String model;
    private final RetryPolicy retry;

    public CachedEmbeddingModel(EmbeddingService delegate, ContentCache cache, String model, RetryPolicy retry) {
        this.delegate = delegate;
        this.cache = cache;
        this.model = model;
        this.retry = retry;
    }

    @Override
    public EmbeddingResponse call(EmbeddingRequest request) {
        List<Embedding> embeddings = new ArrayList<>();
        List<String> inputs = request.getInstructions();
        for (int i = 0; i < inputs.size(); i++) {
            embeddings.add(new Embedding(embed(inputs.get(i)), i));
        }
        return new EmbeddingResponse(embeddings);
    }

    @Override
    public float[] embed(String text) {
        String input = text == null ? "" : text.strip();
        String key = keyFor(input);
        return cache.getEmbedding(key).orElseGet(() -> {
            log.debug("Embedding cache miss ({} chars)", input.length());
            float[] vector = delegate.embed(input, model, retry);
            cache.put(key, vector);
            return vector;
        });
    }

    @Override
    public float[] embed(Document document) {
        return embed(document.getText());
    }

    private String keyFor(String input) {
        return CacheKeys.of(STAGE, model, Hashes.sha256(input));
    }
}
