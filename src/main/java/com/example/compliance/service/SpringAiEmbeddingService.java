package com.example.compliance.service;

import com.example.compliance.model.RetryPolicy;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link EmbeddingService} over the auto-configured OpenAI {@link EmbeddingModel}.
 */
@Service
public class SpringAiEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;

    public SpringAiEmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embed(String text, String model, RetryPolicy retry) {
        return ResilientLlmCaller.withRetry("embedding@" + model, retry.maxRetries(), retry.backoff(), () -> {
            EmbeddingResponse response = embeddingModel.call(new EmbeddingRequest(List.of(text),
                    OpenAiEmbeddingOptions.builder().model(model).build()));
            if (response == null || response.getResult() == null || response.getResult().getOutput().length == 0) {
                throw new IllegalStateException("Empty embedding in provider response");
            }
            TokenUsageAccumulator acc = TokenUsageAccumulator.current();
            if (acc != null) {
                acc.addEmbeddingCall();
            }
            return response.getResult().getOutput();
        });
    }
}
