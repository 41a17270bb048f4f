package com.example.compliance.service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-run provider usage counters backed by an {@link InheritableThreadLocal}.
 *
 * <p>Usage pattern:
 * <pre>
 *   TokenUsageAccumulator usage = TokenUsageAccumulator.start();   // run thread, before the worker pool exists
 *   try {
 *       ...                                                        // workers inherit the same counters
 *   } finally {
 *       TokenUsageAccumulator.clear();
 *   }
 * </pre>
 */
public final class TokenUsageAccumulator {

    private static final InheritableThreadLocal<TokenUsageAccumulator> CONTEXT =
            new InheritableThreadLocal<>() {
                @Override
                protected TokenUsageAccumulator childValue(TokenUsageAccumulator parent) {
                    return parent;
                }
            };

    private final AtomicLong llmCalls = new AtomicLong();
    private final AtomicLong embeddingCalls = new AtomicLong();
    private final AtomicLong promptTokens = new AtomicLong();
    private final AtomicLong completionTokens = new AtomicLong();

    private TokenUsageAccumulator() {
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    public static TokenUsageAccumulator start() {
        TokenUsageAccumulator acc = new TokenUsageAccumulator();
        CONTEXT.set(acc);
        return acc;
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /** Accumulator bound to the current thread, or {@code null} outside a run. */
    public static TokenUsageAccumulator current() {
        return CONTEXT.get();
    }

    // ── Accumulation ─────────────────────────────────────────────────────────

    public void addLlmCall(long prompt, long completion) {
        llmCalls.incrementAndGet();
        promptTokens.addAndGet(prompt);
        completionTokens.addAndGet(completion);
    }

    public void addEmbeddingCall() {
        embeddingCalls.incrementAndGet();
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    public long getLlmCalls() {
        return llmCalls.get();
    }

    public long getEmbeddingCalls() {
        return embeddingCalls.get();
    }

    public long getPromptTokens() {
        return promptTokens.get();
    }

    public long getCompletionTokens() {
        return completionTokens.get();
    }

    @Override
    public String toString() {
        return "llmCalls=" + llmCalls + ", embeddingCalls=" + embeddingCalls
                + ", promptTokens=" + promptTokens + ", completionTokens=" + completionTokens;
    }
}
