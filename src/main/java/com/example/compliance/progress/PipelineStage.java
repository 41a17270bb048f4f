package com.example.compliance.progress;

/**
 * Pipeline stages with the share of overall progress each one covers.
 */
public enum PipelineStage {
    LOAD(0.0, 0.1),
    NEED_CHECK(0.1, 0.3),
    AUDIT_PLAN(0.3, 0.6),
    SEARCH(0.6, 0.8),
    JUDGE(0.8, 1.0),
    DONE(1.0, 1.0);

    private final double from;
    private final double to;

    PipelineStage(double from, double to) {
        this.from = from;
        this.to = to;
    }

    /** Overall progress (0-100) after {@code completed} of {@code total} items of this stage. */
    public int percent(int completed, int total) {
        double within = total <= 0 ? 1.0 : Math.min(1.0, (double) completed / total);
        return (int) Math.round((from + (to - from) * within) * 100);
    }
}
