package com.example.compliance.progress;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable value object describing one unit of pipeline work that just finished.
 */
public final class ProgressEvent {

    private final long timestamp;
    private final PipelineStage stage;
    private final String clauseId;
    private final String taskId;
    private final String status;
    private final String message;
    private final int completed;
    private final int total;
    private final int percentComplete;
    private final Map<String, Object> details;

    private ProgressEvent(Builder b) {
        this.timestamp = b.timestamp;
        this.stage = b.stage;
        this.clauseId = b.clauseId;
        this.taskId = b.taskId;
        this.status = b.status;
        this.message = b.message;
        this.completed = b.completed;
        this.total = b.total;
        this.percentComplete = stage.percent(b.completed, b.total);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(b.details));
    }

    public long getTimestamp() {
        return timestamp;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public String getClauseId() {
        return clauseId;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public int getCompleted() {
        return completed;
    }

    public int getTotal() {
        return total;
    }

    public int getPercentComplete() {
        return percentComplete;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "[" + stage + " " + completed + "/" + total + "] "
                + (clauseId != null ? clauseId + " " : "")
                + (taskId != null ? taskId + " " : "")
                + status + (message != null ? " - " + message : "");
    }

    public static Builder builder(PipelineStage stage) {
        return new Builder(stage);
    }

    public static final class Builder {
        private final PipelineStage stage;
        private long timestamp = System.currentTimeMillis();
        private String clauseId;
        private String taskId;
        private String status = "";
        private String message;
        private int completed;
        private int total;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(PipelineStage stage) {
            this.stage = Objects.requireNonNull(stage, "stage");
        }

        public Builder clauseId(String clauseId) {
            this.clauseId = clauseId;
            return this;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder counts(int completed, int total) {
            this.completed = completed;
            this.total = total;
            return this;
        }

        public Builder putDetail(String key, Object value) {
            if (key != null && value != null) {
                this.details.put(key, value);
            }
            return this;
        }

        public ProgressEvent build() {
            return new ProgressEvent(this);
        }
    }
}
