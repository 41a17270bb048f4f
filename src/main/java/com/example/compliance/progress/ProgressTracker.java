package com.example.compliance.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe recorder of the events of one run; forwards each event to a downstream listener.
 */
public final class ProgressTracker implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final CopyOnWriteArrayList<ProgressEvent> events = new CopyOnWriteArrayList<>();
    private final ProgressListener downstream;

    public ProgressTracker(ProgressListener downstream) {
        this.downstream = downstream != null ? downstream : ProgressListener.NONE;
    }

    @Override
    public void onProgress(ProgressEvent event) {
        events.add(event);
        log.debug("{}", event);
        downstream.onProgress(event);
    }

    /** Immutable snapshot of the recorded events in arrival order. */
    public List<ProgressEvent> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    /** Events recorded after the first {@code offset} ones. */
    public List<ProgressEvent> since(int offset) {
        List<ProgressEvent> all = snapshot();
        return offset >= all.size() ? List.of() : all.subList(Math.max(0, offset), all.size());
    }

    public ProgressEvent latest() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }
}
