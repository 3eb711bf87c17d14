package com.workpipe.engine;

import java.util.HashMap;
import java.util.Map;

/**
 * Attempt counts per normalized item key, shared by every stage of a run.
 * All access goes through the instance monitor.
 */
public class RetryTracker {
    private final Map<String, Integer> counts = new HashMap<>();
    private final int maxRetries;

    public RetryTracker(int maxRetries) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.maxRetries = maxRetries;
    }

    public synchronized int increment(WorkItem item) {
        return counts.merge(item.key(), 1, Integer::sum);
    }

    public synchronized int count(WorkItem item) {
        return counts.getOrDefault(item.key(), 0);
    }

    public synchronized boolean shouldProcess(WorkItem item) {
        return count(item) <= maxRetries;
    }

    public int maxRetries() {
        return maxRetries;
    }
}
