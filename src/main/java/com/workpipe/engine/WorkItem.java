package com.workpipe.engine;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One attempt at a logical item. The label carries the attempt as a
 * " (retry n)" suffix; {@link #key()} strips it so every attempt of the same
 * item shares one retry budget.
 */
public class WorkItem {
    private static final String PREFIX = "Item #";
    private static final Pattern RETRY_SUFFIX = Pattern.compile("^(.*?)(?: \\(retry \\d+\\))+$");

    public final long id;
    public final int attempt;      // 0 for the first offer
    public final String label;

    private WorkItem(long id, int attempt, String label) {
        this.id = id;
        this.attempt = attempt;
        this.label = label;
    }

    public static WorkItem first(long id) {
        return new WorkItem(id, 0, PREFIX + id);
    }

    /** Same logical item, relabelled for the given retry attempt. */
    public WorkItem retry(int attempt) {
        if (attempt <= 0) throw new IllegalArgumentException("retry attempt must be > 0");
        return new WorkItem(id, attempt, key() + " (retry " + attempt + ")");
    }

    public String key() {
        return normalize(label);
    }

    /** Strips any retry suffixes; labels without one come back unchanged. */
    public static String normalize(String label) {
        if (label == null) throw new IllegalArgumentException("label must not be null");
        Matcher m = RETRY_SUFFIX.matcher(label);
        return m.matches() ? m.group(1) : label;
    }

    @Override
    public String toString() {
        return label;
    }
}
