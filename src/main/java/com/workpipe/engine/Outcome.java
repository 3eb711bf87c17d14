package com.workpipe.engine;

public enum Outcome {
    DELIVERED(true),
    /** Resubmitted to the retries queue; the item is still live. */
    RETRIED(false),
    DEAD(true),
    DROPPED_BACKPRESSURE(true),
    /** Refused by the producer because the key was already exhausted. */
    SKIPPED(true);

    private final boolean terminal;

    Outcome(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
