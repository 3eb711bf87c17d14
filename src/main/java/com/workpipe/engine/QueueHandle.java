package com.workpipe.engine;

/** Operations shared by both ends of a {@link WorkQueue}. */
public interface QueueHandle {
    String name();

    int capacity();

    int size();

    boolean isEmpty();

    boolean isClosed();

    /** Rings {@code signal} after every enqueue, dequeue, acknowledgement and close. */
    void watch(Signal signal);
}
