package com.workpipe.engine;

/** Consumer end of a {@link WorkQueue}. */
public interface QueueSource<T> extends QueueHandle {

    /** Blocks until an item arrives; returns null once the queue is closed and drained. */
    T take() throws InterruptedException;

    /** Returns the head item, or null if none is queued right now. */
    T poll();

    /** Acknowledges that one taken item is fully handled. */
    void markDone();

    boolean isDrained();
}
