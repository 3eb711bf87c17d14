package com.workpipe.engine;

/** Producer end of a {@link WorkQueue}. */
public interface QueueSink<T> extends QueueHandle {

    /**
     * Non-blocking enqueue.
     *
     * @return false when the queue is at capacity
     * @throws IllegalStateException if the queue is closed
     */
    boolean offer(T item);

    /** Blocks while the queue is full. */
    void put(T item) throws InterruptedException;

    /** Marks end of stream. Idempotent; items already queued stay readable. */
    void close();

    /** Items enqueued but not yet acknowledged by the consumer. */
    int unfinished();
}
