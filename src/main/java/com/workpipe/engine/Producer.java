package com.workpipe.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Offers {@code itemCount} sequential items onto the orders queue without ever
 * blocking on it. A full queue is answered with backoff and another offer of the
 * same item; each backoff spends one unit of the item's retry budget.
 */
public class Producer implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Producer.class);

    private final QueueSink<WorkItem> orders;
    private final int itemCount;
    private final RetryTracker tracker;
    private final Backoff backoff;
    private final DurationSource thinkTime;
    private final PipelineListener listener;

    private int enqueued = 0;

    public Producer(QueueSink<WorkItem> orders, int itemCount, RetryTracker tracker,
                    Backoff backoff, DurationSource thinkTime, PipelineListener listener) {
        this.orders = orders;
        this.itemCount = itemCount;
        this.tracker = tracker;
        this.backoff = backoff;
        this.thinkTime = thinkTime;
        this.listener = listener;
    }

    @Override
    public void run() {
        log.info("Producer started, {} items to offer", itemCount);
        try {
            for (long id = 1; id <= itemCount; id++) {
                offer(WorkItem.first(id));
            }
            log.info("Producer finished: {} of {} items enqueued", enqueued, itemCount);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Producer interrupted after {} items", enqueued);
        } finally {
            orders.close();
        }
    }

    private void offer(WorkItem item) throws InterruptedException {
        if (!tracker.shouldProcess(item)) {
            log.warn("{} already has too many attempts ({}), skipping", item, tracker.count(item));
            listener.onEvent(new PipelineEvent(Outcome.SKIPPED, Stage.PRODUCER, item.label, "retry budget exhausted"));
            return;
        }

        while (!orders.offer(item)) {
            int attempts = tracker.count(item);
            Duration pause = backoff.delay(attempts);
            log.debug("Attempt {} on {}: orders queue full, backing off {}ms", attempts + 1, item, pause.toMillis());
            sleep(pause);
            tracker.increment(item);

            if (!tracker.shouldProcess(item)) {
                log.warn("Giving up on {} after {} attempts, dropping", item, tracker.count(item));
                listener.onEvent(new PipelineEvent(Outcome.DROPPED_BACKPRESSURE, Stage.PRODUCER, item.label,
                        "orders queue full"));
                return;
            }
        }

        enqueued++;
        Duration pause = thinkTime.next();
        sleep(pause);
        log.debug("Placed {} ({}ms)", item, pause.toMillis());
    }

    private static void sleep(Duration d) throws InterruptedException {
        if (!d.isZero() && !d.isNegative()) Thread.sleep(d.toMillis());
    }

    /** Items that made it onto the orders queue. Read after {@link #run()} returns. */
    public int enqueued() {
        return enqueued;
    }
}
