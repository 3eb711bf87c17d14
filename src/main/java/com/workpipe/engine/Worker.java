package com.workpipe.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;

/**
 * Drains the merged queue. Each item races its processing time against a fixed
 * timeout; a timeout or a simulated delivery failure turns it into a retry.
 * Every taken item is acknowledged with {@link QueueSource#markDone()} only after
 * its retry, if any, has been submitted. Deciding that a retry is out of budget
 * is left to the {@link Router}, the only writer of the dead-letter queue.
 */
public class Worker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final QueueSource<WorkItem> merged;
    private final QueueSink<WorkItem> retries;
    private final RetryTracker tracker;
    private final Race race;
    private final Duration timeout;
    private final DurationSource processingTime;
    private final int failureRate;
    private final Random random;
    private final PipelineListener listener;

    public Worker(QueueSource<WorkItem> merged, QueueSink<WorkItem> retries, RetryTracker tracker, Race race, Duration timeout, DurationSource processingTime,
                  int failureRate, Random random, PipelineListener listener) {
        if (failureRate < 0 || failureRate > 10) throw new IllegalArgumentException("failureRate must be in 0..10");
        this.merged = merged;
        this.retries = retries;
        this.tracker = tracker;
        this.race = race;
        this.timeout = timeout;
        this.processingTime = processingTime;
        this.failureRate = failureRate;
        this.random = random;
        this.listener = listener;
    }

    @Override
    public void run() {
        log.info("Worker started");
        try {
            WorkItem item;
            while ((item = merged.take()) != null) {
                try {
                    handle(item);
                } finally {
                    merged.markDone();
                }
            }
            log.info("Worker finished, merged queue closed and drained");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted");
        }
    }

    void handle(WorkItem item) throws InterruptedException {
        Duration pause = processingTime.next();
        log.debug("Processing {} (estimated {}ms)", item, pause.toMillis());

        switch (race.run(pause, timeout)) {
            case PROCESSING -> {
                if (random.nextInt(10) < failureRate) {
                    log.info("Delivery of {} failed, resubmitting", item);
                    resubmit(item, "delivery failed");
                } else {
                    log.info("Delivered {}", item);
                    listener.onEvent(new PipelineEvent(Outcome.DELIVERED, Stage.WORKER, item.label, null));
                }
            }
            case TIMEOUT -> {
                log.info("Timeout: {} took longer than {}ms, resubmitting", item, timeout.toMillis());
                resubmit(item, "timeout");
            }
        }
    }

    private void resubmit(WorkItem item, String reason) {
        int attempt = tracker.increment(item);
        WorkItem retry = item.retry(attempt);
        if (retries.offer(retry)) {
            log.debug("Added {} to retry queue", retry);
            listener.onEvent(new PipelineEvent(Outcome.RETRIED, Stage.WORKER, retry.label, reason));
        } else {
            drop(item, "retry queue full after " + reason);
        }
    }

    private void drop(WorkItem item, String reason) {
        log.warn("{}: discarded {}", reason, item);
        listener.onEvent(new PipelineEvent(Outcome.DROPPED_BACKPRESSURE, Stage.WORKER, item.label, reason));
    }
}
