package com.workpipe.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;

/**
 * Merges new orders and retries into the worker's queue, and diverts retries
 * whose key is out of budget to the dead-letter queue.
 *
 * <p>Closing the orders queue does not end the run: the worker can keep feeding
 * retries after that. The router stops once orders are closed, the worker has
 * acknowledged everything it was given, and the retries queue is empty. The
 * unfinished count is read before the retries queue because the worker submits
 * a retry before acknowledging the item it came from.
 *
 * <p>That stop condition is the loop guard, re-evaluated after every selection.
 * Any queue change wakes the selector, and the idle window bounds how long the
 * router sleeps between checks when nothing at all happens.
 */
public class Router implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final QueueSource<WorkItem> orders;
    private final QueueSource<WorkItem> retries;
    private final QueueSink<WorkItem> merged;
    private final QueueSink<WorkItem> dead;
    private final RetryTracker tracker;
    private final EventSelector<WorkItem> selector;
    private final Duration idleTimeout;
    private final PipelineListener listener;

    private boolean ordersOpen = true;

    public Router(QueueSource<WorkItem> orders, QueueSource<WorkItem> retries, QueueSink<WorkItem> merged,
                  QueueSink<WorkItem> dead, RetryTracker tracker, Duration idleTimeout, Random random,
                  PipelineListener listener) {
        this.orders = orders;
        this.retries = retries;
        this.merged = merged;
        this.dead = dead;
        this.tracker = tracker;
        this.listener = listener;
        this.idleTimeout = idleTimeout;

        Signal signal = new Signal();
        this.selector = new EventSelector<>(signal, idleTimeout, random, orders, retries);
        merged.watch(signal);
    }

    @Override
    public void run() {
        log.info("Router started, merging {} and {} into {}", orders.name(), retries.name(), merged.name());
        try {
            while (ordersOpen || !quiescent()) {
                Selection<WorkItem> next = selector.select();
                switch (next.kind) {
                    case ITEM -> {
                        if (next.from(orders)) {
                            log.debug("Forwarding new item {}", next.item);
                            merged.put(next.item);
                        } else {
                            route(next.item);
                        }
                    }
                    case CLOSED -> {
                        if (next.from(orders)) {
                            log.info("No more new items coming in ({} closed)", orders.name());
                            ordersOpen = false;
                        }
                    }
                    case IDLE -> log.debug("Idle for {}ms, ordersOpen={}, unfinished={}, retries={}",
                            idleTimeout.toMillis(), ordersOpen, merged.unfinished(), retries.size());
                    case QUIET -> { }
                }
            }
            log.info("Router finished, all items and retries processed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Router interrupted");
        } finally {
            merged.close();
        }
    }

    private void route(WorkItem retry) throws InterruptedException {
        if (tracker.shouldProcess(retry)) {
            log.debug("Handling retry {}", retry);
            merged.put(retry);
            return;
        }
        if (dead.offer(retry)) {
            log.info("{} exceeded retry limit, moved to dead letters", retry.key());
        } else {
            log.warn("Dead letter queue full, discarding {}", retry.key());
            listener.onEvent(new PipelineEvent(Outcome.DROPPED_BACKPRESSURE, Stage.ROUTER, retry.label,
                    "dead-letter queue full"));
        }
    }

    // order matters, see class doc
    private boolean quiescent() {
        return merged.unfinished() == 0 && retries.isEmpty();
    }
}
