package com.workpipe.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;

/**
 * Wires producer, router, worker and dead-letter drain around one retry tracker
 * and four bounded queues, runs them on their own threads and waits for all of
 * them. The dead-letter queue is closed only after the router has returned.
 */
public class PipelineEngine {
    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);
    private static final int STAGES = 4;

    private final PipelineConfig cfg;
    private final Stats stats = new Stats();
    private final RetryTracker tracker;

    private final WorkQueue<WorkItem> orders;
    private final WorkQueue<WorkItem> retries;
    private final WorkQueue<WorkItem> merged;
    private final WorkQueue<WorkItem> dead;

    private DeadLetterSink deadLetterSink = DeadLetterSink.logging();
    private PipelineListener listener = PipelineListener.NONE;
    private Random random = new Random();
    private DurationSource thinkTime;
    private DurationSource processingTime;

    public PipelineEngine(PipelineConfig cfg) {
        cfg.validate();
        this.cfg = cfg;
        this.tracker = new RetryTracker(cfg.maxRetries);
        this.orders = new WorkQueue<>("orders", cfg.ordersCapacity);
        this.retries = new WorkQueue<>("retries", cfg.retriesCapacity);
        this.merged = new WorkQueue<>("merged", cfg.mergedCapacity);
        this.dead = new WorkQueue<>("dead", cfg.deadCapacity);
    }

    public PipelineEngine deadLetterSink(DeadLetterSink sink) {
        this.deadLetterSink = sink;
        return this;
    }

    public PipelineEngine listener(PipelineListener listener) {
        this.listener = listener;
        return this;
    }

    public PipelineEngine random(Random random) {
        this.random = random;
        return this;
    }

    public PipelineEngine thinkTime(DurationSource thinkTime) {
        this.thinkTime = thinkTime;
        return this;
    }

    public PipelineEngine processingTime(DurationSource processingTime) {
        this.processingTime = processingTime;
        return this;
    }

    public Stats stats() { return stats; }

    public RetryTracker tracker() { return tracker; }

    /**
     * Runs the pipeline to completion.
     *
     * @throws PipelineException if a stage failed unexpectedly; thrown once the other
     *         stages, interrupted, have all returned
     */
    public Stats run() throws InterruptedException {
        log.info("Queue capacities - orders: {}, retries: {}, merged: {}, dead: {}",
                orders.capacity(), retries.capacity(), merged.capacity(), dead.capacity());

        PipelineListener events = stats.andThen(listener);
        ScheduledExecutorService timer = Race.newTimer(named("timer"));
        ExecutorService stages = Executors.newFixedThreadPool(STAGES, named("stage"));

        Producer producer = new Producer(orders, cfg.itemCount, tracker, Backoff.from(cfg, random),
                orDefault(thinkTime, cfg.thinkTimeMaxMs), events);
        Router router = new Router(orders, retries, merged, dead, tracker,
                Duration.ofMillis(cfg.idleTimeoutMs), random, events);
        Worker worker = new Worker(merged, retries, tracker, new Race(timer),
                Duration.ofMillis(cfg.workerTimeoutMs), orDefault(processingTime, cfg.processingTimeMaxMs),
                cfg.failureRate, random, events);
        DeadLetterDrain drain = new DeadLetterDrain(dead, deadLetterSink, events);

        CompletionService<String> done = new ExecutorCompletionService<>(stages);
        done.submit(producer, "producer");
        done.submit(() -> {
            try {
                router.run();
            } finally {
                dead.close();
            }
        }, "router");
        done.submit(worker, "worker");
        done.submit(drain, "dead-letter");

        PipelineException failure = null;
        try {
            for (int i = 0; i < STAGES; i++) {
                Future<String> f = done.take();
                try {
                    log.debug("Stage {} finished", f.get());
                } catch (ExecutionException e) {
                    if (failure == null) {
                        log.error("Pipeline stage failed, stopping the others", e.getCause());
                        failure = new PipelineException("pipeline stage failed", e.getCause());
                        stages.shutdownNow();
                    }
                }
            }
        } catch (InterruptedException e) {
            stages.shutdownNow();
            throw e;
        } finally {
            stages.shutdown();
            timer.shutdownNow();
        }
        if (failure != null) throw failure;

        stats.produced.add(producer.enqueued());
        log.info("Pipeline complete: {}", stats);
        return stats;
    }

    private DurationSource orDefault(DurationSource source, long maxMs) {
        return source != null ? source : DurationSource.uniform(Duration.ofMillis(maxMs), random);
    }

    private static ThreadFactory named(String prefix) {
        return r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName(prefix + "-" + t.getId());
            return t;
        };
    }
}
