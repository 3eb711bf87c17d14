package com.workpipe.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerTest {
    private ScheduledExecutorService timer;
    private WorkQueue<WorkItem> merged;
    private WorkQueue<WorkItem> retries;
    private RetryTracker tracker;
    private RecordingListener events;

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
        merged = new WorkQueue<>("merged", 8);
        retries = new WorkQueue<>("retries", 8);
        tracker = new RetryTracker(2);
        events = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    private Worker worker(Duration processing, Duration timeout, int failureRate) {
        return new Worker(merged, retries, tracker, new Race(timer), timeout,
                DurationSource.fixed(processing), failureRate, new Random(11), events);
    }

    private void feed(WorkItem... items) throws InterruptedException {
        for (WorkItem item : items) merged.put(item);
        merged.close();
    }

    @Test
    void deliversWhenProcessingBeatsTimeout() throws Exception {
        feed(WorkItem.first(1), WorkItem.first(2));

        worker(Duration.ZERO, Duration.ofSeconds(2), 0).run();

        assertEquals(List.of("Item #1", "Item #2"), events.labels(Outcome.DELIVERED));
        assertTrue(retries.isEmpty());
        assertEquals(0, merged.unfinished());
    }

    @Test
    void timeoutBecomesRetryWithAttemptInLabel() throws Exception {
        feed(WorkItem.first(1));

        worker(Duration.ofSeconds(10), Duration.ofMillis(10), 0).run();

        WorkItem retry = retries.poll();
        assertEquals("Item #1 (retry 1)", retry.label);
        assertEquals(1, tracker.count(retry));
        PipelineEvent e = events.of(Outcome.RETRIED).get(0);
        assertEquals("timeout", e.reason);
        assertTrue(events.labels(Outcome.DELIVERED).isEmpty());
        assertEquals(0, merged.unfinished());
    }

    @Test
    void deliveryFailureBecomesRetry() throws Exception {
        feed(WorkItem.first(3).retry(1));
        tracker.increment(WorkItem.first(3));

        worker(Duration.ZERO, Duration.ofSeconds(2), 10).run();

        assertEquals("Item #3 (retry 2)", retries.poll().label);
        assertEquals("delivery failed", events.of(Outcome.RETRIED).get(0).reason);
    }

    @Test
    void fullRetryQueueDropsTheItem() throws Exception {
        retries = new WorkQueue<>("retries", 1);
        retries.offer(WorkItem.first(50).retry(1));
        feed(WorkItem.first(1));

        worker(Duration.ofSeconds(10), Duration.ofMillis(10), 0).run();

        assertEquals(1, retries.size());
        assertEquals(List.of("Item #1"), events.labels(Outcome.DROPPED_BACKPRESSURE));
        assertEquals(Stage.WORKER, events.of(Outcome.DROPPED_BACKPRESSURE).get(0).stage);
    }

    @Test
    void lastAllowedAttemptIsStillProcessedAndResubmitted() throws Exception {
        WorkItem item = WorkItem.first(4).retry(2);
        tracker.increment(item);
        tracker.increment(item);
        feed(item);

        worker(Duration.ofSeconds(10), Duration.ofMillis(10), 0).run();

        // out of budget now, but judging that is the router's job
        WorkItem retry = retries.poll();
        assertEquals("Item #4 (retry 3)", retry.label);
        assertFalse(tracker.shouldProcess(retry));
        assertEquals(List.of("Item #4 (retry 3)"), events.labels(Outcome.RETRIED));
        assertEquals(0, merged.unfinished());
    }

    @Test
    void rejectsFailureRateOutsideTenScale() {
        assertThrows(IllegalArgumentException.class, () -> worker(Duration.ZERO, Duration.ofSeconds(1), 11));
    }
}
