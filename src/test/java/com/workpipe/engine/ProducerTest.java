package com.workpipe.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class ProducerTest {
    private final Backoff fastBackoff = new Backoff(Duration.ofMillis(1), 2.0, Duration.ofMillis(5), 0.0, new Random(3));
    private final DurationSource noThinkTime = DurationSource.fixed(Duration.ZERO);

    @Test
    void enqueuesAllItemsInOrderAndCloses() throws Exception {
        WorkQueue<WorkItem> orders = new WorkQueue<>("orders", 5);
        RecordingListener events = new RecordingListener();
        Producer producer = new Producer(orders, 5, new RetryTracker(2), fastBackoff, noThinkTime, events);

        producer.run();

        assertEquals(5, producer.enqueued());
        assertTrue(orders.isClosed());
        for (int i = 1; i <= 5; i++) {
            assertEquals("Item #" + i, orders.take().label);
        }
        assertNull(orders.take());
        assertTrue(events.events.isEmpty());
    }

    @Test
    void backsOffOnFullQueueThenGivesUpWhenBudgetIsSpent() {
        WorkQueue<WorkItem> orders = new WorkQueue<>("orders", 1);
        orders.offer(WorkItem.first(99));
        RetryTracker tracker = new RetryTracker(1);
        RecordingListener events = new RecordingListener();

        new Producer(orders, 1, tracker, fastBackoff, noThinkTime, events).run();

        WorkItem item = WorkItem.first(1);
        assertEquals(2, tracker.count(item));
        assertFalse(tracker.shouldProcess(item));
        assertEquals(1, orders.size(), "only the blocker is queued");
        assertTrue(orders.isClosed());

        PipelineEvent dropped = events.of(Outcome.DROPPED_BACKPRESSURE).get(0);
        assertEquals("Item #1", dropped.label);
        assertEquals(Stage.PRODUCER, dropped.stage);
    }

    @Test
    void retriesTheSameItemOnceSpaceFreesUp() throws Exception {
        WorkQueue<WorkItem> orders = new WorkQueue<>("orders", 1);
        orders.offer(WorkItem.first(99));
        RetryTracker tracker = new RetryTracker(1000);
        Backoff slowish = new Backoff(Duration.ofMillis(20), 1.0, Duration.ofMillis(20), 0.0, new Random());
        Producer producer = new Producer(orders, 2, tracker, slowish, noThinkTime, new RecordingListener());

        Thread t = new Thread(producer);
        t.start();
        Thread.sleep(50);
        assertEquals(99, orders.take().id);
        assertEquals("Item #1", orders.take().label);
        assertEquals("Item #2", orders.take().label);
        t.join(5_000);

        assertFalse(t.isAlive());
        assertEquals(2, producer.enqueued());
        assertTrue(tracker.count(WorkItem.first(1)) >= 1, "first item had to back off at least once");
    }

    @Test
    void skipsItemsThatAreAlreadyExhausted() throws Exception {
        WorkQueue<WorkItem> orders = new WorkQueue<>("orders", 4);
        RetryTracker tracker = new RetryTracker(1);
        tracker.increment(WorkItem.first(2));
        tracker.increment(WorkItem.first(2));
        RecordingListener events = new RecordingListener();

        new Producer(orders, 3, tracker, fastBackoff, noThinkTime, events).run();

        assertEquals("Item #1", orders.take().label);
        assertEquals("Item #3", orders.take().label);
        assertNull(orders.take());
        assertEquals(List.of("Item #2"), events.labels(Outcome.SKIPPED));
    }
}
