package com.workpipe.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Waits for the first event among several queue sources: an item to take, or a
 * source reaching end of stream. When more than one source is ready the scan
 * starts at a random source, so callers must not rely on any order between them.
 */
public class EventSelector<T> {
    private final List<QueueSource<T>> active;
    private final Signal signal;
    private final Duration idleWindow;
    private final Random random;

    @SafeVarargs
    public EventSelector(Signal signal, Duration idleWindow, Random random, QueueSource<T>... sources) {
        if (idleWindow.isNegative() || idleWindow.isZero()) {
            throw new IllegalArgumentException("idleWindow must be positive");
        }
        this.signal = signal;
        this.idleWindow = idleWindow;
        this.random = random;
        this.active = new ArrayList<>(List.of(sources));
        for (QueueSource<T> s : sources) {
            s.watch(signal);
        }
    }

    /**
     * Returns the next ready event, or waits up to the idle window for one.
     * A fresh window starts on every call.
     */
    public Selection<T> select() throws InterruptedException {
        long seen = signal.generation();

        Selection<T> ready = scan();
        if (ready != null) return ready;

        if (!signal.awaitChange(seen, idleWindow)) {
            return Selection.idle();
        }
        ready = scan();
        return ready != null ? ready : Selection.quiet();
    }

    private Selection<T> scan() {
        int n = active.size();
        if (n == 0) return null;
        int start = random.nextInt(n);
        for (int i = 0; i < n; i++) {
            QueueSource<T> source = active.get((start + i) % n);
            T item = source.poll();
            if (item != null) return Selection.item(source, item);
            if (source.isDrained()) {
                active.remove(source);
                return Selection.closed(source);
            }
        }
        return null;
    }

    public boolean isWatching(QueueSource<T> source) {
        return active.contains(source);
    }
}
