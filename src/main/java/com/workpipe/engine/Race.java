package com.workpipe.engine;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Two timers on a shared scheduler; whichever fires first decides the result.
 * The processing timer is scheduled first, so on a single-threaded timer equal
 * delays always resolve to {@link Winner#PROCESSING}.
 */
public class Race {
    public enum Winner { PROCESSING, TIMEOUT }

    private final ScheduledExecutorService timer;

    public Race(ScheduledExecutorService timer) {
        this.timer = timer;
    }

    /** Single-threaded timer that drops cancelled timers instead of holding them until they expire. */
    public static ScheduledThreadPoolExecutor newTimer(ThreadFactory threadFactory) {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, threadFactory);
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    public Winner run(Duration processing, Duration timeout) throws InterruptedException {
        CompletableFuture<Winner> first = new CompletableFuture<>();
        ScheduledFuture<?> done = timer.schedule(() -> first.complete(Winner.PROCESSING),
                processing.toNanos(), TimeUnit.NANOSECONDS);
        ScheduledFuture<?> expired = timer.schedule(() -> first.complete(Winner.TIMEOUT),
                timeout.toNanos(), TimeUnit.NANOSECONDS);
        try {
            return first.get();
        } catch (ExecutionException e) {
            throw new PipelineException("race timer failed", e.getCause());
        } finally {
            done.cancel(false);
            expired.cancel(false);
        }
    }
}
