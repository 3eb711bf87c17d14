package com.workpipe.engine;

import java.time.Duration;
import java.util.Random;

/** Supplies simulated latencies (think time, processing time). */
@FunctionalInterface
public interface DurationSource {
    Duration next();

    static DurationSource fixed(Duration d) {
        return () -> d;
    }

    /** Uniform in [0, max) milliseconds. */
    static DurationSource uniform(Duration max, Random random) {
        long bound = max.toMillis();
        if (bound <= 0) return fixed(Duration.ZERO);
        return () -> Duration.ofMillis((long) (random.nextDouble() * bound));
    }
}
