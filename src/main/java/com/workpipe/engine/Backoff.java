package com.workpipe.engine;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff: {@code min(base * multiplier^attempts, cap)}, then
 * scaled by a uniform factor in {@code [1 - jitter, 1 + jitter)}.
 */
public class Backoff {
    private final long baseMs;
    private final double multiplier;
    private final long capMs;
    private final double jitter;
    private final Random random;

    public Backoff(Duration base, double multiplier, Duration cap, double jitter, Random random) {
        if (base.isNegative() || cap.isNegative()) throw new IllegalArgumentException("durations must be >= 0");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
        if (jitter < 0.0 || jitter >= 1.0) throw new IllegalArgumentException("jitter must be in [0, 1)");
        this.baseMs = base.toMillis();
        this.multiplier = multiplier;
        this.capMs = cap.toMillis();
        this.jitter = jitter;
        this.random = random;
    }

    public static Backoff from(PipelineConfig cfg, Random random) {
        return new Backoff(Duration.ofMillis(cfg.backoffBaseMs), cfg.backoffMultiplier,
                Duration.ofMillis(cfg.backoffCapMs), cfg.backoffJitter, random);
    }

    /** Un-jittered delay for the given number of prior attempts. */
    public long baseDelayMs(int attempts) {
        double raw = baseMs * Math.pow(multiplier, attempts);
        return (long) Math.min(raw, capMs);
    }

    public Duration delay(int attempts) {
        long ms = baseDelayMs(attempts);
        if (jitter == 0.0) return Duration.ofMillis(ms);
        double factor = 1.0 + (random.nextDouble() * 2.0 - 1.0) * jitter;
        return Duration.ofMillis(Math.round(ms * factor));
    }
}
