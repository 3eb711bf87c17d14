package com.workpipe.engine;

public class PipelineConfig {
    public int itemCount = 20;

    public int ordersCapacity = 10;
    public int retriesCapacity = 10;
    public int mergedCapacity = 10;
    public int deadCapacity = 10;

    public int maxRetries = 2;

    public long workerTimeoutMs = 500;
    public int failureRate = 2;          // out of 10
    public long processingTimeMaxMs = 1000;

    public long backoffBaseMs = 50;
    public double backoffMultiplier = 2.0;
    public long backoffCapMs = 1000;
    public double backoffJitter = 0.2;   // +/- fraction
    public long thinkTimeMaxMs = 100;

    public long idleTimeoutMs = 1000;

    public String dlqPath;               // null -> log dead letters only

    public PipelineConfig() {}

    public void validate() {
        if (itemCount < 0) throw new IllegalArgumentException("itemCount must be >= 0");
        requirePositive("ordersCapacity", ordersCapacity);
        requirePositive("retriesCapacity", retriesCapacity);
        requirePositive("mergedCapacity", mergedCapacity);
        requirePositive("deadCapacity", deadCapacity);
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (failureRate < 0 || failureRate > 10) throw new IllegalArgumentException("failureRate must be in 0..10");
        requirePositive("workerTimeoutMs", workerTimeoutMs);
        requirePositive("idleTimeoutMs", idleTimeoutMs);
        if (processingTimeMaxMs < 0 || thinkTimeMaxMs < 0 || backoffBaseMs < 0 || backoffCapMs < 0) {
            throw new IllegalArgumentException("durations must be >= 0");
        }
        if (backoffMultiplier < 1.0) throw new IllegalArgumentException("backoffMultiplier must be >= 1");
        if (backoffJitter < 0.0 || backoffJitter >= 1.0) throw new IllegalArgumentException("backoffJitter must be in [0, 1)");
    }

    private static void requirePositive(String field, long value) {
        if (value <= 0) throw new IllegalArgumentException(field + " must be > 0");
    }
}
