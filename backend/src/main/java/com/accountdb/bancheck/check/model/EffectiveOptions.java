package com.accountdb.bancheck.check.model;

import java.time.Duration;

public record EffectiveOptions(
    boolean autoBalanced,
    int logicalBatchSize,
    int maxConcurrentBatches,
    int maxWorkersPerBatch,
    double interRequestSubmitDelay,
    int maxRetriesPerUrl,
    double retryDelaySeconds
) {
    public static final int MIN_BATCH_SIZE = 1;
    public static final int MAX_BATCH_SIZE = 50;
    public static final int MIN_CONCURRENT_BATCHES = 1;
    public static final int MAX_CONCURRENT_BATCHES = 10;
    public static final int MIN_WORKERS_PER_BATCH = 1;
    public static final int MAX_WORKERS_PER_BATCH = 10;
    public static final double MAX_SUBMIT_DELAY_SECONDS = 1.0;
    public static final int MAX_RETRIES_PER_URL = 5;
    public static final double MAX_RETRY_DELAY_SECONDS = 10.0;

    public int maxInFlightRequests() {
        return maxConcurrentBatches * maxWorkersPerBatch;
    }

    public Duration submitDelay() {
        return Duration.ofMillis(Math.round(interRequestSubmitDelay * 1000));
    }

    public Duration retryDelay() {
        return Duration.ofMillis(Math.round(retryDelaySeconds * 1000));
    }
}
