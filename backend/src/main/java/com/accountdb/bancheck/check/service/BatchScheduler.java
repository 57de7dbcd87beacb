package com.accountdb.bancheck.check.service;

import com.accountdb.bancheck.check.model.CheckResult;
import com.accountdb.bancheck.check.model.EffectiveOptions;
import com.accountdb.bancheck.check.proxy.ProxyExhaustionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the identifiers of one task as consecutive batches: at most {@code maxConcurrentBatches} batches at a
 * time, each with at most {@code maxWorkersPerBatch} checks in flight.
 */
public class BatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);
    static final String TIMED_OUT = "timed out";
    static final String NOT_PROCESSED = "not processed";
    private static final long SHUTDOWN_GRACE_MS = 5000;

    public enum Outcome {
        COMPLETED,
        TIMED_OUT,
        INTERRUPTED
    }

    private final String taskId;
    private final CheckWorker worker;
    private final TaskResultAggregator aggregator;
    private final EffectiveOptions options;
    private final SubmitThrottle throttle;
    private final Set<ExecutorService> activePools = ConcurrentHashMap.newKeySet();
    private final AtomicReference<TaskPersistenceException> fatal = new AtomicReference<>();
    private volatile boolean stopping;

    public BatchScheduler(
        String taskId,
        CheckWorker worker,
        TaskResultAggregator aggregator,
        EffectiveOptions options,
        SubmitThrottle throttle
    ) {
        this.taskId = taskId;
        this.worker = worker;
        this.aggregator = aggregator;
        this.options = options;
        this.throttle = throttle == null ? new SubmitThrottle(options.submitDelay()) : throttle;
    }

    public static List<List<String>> partition(List<String> identifiers, int batchSize) {
        int size = Math.max(1, batchSize);
        List<List<String>> batches = new ArrayList<>();
        if (identifiers == null) {
            return batches;
        }
        for (int start = 0; start < identifiers.size(); start += size) {
            batches.add(List.copyOf(identifiers.subList(start, Math.min(identifiers.size(), start + size))));
        }
        return batches;
    }

    /**
     * Blocks until every identifier has a result or {@code timeout} passes.
     *
     * @throws TaskPersistenceException when results can no longer be stored; remaining work is abandoned
     */
    public Outcome run(List<String> identifiers, Duration timeout) {
        List<List<String>> batches = partition(identifiers, options.logicalBatchSize());
        if (batches.isEmpty()) {
            return Outcome.COMPLETED;
        }
        int width = Math.min(options.maxConcurrentBatches(), batches.size());
        ExecutorService batchPool = Executors.newFixedThreadPool(width);
        activePools.add(batchPool);
        log.info(
            "Task {}: {} identifiers in {} batches (batch size {}, {} concurrent batches, {} workers per batch)",
            taskId,
            identifiers.size(),
            batches.size(),
            options.logicalBatchSize(),
            width,
            options.maxWorkersPerBatch()
        );
        for (int i = 0; i < batches.size(); i++) {
            int batchId = i + 1;
            List<String> batch = batches.get(i);
            batchPool.submit(() -> runBatch(batchId, batch));
        }
        batchPool.shutdown();

        try {
            boolean finished = batchPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            TaskPersistenceException failure = fatal.get();
            if (failure != null) {
                throw failure;
            }
            if (!finished) {
                log.warn("Task {} exceeded its {}s time limit; resolving outstanding identifiers", taskId, timeout.toSeconds());
                aggregator.seal();
                stopAll();
                awaitQuietly(batchPool);
                aggregator.forceComplete(TIMED_OUT);
                return Outcome.TIMED_OUT;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            aggregator.seal();
            stopAll();
            return Outcome.INTERRUPTED;
        } finally {
            activePools.remove(batchPool);
        }

        if (!aggregator.isComplete()) {
            int leftover = aggregator.forceComplete(NOT_PROCESSED);
            log.warn("Task {}: {} identifiers were left without a result", taskId, leftover);
        }
        return Outcome.COMPLETED;
    }

    void runBatch(int batchId, List<String> batch) {
        int width = Math.min(options.maxWorkersPerBatch(), batch.size());
        ExecutorService workers = Executors.newFixedThreadPool(width);
        activePools.add(workers);
        Semaphore permits = new Semaphore(width);
        RateLimitGate gate = new RateLimitGate();
        AtomicReference<String> batchFailure = new AtomicReference<>();
        List<Future<?>> inFlight = new ArrayList<>(batch.size());
        log.debug("Task {}: batch {} started with {} identifiers", taskId, batchId, batch.size());
        try {
            for (String steamId : batch) {
                if (stopping || batchFailure.get() != null) {
                    break;
                }
                permits.acquire();
                try {
                    gate.awaitOpen();
                    throttle.awaitTurn();
                } catch (InterruptedException e) {
                    permits.release();
                    throw e;
                }
                inFlight.add(workers.submit(() -> {
                    try {
                        checkOne(steamId, batchId, gate, batchFailure);
                    } finally {
                        permits.release();
                    }
                }));
            }
            for (Future<?> future : inFlight) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (ExecutionException e) {
            batchFailure.compareAndSet(null, "batch failed: " + describe(e.getCause()));
        } catch (RuntimeException e) {
            batchFailure.compareAndSet(null, "batch failed: " + describe(e));
        } finally {
            workers.shutdownNow();
            activePools.remove(workers);
        }

        String reason = batchFailure.get();
        if (reason != null && !stopping) {
            try {
                int resolved = aggregator.resolveAll(batch, reason, batchId);
                log.warn("Task {}: batch {} aborted ({}); {} identifiers marked as errors", taskId, batchId, reason, resolved);
            } catch (TaskPersistenceException e) {
                abort(e);
            }
        } else {
            log.debug("Task {}: batch {} finished", taskId, batchId);
        }
    }

    private void checkOne(String steamId, int batchId, RateLimitGate gate, AtomicReference<String> batchFailure) {
        if (stopping) {
            return;
        }
        CheckResult result;
        try {
            result = worker.check(steamId, batchId, gate, throttle);
        } catch (ProxyExhaustionException e) {
            batchFailure.compareAndSet(null, "no usable proxy: " + e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.warn("Task {}: unexpected failure while checking {}", taskId, steamId, e);
            result = CheckResult.error(steamId, "unexpected failure: " + describe(e), null, batchId, 0);
        }
        try {
            aggregator.record(result);
        } catch (TaskPersistenceException e) {
            abort(e);
        }
    }

    private void abort(TaskPersistenceException e) {
        if (fatal.compareAndSet(null, e)) {
            log.warn("Task {}: aborting after persistence failure", taskId);
            stopAll();
        }
    }

    private void stopAll() {
        stopping = true;
        for (ExecutorService pool : activePools) {
            pool.shutdownNow();
        }
    }

    private void awaitQuietly(ExecutorService pool) throws InterruptedException {
        if (!pool.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
            log.warn("Task {}: batch threads still running after shutdown", taskId);
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
