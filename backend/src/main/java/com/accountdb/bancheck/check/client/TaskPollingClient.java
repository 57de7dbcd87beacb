package com.accountdb.bancheck.check.client;

import com.accountdb.bancheck.check.model.BanCheckTask;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Polls one task until it reaches a terminal status. Every exit path (terminal task, error, {@link #cancel()},
 * {@link #close()}) cancels the pending scheduled poll.
 */
public class TaskPollingClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskPollingClient.class);
    private static final double JITTER_RATIO = 0.25;

    private final URI baseUrl;
    private final long ownerId;
    private final String role;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Duration baseInterval;
    private final Duration maxBackoff;
    private final int maxConsecutiveErrors;

    private PollingState state = PollingState.NOT_POLLING;
    private ScheduledFuture<?> scheduled;
    private CompletableFuture<BanCheckTask> completion;
    private Consumer<BanCheckTask> listener;
    private String taskId;
    private Duration currentBackoff;
    private int consecutiveErrors;
    private long generation;

    public TaskPollingClient(
        URI baseUrl,
        long ownerId,
        String role,
        HttpClient httpClient,
        ObjectMapper objectMapper,
        Duration baseInterval,
        Duration maxBackoff,
        int maxConsecutiveErrors
    ) {
        this(
            baseUrl,
            ownerId,
            role,
            httpClient,
            objectMapper,
            Executors.newSingleThreadScheduledExecutor(),
            true,
            baseInterval,
            maxBackoff,
            maxConsecutiveErrors
        );
    }

    TaskPollingClient(
        URI baseUrl,
        long ownerId,
        String role,
        HttpClient httpClient,
        ObjectMapper objectMapper,
        ScheduledExecutorService scheduler,
        boolean ownsScheduler,
        Duration baseInterval,
        Duration maxBackoff,
        int maxConsecutiveErrors
    ) {
        String base = baseUrl.toString();
        this.baseUrl = URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) : base);
        this.ownerId = ownerId;
        this.role = role;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.baseInterval = baseInterval;
        this.maxBackoff = maxBackoff.compareTo(baseInterval) < 0 ? baseInterval : maxBackoff;
        this.maxConsecutiveErrors = Math.max(1, maxConsecutiveErrors);
    }

    /**
     * Starts polling {@code taskId}. The returned future completes with the terminal snapshot.
     *
     * @throws IllegalStateException when this client is already polling
     */
    public synchronized CompletableFuture<BanCheckTask> start(String taskId, Consumer<BanCheckTask> listener) {
        if (state != PollingState.NOT_POLLING) {
            throw new IllegalStateException("Already polling task " + this.taskId);
        }
        this.taskId = taskId;
        this.listener = listener;
        this.completion = new CompletableFuture<>();
        this.currentBackoff = baseInterval;
        this.consecutiveErrors = 0;
        this.generation++;
        transition(PollingState.POLLING);
        schedule(Duration.ZERO, generation);
        return completion;
    }

    public synchronized PollingState state() {
        return state;
    }

    public synchronized void cancel() {
        if (state == PollingState.NOT_POLLING) {
            return;
        }
        stop();
        completion.cancel(false);
    }

    @Override
    public void close() {
        cancel();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private void pollGuarded(long expectedGeneration) {
        try {
            poll(expectedGeneration);
        } catch (RuntimeException e) {
            synchronized (this) {
                if (expectedGeneration == generation && state != PollingState.NOT_POLLING) {
                    log.warn("Polling task {} failed unexpectedly", taskId, e);
                    fail(new TaskPollingException("Polling task " + taskId + " failed: " + e, e));
                }
            }
        }
    }

    private void poll(long expectedGeneration) {
        String polledTaskId;
        synchronized (this) {
            if (state == PollingState.NOT_POLLING || expectedGeneration != generation) {
                return;
            }
            polledTaskId = taskId;
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(buildRequest(polledTaskId), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            onTransientError(expectedGeneration, "I/O error: " + e.getMessage(), 0);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            synchronized (this) {
                if (expectedGeneration == generation && state != PollingState.NOT_POLLING) {
                    fail(new TaskPollingException("Polling interrupted", e));
                }
            }
            return;
        }
        handleResponse(expectedGeneration, response);
    }

    private void handleResponse(long expectedGeneration, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429) {
            onRateLimited(expectedGeneration, response.headers().firstValue("Retry-After").orElse(null));
            return;
        }
        if (status >= 500) {
            onTransientError(expectedGeneration, "HTTP " + status, status);
            return;
        }
        BanCheckTask task = null;
        TaskPollingException error = null;
        if (status == 200) {
            try {
                task = objectMapper.readValue(response.body(), BanCheckTask.class);
            } catch (IOException e) {
                error = new TaskPollingException("Unreadable task payload", e);
            }
            if (task == null && error == null) {
                error = new TaskPollingException("Empty task payload", status);
            }
        } else {
            error = new TaskPollingException("Task poll rejected with HTTP " + status, status);
        }

        Consumer<BanCheckTask> notify;
        synchronized (this) {
            if (expectedGeneration != generation || state == PollingState.NOT_POLLING) {
                return;
            }
            if (error != null) {
                fail(error);
                return;
            }
            consecutiveErrors = 0;
            currentBackoff = baseInterval;
            notify = listener;
        }
        if (notify != null) {
            notify.accept(task);
        }
        synchronized (this) {
            if (expectedGeneration != generation || state == PollingState.NOT_POLLING) {
                return;
            }
            if (task.isTerminal()) {
                stop();
                completion.complete(task);
                return;
            }
            transition(PollingState.POLLING);
            schedule(jittered(baseInterval), expectedGeneration);
        }
    }

    private synchronized void onRateLimited(long expectedGeneration, String retryAfter) {
        if (expectedGeneration != generation || state == PollingState.NOT_POLLING) {
            return;
        }
        Duration doubled = currentBackoff.multipliedBy(2);
        currentBackoff = doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
        Duration delay = currentBackoff;
        Duration requested = parseRetryAfter(retryAfter);
        if (requested != null && requested.compareTo(delay) > 0) {
            delay = requested;
        }
        log.debug("Task {} poll rate limited; backing off for {}", taskId, delay);
        transition(PollingState.BACKING_OFF);
        schedule(jittered(delay), expectedGeneration);
    }

    private synchronized void onTransientError(long expectedGeneration, String message, int statusCode) {
        if (expectedGeneration != generation || state == PollingState.NOT_POLLING) {
            return;
        }
        consecutiveErrors++;
        if (consecutiveErrors >= maxConsecutiveErrors) {
            fail(new TaskPollingException(
                "Giving up on task " + taskId + " after " + consecutiveErrors + " errors: " + message,
                statusCode
            ));
            return;
        }
        Duration doubled = currentBackoff.multipliedBy(2);
        currentBackoff = doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
        transition(PollingState.BACKING_OFF);
        schedule(jittered(currentBackoff), expectedGeneration);
    }

    private void fail(TaskPollingException error) {
        stop();
        completion.completeExceptionally(error);
    }

    private void stop() {
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduled = null;
        }
        generation++;
        transition(PollingState.NOT_POLLING);
    }

    private void schedule(Duration delay, long expectedGeneration) {
        scheduled = scheduler.schedule(() -> pollGuarded(expectedGeneration), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void transition(PollingState next) {
        if (state != next) {
            log.debug("Task {} polling state {} -> {}", taskId, state, next);
            state = next;
        }
    }

    private HttpRequest buildRequest(String polledTaskId) {
        String path = "/api/ban-check/tasks/" + URLEncoder.encode(polledTaskId, StandardCharsets.UTF_8);
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
            .timeout(Duration.ofSeconds(30))
            .header("Accept", "application/json")
            .header("X-Owner-Id", String.valueOf(ownerId))
            .GET();
        if (role != null && !role.isBlank()) {
            builder.header("X-Owner-Role", role);
        }
        return builder.build();
    }

    private Duration jittered(Duration delay) {
        long millis = delay.toMillis();
        if (millis <= 0) {
            return Duration.ZERO;
        }
        long jitter = (long) (millis * JITTER_RATIO * ThreadLocalRandom.current().nextDouble());
        return Duration.ofMillis(millis + jitter);
    }

    static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds <= 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
