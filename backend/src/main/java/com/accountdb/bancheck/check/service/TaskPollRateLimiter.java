package com.accountdb.bancheck.check.service;

import com.accountdb.bancheck.check.model.CallerContext;
import com.accountdb.bancheck.config.BanCheckProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request budget for task status reads, one window per caller.
 */
@Component
public class TaskPollRateLimiter {
    private final Map<Long, Window> windows = new ConcurrentHashMap<>();
    private final Duration windowLength;
    private final int maxRequestsPerWindow;
    private final Clock clock;

    public TaskPollRateLimiter(BanCheckProperties properties, Clock clock) {
        this.windowLength = Duration.ofSeconds(properties.getApi().getPollWindowSeconds());
        this.maxRequestsPerWindow = properties.getApi().getPollMaxRequestsPerWindow();
        this.clock = clock;
    }

    /**
     * @throws PollingRateLimitException when the caller already used up the current window
     */
    public void acquire(CallerContext caller) {
        long key = caller == null ? 0L : caller.ownerId();
        Window window = windows.computeIfAbsent(key, ignored -> new Window());
        window.acquire(clock.instant());
    }

    private final class Window {
        private Instant startedAt;
        private int count;

        private synchronized void acquire(Instant now) {
            if (startedAt == null || !now.isBefore(startedAt.plus(windowLength))) {
                startedAt = now;
                count = 0;
            }
            if (count >= maxRequestsPerWindow) {
                Duration remaining = Duration.between(now, startedAt.plus(windowLength));
                long seconds = remaining.toSeconds() + (remaining.toNanosPart() > 0 ? 1 : 0);
                throw new PollingRateLimitException(seconds);
            }
            count++;
        }
    }
}
