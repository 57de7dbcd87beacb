package com.accountdb.bancheck.check.proxy;

import com.accountdb.bancheck.check.model.ProxyStats;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable health and usage counters for one proxy. Not thread-safe: every
 * access goes through the owning {@link ProxyPool} monitor.
 */
class ProxyRecord {
    private final ProxyEndpoint endpoint;
    private int consecutiveFailures;
    private boolean disabled;
    private Instant disabledUntil;
    private Instant lastUsedAt;
    private long attempts;
    private long successes;
    private long failures;
    private long rateLimited;
    private long totalLatencyMs;

    ProxyRecord(ProxyEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    ProxyEndpoint endpoint() {
        return endpoint;
    }

    boolean isDisabled() {
        return disabled;
    }

    boolean reEnableIfCooledDown(Instant now) {
        if (disabled && disabledUntil != null && !disabledUntil.isAfter(now)) {
            disabled = false;
            disabledUntil = null;
            consecutiveFailures = 0;
            return true;
        }
        return false;
    }

    void markUsed(Instant now) {
        attempts++;
        lastUsedAt = now;
    }

    void recordSuccess(Duration latency) {
        successes++;
        consecutiveFailures = 0;
        addLatency(latency);
    }

    boolean recordFailure(Duration latency, boolean rateLimitedResponse, int threshold, Instant disableUntil) {
        failures++;
        if (rateLimitedResponse) {
            rateLimited++;
        }
        consecutiveFailures++;
        addLatency(latency);
        if (!disabled && consecutiveFailures >= threshold) {
            disabled = true;
            disabledUntil = disableUntil;
            return true;
        }
        return false;
    }

    ProxyStats snapshot() {
        long completed = successes + failures;
        return new ProxyStats(
            endpoint.maskedUri(),
            consecutiveFailures,
            disabled,
            disabledUntil,
            lastUsedAt,
            attempts,
            successes,
            failures,
            rateLimited,
            completed == 0 ? 0 : totalLatencyMs / completed
        );
    }

    private void addLatency(Duration latency) {
        if (latency != null && !latency.isNegative()) {
            totalLatencyMs += latency.toMillis();
        }
    }
}
