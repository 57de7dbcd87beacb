package com.accountdb.bancheck.check.proxy;

import com.accountdb.bancheck.check.model.ProxyPoolStats;
import com.accountdb.bancheck.check.model.ProxyStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Round-robin proxy selection with per-proxy health tracking for one task.
 * A {@code null} endpoint stands for a direct connection.
 */
public class ProxyPool {
    private static final Logger log = LoggerFactory.getLogger(ProxyPool.class);

    private final Map<ProxyEndpoint, ProxyRecord> records = new LinkedHashMap<>();
    private final List<ProxyRecord> rotation;
    private final int failureThreshold;
    private final Duration cooldown;
    private final boolean allowDirectFallback;
    private final int rejectedEntries;
    private final Clock clock;
    private int cursor;
    private long directAttempts;

    public ProxyPool(
        List<ProxyEndpoint> endpoints,
        int rejectedEntries,
        int failureThreshold,
        Duration cooldown,
        boolean allowDirectFallback,
        Clock clock
    ) {
        if (endpoints != null) {
            for (ProxyEndpoint endpoint : endpoints) {
                records.putIfAbsent(endpoint, new ProxyRecord(endpoint));
            }
        }
        this.rotation = new ArrayList<>(records.values());
        this.rejectedEntries = Math.max(0, rejectedEntries);
        this.failureThreshold = Math.max(1, failureThreshold);
        this.cooldown = cooldown == null || cooldown.isNegative() ? Duration.ZERO : cooldown;
        this.allowDirectFallback = allowDirectFallback;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public static ProxyPool direct() {
        return new ProxyPool(List.of(), 0, 1, Duration.ZERO, true, Clock.systemUTC());
    }

    public boolean isDirect() {
        return rotation.isEmpty();
    }

    public int size() {
        return rotation.size();
    }

    public ProxyEndpoint next() {
        return next(null);
    }

    /**
     * Picks the next enabled proxy after the cursor, preferring one that differs from {@code avoid}.
     *
     * @throws ProxyExhaustionException when every proxy is disabled and direct fallback is not allowed
     */
    public synchronized ProxyEndpoint next(ProxyEndpoint avoid) {
        if (rotation.isEmpty()) {
            directAttempts++;
            return null;
        }
        Instant now = clock.instant();
        int size = rotation.size();
        int avoidedIndex = -1;
        for (int i = 0; i < size; i++) {
            int index = (cursor + i) % size;
            ProxyRecord record = rotation.get(index);
            if (record.reEnableIfCooledDown(now)) {
                log.info("Proxy {} re-enabled after cooldown", record.endpoint());
            }
            if (record.isDisabled()) {
                continue;
            }
            if (avoid != null && record.endpoint().equals(avoid)) {
                avoidedIndex = index;
                continue;
            }
            return take(index, now);
        }
        if (avoidedIndex >= 0) {
            return take(avoidedIndex, now);
        }
        if (allowDirectFallback) {
            directAttempts++;
            log.debug("All {} proxies disabled; falling back to a direct connection", size);
            return null;
        }
        throw new ProxyExhaustionException("All " + size + " proxies are disabled (cooling down)");
    }

    public synchronized void recordSuccess(ProxyEndpoint endpoint, Duration latency) {
        ProxyRecord record = endpoint == null ? null : records.get(endpoint);
        if (record != null) {
            record.recordSuccess(latency);
        }
    }

    public synchronized void recordFailure(ProxyEndpoint endpoint, Duration latency, boolean rateLimited) {
        ProxyRecord record = endpoint == null ? null : records.get(endpoint);
        if (record == null) {
            return;
        }
        Instant disableUntil = clock.instant().plus(cooldown);
        if (record.recordFailure(latency, rateLimited, failureThreshold, disableUntil)) {
            log.warn(
                "Proxy {} disabled after {} consecutive failures until {}",
                endpoint,
                failureThreshold,
                disableUntil
            );
        }
    }

    public synchronized ProxyPoolStats stats() {
        Instant now = clock.instant();
        List<ProxyStats> snapshots = new ArrayList<>(rotation.size());
        int enabled = 0;
        for (ProxyRecord record : rotation) {
            record.reEnableIfCooledDown(now);
            if (!record.isDisabled()) {
                enabled++;
            }
            snapshots.add(record.snapshot());
        }
        return new ProxyPoolStats(rotation.size(), enabled, rejectedEntries, directAttempts, snapshots);
    }

    private ProxyEndpoint take(int index, Instant now) {
        ProxyRecord record = rotation.get(index);
        record.markUsed(now);
        cursor = (index + 1) % rotation.size();
        return record.endpoint();
    }
}
