package com.accountdb.bancheck.check.model;

import java.time.Instant;

public record ProxyStats(
    String uri,
    int consecutiveFailures,
    boolean disabled,
    Instant disabledUntil,
    Instant lastUsedAt,
    long attempts,
    long successes,
    long failures,
    long rateLimited,
    long averageLatencyMs
) {
}
