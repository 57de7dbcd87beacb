package com.accountdb.bancheck.check.service;

import com.accountdb.bancheck.check.http.ProfileFetcher;
import com.accountdb.bancheck.check.model.CheckResult;
import com.accountdb.bancheck.check.model.EffectiveOptions;
import com.accountdb.bancheck.check.model.HttpFetchResult;
import com.accountdb.bancheck.check.model.ProfileClassification;
import com.accountdb.bancheck.check.proxy.ProxyEndpoint;
import com.accountdb.bancheck.check.proxy.ProxyPool;
import com.accountdb.bancheck.check.util.FailureReasonClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Resolves a single identifier to a terminal result, retrying transient failures on rotating proxies.
 * A {@link com.accountdb.bancheck.check.proxy.ProxyExhaustionException} is left to the caller.
 */
public class CheckWorker {
    private static final Logger log = LoggerFactory.getLogger(CheckWorker.class);
    static final String INVALID_FORMAT = "invalid SteamID64 format";
    static final String INTERRUPTED = "interrupted before completion";
    private static final long MAX_RETRY_AFTER_SECONDS = 300;

    private final ProfileFetcher fetcher;
    private final ProxyPool proxyPool;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final Duration rateLimitPause;
    private final boolean requireSteamId64;

    public CheckWorker(
        ProfileFetcher fetcher,
        ProxyPool proxyPool,
        EffectiveOptions options,
        Duration rateLimitPause,
        boolean requireSteamId64
    ) {
        this.fetcher = fetcher;
        this.proxyPool = proxyPool;
        this.maxAttempts = options.maxRetriesPerUrl() + 1;
        this.retryDelay = options.retryDelay();
        this.rateLimitPause = rateLimitPause == null ? Duration.ZERO : rateLimitPause;
        this.requireSteamId64 = requireSteamId64;
    }

    /**
     * The caller spaces out the first attempt; every retry waits for {@code throttle} itself, so retries
     * released together by a rate-limit pause still start one delay apart.
     */
    public CheckResult check(String steamId, int batchId, RateLimitGate gate, SubmitThrottle throttle) {
        if (requireSteamId64 && !IdentifierNormalizer.isSteamId64(steamId)) {
            return CheckResult.error(steamId, INVALID_FORMAT, null, batchId, 0);
        }
        ProxyEndpoint proxy = null;
        String lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return CheckResult.error(steamId, INTERRUPTED, ProxyEndpoint.label(proxy), batchId, attempt - 1);
            }
            proxy = proxyPool.next(attempt == 1 ? null : proxy);
            HttpFetchResult fetch = fetcher.fetchProfile(steamId, proxy);
            Duration latency = fetch == null || fetch.duration() == null ? Duration.ZERO : fetch.duration();

            if (fetch != null && fetch.isSuccessful()) {
                proxyPool.recordSuccess(proxy, latency);
                ProfileClassification classification = ProfileClassifier.classify(fetch.body());
                log.debug("{} classified as {} on attempt {}", steamId, classification.statusSummary(), attempt);
                return new CheckResult(
                    steamId,
                    classification.statusSummary(),
                    classification.details(),
                    ProxyEndpoint.label(proxy),
                    batchId,
                    attempt
                );
            }

            String reason = FailureReasonClassifier.classify(fetch);
            lastFailure = FailureReasonClassifier.describe(reason, fetch);
            if (FailureReasonClassifier.INTERRUPTED.equals(reason)) {
                return CheckResult.error(steamId, INTERRUPTED, ProxyEndpoint.label(proxy), batchId, attempt);
            }
            if (FailureReasonClassifier.countsAgainstProxy(reason)) {
                proxyPool.recordFailure(proxy, latency, FailureReasonClassifier.HTTP_429_RATE_LIMIT.equals(reason));
            } else {
                proxyPool.recordSuccess(proxy, latency);
            }
            if (FailureReasonClassifier.HTTP_429_RATE_LIMIT.equals(reason) && gate != null) {
                Duration pause = rateLimitPause(fetch);
                log.warn("Rate limited while checking {} via {}; pausing batch {} for {}", steamId, ProxyEndpoint.label(proxy), batchId, pause);
                gate.pauseFor(pause);
            }
            log.debug("{} attempt {}/{} failed: {}", steamId, attempt, maxAttempts, lastFailure);

            if (!FailureReasonClassifier.isRetryable(reason)) {
                return CheckResult.error(steamId, lastFailure, ProxyEndpoint.label(proxy), batchId, attempt);
            }
            if (attempt < maxAttempts) {
                try {
                    sleepBeforeRetry();
                    if (gate != null) {
                        gate.awaitOpen();
                    }
                    if (throttle != null) {
                        throttle.awaitTurn();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return CheckResult.error(steamId, INTERRUPTED, ProxyEndpoint.label(proxy), batchId, attempt);
                }
            }
        }
        return CheckResult.error(
            steamId,
            "failed after " + maxAttempts + " attempts: " + lastFailure,
            ProxyEndpoint.label(proxy),
            batchId,
            maxAttempts
        );
    }

    private Duration rateLimitPause(HttpFetchResult fetch) {
        long retryAfterSeconds = Math.min(MAX_RETRY_AFTER_SECONDS, parseRetryAfterSeconds(fetch.retryAfter()));
        if (retryAfterSeconds > 0 && Duration.ofSeconds(retryAfterSeconds).compareTo(rateLimitPause) > 0) {
            return Duration.ofSeconds(retryAfterSeconds);
        }
        return rateLimitPause;
    }

    private void sleepBeforeRetry() throws InterruptedException {
        long baseMs = retryDelay.toMillis();
        if (baseMs <= 0) {
            return;
        }
        long jitterMs = (long) (baseMs * 0.2 * ThreadLocalRandom.current().nextDouble());
        Thread.sleep(baseMs + jitterMs);
    }

    static long parseRetryAfterSeconds(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
