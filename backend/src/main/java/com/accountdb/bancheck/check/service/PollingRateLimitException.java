package com.accountdb.bancheck.check.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class PollingRateLimitException extends RuntimeException {
    private final long retryAfterSeconds;

    public PollingRateLimitException(long retryAfterSeconds) {
        super("Task status polled too frequently; retry after " + retryAfterSeconds + "s");
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
