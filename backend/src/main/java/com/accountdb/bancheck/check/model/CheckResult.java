package com.accountdb.bancheck.check.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record CheckResult(
    String steamId,
    StatusSummary statusSummary,
    String details,
    String proxyUsed,
    int batchId,
    int attempts
) {
    public static CheckResult error(String steamId, String details, String proxyUsed, int batchId, int attempts) {
        return new CheckResult(steamId, StatusSummary.ERROR, details, proxyUsed, batchId, attempts);
    }

    @JsonIgnore
    public boolean isError() {
        return statusSummary == StatusSummary.ERROR;
    }
}
