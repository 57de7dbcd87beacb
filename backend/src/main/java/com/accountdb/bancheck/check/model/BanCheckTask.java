package com.accountdb.bancheck.check.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

public record BanCheckTask(
    String taskId,
    TaskStatus status,
    String message,
    double progress,
    List<CheckResult> results,
    ProxyPoolStats proxyStats,
    Instant createdAt,
    Instant updatedAt,
    long ownerId
) {
    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
