package com.accountdb.bancheck.check.model;

import java.util.List;

public record TaskListResponse(
    List<BanCheckTask> tasks,
    long total,
    int limit,
    int offset
) {
}
