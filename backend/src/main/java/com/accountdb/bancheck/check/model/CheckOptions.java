package com.accountdb.bancheck.check.model;

import java.util.List;

public record CheckOptions(
    Boolean useAutoBalancing,
    List<String> proxyList,
    Integer logicalBatchSize,
    Integer maxConcurrentBatches,
    Integer maxWorkersPerBatch,
    Double interRequestSubmitDelay,
    Integer maxRetriesPerUrl,
    Double retryDelaySeconds
) {
    public static CheckOptions defaults() {
        return new CheckOptions(false, List.of(), null, null, null, null, null, null);
    }

    public boolean autoBalancing() {
        return Boolean.TRUE.equals(useAutoBalancing);
    }

    public List<String> proxyListOrEmpty() {
        return proxyList == null ? List.of() : proxyList;
    }
}
