package com.accountdb.bancheck.check.model;

import java.util.List;

public record ProxyPoolStats(
    int totalProxies,
    int enabledProxies,
    int rejectedEntries,
    long directAttempts,
    List<ProxyStats> proxies
) {
    public static ProxyPoolStats empty() {
        return new ProxyPoolStats(0, 0, 0, 0, List.of());
    }
}
