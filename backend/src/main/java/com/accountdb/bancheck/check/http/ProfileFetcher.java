package com.accountdb.bancheck.check.http;

import com.accountdb.bancheck.check.model.HttpFetchResult;
import com.accountdb.bancheck.check.proxy.ProxyEndpoint;

import java.util.Collection;

public interface ProfileFetcher {
    /**
     * Fetches the public profile page of one account, through {@code proxy} or directly when it is {@code null}.
     * Transport failures are reported through {@link HttpFetchResult#errorCode()}, never thrown.
     */
    HttpFetchResult fetchProfile(String steamId, ProxyEndpoint proxy);

    /**
     * Called once per task before its first fetch. Connections to {@code proxies} may be kept until the
     * matching {@link #releaseProxies(Collection)}.
     */
    default void retainProxies(Collection<ProxyEndpoint> proxies) {
    }

    default void releaseProxies(Collection<ProxyEndpoint> proxies) {
    }
}
