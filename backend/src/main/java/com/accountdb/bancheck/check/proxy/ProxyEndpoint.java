package com.accountdb.bancheck.check.proxy;

public record ProxyEndpoint(
    String scheme,
    String host,
    int port,
    String username,
    String password
) {
    public static final String DIRECT_LABEL = "direct";

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    public String address() {
        return scheme + "://" + host + ":" + port;
    }

    public String maskedUri() {
        if (!hasCredentials()) {
            return address();
        }
        return scheme + "://" + username + ":***@" + host + ":" + port;
    }

    public static String label(ProxyEndpoint endpoint) {
        return endpoint == null ? DIRECT_LABEL : endpoint.maskedUri();
    }

    @Override
    public String toString() {
        return maskedUri();
    }
}
