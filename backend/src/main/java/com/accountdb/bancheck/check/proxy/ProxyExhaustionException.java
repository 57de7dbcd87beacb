package com.accountdb.bancheck.check.proxy;

public class ProxyExhaustionException extends RuntimeException {
    public ProxyExhaustionException(String message) {
        super(message);
    }
}
