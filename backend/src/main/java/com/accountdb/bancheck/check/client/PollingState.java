package com.accountdb.bancheck.check.client;

public enum PollingState {
    NOT_POLLING,
    POLLING,
    BACKING_OFF
}
