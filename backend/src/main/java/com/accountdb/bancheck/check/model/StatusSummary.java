package com.accountdb.bancheck.check.model;

public enum StatusSummary {
    BANNED,
    CLEAN,
    PRIVATE,
    ERROR
}
