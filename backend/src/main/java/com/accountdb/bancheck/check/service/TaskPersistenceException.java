package com.accountdb.bancheck.check.service;

public class TaskPersistenceException extends RuntimeException {
    public TaskPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
