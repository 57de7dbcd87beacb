package com.accountdb.bancheck.check.client;

public class TaskPollingException extends RuntimeException {
    private final int statusCode;

    public TaskPollingException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TaskPollingException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
