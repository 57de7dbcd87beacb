package com.accountdb.bancheck.check.model;

public record ProfileClassification(StatusSummary statusSummary, String details) {
}
