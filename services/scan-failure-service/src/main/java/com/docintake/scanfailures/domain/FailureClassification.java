package com.docintake.scanfailures.domain;

public record FailureClassification(
    Severity severity,
    boolean canRetry,
    boolean userActionRequired,
    String recommendedAction
) {
}
