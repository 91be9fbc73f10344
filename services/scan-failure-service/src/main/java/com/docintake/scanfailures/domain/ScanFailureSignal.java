package com.docintake.scanfailures.domain;

/**
 * A single failed scan attempt as reported by a connector.
 */
public record ScanFailureSignal(
    FailureType failureType,
    String errorMessage,
    Integer httpStatusCode,
    ScanDiagnostics diagnostics
) {

    public static ScanFailureSignal of(FailureType failureType, String errorMessage) {
        return new ScanFailureSignal(failureType, errorMessage, null, null);
    }

    public SourceType sourceType() {
        return failureType.sourceType();
    }
}
