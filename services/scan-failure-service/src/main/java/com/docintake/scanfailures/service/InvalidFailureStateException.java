package com.docintake.scanfailures.service;

import java.util.UUID;

/**
 * An operator action conflicts with the current state of the failure record.
 */
public class InvalidFailureStateException extends RuntimeException {

    public enum Reason {
        ALREADY_RESOLVED,
        EXCLUDED
    }

    private final Reason reason;

    public InvalidFailureStateException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static InvalidFailureStateException alreadyResolved(UUID failureId) {
        return new InvalidFailureStateException(Reason.ALREADY_RESOLVED,
            "Source scan failure " + failureId + " is already resolved");
    }

    public static InvalidFailureStateException excluded(UUID failureId) {
        return new InvalidFailureStateException(Reason.EXCLUDED,
            "Source scan failure " + failureId + " is excluded; unexclude it before retrying");
    }

    public Reason getReason() {
        return reason;
    }
}
