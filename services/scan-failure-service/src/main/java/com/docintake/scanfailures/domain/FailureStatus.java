package com.docintake.scanfailures.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * How long-standing a failure episode is, judged by its total failure count.
 */
public enum FailureStatus {
    RECENT,
    RECURRING,
    PERSISTENT,
    CHRONIC;

    public static FailureStatus of(int failureCount) {
        if (failureCount > 20) {
            return CHRONIC;
        }
        if (failureCount > 10) {
            return PERSISTENT;
        }
        if (failureCount > 3) {
            return RECURRING;
        }
        return RECENT;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
