package com.docintake.scanfailures.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Instant;
import java.util.Locale;

/**
 * What the dashboard should show as the next step for a failure.
 */
public enum ActionStatus {
    RESOLVED,
    EXCLUDED,
    READY_FOR_RETRY,
    NEEDS_INTERVENTION,
    SCHEDULED,
    AWAITING_ACTION;

    public static ActionStatus of(SourceScanFailureEntity failure, Instant now) {
        if (failure.isResolved()) {
            return RESOLVED;
        }
        if (failure.isUserExcluded()) {
            return EXCLUDED;
        }
        if (failure.isReadyForRetry(now)) {
            return READY_FOR_RETRY;
        }
        if (failure.getSeverity() == Severity.CRITICAL) {
            return NEEDS_INTERVENTION;
        }
        return failure.getNextRetryAt() != null ? SCHEDULED : AWAITING_ACTION;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
