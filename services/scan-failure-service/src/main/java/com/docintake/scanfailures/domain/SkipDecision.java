package com.docintake.scanfailures.domain;

import java.time.Instant;

/**
 * Answer to a connector asking whether a resource should be scanned this pass.
 */
public record SkipDecision(boolean skip, String reason, int failureCount, Instant nextRetryAt) {

    public static SkipDecision proceed(String reason) {
        return new SkipDecision(false, reason, 0, null);
    }
}
