package com.docintake.scanfailures.service;

import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.Severity;
import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import com.docintake.scanfailures.domain.SourceType;
import java.time.Instant;

/**
 * Filters and paging for the failure listing. {@code null} filters match everything;
 * a {@code null} limit returns every remaining row.
 */
public record FailureListQuery(
    SourceType sourceType,
    FailureType failureType,
    Severity severity,
    boolean includeResolved,
    boolean includeExcluded,
    boolean readyForRetry,
    Integer limit,
    int offset
) {

    public static final int MAX_LIMIT = 1000;

    public FailureListQuery {
        if (limit != null && (limit < 1 || limit > MAX_LIMIT)) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }

    public static FailureListQuery forSource(SourceType sourceType) {
        return new FailureListQuery(sourceType, null, null, true, true, false, null, 0);
    }

    public boolean matches(SourceScanFailureEntity failure, Instant now) {
        if (failureType != null && failure.getFailureType() != failureType) {
            return false;
        }
        if (severity != null && failure.getSeverity() != severity) {
            return false;
        }
        if (!includeResolved && failure.isResolved()) {
            return false;
        }
        if (!includeExcluded && failure.isUserExcluded()) {
            return false;
        }
        return !readyForRetry || failure.isReadyForRetry(now);
    }
}
