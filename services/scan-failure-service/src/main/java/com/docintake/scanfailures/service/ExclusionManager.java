package com.docintake.scanfailures.service;

import com.docintake.scanfailures.domain.ResolutionMethod;
import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator overrides on individual failure records. Each action locks the
 * record, checks its state and applies the change in one transaction.
 */
@Service
public class ExclusionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExclusionManager.class);

    private final FailureStore failureStore;
    private final RetryScheduler retryScheduler;
    private final Clock clock;

    public ExclusionManager(FailureStore failureStore, RetryScheduler retryScheduler, Clock clock) {
        this.failureStore = failureStore;
        this.retryScheduler = retryScheduler;
        this.clock = clock;
    }

    /**
     * Makes the resource due for a scan right away. Counters are kept.
     *
     * @throws InvalidFailureStateException when the record is resolved or excluded
     */
    public SourceScanFailureEntity retry(UUID failureId, String notes) {
        Instant now = clock.instant();
        SourceScanFailureEntity updated = failureStore.updateById(failureId, failure -> {
            requireActive(failure);
            if (failure.isUserExcluded()) {
                throw InvalidFailureStateException.excluded(failure.getId());
            }
            failure.scheduleImmediateRetry(now);
            failure.replaceNotes(notes);
        });
        LOGGER.info("Manual retry scheduled for {} resource '{}' ({})",
            updated.getSourceType().wireName(), updated.getResourcePath(), failureId);
        return updated;
    }

    /**
     * Removes the resource from automatic retries. Repeating the call only
     * updates {@code permanent} and the notes.
     */
    public SourceScanFailureEntity exclude(UUID failureId, String notes, boolean permanent) {
        SourceScanFailureEntity updated = failureStore.updateById(failureId, failure -> {
            requireActive(failure);
            failure.exclude(permanent);
            failure.replaceNotes(notes);
        });
        LOGGER.info("Excluded {} resource '{}' ({}, permanent={})",
            updated.getSourceType().wireName(), updated.getResourcePath(), failureId, permanent);
        return updated;
    }

    public SourceScanFailureEntity unexclude(UUID failureId) {
        Instant now = clock.instant();
        SourceScanFailureEntity updated = failureStore.updateById(failureId, failure -> {
            requireActive(failure);
            if (!failure.isUserExcluded()) {
                return;
            }
            Instant nextRetryAt = retryScheduler.schedule(
                failure.getConsecutiveFailures(),
                failure.isCanRetry(),
                false,
                now
            ).orElse(null);
            failure.unexclude(nextRetryAt);
        });
        LOGGER.info("Unexcluded {} resource '{}' ({}, nextRetryAt={})",
            updated.getSourceType().wireName(), updated.getResourcePath(), failureId, updated.getNextRetryAt());
        return updated;
    }

    public SourceScanFailureEntity resolve(UUID failureId, String notes) {
        Instant now = clock.instant();
        SourceScanFailureEntity updated = failureStore.updateById(failureId, failure -> {
            requireActive(failure);
            failure.markResolved(ResolutionMethod.MANUAL, now);
            failure.replaceNotes(notes);
        });
        LOGGER.info("Manually resolved {} resource '{}' ({})",
            updated.getSourceType().wireName(), updated.getResourcePath(), failureId);
        return updated;
    }

    private static void requireActive(SourceScanFailureEntity failure) {
        if (failure.isResolved()) {
            throw InvalidFailureStateException.alreadyResolved(failure.getId());
        }
    }
}
