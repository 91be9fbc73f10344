package com.docintake.scanfailures.service;

import com.docintake.scanfailures.domain.FailureClassification;
import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.ResolutionMethod;
import com.docintake.scanfailures.domain.ScanDiagnostics;
import com.docintake.scanfailures.domain.ScanFailureSignal;
import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import com.docintake.scanfailures.domain.SourceType;
import com.docintake.scanfailures.service.interpret.ScanErrorInterpreter;
import com.docintake.scanfailures.service.interpret.ScanErrorInterpreters;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Connector-facing entry point: turns scan outcomes into failure records.
 */
@Service
public class FailureRecorder {

    private static final Logger LOGGER = LoggerFactory.getLogger(FailureRecorder.class);

    private final FailureStore failureStore;
    private final SeverityClassifier severityClassifier;
    private final RetryScheduler retryScheduler;
    private final ScanErrorInterpreters interpreters;
    private final Clock clock;

    public FailureRecorder(
        FailureStore failureStore,
        SeverityClassifier severityClassifier,
        RetryScheduler retryScheduler,
        ScanErrorInterpreters interpreters,
        Clock clock
    ) {
        this.failureStore = failureStore;
        this.severityClassifier = severityClassifier;
        this.retryScheduler = retryScheduler;
        this.interpreters = interpreters;
        this.clock = clock;
    }

    public SourceScanFailureEntity recordFailure(UUID sourceId, String resourcePath, ScanFailureSignal signal) {
        validate(sourceId, resourcePath, signal);
        Instant now = clock.instant();

        SourceScanFailureEntity saved = failureStore.upsertActive(
            sourceId,
            resourcePath,
            () -> {
                SourceScanFailureEntity created = SourceScanFailureEntity.openEpisode(sourceId, resourcePath, signal, now);
                classifyAndSchedule(created, signal.diagnostics(), now);
                return created;
            },
            existing -> {
                if (existing.getSourceType() != signal.sourceType()) {
                    throw new IllegalArgumentException("Resource '" + resourcePath + "' is tracked as a "
                        + existing.getSourceType().wireName() + " failure and cannot record "
                        + signal.failureType().wireName());
                }
                existing.registerFailure(signal, now);
                classifyAndSchedule(existing, signal.diagnostics(), now);
            }
        );

        LOGGER.info("Recorded {} failure #{} for {} resource '{}' (severity={}, nextRetryAt={}, excluded={})",
            saved.getFailureType().wireName(),
            saved.getConsecutiveFailures(),
            saved.getSourceType().wireName(),
            resourcePath,
            saved.getSeverity().wireName(),
            saved.getNextRetryAt(),
            saved.isUserExcluded());
        return saved;
    }

    /**
     * Records a failure from the connector's raw error, letting the source's
     * interpreter pick the failure type.
     */
    public SourceScanFailureEntity recordError(
        UUID sourceId,
        SourceType sourceType,
        String resourcePath,
        String errorMessage,
        Integer httpStatusCode,
        ScanDiagnostics diagnostics
    ) {
        if (sourceType == null) {
            throw new IllegalArgumentException("sourceType is required");
        }
        FailureType failureType = interpreters.forSource(sourceType).interpret(errorMessage, httpStatusCode);
        return recordFailure(sourceId, resourcePath, new ScanFailureSignal(failureType, errorMessage, httpStatusCode, diagnostics));
    }

    public SourceScanFailureEntity recordError(
        UUID sourceId,
        SourceType sourceType,
        String resourcePath,
        Throwable error,
        ScanDiagnostics diagnostics
    ) {
        return recordError(sourceId, sourceType, resourcePath, ScanErrorInterpreter.describe(error), null, diagnostics);
    }

    /**
     * Closes the open episode for the key, if any. Exclusion flags are kept.
     */
    public void recordSuccess(UUID sourceId, String resourcePath) {
        requireKey(sourceId, resourcePath);
        Instant now = clock.instant();
        Optional<SourceScanFailureEntity> resolved = failureStore.updateActive(
            sourceId,
            resourcePath,
            existing -> existing.markResolved(ResolutionMethod.SUCCESSFUL_SCAN, now)
        );
        resolved.ifPresent(failure -> LOGGER.info(
            "Resolved {} failure episode {} for resource '{}' after {} failures",
            failure.getSourceType().wireName(),
            failure.getId(),
            resourcePath,
            failure.getFailureCount()));
    }

    private void classifyAndSchedule(SourceScanFailureEntity failure, ScanDiagnostics diagnostics, Instant now) {
        FailureClassification classification = severityClassifier.classify(
            failure.getSourceType(),
            failure.getFailureType(),
            failure.getConsecutiveFailures(),
            diagnostics == null ? failure.storedDiagnostics() : diagnostics
        );
        Instant nextRetryAt = retryScheduler.schedule(
            failure.getConsecutiveFailures(),
            classification.canRetry(),
            failure.isUserExcluded(),
            now
        ).orElse(null);
        failure.applyClassification(classification, nextRetryAt);
    }

    private void validate(UUID sourceId, String resourcePath, ScanFailureSignal signal) {
        requireKey(sourceId, resourcePath);
        if (signal == null || signal.failureType() == null) {
            throw new IllegalArgumentException("failure type is required");
        }
        ScanDiagnostics diagnostics = signal.diagnostics();
        if (diagnostics != null && diagnostics.sourceType() != signal.sourceType()) {
            throw new IllegalArgumentException("Diagnostics for " + diagnostics.sourceType().wireName()
                + " cannot describe a " + signal.sourceType().wireName() + " failure");
        }
    }

    private void requireKey(UUID sourceId, String resourcePath) {
        if (sourceId == null) {
            throw new IllegalArgumentException("sourceId is required");
        }
        if (resourcePath == null || resourcePath.isBlank()) {
            throw new IllegalArgumentException("resourcePath must not be blank");
        }
        if (resourcePath.length() > SourceScanFailureEntity.MAX_PATH_LENGTH) {
            throw new IllegalArgumentException("resourcePath must not exceed "
                + SourceScanFailureEntity.MAX_PATH_LENGTH + " characters");
        }
    }
}
