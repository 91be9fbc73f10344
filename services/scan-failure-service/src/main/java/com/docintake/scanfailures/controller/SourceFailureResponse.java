package com.docintake.scanfailures.controller;

import com.docintake.scanfailures.domain.ActionStatus;
import com.docintake.scanfailures.domain.DiagnosticSummary;
import com.docintake.scanfailures.domain.FailureStatus;
import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.ResolutionMethod;
import com.docintake.scanfailures.domain.Severity;
import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import com.docintake.scanfailures.domain.SourceType;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;

public record SourceFailureResponse(
    UUID id,
    @JsonProperty("source_id") UUID sourceId,
    @JsonProperty("source_type") SourceType sourceType,
    @JsonProperty("resource_path") String resourcePath,
    @JsonProperty("failure_type") FailureType failureType,
    Severity severity,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("http_status_code") Integer httpStatusCode,
    @JsonProperty("failure_count") int failureCount,
    @JsonProperty("consecutive_failures") int consecutiveFailures,
    @JsonProperty("first_failure_at") Instant firstFailureAt,
    @JsonProperty("last_failure_at") Instant lastFailureAt,
    @JsonProperty("next_retry_at") Instant nextRetryAt,
    @JsonProperty("user_excluded") boolean userExcluded,
    boolean permanent,
    boolean resolved,
    @JsonProperty("resolved_at") Instant resolvedAt,
    @JsonProperty("resolution_method") ResolutionMethod resolutionMethod,
    @JsonProperty("user_notes") String userNotes,
    @JsonProperty("bucket_name") String bucketName,
    String region,
    @JsonProperty("diagnostic_summary") DiagnosticSummary diagnosticSummary,
    @JsonProperty("failure_status") FailureStatus failureStatus,
    @JsonProperty("action_status") ActionStatus actionStatus
) {

    public static SourceFailureResponse from(SourceScanFailureEntity entity, Instant now) {
        return new SourceFailureResponse(
            entity.getId(),
            entity.getSourceId(),
            entity.getSourceType(),
            entity.getResourcePath(),
            entity.getFailureType(),
            entity.getSeverity(),
            entity.getErrorMessage(),
            entity.getHttpStatusCode(),
            entity.getFailureCount(),
            entity.getConsecutiveFailures(),
            entity.getFirstFailureAt(),
            entity.getLastFailureAt(),
            entity.getNextRetryAt(),
            entity.isUserExcluded(),
            entity.isPermanent(),
            entity.isResolved(),
            entity.getResolvedAt(),
            entity.getResolutionMethod(),
            entity.getUserNotes(),
            entity.getBucketName(),
            entity.getRegion(),
            entity.diagnosticSummary(),
            FailureStatus.of(entity.getFailureCount()),
            ActionStatus.of(entity, now)
        );
    }
}
