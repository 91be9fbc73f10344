package com.docintake.scanfailures.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

/**
 * One failure episode for a {@code (source_id, resource_path)} key.
 * <p>
 * {@code active_key} holds a digest of the key while the episode is open and is
 * cleared on resolution, so the unique constraint on it allows at most one open
 * episode per key while keeping any number of resolved ones.
 */
@Entity
@Table(
    name = "source_scan_failures",
    indexes = {
        @Index(name = "idx_source_scan_failures_source_type", columnList = "source_type"),
        @Index(name = "idx_source_scan_failures_resolved", columnList = "resolved"),
        @Index(name = "idx_source_scan_failures_next_retry", columnList = "next_retry_at"),
        @Index(name = "idx_source_scan_failures_source_path", columnList = "source_id,resource_path")
    },
    uniqueConstraints = @UniqueConstraint(name = "uk_source_scan_failures_active_key", columnNames = "active_key")
)
public class SourceScanFailureEntity {

    public static final int MAX_MESSAGE_LENGTH = 2000;
    public static final int MAX_PATH_LENGTH = 4096;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "source_id", nullable = false, updatable = false)
    private UUID sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, updatable = false, length = 20)
    private SourceType sourceType;

    @Column(name = "resource_path", nullable = false, updatable = false, length = MAX_PATH_LENGTH)
    private String resourcePath;

    @Column(name = "active_key", length = 64)
    private String activeKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_type", nullable = false, length = 40)
    private FailureType failureType;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private Severity severity;

    @Column(name = "error_message", length = MAX_MESSAGE_LENGTH)
    private String errorMessage;

    @Column(name = "http_status_code")
    private Integer httpStatusCode;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "first_failure_at", nullable = false)
    private Instant firstFailureAt;

    @Column(name = "last_failure_at", nullable = false)
    private Instant lastFailureAt;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "user_excluded", nullable = false)
    private boolean userExcluded;

    @Column(name = "permanent", nullable = false)
    private boolean permanent;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_method", length = 20)
    private ResolutionMethod resolutionMethod;

    @Column(name = "user_notes", length = MAX_MESSAGE_LENGTH)
    private String userNotes;

    @Column(name = "path_length", nullable = false)
    private int pathLength;

    @Column(name = "directory_depth", nullable = false)
    private int directoryDepth;

    @Column(name = "estimated_item_count")
    private Integer estimatedItemCount;

    @Column(name = "response_time_ms")
    private Integer responseTimeMs;

    @Column(name = "response_size_mb")
    private Double responseSizeMb;

    @Column(name = "server_type", length = 255)
    private String serverType;

    @Column(name = "bucket_name", length = 255)
    private String bucketName;

    @Column(name = "region", length = 64)
    private String region;

    @Column(name = "can_retry", nullable = false)
    private boolean canRetry;

    @Column(name = "user_action_required", nullable = false)
    private boolean userActionRequired;

    @Column(name = "recommended_action", nullable = false, length = 1024)
    private String recommendedAction;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static SourceScanFailureEntity openEpisode(UUID sourceId, String resourcePath, ScanFailureSignal signal, Instant now) {
        SourceScanFailureEntity entity = new SourceScanFailureEntity();
        entity.id = UUID.randomUUID();
        entity.sourceId = sourceId;
        entity.sourceType = signal.sourceType();
        entity.resourcePath = resourcePath;
        entity.activeKey = activeKeyOf(sourceId, resourcePath);
        entity.failureCount = 1;
        entity.consecutiveFailures = 1;
        entity.firstFailureAt = now;
        entity.lastFailureAt = now;
        entity.applySignal(signal);
        return entity;
    }

    /**
     * Bookkeeping for a repeated failure. Exclusion is left as is.
     */
    public void registerFailure(ScanFailureSignal signal, Instant now) {
        this.failureCount++;
        this.consecutiveFailures++;
        this.lastFailureAt = now;
        applySignal(signal);
    }

    public void applyClassification(FailureClassification classification, Instant nextRetryAt) {
        this.severity = classification.severity();
        this.canRetry = classification.canRetry();
        this.userActionRequired = classification.userActionRequired();
        this.recommendedAction = classification.recommendedAction();
        this.nextRetryAt = userExcluded || !canRetry ? null : nextRetryAt;
    }

    public void markResolved(ResolutionMethod method, Instant now) {
        this.resolved = true;
        this.resolvedAt = now;
        this.resolutionMethod = method;
        this.consecutiveFailures = 0;
        this.nextRetryAt = null;
        this.activeKey = null;
    }

    /**
     * Operator override: the resource becomes due immediately even when the
     * classifier judged it non-retryable.
     */
    public void scheduleImmediateRetry(Instant now) {
        this.canRetry = true;
        this.userActionRequired = false;
        this.nextRetryAt = now;
    }

    public void exclude(boolean permanent) {
        this.userExcluded = true;
        this.permanent = permanent;
        this.nextRetryAt = null;
    }

    public void unexclude(Instant nextRetryAt) {
        this.userExcluded = false;
        this.permanent = false;
        this.nextRetryAt = canRetry ? nextRetryAt : null;
    }

    public void replaceNotes(String notes) {
        if (notes != null) {
            this.userNotes = truncate(notes);
        }
    }

    public boolean isReadyForRetry(Instant now) {
        return !resolved && !userExcluded && nextRetryAt != null && !nextRetryAt.isAfter(now);
    }

    public DiagnosticSummary diagnosticSummary() {
        return new DiagnosticSummary(
            pathLength,
            directoryDepth,
            estimatedItemCount,
            responseTimeMs,
            responseSizeMb,
            serverType,
            recommendedAction,
            canRetry,
            userActionRequired
        );
    }

    /**
     * Diagnostics as last stored, in the variant matching this record's source type.
     */
    public ScanDiagnostics storedDiagnostics() {
        return switch (sourceType) {
            case WEBDAV -> new WebDavDiagnostics(
                pathLength, directoryDepth, estimatedItemCount, responseTimeMs, responseSizeMb, serverType);
            case S3 -> new S3Diagnostics(pathLength, directoryDepth, responseTimeMs, bucketName, region);
            case LOCAL_FOLDER -> new LocalFolderDiagnostics(pathLength, directoryDepth, estimatedItemCount);
        };
    }

    public static String activeKeyOf(UUID sourceId, String resourcePath) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((sourceId + "|" + resourcePath).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void applySignal(ScanFailureSignal signal) {
        this.failureType = signal.failureType();
        this.errorMessage = truncate(signal.errorMessage());
        this.httpStatusCode = signal.httpStatusCode();

        ScanDiagnostics diagnostics = signal.diagnostics();
        if (diagnostics == null) {
            this.pathLength = resourcePath.length();
            this.directoryDepth = ScanDiagnostics.depthOf(resourcePath);
            this.estimatedItemCount = null;
            this.responseTimeMs = null;
            this.responseSizeMb = null;
            this.serverType = null;
            this.bucketName = null;
            this.region = null;
            return;
        }
        this.pathLength = diagnostics.pathLength();
        this.directoryDepth = diagnostics.directoryDepth();
        this.estimatedItemCount = diagnostics.estimatedItemCount();
        this.responseTimeMs = diagnostics.responseTimeMs();
        this.responseSizeMb = diagnostics.responseSizeMb();
        this.serverType = diagnostics.serverType();
        this.bucketName = diagnostics.bucket();
        this.region = diagnostics.region();
    }

    private static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() <= MAX_MESSAGE_LENGTH ? text : text.substring(0, MAX_MESSAGE_LENGTH);
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    public String getResourcePath() {
        return resourcePath;
    }

    public String getActiveKey() {
        return activeKey;
    }

    public FailureType getFailureType() {
        return failureType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Integer getHttpStatusCode() {
        return httpStatusCode;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public Instant getFirstFailureAt() {
        return firstFailureAt;
    }

    public Instant getLastFailureAt() {
        return lastFailureAt;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }

    public boolean isUserExcluded() {
        return userExcluded;
    }

    public boolean isPermanent() {
        return permanent;
    }

    public boolean isResolved() {
        return resolved;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public ResolutionMethod getResolutionMethod() {
        return resolutionMethod;
    }

    public String getUserNotes() {
        return userNotes;
    }

    public boolean isCanRetry() {
        return canRetry;
    }

    public boolean isUserActionRequired() {
        return userActionRequired;
    }

    public String getRecommendedAction() {
        return recommendedAction;
    }

    public int getPathLength() {
        return pathLength;
    }

    public int getDirectoryDepth() {
        return directoryDepth;
    }

    public String getBucketName() {
        return bucketName;
    }

    public String getRegion() {
        return region;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
