package com.docintake.scanfailures.service;

import com.docintake.scanfailures.domain.FailureClassification;
import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.LocalFolderDiagnostics;
import com.docintake.scanfailures.domain.S3Diagnostics;
import com.docintake.scanfailures.domain.ScanDiagnostics;
import com.docintake.scanfailures.domain.Severity;
import com.docintake.scanfailures.domain.SourceType;
import com.docintake.scanfailures.domain.WebDavDiagnostics;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Maps a failure to its severity, retry eligibility and operator guidance.
 * Pure and total: every input combination yields a classification.
 */
@Component
public class SeverityClassifier {

    private static final Set<FailureType> NOT_SELF_RESOLVING = EnumSet.of(
        FailureType.PATH_TOO_LONG,
        FailureType.INVALID_CHARACTERS,
        FailureType.S3_BUCKET_NOT_FOUND,
        FailureType.S3_INVALID_CREDENTIALS,
        FailureType.LOCAL_PATH_NOT_FOUND
    );

    private static final Map<FailureType, String> RECOMMENDED_ACTIONS = new EnumMap<>(FailureType.class);

    static {
        RECOMMENDED_ACTIONS.put(FailureType.TIMEOUT,
            "The server took too long to respond. The scan will be retried automatically; consider splitting very large directories.");
        RECOMMENDED_ACTIONS.put(FailureType.PATH_TOO_LONG,
            "Shorten directory and file names to reduce the total path length.");
        RECOMMENDED_ACTIONS.put(FailureType.PERMISSION_DENIED,
            "Check that the configured WebDAV account can read this directory.");
        RECOMMENDED_ACTIONS.put(FailureType.INVALID_CHARACTERS,
            "Rename files or directories that contain characters the server cannot handle.");
        RECOMMENDED_ACTIONS.put(FailureType.NETWORK_ERROR,
            "The server could not be reached. The scan will be retried automatically.");
        RECOMMENDED_ACTIONS.put(FailureType.SERVER_ERROR,
            "The WebDAV server returned an error. Check the server logs if the problem persists.");
        RECOMMENDED_ACTIONS.put(FailureType.XML_PARSE_ERROR,
            "The server returned a malformed directory listing. Check the WebDAV server configuration.");
        RECOMMENDED_ACTIONS.put(FailureType.TOO_MANY_ITEMS,
            "Split this directory into smaller subdirectories.");
        RECOMMENDED_ACTIONS.put(FailureType.DEPTH_LIMIT,
            "Flatten the directory structure or exclude deeply nested folders.");
        RECOMMENDED_ACTIONS.put(FailureType.SIZE_LIMIT,
            "The directory listing is too large to process. Split or exclude it.");
        RECOMMENDED_ACTIONS.put(FailureType.UNKNOWN,
            "An unrecognized error occurred. Review the error message and exclude the resource if it keeps failing.");
        RECOMMENDED_ACTIONS.put(FailureType.S3_ACCESS_DENIED,
            "Grant the configured credentials list and read access on this bucket or prefix.");
        RECOMMENDED_ACTIONS.put(FailureType.S3_BUCKET_NOT_FOUND,
            "Verify the bucket name and region in the source configuration.");
        RECOMMENDED_ACTIONS.put(FailureType.S3_INVALID_CREDENTIALS,
            "Update the access key and secret in the source configuration.");
        RECOMMENDED_ACTIONS.put(FailureType.S3_NETWORK_ERROR,
            "The S3 endpoint could not be reached. The scan will be retried automatically.");
        RECOMMENDED_ACTIONS.put(FailureType.LOCAL_PERMISSION_DENIED,
            "Grant the service user read access to this folder.");
        RECOMMENDED_ACTIONS.put(FailureType.LOCAL_PATH_NOT_FOUND,
            "The folder no longer exists. Update the watch folder configuration or restore the folder.");
        RECOMMENDED_ACTIONS.put(FailureType.LOCAL_DISK_FULL,
            "Free up disk space on the volume holding this folder.");
        RECOMMENDED_ACTIONS.put(FailureType.LOCAL_IO_ERROR,
            "A filesystem error occurred. Check the disk and mount health.");
    }

    public FailureClassification classify(
        SourceType sourceType,
        FailureType failureType,
        int consecutiveFailures,
        ScanDiagnostics diagnostics
    ) {
        // a type outside the source's own vocabulary is treated as unclassified
        FailureType effective = failureType.sourceType() == sourceType ? failureType : FailureType.UNKNOWN;
        Severity severity = severityOf(effective, consecutiveFailures);
        boolean canRetry = !NOT_SELF_RESOLVING.contains(effective);
        boolean userActionRequired = !canRetry || severity == Severity.CRITICAL;
        String action = recommendedAction(effective, diagnostics);
        return new FailureClassification(severity, canRetry, userActionRequired, action);
    }

    Severity severityOf(FailureType failureType, int consecutiveFailures) {
        return switch (failureType.category()) {
            case ACCESS, INVALID_TARGET -> Severity.HIGH;
            case STRUCTURAL -> consecutiveFailures >= 3 ? Severity.HIGH : Severity.MEDIUM;
            case TRANSIENT -> {
                if (consecutiveFailures >= 10) {
                    yield Severity.HIGH;
                }
                yield consecutiveFailures >= 5 ? Severity.MEDIUM : Severity.LOW;
            }
            case SERVER -> Severity.MEDIUM;
            case UNCLASSIFIED -> Severity.CRITICAL;
        };
    }

    private String recommendedAction(FailureType failureType, ScanDiagnostics diagnostics) {
        String base = RECOMMENDED_ACTIONS.get(failureType);
        String hint = diagnostics == null ? null : measuredHint(failureType, diagnostics);
        return hint == null ? base : base + " " + hint;
    }

    private String measuredHint(FailureType failureType, ScanDiagnostics diagnostics) {
        if (diagnostics instanceof S3Diagnostics s3) {
            return s3.bucket() == null ? null : "(bucket: " + s3.bucket() + ")";
        }
        if (diagnostics instanceof WebDavDiagnostics webDav) {
            return switch (failureType) {
                case PATH_TOO_LONG -> "(current length: " + webDav.pathLength() + " characters)";
                case DEPTH_LIMIT -> "(current depth: " + webDav.directoryDepth() + ")";
                case TOO_MANY_ITEMS -> webDav.estimatedItemCount() == null
                    ? null
                    : "(about " + webDav.estimatedItemCount() + " items)";
                case TIMEOUT -> webDav.responseTimeMs() == null
                    ? null
                    : "(last response took " + webDav.responseTimeMs() + " ms)";
                case SERVER_ERROR, XML_PARSE_ERROR -> webDav.serverType() == null
                    ? null
                    : "(server: " + webDav.serverType() + ")";
                default -> null;
            };
        }
        if (diagnostics instanceof LocalFolderDiagnostics local && failureType == FailureType.LOCAL_DISK_FULL) {
            return local.estimatedItemCount() == null ? null : "(about " + local.estimatedItemCount() + " items)";
        }
        return null;
    }
}
