package com.docintake.scanfailures.domain;

/**
 * Measured context a connector attaches to a failure. Each connector family has
 * its own variant so its fields stay statically known; shared accessors default
 * to {@code null} where a family does not measure them.
 */
public sealed interface ScanDiagnostics permits WebDavDiagnostics, S3Diagnostics, LocalFolderDiagnostics {

    SourceType sourceType();

    int pathLength();

    int directoryDepth();

    default Integer estimatedItemCount() {
        return null;
    }

    default Integer responseTimeMs() {
        return null;
    }

    default Double responseSizeMb() {
        return null;
    }

    default String serverType() {
        return null;
    }

    default String bucket() {
        return null;
    }

    default String region() {
        return null;
    }

    /**
     * Number of non-empty segments minus one, so {@code /a/b/file} has depth 2
     * and the root has depth 0.
     */
    static int depthOf(String path) {
        if (path == null || path.isBlank()) {
            return 0;
        }
        int segments = 0;
        for (String part : path.split("[/\\\\]")) {
            if (!part.isEmpty()) {
                segments++;
            }
        }
        return Math.max(0, segments - 1);
    }
}
