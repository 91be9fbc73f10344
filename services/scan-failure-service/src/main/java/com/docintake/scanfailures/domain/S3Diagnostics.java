package com.docintake.scanfailures.domain;

public record S3Diagnostics(
    int pathLength,
    int directoryDepth,
    Integer responseTimeMs,
    String bucket,
    String region
) implements ScanDiagnostics {

    public static S3Diagnostics forKey(String bucket, String key) {
        return new S3Diagnostics(key.length(), ScanDiagnostics.depthOf(key), null, bucket, null);
    }

    @Override
    public SourceType sourceType() {
        return SourceType.S3;
    }
}
