package com.docintake.scanfailures.domain;

public record WebDavDiagnostics(
    int pathLength,
    int directoryDepth,
    Integer estimatedItemCount,
    Integer responseTimeMs,
    Double responseSizeMb,
    String serverType
) implements ScanDiagnostics {

    public static WebDavDiagnostics forPath(String path) {
        return new WebDavDiagnostics(path.length(), ScanDiagnostics.depthOf(path), null, null, null, null);
    }

    @Override
    public SourceType sourceType() {
        return SourceType.WEBDAV;
    }
}
