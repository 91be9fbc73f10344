package com.docintake.scanfailures.domain;

public record LocalFolderDiagnostics(
    int pathLength,
    int directoryDepth,
    Integer estimatedItemCount
) implements ScanDiagnostics {

    public static LocalFolderDiagnostics forPath(String path) {
        return new LocalFolderDiagnostics(path.length(), ScanDiagnostics.depthOf(path), null);
    }

    @Override
    public SourceType sourceType() {
        return SourceType.LOCAL_FOLDER;
    }
}
