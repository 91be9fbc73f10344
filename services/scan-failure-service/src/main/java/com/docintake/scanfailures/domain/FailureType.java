package com.docintake.scanfailures.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Union of the failure vocabularies reported by the three connector families.
 * Every constant belongs to exactly one {@link SourceType}.
 */
public enum FailureType {
    TIMEOUT(SourceType.WEBDAV, FailureCategory.TRANSIENT),
    PATH_TOO_LONG(SourceType.WEBDAV, FailureCategory.STRUCTURAL),
    PERMISSION_DENIED(SourceType.WEBDAV, FailureCategory.ACCESS),
    INVALID_CHARACTERS(SourceType.WEBDAV, FailureCategory.INVALID_TARGET),
    NETWORK_ERROR(SourceType.WEBDAV, FailureCategory.TRANSIENT),
    SERVER_ERROR(SourceType.WEBDAV, FailureCategory.SERVER),
    XML_PARSE_ERROR(SourceType.WEBDAV, FailureCategory.SERVER),
    TOO_MANY_ITEMS(SourceType.WEBDAV, FailureCategory.STRUCTURAL),
    DEPTH_LIMIT(SourceType.WEBDAV, FailureCategory.STRUCTURAL),
    SIZE_LIMIT(SourceType.WEBDAV, FailureCategory.STRUCTURAL),
    UNKNOWN(SourceType.WEBDAV, FailureCategory.UNCLASSIFIED),

    S3_ACCESS_DENIED(SourceType.S3, FailureCategory.ACCESS),
    S3_BUCKET_NOT_FOUND(SourceType.S3, FailureCategory.INVALID_TARGET),
    S3_INVALID_CREDENTIALS(SourceType.S3, FailureCategory.ACCESS),
    S3_NETWORK_ERROR(SourceType.S3, FailureCategory.TRANSIENT),

    LOCAL_PERMISSION_DENIED(SourceType.LOCAL_FOLDER, FailureCategory.ACCESS),
    LOCAL_PATH_NOT_FOUND(SourceType.LOCAL_FOLDER, FailureCategory.INVALID_TARGET),
    LOCAL_DISK_FULL(SourceType.LOCAL_FOLDER, FailureCategory.STRUCTURAL),
    LOCAL_IO_ERROR(SourceType.LOCAL_FOLDER, FailureCategory.SERVER);

    private final SourceType sourceType;
    private final FailureCategory category;

    FailureType(SourceType sourceType, FailureCategory category) {
        this.sourceType = sourceType;
        this.category = category;
    }

    public SourceType sourceType() {
        return sourceType;
    }

    public FailureCategory category() {
        return category;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FailureType fromWireName(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        try {
            return FailureType.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown failure type: " + value, ex);
        }
    }
}
