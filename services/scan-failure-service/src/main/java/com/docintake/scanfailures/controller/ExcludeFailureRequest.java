package com.docintake.scanfailures.controller;

import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import jakarta.validation.constraints.Size;

public record ExcludeFailureRequest(
    @Size(max = SourceScanFailureEntity.MAX_MESSAGE_LENGTH)
    String notes,

    Boolean permanent
) {

    public boolean permanentOrDefault() {
        return permanent == null || permanent;
    }
}
