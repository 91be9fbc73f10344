package com.docintake.scanfailures.controller;

import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import jakarta.validation.constraints.Size;

public record ResolveFailureRequest(
    @Size(max = SourceScanFailureEntity.MAX_MESSAGE_LENGTH)
    String notes
) {
}
