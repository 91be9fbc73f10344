package com.docintake.scanfailures.controller;

import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import jakarta.validation.constraints.Size;

public record RetryFailureRequest(
    @Size(max = SourceScanFailureEntity.MAX_MESSAGE_LENGTH)
    String notes
) {
}
