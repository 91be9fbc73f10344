package com.docintake.scanfailures.service;

import java.util.UUID;

public class FailureNotFoundException extends RuntimeException {

    public FailureNotFoundException(UUID failureId) {
        super("Source scan failure not found: " + failureId);
    }
}
