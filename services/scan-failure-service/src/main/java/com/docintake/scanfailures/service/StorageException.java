package com.docintake.scanfailures.service;

/**
 * Persistence failed and the operation left no partial change behind.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
