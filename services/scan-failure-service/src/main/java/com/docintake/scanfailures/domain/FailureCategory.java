package com.docintake.scanfailures.domain;

/**
 * Source-independent grouping of failure types; drives the baseline severity.
 */
public enum FailureCategory {
    /** Credentials or permissions rejected by the source. */
    ACCESS,
    /** The resource exceeds a path, size, depth or item limit. */
    STRUCTURAL,
    /** Connectivity problems expected to clear on their own. */
    TRANSIENT,
    /** The source answered, but with an error or an unreadable payload. */
    SERVER,
    /** The configured target does not exist or cannot be addressed. */
    INVALID_TARGET,
    UNCLASSIFIED
}
