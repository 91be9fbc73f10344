package com.docintake.scanfailures.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scan-failures")
public class ScanFailureProperties {

    private Duration retryBaseDelay = Duration.ofMinutes(5);
    private Duration retryMaxDelay = Duration.ofHours(24);
    private int defaultRetryCandidateLimit = 10;
    private boolean summaryLogEnabled = false;
    private long summaryLogFixedDelayMs = 900_000;

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public void setRetryMaxDelay(Duration retryMaxDelay) {
        this.retryMaxDelay = retryMaxDelay;
    }

    public int getDefaultRetryCandidateLimit() {
        return defaultRetryCandidateLimit;
    }

    public void setDefaultRetryCandidateLimit(int defaultRetryCandidateLimit) {
        this.defaultRetryCandidateLimit = defaultRetryCandidateLimit;
    }

    public boolean isSummaryLogEnabled() {
        return summaryLogEnabled;
    }

    public void setSummaryLogEnabled(boolean summaryLogEnabled) {
        this.summaryLogEnabled = summaryLogEnabled;
    }

    public long getSummaryLogFixedDelayMs() {
        return summaryLogFixedDelayMs;
    }

    public void setSummaryLogFixedDelayMs(long summaryLogFixedDelayMs) {
        this.summaryLogFixedDelayMs = summaryLogFixedDelayMs;
    }
}
