package com.docintake.scanfailures.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record FailureStats(
    @JsonProperty("active_failures") long activeFailures,
    @JsonProperty("resolved_failures") long resolvedFailures,
    @JsonProperty("excluded_resources") long excludedResources,
    @JsonProperty("critical_failures") long criticalFailures,
    @JsonProperty("high_failures") long highFailures,
    @JsonProperty("medium_failures") long mediumFailures,
    @JsonProperty("low_failures") long lowFailures,
    @JsonProperty("ready_for_retry") long readyForRetry,
    @JsonProperty("failures_by_source_type") Map<String, Long> failuresBySourceType,
    @JsonProperty("failures_by_error_type") Map<String, Long> failuresByErrorType
) {

    public static FailureStats empty() {
        return new FailureStats(0, 0, 0, 0, 0, 0, 0, 0, Map.of(), Map.of());
    }

    public long totalFailures() {
        return activeFailures + resolvedFailures;
    }
}
