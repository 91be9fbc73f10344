package com.docintake.scanfailures.controller;

import com.docintake.scanfailures.domain.FailureStats;
import com.docintake.scanfailures.domain.FailureStatsPercentages;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Stats counters at the top level, with rounded ratios under {@code percentages}.
 */
public record StatsResponse(
    @JsonUnwrapped FailureStats stats,
    FailureStatsPercentages percentages
) {

    public static StatsResponse of(FailureStats stats) {
        return new StatsResponse(stats, FailureStatsPercentages.from(stats).rounded());
    }
}
