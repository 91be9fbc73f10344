package com.docintake.scanfailures.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Presentation-only ratios derived from a {@link FailureStats} snapshot.
 * Severity shares use all recorded failures as the base; the retry share uses
 * active failures only.
 */
public record FailureStatsPercentages(
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("critical_pct") double criticalPct,
    @JsonProperty("high_pct") double highPct,
    @JsonProperty("medium_pct") double mediumPct,
    @JsonProperty("low_pct") double lowPct,
    @JsonProperty("retry_pct") double retryPct
) {

    public static FailureStatsPercentages from(FailureStats stats) {
        long total = stats.totalFailures();
        double successRate = total == 0 ? 100.0 : pct(stats.resolvedFailures(), total);
        return new FailureStatsPercentages(
            successRate,
            pct(stats.criticalFailures(), total),
            pct(stats.highFailures(), total),
            pct(stats.mediumFailures(), total),
            pct(stats.lowFailures(), total),
            pct(stats.readyForRetry(), stats.activeFailures())
        );
    }

    public static double pct(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator * 100.0;
    }

    public FailureStatsPercentages rounded() {
        return new FailureStatsPercentages(
            oneDecimal(successRate),
            oneDecimal(criticalPct),
            oneDecimal(highPct),
            oneDecimal(mediumPct),
            oneDecimal(lowPct),
            oneDecimal(retryPct)
        );
    }

    private static double oneDecimal(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
