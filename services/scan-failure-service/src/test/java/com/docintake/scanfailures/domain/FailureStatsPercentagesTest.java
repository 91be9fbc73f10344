package com.docintake.scanfailures.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class FailureStatsPercentagesTest {

    @Test
    void should_ComputeDashboardRatios_When_StatsArePopulated() {
        FailureStats stats = new FailureStats(15, 35, 2, 3, 7, 4, 1, 8, Map.of(), Map.of());

        FailureStatsPercentages percentages = FailureStatsPercentages.from(stats).rounded();

        assertThat(percentages.successRate()).isEqualTo(70.0);
        assertThat(percentages.criticalPct()).isEqualTo(6.0);
        assertThat(percentages.highPct()).isEqualTo(14.0);
        assertThat(percentages.mediumPct()).isEqualTo(8.0);
        assertThat(percentages.lowPct()).isEqualTo(2.0);
        assertThat(percentages.retryPct()).isEqualTo(53.3);
    }

    @Test
    void should_ReportFullSuccess_When_NothingWasRecorded() {
        FailureStatsPercentages percentages = FailureStatsPercentages.from(FailureStats.empty());

        assertThat(percentages.successRate()).isEqualTo(100.0);
        assertThat(percentages.criticalPct()).isZero();
        assertThat(percentages.retryPct()).isZero();
    }

    @Test
    void should_ReportZeroRetryShare_When_NoActiveFailures() {
        FailureStats stats = new FailureStats(0, 12, 0, 0, 0, 0, 0, 0, Map.of(), Map.of());

        FailureStatsPercentages percentages = FailureStatsPercentages.from(stats);

        assertThat(percentages.retryPct()).isEqualTo(0.0);
        assertThat(percentages.successRate()).isEqualTo(100.0);
    }

    @Test
    void should_ReturnZero_When_DenominatorIsZero() {
        assertThat(FailureStatsPercentages.pct(5, 0)).isEqualTo(0.0);
        assertThat(FailureStatsPercentages.pct(1, 4)).isEqualTo(25.0);
    }
}
