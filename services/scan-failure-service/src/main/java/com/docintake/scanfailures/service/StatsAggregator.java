package com.docintake.scanfailures.service;

import com.docintake.scanfailures.domain.FailureStats;
import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import com.docintake.scanfailures.domain.SourceType;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Folds a set of failure records into a {@link FailureStats} snapshot in one pass.
 * Severity counts only cover active records; the exclusion count covers every
 * record still flagged as excluded.
 */
@Component
public class StatsAggregator {

    public FailureStats snapshot(Collection<SourceScanFailureEntity> failures, Instant now) {
        long active = 0;
        long resolved = 0;
        long excluded = 0;
        long critical = 0;
        long high = 0;
        long medium = 0;
        long low = 0;
        long ready = 0;

        Map<String, Long> bySourceType = new LinkedHashMap<>();
        for (SourceType sourceType : SourceType.values()) {
            bySourceType.put(sourceType.wireName(), 0L);
        }
        Map<String, Long> byErrorType = new TreeMap<>();

        for (SourceScanFailureEntity failure : failures) {
            bySourceType.merge(failure.getSourceType().wireName(), 1L, Long::sum);
            byErrorType.merge(failure.getFailureType().wireName(), 1L, Long::sum);
            if (failure.isUserExcluded()) {
                excluded++;
            }
            if (failure.isResolved()) {
                resolved++;
                continue;
            }
            active++;
            switch (failure.getSeverity()) {
                case CRITICAL -> critical++;
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
            if (failure.isReadyForRetry(now)) {
                ready++;
            }
        }

        return new FailureStats(
            active,
            resolved,
            excluded,
            critical,
            high,
            medium,
            low,
            ready,
            bySourceType,
            byErrorType
        );
    }
}
