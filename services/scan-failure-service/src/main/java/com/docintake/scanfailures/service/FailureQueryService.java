package com.docintake.scanfailures.service;

import com.docintake.scanfailures.config.ScanFailureProperties;
import com.docintake.scanfailures.domain.FailureStats;
import com.docintake.scanfailures.domain.SkipDecision;
import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import com.docintake.scanfailures.domain.SourceType;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;

@Service
public class FailureQueryService {

    static final int MAX_RETRY_CANDIDATES = 200;

    private final FailureStore failureStore;
    private final StatsAggregator statsAggregator;
    private final ScanFailureProperties properties;
    private final Clock clock;

    public FailureQueryService(
        FailureStore failureStore,
        StatsAggregator statsAggregator,
        ScanFailureProperties properties,
        Clock clock
    ) {
        this.failureStore = failureStore;
        this.statsAggregator = statsAggregator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Failures newest first, filtered and paged by the query, with stats over the
     * query's source type only. Stats always count every row of that source type.
     */
    public FailureListing list(FailureListQuery query) {
        Instant now = clock.instant();
        return failureStore.readSnapshot(query.sourceType(), all -> {
            FailureStats stats = statsAggregator.snapshot(all, now);
            List<SourceScanFailureEntity> failures = all.stream()
                .filter(failure -> query.matches(failure, now))
                .skip(query.offset())
                .limit(query.limit() == null ? Long.MAX_VALUE : query.limit())
                .toList();
            return new FailureListing(failures, stats, now);
        });
    }

    public FailureStats stats(SourceType sourceType) {
        Instant now = clock.instant();
        return failureStore.readSnapshot(sourceType, all -> statsAggregator.snapshot(all, now));
    }

    public SourceScanFailureEntity get(UUID failureId) {
        return failureStore.findById(failureId)
            .orElseThrow(() -> new FailureNotFoundException(failureId));
    }

    public List<SourceScanFailureEntity> retryCandidates(SourceType sourceType, Integer limit) {
        int requested = limit == null ? properties.getDefaultRetryCandidateLimit() : limit;
        int clamped = Math.max(1, Math.min(requested, MAX_RETRY_CANDIDATES));
        return failureStore.findRetryCandidates(sourceType, clock.instant(), clamped);
    }

    /**
     * Tells a connector whether to leave a resource out of the current scan.
     */
    public SkipDecision shouldSkip(UUID sourceId, String resourcePath) {
        Optional<SourceScanFailureEntity> active = failureStore.findActive(sourceId, resourcePath);
        if (active.isEmpty()) {
            return SkipDecision.proceed("no active failure");
        }
        SourceScanFailureEntity failure = active.get();
        Instant now = clock.instant();
        Instant nextRetryAt = failure.getNextRetryAt();

        if (failure.isUserExcluded()) {
            String reason = failure.isPermanent() ? "permanently excluded" : "temporarily excluded";
            return skip(failure, reason);
        }
        if (nextRetryAt == null) {
            return skip(failure, "not retryable: " + failure.getFailureType().wireName());
        }
        if (nextRetryAt.isAfter(now)) {
            return skip(failure, "retry scheduled");
        }
        return new SkipDecision(false, "retry due", failure.getFailureCount(), nextRetryAt);
    }

    private static SkipDecision skip(SourceScanFailureEntity failure, String reason) {
        return new SkipDecision(true, reason, failure.getFailureCount(), failure.getNextRetryAt());
    }

    public record FailureListing(List<SourceScanFailureEntity> failures, FailureStats stats, Instant observedAt) {
    }
}
