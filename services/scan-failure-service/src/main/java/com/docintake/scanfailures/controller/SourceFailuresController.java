package com.docintake.scanfailures.controller;

import com.docintake.scanfailures.domain.FailureStats;
import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.Severity;
import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import com.docintake.scanfailures.domain.SourceType;
import com.docintake.scanfailures.service.ExclusionManager;
import com.docintake.scanfailures.service.FailureListQuery;
import com.docintake.scanfailures.service.FailureQueryService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/source-failures")
public class SourceFailuresController {

    private final FailureQueryService queryService;
    private final ExclusionManager exclusionManager;
    private final Clock clock;

    public SourceFailuresController(FailureQueryService queryService, ExclusionManager exclusionManager, Clock clock) {
        this.queryService = queryService;
        this.exclusionManager = exclusionManager;
        this.clock = clock;
    }

    @GetMapping
    public FailureListResponse list(
        @RequestParam(name = "source_type", required = false) String sourceType,
        @RequestParam(name = "error_type", required = false) String errorType,
        @RequestParam(name = "severity", required = false) String severity,
        @RequestParam(name = "include_resolved", defaultValue = "true") boolean includeResolved,
        @RequestParam(name = "include_excluded", defaultValue = "true") boolean includeExcluded,
        @RequestParam(name = "ready_for_retry", defaultValue = "false") boolean readyForRetry,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "offset", defaultValue = "0") int offset
    ) {
        FailureListQuery query = new FailureListQuery(
            parseSourceType(sourceType),
            isBlank(errorType) ? null : FailureType.fromWireName(errorType),
            isBlank(severity) ? null : Severity.fromWireName(severity),
            includeResolved,
            includeExcluded,
            readyForRetry,
            limit,
            offset
        );
        FailureQueryService.FailureListing listing = queryService.list(query);
        List<SourceFailureResponse> failures = listing.failures().stream()
            .map(failure -> SourceFailureResponse.from(failure, listing.observedAt()))
            .toList();
        return new FailureListResponse(failures, listing.stats());
    }

    @GetMapping("/stats")
    public StatsResponse stats(@RequestParam(name = "source_type", required = false) String sourceType) {
        FailureStats stats = queryService.stats(parseSourceType(sourceType));
        return StatsResponse.of(stats);
    }

    @GetMapping("/retry-candidates")
    public List<SourceFailureResponse> retryCandidates(
        @RequestParam(name = "source_type", required = false) String sourceType,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        Instant now = clock.instant();
        return queryService.retryCandidates(parseSourceType(sourceType), limit).stream()
            .map(failure -> SourceFailureResponse.from(failure, now))
            .toList();
    }

    @GetMapping("/{id}")
    public SourceFailureResponse get(@PathVariable UUID id) {
        return toResponse(queryService.get(id));
    }

    @PostMapping("/{id}/retry")
    public SourceFailureResponse retry(
        @PathVariable UUID id,
        @Valid @RequestBody(required = false) RetryFailureRequest request
    ) {
        String notes = request == null ? null : request.notes();
        return toResponse(exclusionManager.retry(id, notes));
    }

    @PostMapping("/{id}/exclude")
    public SourceFailureResponse exclude(
        @PathVariable UUID id,
        @Valid @RequestBody(required = false) ExcludeFailureRequest request
    ) {
        String notes = request == null ? null : request.notes();
        boolean permanent = request == null || request.permanentOrDefault();
        return toResponse(exclusionManager.exclude(id, notes, permanent));
    }

    @PostMapping("/{id}/unexclude")
    public SourceFailureResponse unexclude(@PathVariable UUID id) {
        return toResponse(exclusionManager.unexclude(id));
    }

    @PostMapping("/{id}/resolve")
    public SourceFailureResponse resolve(
        @PathVariable UUID id,
        @Valid @RequestBody(required = false) ResolveFailureRequest request
    ) {
        String notes = request == null ? null : request.notes();
        return toResponse(exclusionManager.resolve(id, notes));
    }

    private SourceFailureResponse toResponse(SourceScanFailureEntity failure) {
        return SourceFailureResponse.from(failure, clock.instant());
    }

    private static SourceType parseSourceType(String value) {
        return isBlank(value) ? null : SourceType.fromWireName(value);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
