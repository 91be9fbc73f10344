package com.docintake.scanfailures.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.ResolutionMethod;
import com.docintake.scanfailures.domain.ScanFailureSignal;
import com.docintake.scanfailures.domain.SourceScanFailureEntity;
import com.docintake.scanfailures.domain.SourceType;
import com.docintake.scanfailures.repository.SourceScanFailureRepository;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ExclusionManagerIntegrationTest {

    @Autowired
    private FailureRecorder failureRecorder;

    @Autowired
    private ExclusionManager exclusionManager;

    @Autowired
    private FailureQueryService queryService;

    @Autowired
    private SourceScanFailureRepository repository;

    private UUID sourceId;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        sourceId = UUID.randomUUID();
    }

    @Test
    void should_RejectRetry_When_ResourceIsPermanentlyExcluded() {
        SourceScanFailureEntity failure = record(FailureType.TIMEOUT, "/docs");
        exclusionManager.exclude(failure.getId(), "skip forever", true);

        assertThatThrownBy(() -> exclusionManager.retry(failure.getId(), null))
            .isInstanceOfSatisfying(InvalidFailureStateException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(InvalidFailureStateException.Reason.EXCLUDED));
    }

    @Test
    void should_UpdatePermanenceAndNotes_When_ExcludedTwice() {
        SourceScanFailureEntity failure = record(FailureType.NETWORK_ERROR, "/docs");

        exclusionManager.exclude(failure.getId(), "first", true);
        SourceScanFailureEntity again = exclusionManager.exclude(failure.getId(), "second", false);

        assertThat(again.isUserExcluded()).isTrue();
        assertThat(again.isPermanent()).isFalse();
        assertThat(again.getUserNotes()).isEqualTo("second");
        assertThat(again.getNextRetryAt()).isNull();
    }

    @Test
    void should_MakeResourceDueImmediately_When_RetryRequested() {
        SourceScanFailureEntity failure = record(FailureType.PATH_TOO_LONG, "/very/long/path");
        assertThat(failure.getNextRetryAt()).isNull();

        SourceScanFailureEntity retried = exclusionManager.retry(failure.getId(), "renamed the folder");

        assertThat(retried.getNextRetryAt()).isBeforeOrEqualTo(Instant.now());
        assertThat(retried.isCanRetry()).isTrue();
        assertThat(retried.getConsecutiveFailures()).isEqualTo(1);
        assertThat(retried.getUserNotes()).isEqualTo("renamed the folder");
        assertThat(queryService.retryCandidates(SourceType.WEBDAV, null))
            .extracting(SourceScanFailureEntity::getId)
            .containsExactly(failure.getId());
        assertThat(queryService.shouldSkip(sourceId, "/very/long/path").skip()).isFalse();
    }

    @Test
    void should_RestoreSchedule_When_RetryableResourceIsUnexcluded() {
        SourceScanFailureEntity failure = record(FailureType.TIMEOUT, "/docs");
        exclusionManager.exclude(failure.getId(), null, false);

        SourceScanFailureEntity restored = exclusionManager.unexclude(failure.getId());

        assertThat(restored.isUserExcluded()).isFalse();
        assertThat(restored.isPermanent()).isFalse();
        assertThat(restored.getNextRetryAt()).isAfter(Instant.now());
    }

    @Test
    void should_LeaveScheduleEmpty_When_NonRetryableResourceIsUnexcluded() {
        SourceScanFailureEntity failure = record(FailureType.PATH_TOO_LONG, "/docs");
        exclusionManager.exclude(failure.getId(), null, true);

        SourceScanFailureEntity restored = exclusionManager.unexclude(failure.getId());

        assertThat(restored.isUserExcluded()).isFalse();
        assertThat(restored.getNextRetryAt()).isNull();
    }

    @Test
    void should_ChangeNothing_When_UnexcludingActiveResource() {
        SourceScanFailureEntity failure = record(FailureType.TIMEOUT, "/docs");

        SourceScanFailureEntity unchanged = exclusionManager.unexclude(failure.getId());

        assertThat(unchanged.isUserExcluded()).isFalse();
        assertThat(unchanged.getNextRetryAt()).isEqualTo(failure.getNextRetryAt());
    }

    @Test
    void should_RejectEveryAction_When_RecordIsResolved() {
        SourceScanFailureEntity failure = record(FailureType.SERVER_ERROR, "/docs");
        SourceScanFailureEntity resolved = exclusionManager.resolve(failure.getId(), "fixed on the server");

        assertThat(resolved.isResolved()).isTrue();
        assertThat(resolved.getResolutionMethod()).isEqualTo(ResolutionMethod.MANUAL);
        assertThat(resolved.getUserNotes()).isEqualTo("fixed on the server");
        assertThat(resolved.getNextRetryAt()).isNull();
        assertThat(resolved.getConsecutiveFailures()).isZero();

        UUID id = failure.getId();
        assertAlreadyResolved(() -> exclusionManager.retry(id, null));
        assertAlreadyResolved(() -> exclusionManager.exclude(id, null, true));
        assertAlreadyResolved(() -> exclusionManager.unexclude(id));
        assertAlreadyResolved(() -> exclusionManager.resolve(id, null));
    }

    @Test
    void should_ThrowNotFound_When_IdIsUnknown() {
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> exclusionManager.exclude(unknown, null, true))
            .isInstanceOf(FailureNotFoundException.class);
    }

    private SourceScanFailureEntity record(FailureType type, String path) {
        return failureRecorder.recordFailure(sourceId, path, ScanFailureSignal.of(type, type.wireName()));
    }

    private static void assertAlreadyResolved(org.assertj.core.api.ThrowableAssert.ThrowingCallable action) {
        assertThatThrownBy(action)
            .isInstanceOfSatisfying(InvalidFailureStateException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(InvalidFailureStateException.Reason.ALREADY_RESOLVED));
    }
}
