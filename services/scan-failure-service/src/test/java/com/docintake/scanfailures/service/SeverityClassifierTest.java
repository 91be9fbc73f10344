package com.docintake.scanfailures.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.docintake.scanfailures.domain.FailureClassification;
import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.S3Diagnostics;
import com.docintake.scanfailures.domain.Severity;
import com.docintake.scanfailures.domain.SourceType;
import com.docintake.scanfailures.domain.WebDavDiagnostics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class SeverityClassifierTest {

    private final SeverityClassifier classifier = new SeverityClassifier();

    @ParameterizedTest
    @CsvSource({
        "1, LOW",
        "4, LOW",
        "5, MEDIUM",
        "9, MEDIUM",
        "10, HIGH",
        "25, HIGH"
    })
    void should_EscalateTimeoutSeverity_When_ConsecutiveFailuresGrow(int consecutive, Severity expected) {
        FailureClassification classification = classifier.classify(
            SourceType.WEBDAV, FailureType.TIMEOUT, consecutive, null);

        assertThat(classification.severity()).isEqualTo(expected);
        assertThat(classification.canRetry()).isTrue();
        assertThat(classification.userActionRequired()).isFalse();
    }

    @Test
    void should_EscalateStructuralFailures_When_TheyRepeatThreeTimes() {
        assertThat(classifier.classify(SourceType.WEBDAV, FailureType.TOO_MANY_ITEMS, 2, null).severity())
            .isEqualTo(Severity.MEDIUM);
        assertThat(classifier.classify(SourceType.WEBDAV, FailureType.TOO_MANY_ITEMS, 3, null).severity())
            .isEqualTo(Severity.HIGH);
        assertThat(classifier.classify(SourceType.LOCAL_FOLDER, FailureType.LOCAL_DISK_FULL, 1, null).severity())
            .isEqualTo(Severity.MEDIUM);
    }

    @Test
    void should_MarkPathTooLongNonRetryable_When_Classified() {
        WebDavDiagnostics diagnostics = WebDavDiagnostics.forPath("/a".repeat(150));

        FailureClassification classification = classifier.classify(
            SourceType.WEBDAV, FailureType.PATH_TOO_LONG, 3, diagnostics);

        assertThat(classification.severity()).isEqualTo(Severity.HIGH);
        assertThat(classification.canRetry()).isFalse();
        assertThat(classification.userActionRequired()).isTrue();
        assertThat(classification.recommendedAction())
            .startsWith("Shorten directory and file names")
            .contains("(current length: 300 characters)");
    }

    @Test
    void should_RequireIntervention_When_FailureIsUnknown() {
        FailureClassification classification = classifier.classify(SourceType.WEBDAV, FailureType.UNKNOWN, 1, null);

        assertThat(classification.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(classification.canRetry()).isTrue();
        assertThat(classification.userActionRequired()).isTrue();
    }

    @Test
    void should_TreatTypeAsUnknown_When_ItBelongsToAnotherSource() {
        FailureClassification classification = classifier.classify(
            SourceType.S3, FailureType.PATH_TOO_LONG, 1, null);

        assertThat(classification.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(classification.canRetry()).isTrue();
    }

    @Test
    void should_RateAccessFailuresHigh_When_FirstSeen() {
        assertThat(classifier.classify(SourceType.WEBDAV, FailureType.PERMISSION_DENIED, 1, null).severity())
            .isEqualTo(Severity.HIGH);
        assertThat(classifier.classify(SourceType.S3, FailureType.S3_ACCESS_DENIED, 1, null).severity())
            .isEqualTo(Severity.HIGH);
        assertThat(classifier.classify(SourceType.LOCAL_FOLDER, FailureType.LOCAL_PERMISSION_DENIED, 1, null).severity())
            .isEqualTo(Severity.HIGH);
    }

    @Test
    void should_NameBucketInAction_When_S3DiagnosticsCarryIt() {
        FailureClassification classification = classifier.classify(
            SourceType.S3,
            FailureType.S3_BUCKET_NOT_FOUND,
            1,
            S3Diagnostics.forKey("invoices-eu", "2024/q1/"));

        assertThat(classification.canRetry()).isFalse();
        assertThat(classification.recommendedAction()).endsWith("(bucket: invoices-eu)");
    }

    @ParameterizedTest
    @EnumSource(FailureType.class)
    void should_ProduceCompleteClassification_When_AnyTypeIsClassified(FailureType failureType) {
        for (int consecutive = 0; consecutive <= 30; consecutive++) {
            FailureClassification classification = classifier.classify(
                failureType.sourceType(), failureType, consecutive, null);

            assertThat(classification.severity()).isNotNull();
            assertThat(classification.recommendedAction()).isNotBlank();
            assertThat(classification.userActionRequired())
                .isEqualTo(!classification.canRetry() || classification.severity() == Severity.CRITICAL);
        }
    }
}
