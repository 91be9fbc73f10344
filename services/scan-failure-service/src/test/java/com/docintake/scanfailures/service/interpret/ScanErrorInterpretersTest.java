package com.docintake.scanfailures.service.interpret;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.SourceType;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ScanErrorInterpretersTest {

    private final ScanErrorInterpreters interpreters = new ScanErrorInterpreters(List.of(
        new WebDavErrorInterpreter(),
        new S3ErrorInterpreter(),
        new LocalFolderErrorInterpreter()
    ));

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "PROPFIND timed out after 30s             |     | TIMEOUT",
        "Gateway Timeout                          | 504 | TIMEOUT",
        "Forbidden                                | 403 | PERMISSION_DENIED",
        "File name too long                       |     | PATH_TOO_LONG",
        "Connection refused (os error 111)        |     | NETWORK_ERROR",
        "Internal Server Error                    | 500 | SERVER_ERROR",
        "Not Found                                | 404 | SERVER_ERROR",
        "XML document structures must start and end |   | XML_PARSE_ERROR",
        "Request entity too large                 | 413 | SIZE_LIMIT",
        "Directory contains too many entries      |     | TOO_MANY_ITEMS",
        "Maximum nested depth exceeded            |     | DEPTH_LIMIT",
        "Illegal character in path                |     | INVALID_CHARACTERS",
        "something odd happened                   |     | UNKNOWN"
    })
    void should_MapWebDavErrors_When_Interpreted(String message, Integer status, FailureType expected) {
        assertThat(interpreters.forSource(SourceType.WEBDAV).interpret(message.trim(), status)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "NoSuchBucket: The specified bucket does not exist |     | S3_BUCKET_NOT_FOUND",
        "InvalidAccessKeyId                                |     | S3_INVALID_CREDENTIALS",
        "SignatureDoesNotMatch                             | 403 | S3_INVALID_CREDENTIALS",
        "AccessDenied                                      | 403 | S3_ACCESS_DENIED",
        "bucket missing                                    | 404 | S3_BUCKET_NOT_FOUND",
        "Unauthorized                                      | 401 | S3_INVALID_CREDENTIALS",
        "dispatch failure: connection reset                |     | S3_NETWORK_ERROR",
        "SlowDown                                          | 503 | S3_NETWORK_ERROR"
    })
    void should_MapS3Errors_When_Interpreted(String message, Integer status, FailureType expected) {
        assertThat(interpreters.forSource(SourceType.S3).interpret(message.trim(), status)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "java.nio.file.AccessDeniedException: /srv/inbox  | LOCAL_PERMISSION_DENIED",
        "Permission denied (os error 13)                  | LOCAL_PERMISSION_DENIED",
        "java.nio.file.NoSuchFileException: /srv/missing  | LOCAL_PATH_NOT_FOUND",
        "No space left on device                          | LOCAL_DISK_FULL",
        "Input/output error                               | LOCAL_IO_ERROR"
    })
    void should_MapLocalErrors_When_Interpreted(String message, FailureType expected) {
        assertThat(interpreters.forSource(SourceType.LOCAL_FOLDER).interpret(message.trim(), null)).isEqualTo(expected);
    }

    @Test
    void should_FallBackToCatchAll_When_MessageIsMissing() {
        assertThat(interpreters.forSource(SourceType.WEBDAV).interpret(null, null)).isEqualTo(FailureType.UNKNOWN);
        assertThat(interpreters.forSource(SourceType.S3).interpret(null, null)).isEqualTo(FailureType.S3_NETWORK_ERROR);
        assertThat(interpreters.forSource(SourceType.LOCAL_FOLDER).interpret(null, null)).isEqualTo(FailureType.LOCAL_IO_ERROR);
    }

    @Test
    void should_DescribeWholeCauseChain_When_ErrorIsWrapped() {
        Exception error = new IllegalStateException("scan aborted", new IOException("No space left on device"));

        String description = ScanErrorInterpreter.describe(error);

        assertThat(description).isEqualTo("IllegalStateException: scan aborted | IOException: No space left on device");
        assertThat(interpreters.forSource(SourceType.LOCAL_FOLDER).interpret(description, null))
            .isEqualTo(FailureType.LOCAL_DISK_FULL);
    }

    @Test
    void should_RejectRegistry_When_TwoInterpretersClaimOneSource() {
        assertThatThrownBy(() -> new ScanErrorInterpreters(List.of(new S3ErrorInterpreter(), new S3ErrorInterpreter())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("S3");
    }

    @Test
    void should_FailLookup_When_SourceHasNoInterpreter() {
        ScanErrorInterpreters webDavOnly = new ScanErrorInterpreters(List.of(new WebDavErrorInterpreter()));

        assertThatThrownBy(() -> webDavOnly.forSource(SourceType.S3))
            .isInstanceOf(IllegalStateException.class);
    }
}
