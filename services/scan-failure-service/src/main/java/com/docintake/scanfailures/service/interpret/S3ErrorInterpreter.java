package com.docintake.scanfailures.service.interpret;

import static com.docintake.scanfailures.service.interpret.ScanErrorInterpreter.containsAny;

import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.SourceType;
import org.springframework.stereotype.Component;

/**
 * S3 has no catch-all type: anything not recognized as a bucket, credential or
 * access problem is treated as a transient endpoint failure.
 */
@Component
public class S3ErrorInterpreter implements ScanErrorInterpreter {

    @Override
    public SourceType supportedSourceType() {
        return SourceType.S3;
    }

    @Override
    public FailureType interpret(String errorMessage, Integer httpStatusCode) {
        String text = ScanErrorInterpreter.normalize(errorMessage);
        if (containsAny(text, "nosuchbucket", "no such bucket")) {
            return FailureType.S3_BUCKET_NOT_FOUND;
        }
        if (containsAny(text, "invalidaccesskeyid", "signaturedoesnotmatch", "signaturemismatch",
            "invalidsecurity", "expiredtoken", "invalid credentials")) {
            return FailureType.S3_INVALID_CREDENTIALS;
        }
        if (containsAny(text, "accessdenied", "access denied", "forbidden")) {
            return FailureType.S3_ACCESS_DENIED;
        }
        if (httpStatusCode != null) {
            if (httpStatusCode == 401) {
                return FailureType.S3_INVALID_CREDENTIALS;
            }
            if (httpStatusCode == 403) {
                return FailureType.S3_ACCESS_DENIED;
            }
            if (httpStatusCode == 404 && text.contains("bucket")) {
                return FailureType.S3_BUCKET_NOT_FOUND;
            }
        }
        return FailureType.S3_NETWORK_ERROR;
    }
}
