package com.docintake.scanfailures.service.interpret;

import static com.docintake.scanfailures.service.interpret.ScanErrorInterpreter.containsAny;

import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.SourceType;
import org.springframework.stereotype.Component;

@Component
public class WebDavErrorInterpreter implements ScanErrorInterpreter {

    @Override
    public SourceType supportedSourceType() {
        return SourceType.WEBDAV;
    }

    @Override
    public FailureType interpret(String errorMessage, Integer httpStatusCode) {
        FailureType byStatus = fromStatus(httpStatusCode);
        if (byStatus != null) {
            return byStatus;
        }

        String text = ScanErrorInterpreter.normalize(errorMessage);
        if (containsAny(text, "timeout", "timed out")) {
            return FailureType.TIMEOUT;
        }
        if (containsAny(text, "name too long", "path too long")) {
            return FailureType.PATH_TOO_LONG;
        }
        if (containsAny(text, "permission denied", "forbidden", "unauthorized")) {
            return FailureType.PERMISSION_DENIED;
        }
        if (containsAny(text, "invalid character", "illegal character")) {
            return FailureType.INVALID_CHARACTERS;
        }
        if (containsAny(text, "connection refused", "connection reset", "unknownhost", "unreachable", "dns", "network")) {
            return FailureType.NETWORK_ERROR;
        }
        if (containsAny(text, "xml", "malformed", "parse")) {
            return FailureType.XML_PARSE_ERROR;
        }
        if (containsAny(text, "too many")) {
            return FailureType.TOO_MANY_ITEMS;
        }
        if (containsAny(text, "depth", "nested")) {
            return FailureType.DEPTH_LIMIT;
        }
        if (containsAny(text, "too large", "size limit")) {
            return FailureType.SIZE_LIMIT;
        }
        if (containsAny(text, "internal server error", "bad gateway", "service unavailable", "not found")) {
            return FailureType.SERVER_ERROR;
        }
        return FailureType.UNKNOWN;
    }

    private FailureType fromStatus(Integer status) {
        if (status == null) {
            return null;
        }
        if (status == 401 || status == 403) {
            return FailureType.PERMISSION_DENIED;
        }
        if (status == 408 || status == 504) {
            return FailureType.TIMEOUT;
        }
        if (status == 414) {
            return FailureType.PATH_TOO_LONG;
        }
        if (status == 413) {
            return FailureType.SIZE_LIMIT;
        }
        if (status == 404 || status >= 500) {
            return FailureType.SERVER_ERROR;
        }
        return null;
    }
}
