package com.docintake.scanfailures.service.interpret;

import static com.docintake.scanfailures.service.interpret.ScanErrorInterpreter.containsAny;

import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.SourceType;
import org.springframework.stereotype.Component;

@Component
public class LocalFolderErrorInterpreter implements ScanErrorInterpreter {

    @Override
    public SourceType supportedSourceType() {
        return SourceType.LOCAL_FOLDER;
    }

    @Override
    public FailureType interpret(String errorMessage, Integer httpStatusCode) {
        String text = ScanErrorInterpreter.normalize(errorMessage);
        if (containsAny(text, "permission denied", "access denied", "accessdenied", "operation not permitted", "os error 13")) {
            return FailureType.LOCAL_PERMISSION_DENIED;
        }
        if (containsAny(text, "no such file", "nosuchfile", "not found", "does not exist", "os error 2")) {
            return FailureType.LOCAL_PATH_NOT_FOUND;
        }
        if (containsAny(text, "no space", "disk full", "quota exceeded", "os error 28")) {
            return FailureType.LOCAL_DISK_FULL;
        }
        return FailureType.LOCAL_IO_ERROR;
    }
}
