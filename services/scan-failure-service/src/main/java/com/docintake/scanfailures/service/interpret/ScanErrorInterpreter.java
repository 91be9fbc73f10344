package com.docintake.scanfailures.service.interpret;

import com.docintake.scanfailures.domain.FailureType;
import com.docintake.scanfailures.domain.SourceType;
import java.util.Locale;

/**
 * Translates a connector's raw error into its source's failure vocabulary.
 * Implementations never fail; unrecognized errors map to the source's catch-all type.
 */
public interface ScanErrorInterpreter {

    SourceType supportedSourceType();

    FailureType interpret(String errorMessage, Integer httpStatusCode);

    /**
     * Lower-cased messages of the whole cause chain, joined by {@code " | "}.
     */
    static String describe(Throwable error) {
        StringBuilder text = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            if (text.length() > 0) {
                text.append(" | ");
            }
            text.append(current.getClass().getSimpleName());
            if (current.getMessage() != null) {
                text.append(": ").append(current.getMessage());
            }
            current = current.getCause();
            depth++;
        }
        return text.toString();
    }

    static String normalize(String errorMessage) {
        return errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
    }

    static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
