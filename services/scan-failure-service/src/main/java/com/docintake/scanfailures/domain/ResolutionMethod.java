package com.docintake.scanfailures.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ResolutionMethod {
    SUCCESSFUL_SCAN,
    MANUAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
