package com.docintake.scanfailures.service.interpret;

import com.docintake.scanfailures.domain.SourceType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ScanErrorInterpreters {

    private final Map<SourceType, ScanErrorInterpreter> bySource = new EnumMap<>(SourceType.class);

    public ScanErrorInterpreters(List<ScanErrorInterpreter> interpreters) {
        for (ScanErrorInterpreter interpreter : interpreters) {
            ScanErrorInterpreter previous = bySource.put(interpreter.supportedSourceType(), interpreter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate scan error interpreter for " + interpreter.supportedSourceType());
            }
        }
    }

    public ScanErrorInterpreter forSource(SourceType sourceType) {
        ScanErrorInterpreter interpreter = bySource.get(sourceType);
        if (interpreter == null) {
            throw new IllegalStateException("No scan error interpreter registered for " + sourceType);
        }
        return interpreter;
    }
}
