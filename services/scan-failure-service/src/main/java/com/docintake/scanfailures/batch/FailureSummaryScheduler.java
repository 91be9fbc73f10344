package com.docintake.scanfailures.batch;

import com.docintake.scanfailures.config.ScanFailureProperties;
import com.docintake.scanfailures.domain.FailureStats;
import com.docintake.scanfailures.service.FailureQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class FailureSummaryScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(FailureSummaryScheduler.class);

    private final ScanFailureProperties properties;
    private final FailureQueryService queryService;

    public FailureSummaryScheduler(ScanFailureProperties properties, FailureQueryService queryService) {
        this.properties = properties;
        this.queryService = queryService;
    }

    @Scheduled(fixedDelayString = "${scan-failures.summary-log-fixed-delay-ms:900000}")
    public void logSummary() {
        if (!properties.isSummaryLogEnabled()) {
            return;
        }
        FailureStats stats = queryService.stats(null);
        if (stats.activeFailures() == 0) {
            LOGGER.debug("No active source scan failures");
            return;
        }
        LOGGER.info("Source scan failures: active={}, critical={}, high={}, excluded={}, readyForRetry={}, bySource={}",
            stats.activeFailures(),
            stats.criticalFailures(),
            stats.highFailures(),
            stats.excludedResources(),
            stats.readyForRetry(),
            stats.failuresBySourceType());
        if (stats.criticalFailures() > 0) {
            LOGGER.warn("{} source scan failures need operator intervention", stats.criticalFailures());
        }
    }
}
