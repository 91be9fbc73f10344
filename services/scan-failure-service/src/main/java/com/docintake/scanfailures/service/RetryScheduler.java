package com.docintake.scanfailures.service;

import com.docintake.scanfailures.config.ScanFailureProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Exponential backoff: {@code min(base * 2^(n-1), cap)} for the n-th consecutive failure.
 */
@Component
public class RetryScheduler {

    private static final int MAX_EXPONENT = 30;

    private final Duration base;
    private final Duration cap;

    public RetryScheduler(ScanFailureProperties properties) {
        Duration base = properties.getRetryBaseDelay();
        Duration cap = properties.getRetryMaxDelay();
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("retry base delay must be positive");
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("retry max delay must not be shorter than the base delay");
        }
        this.base = base;
        this.cap = cap;
    }

    public Optional<Instant> schedule(int consecutiveFailures, boolean canRetry, boolean userExcluded, Instant now) {
        if (!canRetry || userExcluded) {
            return Optional.empty();
        }
        return Optional.of(now.plus(backoff(consecutiveFailures)));
    }

    public Duration backoff(int consecutiveFailures) {
        int exponent = Math.min(Math.max(consecutiveFailures, 1) - 1, MAX_EXPONENT);
        long multiplier = 1L << exponent;
        long capMillis = cap.toMillis();
        long baseMillis = base.toMillis();
        if (baseMillis > capMillis / multiplier) {
            return cap;
        }
        return Duration.ofMillis(baseMillis * multiplier);
    }
}
