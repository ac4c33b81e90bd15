package org.netpreserve.sitewalker.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sitewalker.util.DurationDeserializer;

import java.time.Duration;

/**
 * Retry policy for transient fetch failures.
 *
 * @param maxRetries number of retries after the first attempt
 * @param backoff    wait before the first retry
 * @param multiplier growth of the wait for each further retry
 */
public record RetryConfig(
        int maxRetries,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration backoff,
        double multiplier) {

    public RetryConfig {
        if (backoff == null) backoff = Duration.ZERO;
    }

    /**
     * Wait before the given retry (1 for the first retry).
     */
    public Duration backoffFor(int retry) {
        double millis = backoff.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        return Duration.ofMillis((long) Math.min(millis, Long.MAX_VALUE));
    }
}
