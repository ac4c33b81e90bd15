package org.netpreserve.sitewalker.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.util.DurationDeserializer;

import java.time.Duration;
import java.util.Set;

/**
 * Politeness settings.
 *
 * @param delay             minimum time between two requests to the same host
 * @param backoffFactor     multiplier applied to the host delay after each consecutive rate-limit response
 * @param maxDelay          upper bound for the backed-off delay
 * @param statusCodes       response codes that signal rate limiting
 * @param maxDomainErrors   consecutive rate-limit responses after which a host is skipped for the rest of the crawl
 * @param requestsPerMinute optional cap on requests across all hosts
 */
public record RateLimitConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration delay,
        double backoffFactor,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxDelay,
        Set<Integer> statusCodes,
        int maxDomainErrors,
        @Nullable Integer requestsPerMinute) {

    public RateLimitConfig {
        if (delay == null) delay = Duration.ZERO;
        if (maxDelay == null) maxDelay = delay;
        if (statusCodes == null) statusCodes = Set.of(429, 503);
    }
}
