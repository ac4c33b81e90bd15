package org.netpreserve.sitewalker.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.util.DurationDeserializer;

import java.time.Duration;

/**
 * Configuration for how the crawl should behave.
 *
 * @param userAgent            User-Agent string to identify as to servers
 * @param limits               global crawl limits (pages, time)
 * @param depth                maximum link depth from any seed, null for unlimited
 * @param concurrency          number of workers fetching at once
 * @param pageTimeout          how long a single fetch may take
 * @param maxConsecutiveErrors failures in a row, across all domains, that abort the crawl (0 disables)
 */
public record CrawlConfig(
        String userAgent,
        LimitsConfig limits,
        @Nullable Integer depth,
        int concurrency,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration pageTimeout,
        int maxConsecutiveErrors) {

    public CrawlConfig {
        if (limits == null) limits = new LimitsConfig(null, null);
    }
}
