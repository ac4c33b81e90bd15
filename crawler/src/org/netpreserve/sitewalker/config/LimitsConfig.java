package org.netpreserve.sitewalker.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sitewalker.util.DurationDeserializer;

import java.time.Duration;

/**
 * Global crawl limits.
 *
 * @param pages maximum number of pages to process, 0 or null for unlimited
 * @param time  maximum duration to run the crawl for, null for unlimited
 */
public record LimitsConfig(
        Long pages,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration time
) {
    public long pageBudget() {
        return pages == null ? 0 : pages;
    }
}
