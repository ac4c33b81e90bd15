package org.netpreserve.sitewalker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Terminal outcome of a URL. A URL in any of these states is never fetched again until the cache is cleared.
 */
public enum CacheStatus {
    SUCCESS,
    FAILED_RETRYABLE_EXHAUSTED,
    FAILED_PERMANENT,
    SKIPPED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CacheStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
