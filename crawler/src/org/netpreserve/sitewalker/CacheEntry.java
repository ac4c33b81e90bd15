package org.netpreserve.sitewalker;

import java.time.Instant;

public record CacheEntry(CacheStatus status, Instant timestamp) {
    public boolean isNewerThan(CacheEntry other) {
        return other == null || timestamp.isAfter(other.timestamp);
    }
}
