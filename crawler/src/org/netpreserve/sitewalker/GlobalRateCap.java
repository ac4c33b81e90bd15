package org.netpreserve.sitewalker;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Spaces requests across all hosts so no more than {@code requestsPerMinute} are dispatched in any minute.
 * Each reservation claims the next free slot at or after the requested instant.
 */
class GlobalRateCap {
    private final Duration interval;
    private @Nullable Instant nextFree;

    GlobalRateCap(int requestsPerMinute) {
        if (requestsPerMinute <= 0) throw new IllegalArgumentException("requestsPerMinute must be positive");
        this.interval = Duration.ofMinutes(1).dividedBy(requestsPerMinute);
    }

    Duration interval() {
        return interval;
    }

    /**
     * Claims a slot no earlier than {@code earliest}.
     */
    synchronized Instant reserve(Instant earliest) {
        Instant slot = earliest;
        if (nextFree != null && nextFree.isAfter(slot)) slot = nextFree;
        nextFree = slot.plus(interval);
        return slot;
    }
}
