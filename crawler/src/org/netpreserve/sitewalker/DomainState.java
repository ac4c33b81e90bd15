package org.netpreserve.sitewalker;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Politeness state of a single host.
 *
 * @param domain            the host
 * @param lastRequestTime   when the most recent request was (or is scheduled to be) dispatched
 * @param currentDelay      minimum spacing of requests, grows while the host is rate limiting us
 * @param cooldownUntil     no requests before this instant
 * @param consecutiveErrors rate-limit responses in a row
 * @param skipped           whether the host has been given up on; its remaining URLs are recorded as skipped
 */
public record DomainState(
        String domain,
        @Nullable Instant lastRequestTime,
        Duration currentDelay,
        @Nullable Instant cooldownUntil,
        int consecutiveErrors,
        boolean skipped) {

    public static DomainState initial(String domain, Duration delay) {
        return new DomainState(domain, null, delay, null, 0, false);
    }

    /**
     * The earliest instant the next request may be dispatched, never earlier than {@code now}.
     */
    public Instant nextPermitted(Instant now) {
        Instant next = now;
        if (lastRequestTime != null) {
            Instant spaced = lastRequestTime.plus(currentDelay);
            if (spaced.isAfter(next)) next = spaced;
        }
        if (cooldownUntil != null && cooldownUntil.isAfter(next)) next = cooldownUntil;
        return next;
    }

    DomainState withLastRequestTime(Instant lastRequestTime) {
        return new DomainState(domain, lastRequestTime, currentDelay, cooldownUntil, consecutiveErrors, skipped);
    }

    DomainState withBackoff(Duration delay, Instant cooldownUntil, int consecutiveErrors, boolean skipped) {
        return new DomainState(domain, lastRequestTime, delay, cooldownUntil, consecutiveErrors, skipped);
    }

    DomainState withReset(Duration baseDelay) {
        return new DomainState(domain, lastRequestTime, baseDelay, cooldownUntil, 0, skipped);
    }
}
