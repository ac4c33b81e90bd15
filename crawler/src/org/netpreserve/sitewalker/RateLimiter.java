package org.netpreserve.sitewalker;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.config.RateLimitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Per-host politeness. Callers reserve a dispatch slot before each request and report back whether the server
 * signalled rate limiting. Consecutive rate-limit responses grow the host's delay exponentially up to
 * {@link RateLimitConfig#maxDelay()}; any other response resets it.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    private static final Duration MIN_BACKOFF = Duration.ofSeconds(1);
    private final RateLimitConfig config;
    private final Clock clock;
    private final Map<String, DomainState> domains = new HashMap<>();
    private final @Nullable GlobalRateCap globalCap;

    public RateLimiter(RateLimitConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.globalCap = config.requestsPerMinute() == null || config.requestsPerMinute() <= 0 ? null :
                new GlobalRateCap(config.requestsPerMinute());
    }

    /**
     * Reserves the next dispatch slot for the host, which later callers will space themselves after.
     *
     * @return how long the caller must wait before sending the request
     */
    public synchronized Duration reserve(String domain) {
        Instant now = clock.instant();
        DomainState state = stateOf(domain);
        Instant slot = state.nextPermitted(now);
        if (globalCap != null) slot = globalCap.reserve(slot);
        domains.put(domain, state.withLastRequestTime(slot));
        return Duration.between(now, slot);
    }

    /**
     * Checks a slot again once its wait is over. A rate-limit response from another request to the host may have
     * started a cooldown in the meantime, in which case a new slot after the cooldown is reserved.
     *
     * @return how much longer the caller must wait, zero if it may dispatch now
     */
    public synchronized Duration recheck(String domain) {
        Instant now = clock.instant();
        DomainState state = stateOf(domain);
        if (state.cooldownUntil() == null || !state.cooldownUntil().isAfter(now)) return Duration.ZERO;
        log.debug("{} went into cooldown while a request was waiting", domain);
        return reserve(domain);
    }

    /**
     * Updates the host after a response.
     *
     * @param rateLimited whether the response status is one of the configured rate-limit codes
     * @return true if this response caused the host to be skipped
     */
    public synchronized boolean record(String domain, boolean rateLimited) {
        DomainState state = stateOf(domain);
        if (!rateLimited) {
            if (state.consecutiveErrors() > 0 || !state.currentDelay().equals(config.delay())) {
                domains.put(domain, state.withReset(config.delay()));
            }
            return false;
        }

        int errors = state.consecutiveErrors() + 1;
        Duration delay = backoffDelay(errors);
        Instant cooldownUntil = clock.instant().plus(delay);
        if (state.cooldownUntil() != null && state.cooldownUntil().isAfter(cooldownUntil)) {
            cooldownUntil = state.cooldownUntil();
        }
        boolean skip = config.maxDomainErrors() > 0 && errors > config.maxDomainErrors();
        domains.put(domain, state.withBackoff(delay, cooldownUntil, errors, state.skipped() || skip));

        if (skip && !state.skipped()) {
            log.warn("Skipping {} after {} consecutive rate-limit responses", domain, errors);
            return true;
        }
        log.atInfo().addKeyValue("domain", domain).addKeyValue("delay", delay).addKeyValue("errors", errors)
                .log("Backing off");
        return false;
    }

    /**
     * Delay after the nth consecutive rate-limit response: base * factor^(n-1), capped at the maximum.
     */
    Duration backoffDelay(int consecutiveErrors) {
        Duration base = config.delay().compareTo(MIN_BACKOFF) < 0 ? MIN_BACKOFF : config.delay();
        Duration cap = config.maxDelay().compareTo(base) < 0 ? base : config.maxDelay();
        double millis = base.toMillis() * Math.pow(config.backoffFactor(), consecutiveErrors - 1);
        if (millis >= cap.toMillis()) return cap;
        return Duration.ofMillis((long) millis);
    }

    public synchronized boolean isSkipped(String domain) {
        DomainState state = domains.get(domain);
        return state != null && state.skipped();
    }

    public synchronized @Nullable DomainState state(String domain) {
        return domains.get(domain);
    }

    public synchronized List<DomainState> snapshot() {
        var list = new ArrayList<>(domains.values());
        list.sort(Comparator.comparing(DomainState::domain));
        return list;
    }

    public synchronized void restore(Collection<DomainState> states) {
        domains.clear();
        for (var state : states) {
            domains.put(state.domain(), state);
        }
    }

    private DomainState stateOf(String domain) {
        return domains.computeIfAbsent(domain, d -> DomainState.initial(d, config.delay()));
    }
}
