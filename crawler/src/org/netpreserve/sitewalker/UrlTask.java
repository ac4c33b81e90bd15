package org.netpreserve.sitewalker;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.util.Url;

import java.time.Instant;

/**
 * A URL waiting in, or taken from, the frontier.
 *
 * @param url          The normalized URL to be fetched.
 * @param depth        The number of links from the seed URL to this URL.
 * @param domain       The host requests are rate limited under.
 * @param retryCount   How many times a transient failure has already sent this URL back to the frontier.
 * @param discoveredAt When the URL was first added to the frontier.
 * @param via          The URL through which this one was discovered. Null for seeds.
 * @param notBefore    Earliest time a retry may be dispatched. Null if it may go immediately.
 */
public record UrlTask(
        @NotNull Url url,
        int depth,
        @NotNull String domain,
        int retryCount,
        @NotNull Instant discoveredAt,
        @Nullable Url via,
        @Nullable Instant notBefore
) {
    public UrlTask {
        if (depth < 0) throw new IllegalArgumentException("negative depth " + depth + " for " + url);
    }

    public UrlTask withRetry(@Nullable Instant notBefore) {
        return new UrlTask(url, depth, domain, retryCount + 1, discoveredAt, via, notBefore);
    }

    public boolean isReady(Instant now) {
        return notBefore == null || !notBefore.isAfter(now);
    }
}
