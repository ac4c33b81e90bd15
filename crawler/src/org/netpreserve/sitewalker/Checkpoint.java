package org.netpreserve.sitewalker;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.config.SeedConfig;

import java.time.Instant;
import java.util.List;

/**
 * Resumable crawl state. The dedup cache is stored in its own file, named by {@code cacheRef}, written at the
 * same moment.
 *
 * @param configFingerprint fingerprint of the job configuration the state belongs to
 * @param created           when the checkpoint was taken
 * @param processedCount    URLs that had reached a terminal state
 * @param cacheRef          filename of the cache written with this checkpoint
 * @param frontier          pending and in-flight tasks
 * @param domains           rate limiter state per host
 * @param seeds             seeds the crawl was started with, needed to rebuild the scope
 */
public record Checkpoint(
        String configFingerprint,
        Instant created,
        long processedCount,
        @Nullable String cacheRef,
        List<UrlTask> frontier,
        List<DomainState> domains,
        List<SeedConfig> seeds) {

    public Checkpoint {
        if (frontier == null) frontier = List.of();
        if (domains == null) domains = List.of();
        if (seeds == null) seeds = List.of();
    }
}
