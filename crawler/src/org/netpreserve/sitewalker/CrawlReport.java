package org.netpreserve.sitewalker;

import java.time.Duration;

/**
 * Summary of a finished crawl run.
 *
 * @param outcome    why the run stopped
 * @param processed  URLs that reached a terminal state, including those restored from a checkpoint
 * @param pending    URLs left in the frontier for a later resume
 * @param cacheStats contents of the dedup cache at the end of the run
 * @param elapsed    wall time of the run
 */
public record CrawlReport(
        CrawlOutcome outcome,
        long processed,
        int pending,
        DedupCache.CacheStats cacheStats,
        Duration elapsed) {

    @Override
    public String toString() {
        return outcome + ": " + processed + " processed, " + pending + " pending, cache " + cacheStats +
               " in " + elapsed.toSeconds() + "s";
    }
}
