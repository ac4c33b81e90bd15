package org.netpreserve.sitewalker;

/**
 * Why a crawl stopped.
 */
public enum CrawlOutcome {
    COMPLETED(0),
    PAGE_LIMIT(0),
    TIME_LIMIT(0),
    CANCELLED(0),
    ERROR_THRESHOLD(2);

    private final int exitCode;

    CrawlOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
