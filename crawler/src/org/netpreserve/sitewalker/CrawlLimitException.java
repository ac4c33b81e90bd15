package org.netpreserve.sitewalker;

public class CrawlLimitException extends SitewalkerException {
    public CrawlLimitException(String message) {
        super(message);
    }
}
