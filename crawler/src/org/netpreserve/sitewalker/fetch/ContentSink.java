package org.netpreserve.sitewalker.fetch;

/**
 * Consumer of successfully fetched pages, e.g. a converter writing a knowledge base.
 */
@FunctionalInterface
public interface ContentSink {
    void accept(FetchResult result) throws Exception;
}
