package org.netpreserve.sitewalker.fetch;

import org.netpreserve.sitewalker.util.Url;

import java.io.IOException;

/**
 * Retrieves a page and the links it contains.
 * <p>
 * Implementations report HTTP error statuses through {@link FetchResult#status()} rather than by throwing.
 * Exceptions are reserved for failures that produced no response at all.
 */
public interface Fetcher extends AutoCloseable {
    FetchResult fetch(Url url, FetchOptions options) throws FetchException, IOException, InterruptedException;

    @Override
    default void close() {
    }
}
