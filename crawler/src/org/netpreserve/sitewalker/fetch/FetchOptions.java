package org.netpreserve.sitewalker.fetch;

import java.time.Duration;

/**
 * @param timeout   how long the whole fetch may take
 * @param userAgent User-Agent header to send
 */
public record FetchOptions(Duration timeout, String userAgent) {
}
