package org.netpreserve.sitewalker.config;

import org.netpreserve.sitewalker.UrlMatcher;

import java.util.List;

/**
 * Crawl scope configuration.
 *
 * @param seeds   default scope type applied to each seed
 * @param include rules for URLs to include
 * @param exclude rules for URLs to exclude (overrides includes)
 */
public record ScopeConfig(
        ScopeType seeds,
        List<UrlMatcher> include,
        List<UrlMatcher> exclude
) {
    public ScopeConfig {
        if (include == null) include = List.of();
        if (exclude == null) exclude = List.of();
    }
}
