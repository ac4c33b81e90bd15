package org.netpreserve.sitewalker.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.UrlMatcher;
import org.netpreserve.sitewalker.util.Url;

/**
 * A starting point of the crawl.
 *
 * @param url       the seed URL
 * @param scopeType how far links from this seed may stray, or null to use the job default
 */
public record SeedConfig(
        @NotNull Url url,
        @Nullable ScopeType scopeType) {

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public SeedConfig(@JsonProperty("url") @NotNull Url url,
                      @JsonProperty("scopeType") @Nullable ScopeType scopeType) {
        this.url = url;
        this.scopeType = scopeType;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public SeedConfig(String url) {
        this(new Url(url), null);
    }

    public UrlMatcher toUrlMatcher(ScopeType defaultScopeType) {
        ScopeType scopeType = this.scopeType;
        if (scopeType == null) scopeType = defaultScopeType;
        if (scopeType == null) scopeType = ScopeType.DOMAIN;
        return switch (scopeType) {
            case HOST -> new UrlMatcher.Host(url.host());
            case DOMAIN -> new UrlMatcher.Domain(url.domain());
            case PAGE -> new UrlMatcher.Exact(url);
            case PREFIX -> new UrlMatcher.Prefix(url.directoryPrefix());
        };
    }
}
