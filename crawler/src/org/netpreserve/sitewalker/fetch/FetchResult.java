package org.netpreserve.sitewalker.fetch;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.util.Url;

import java.util.List;
import java.util.Locale;

/**
 * Outcome of fetching a single URL.
 *
 * @param url         the URL that was requested
 * @param status      HTTP status code, or 0 if no response was received
 * @param contentType value of the Content-Type header, if any
 * @param content     response body decoded as text, empty for non-text responses
 * @param links       absolute http(s) links found in the content
 * @param error       description of the failure when no response was received
 */
public record FetchResult(
        @NotNull Url url,
        int status,
        @Nullable String contentType,
        @NotNull String content,
        @NotNull List<Url> links,
        @Nullable String error) {

    public FetchResult {
        if (content == null) content = "";
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static FetchResult ok(Url url, String content, List<Url> links) {
        return new FetchResult(url, 200, "text/html", content, links, null);
    }

    public static FetchResult status(Url url, int status) {
        return new FetchResult(url, status, null, "", List.of(), null);
    }

    public static FetchResult error(Url url, String error) {
        return new FetchResult(url, 0, null, "", List.of(), error);
    }

    public boolean isHtml() {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("text/html");
    }
}
