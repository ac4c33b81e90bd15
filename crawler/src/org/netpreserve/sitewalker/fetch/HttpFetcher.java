package org.netpreserve.sitewalker.fetch;

import org.jsoup.Jsoup;
import org.jsoup.helper.DataUtil;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.netpreserve.sitewalker.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fetches pages with the JDK HTTP client and extracts links from HTML with jsoup.
 */
public class HttpFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);
    private final HttpClient httpClient;

    public HttpFetcher() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(30))
                .build());
    }

    public HttpFetcher(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public FetchResult fetch(Url url, FetchOptions options) throws FetchException, IOException, InterruptedException {
        URI uri;
        try {
            uri = url.toURI();
        } catch (URISyntaxException e) {
            throw new FetchException(url, "Malformed URL", true);
        }

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(HttpRequest.newBuilder(uri)
                    .timeout(options.timeout())
                    .header("User-Agent", options.userAgent())
                    .GET()
                    .build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new FetchTimedOutException(url, "Timed out after " + options.timeout());
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, "Unsupported URL", true);
        }

        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        int status = response.statusCode();
        if (status >= 300 && status < 400) {
            // not followed by the client, e.g. https to http
            List<Url> target = redirectTarget(response);
            log.debug("Unfollowed redirect from {} to {}", url, target);
            return new FetchResult(url, status, contentType, "", target, null);
        }
        var result = new FetchResult(url, status, contentType, "", List.of(), null);
        if (!result.isHtml() || response.body() == null) {
            return result;
        }

        // redirects change the base for relative links
        String baseUri = response.uri().toString();
        Document document;
        try (var in = new ByteArrayInputStream(response.body())) {
            // without a header charset jsoup uses the BOM or the meta tag, falling back to UTF-8
            document = Jsoup.parse(in, DataUtil.getCharsetFromContentType(contentType), baseUri);
        }
        List<Url> links = extractLinks(document);
        log.debug("Extracted {} links from {}", links.size(), url);
        return new FetchResult(url, response.statusCode(), contentType, document.outerHtml(), links, null);
    }

    private static List<Url> redirectTarget(HttpResponse<?> response) {
        String location = response.headers().firstValue("Location").orElse(null);
        if (location == null || location.isBlank()) return List.of();
        Url target;
        try {
            target = new Url(response.uri().resolve(location.trim()).toString());
        } catch (IllegalArgumentException e) {
            log.debug("Unusable redirect location {}: {}", location, e.getMessage());
            return List.of();
        }
        return target.isHttp() ? List.of(target.withoutFragment()) : List.of();
    }

    static List<Url> extractLinks(Document document) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isBlank()) continue;
            Url link = new Url(href.trim());
            if (!link.isHttp()) continue;
            links.add(link.withoutFragment().toString());
        }
        var urls = new ArrayList<Url>(links.size());
        for (String link : links) urls.add(new Url(link));
        return urls;
    }
}
