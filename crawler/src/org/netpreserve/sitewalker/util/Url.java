package org.netpreserve.sitewalker.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import de.malkusch.whoisServerList.publicSuffixList.PublicSuffixList;
import de.malkusch.whoisServerList.publicSuffixList.PublicSuffixListFactory;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.urlcanon.Canonicalizer;
import org.netpreserve.urlcanon.ParsedUrl;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * URL type which caches parsing.
 */
public class Url {
    private static final PublicSuffixList publicSuffixList = new PublicSuffixListFactory().build();
    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern VALID_HOST = Pattern.compile("\\[[0-9a-fA-F:.]+]|[^\\s#%/:<>?@\\\\^|\\[\\]]+");
    private static final String URI_UNSAFE = "\"<>\\^`{|}";
    private final String url;
    private URI uri;
    private ParsedUrl parsedUrl;

    @JsonCreator
    public Url(String url) {
        this.url = url;
    }

    private Url(ParsedUrl parsedUrl) {
        this(parsedUrl.toString());
        this.parsedUrl = parsedUrl;
    }

    public static Url orNull(String url) {
        if (url == null) return null;
        return new Url(url);
    }

    /**
     * Converts to a {@link URI} for the HTTP client. Characters that browsers send but {@link URI} refuses, such as
     * '|' or a stray '%', are percent-encoded first.
     */
    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            try {
                uri = new URI(url);
            } catch (URISyntaxException e) {
                uri = new URI(encodeUnsafe(url));
            }
        }
        return uri;
    }

    static String encodeUnsafe(String url) {
        var builder = new StringBuilder(url.length() + 16);
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c == '%' && i + 2 < url.length() && isHex(url.charAt(i + 1)) && isHex(url.charAt(i + 2))) {
                builder.append(c);
            } else if (c == '%' || c <= 0x20 || c >= 0x7f || URI_UNSAFE.indexOf(c) >= 0) {
                int end = Character.isHighSurrogate(c) && i + 1 < url.length() ? i + 2 : i + 1;
                for (byte b : url.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
                    builder.append('%').append(String.format("%02X", b & 0xff));
                }
                i = end - 1;
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) != -1;
    }

    private ParsedUrl parse() {
        if (parsedUrl == null) {
            parsedUrl = ParsedUrl.parseUrl(url);
        }
        return parsedUrl;
    }

    /**
     * Lower-cased host, or null if the URL has no host.
     */
    public @Nullable String host() {
        String host = parse().getHost();
        if (host == null || host.isEmpty()) return null;
        return host.toLowerCase(Locale.ROOT);
    }

    /**
     * Registrable domain (e.g. example.co.uk for docs.example.co.uk). Falls back to the host.
     */
    public @Nullable String domain() {
        String host = host();
        if (host == null) return null;
        String domain = publicSuffixList.getRegistrableDomain(host);
        if (domain == null) return host;
        return domain;
    }

    public static String reverseHost(String host) {
        if (host == null) return null;
        if (host.startsWith("[") || IPV4.matcher(host).matches()) return host;
        var builder = new StringBuilder();
        String[] segments = host.split("\\.");
        for (int i = segments.length - 1; i >= 0; i--) {
            builder.append(segments[i]);
            builder.append(",");
        }
        return builder.toString();
    }

    @JsonValue
    public String toString() {
        return url;
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http:") ||
               startsWithIgnoreCase(url, "https:");
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    private ParsedUrl whatwg() {
        ParsedUrl copy = new ParsedUrl(parse());
        Canonicalizer.WHATWG.canonicalize(copy);
        return copy;
    }

    /**
     * Canonical form used as the dedup key: WHATWG canonicalization (lower-cased scheme and host, default port
     * dropped, empty path replaced by "/", unsafe characters percent-encoded) followed by removing the fragment
     * and sorting the query parameters.
     *
     * @throws URISyntaxException if the URL lacks a scheme or has no valid host
     */
    public Url normalized() throws URISyntaxException {
        ParsedUrl canonical;
        try {
            canonical = whatwg();
        } catch (RuntimeException e) {
            throw new URISyntaxException(url, "Unable to canonicalize: " + e.getMessage());
        }
        String host = canonical.getHost();
        if (canonical.getScheme() == null || canonical.getScheme().isEmpty()) {
            throw new URISyntaxException(url, "Missing scheme");
        }
        if (host == null || !VALID_HOST.matcher(host).matches()) {
            throw new URISyntaxException(url, "Missing or invalid host");
        }
        canonical.setHashSign("");
        canonical.setFragment("");
        String query = sortQuery(canonical.getQuery());
        canonical.setQuestionMark(query == null ? "" : "?");
        canonical.setQuery(query == null ? "" : query);

        String normalized = canonical.toString();
        if (normalized.equals(url)) return this;
        return new Url(canonical);
    }

    private static @Nullable String sortQuery(String query) {
        if (query == null || query.isEmpty()) return null;
        return Arrays.stream(query.split("&"))
                .filter(param -> !param.isEmpty())
                .sorted()
                .collect(Collectors.joining("&"));
    }

    /**
     * The URL with its path truncated after the last slash, and without query or fragment.
     */
    public Url directoryPrefix() {
        ParsedUrl copy = whatwg();
        String path = copy.getPath();
        path = path == null || path.isEmpty() ? "/" : path.replaceFirst("/[^/]*$", "/");
        copy.setPath(path);
        copy.setQuestionMark("");
        copy.setQuery("");
        copy.setHashSign("");
        copy.setFragment("");
        return new Url(copy);
    }

    public boolean startsWith(Url prefix) {
        ParsedUrl parsed = parse();
        ParsedUrl prefixParsed = prefix.parse();
        return parsed.getScheme().equalsIgnoreCase(prefixParsed.getScheme()) &&
               parsed.getHost().equalsIgnoreCase(prefixParsed.getHost()) &&
               parsed.getPort().equals(prefixParsed.getPort()) &&
               nonEmptyPath(parsed).startsWith(nonEmptyPath(prefixParsed));
    }

    private static String nonEmptyPath(ParsedUrl parsed) {
        String path = parsed.getPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
