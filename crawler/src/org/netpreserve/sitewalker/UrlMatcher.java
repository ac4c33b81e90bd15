package org.netpreserve.sitewalker;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.apache.commons.lang3.StringUtils;
import org.netpreserve.sitewalker.util.Url;

import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A rule selecting URLs, used for crawl scope. In YAML each rule is a single-key map such as
 * {@code host: example.org} or {@code regex: "https://example\.org/docs/.*"}.
 */
@JsonSubTypes({
        @JsonSubTypes.Type(value = UrlMatcher.Host.class),
        @JsonSubTypes.Type(value = UrlMatcher.Regex.class),
        @JsonSubTypes.Type(value = UrlMatcher.Domain.class),
        @JsonSubTypes.Type(value = UrlMatcher.Exact.class),
        @JsonSubTypes.Type(value = UrlMatcher.Prefix.class),
})
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
public sealed interface UrlMatcher extends Predicate<Url> {
    record Host(String host) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            return host.equalsIgnoreCase(url.host());
        }
    }

    /**
     * Matches the domain itself and any of its subdomains.
     */
    record Domain(String domain) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            String host = url.host();
            if (host == null) return false;
            return domain.equalsIgnoreCase(host) || StringUtils.endsWithIgnoreCase(host, "." + domain);
        }
    }

    record Regex(String regex) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            return url.toString().matches(regex);
        }
    }

    record Exact(Url url) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            return url.equals(this.url);
        }
    }

    record Prefix(Url prefix) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            return url.startsWith(prefix);
        }
    }

    /**
     * Matches against many rules at once, using set lookups for the host, domain and exact rules.
     */
    final class Multi implements UrlMatcher {
        private final Set<String> urls = new HashSet<>();
        private final Set<String> hosts = new HashSet<>();
        private final NavigableSet<String> reversedDomains = new TreeSet<>();
        private final List<Prefix> prefixes = new ArrayList<>();
        private final List<Pattern> regexes = new ArrayList<>();

        public Multi() {
        }

        public Multi(Collection<UrlMatcher> matchers) {
            addAll(matchers);
        }

        public void addAll(Collection<UrlMatcher> matchers) {
            for (var matcher : matchers) {
                add(matcher);
            }
        }

        public void add(UrlMatcher matcher) {
            if (matcher instanceof Host host) {
                hosts.add(host.host().toLowerCase(Locale.ROOT));
            } else if (matcher instanceof Domain domain) {
                String lowerCaseDomain = domain.domain().toLowerCase(Locale.ROOT);
                hosts.add(lowerCaseDomain);
                reversedDomains.add(Url.reverseHost(lowerCaseDomain));
            } else if (matcher instanceof Exact exact) {
                urls.add(exact.url().toString());
            } else if (matcher instanceof Prefix prefix) {
                prefixes.add(prefix);
            } else if (matcher instanceof Regex regex) {
                regexes.add(Pattern.compile(regex.regex()));
            } else if (matcher instanceof Multi multi) {
                urls.addAll(multi.urls);
                hosts.addAll(multi.hosts);
                reversedDomains.addAll(multi.reversedDomains);
                prefixes.addAll(multi.prefixes);
                regexes.addAll(multi.regexes);
            }
        }

        public boolean isEmpty() {
            return urls.isEmpty() && hosts.isEmpty() && prefixes.isEmpty() && regexes.isEmpty();
        }

        @Override
        public boolean test(Url url) {
            if (urls.contains(url.toString())) return true;
            String host = url.host();
            if (host != null && !hosts.isEmpty()) {
                host = host.toLowerCase(Locale.ROOT);
                if (hosts.contains(host)) return true;
                if (!reversedDomains.isEmpty() && containsPrefixOf(reversedDomains, Url.reverseHost(host))) {
                    return true;
                }
            }
            for (var prefix : prefixes) {
                if (prefix.test(url)) return true;
            }
            for (var regex : regexes) {
                if (regex.matcher(url.toString()).matches()) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Returns true if the set contains a string that is a prefix of the given string.
         */
        public static boolean containsPrefixOf(NavigableSet<String> set, String s) {
            String candidate = set.floor(s);
            while (candidate != null) {
                if (s.startsWith(candidate)) {
                    return true;
                }
                candidate = set.lower(candidate);
            }
            return false;
        }
    }
}
