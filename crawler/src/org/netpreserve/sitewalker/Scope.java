package org.netpreserve.sitewalker;

import org.netpreserve.sitewalker.config.ScopeConfig;
import org.netpreserve.sitewalker.config.ScopeType;
import org.netpreserve.sitewalker.config.SeedConfig;
import org.netpreserve.sitewalker.util.Url;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Decides which discovered links are followed. Seeds widen the scope according to their scope type; explicit
 * excludes always win.
 */
public class Scope implements Predicate<Url> {
    private final UrlMatcher.Multi includes = new UrlMatcher.Multi();
    private final UrlMatcher.Multi excludes = new UrlMatcher.Multi();
    private final List<SeedConfig> seeds = new ArrayList<>();
    private final ScopeType defaultSeedScope;

    public Scope(ScopeConfig config) {
        this.defaultSeedScope = config.seeds();
        includes.addAll(config.include());
        excludes.addAll(config.exclude());
    }

    public synchronized void addSeed(SeedConfig seed) {
        if (seeds.contains(seed)) return;
        seeds.add(seed);
        includes.add(seed.toUrlMatcher(defaultSeedScope));
    }

    public synchronized List<SeedConfig> seeds() {
        return List.copyOf(seeds);
    }

    @Override
    public synchronized boolean test(Url url) {
        if (excludes.test(url)) return false;
        return includes.test(url);
    }
}
