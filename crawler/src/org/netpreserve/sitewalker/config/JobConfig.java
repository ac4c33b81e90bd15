package org.netpreserve.sitewalker.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.netpreserve.sitewalker.util.Json;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for a crawl job. Built once at startup, validated, and handed to every component.
 *
 * @param seeds      where to start
 * @param scope      what to crawl (inclusion/exclusion patterns)
 * @param crawl      how to crawl (behavior, limits)
 * @param rateLimit  per-host politeness and the global request cap
 * @param retry      retry policy for transient failures
 * @param checkpoint when to snapshot crawl state
 * @param storage    where the dedup cache lives
 * @param resume     what to do with a previous run's state
 */
public record JobConfig(
        List<SeedConfig> seeds,
        ScopeConfig scope,
        CrawlConfig crawl,
        RateLimitConfig rateLimit,
        RetryConfig retry,
        CheckpointConfig checkpoint,
        StorageConfig storage,
        ResumeMode resume
) {
    public JobConfig {
        if (seeds == null) seeds = List.of();
        if (scope == null) scope = new ScopeConfig(ScopeType.DOMAIN, List.of(), List.of());
        if (storage == null) storage = new StorageConfig(null, null);
        if (resume == null) resume = ResumeMode.CONTINUE;
    }

    public JobConfig withResume(ResumeMode resume) {
        return new JobConfig(seeds, scope, crawl, rateLimit, retry, checkpoint, storage, resume);
    }

    public JobConfig withSeeds(List<SeedConfig> seeds) {
        return new JobConfig(seeds, scope, crawl, rateLimit, retry, checkpoint, storage, resume);
    }

    /**
     * Checks the configuration for values the crawler can't work with.
     *
     * @return this configuration, for chaining
     */
    public JobConfig validate() throws ConfigException {
        List<String> problems = new ArrayList<>();
        if (crawl == null) {
            problems.add("crawl section is missing");
        } else {
            if (crawl.depth() != null && crawl.depth() < 0) problems.add("crawl.depth must not be negative");
            if (crawl.concurrency() < 1) problems.add("crawl.concurrency must be at least 1");
            if (crawl.pageTimeout() == null || isNotPositive(crawl.pageTimeout())) {
                problems.add("crawl.pageTimeout must be positive");
            }
            if (crawl.maxConsecutiveErrors() < 0) problems.add("crawl.maxConsecutiveErrors must not be negative");
            if (crawl.limits().pages() != null && crawl.limits().pages() < 0) {
                problems.add("crawl.limits.pages must not be negative");
            }
            if (crawl.limits().time() != null && isNotPositive(crawl.limits().time())) {
                problems.add("crawl.limits.time must be positive");
            }
        }
        if (rateLimit == null) {
            problems.add("rateLimit section is missing");
        } else {
            if (rateLimit.delay().isNegative()) problems.add("rateLimit.delay must not be negative");
            if (rateLimit.backoffFactor() < 1.0) problems.add("rateLimit.backoffFactor must be at least 1");
            if (rateLimit.maxDelay().compareTo(rateLimit.delay()) < 0) {
                problems.add("rateLimit.maxDelay must not be less than rateLimit.delay");
            }
            if (rateLimit.maxDomainErrors() < 0) problems.add("rateLimit.maxDomainErrors must not be negative");
            if (rateLimit.requestsPerMinute() != null && rateLimit.requestsPerMinute() <= 0) {
                problems.add("rateLimit.requestsPerMinute must be positive");
            }
        }
        if (retry == null) {
            problems.add("retry section is missing");
        } else {
            if (retry.maxRetries() < 0) problems.add("retry.maxRetries must not be negative");
            if (retry.backoff().isNegative()) problems.add("retry.backoff must not be negative");
            if (retry.multiplier() < 1.0) problems.add("retry.multiplier must be at least 1");
        }
        if (checkpoint == null) {
            problems.add("checkpoint section is missing");
        } else {
            if (checkpoint.interval() < 0) problems.add("checkpoint.interval must not be negative");
            if (checkpoint.period() != null && isNotPositive(checkpoint.period())) {
                problems.add("checkpoint.period must be positive");
            }
        }
        for (SeedConfig seed : seeds) {
            if (seed.url() == null || !seed.url().isHttp() || seed.url().host() == null) {
                problems.add("seed is not an http(s) URL: " + seed.url());
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid configuration: " + String.join("; ", problems));
        }
        return this;
    }

    private static boolean isNotPositive(Duration duration) {
        return duration.isNegative() || duration.isZero();
    }

    /**
     * Hash of the settings that decide which URLs get visited. A checkpoint taken under a different fingerprint
     * describes a different crawl and is not resumed. Seeds are left out so a resumed crawl may add new ones.
     */
    public String fingerprint() {
        Map<String, Object> relevant = new LinkedHashMap<>();
        relevant.put("scope", scope);
        relevant.put("depth", crawl.depth());
        relevant.put("pages", crawl.limits().pageBudget());
        relevant.put("maxRetries", retry.maxRetries());
        try {
            byte[] json = Json.MAPPER.writeValueAsBytes(relevant);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to fingerprint configuration", e);
        }
    }
}
