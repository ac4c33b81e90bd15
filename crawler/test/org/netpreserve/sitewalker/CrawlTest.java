package org.netpreserve.sitewalker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.sitewalker.config.ConfigException;
import org.netpreserve.sitewalker.config.ConfigLoader;
import org.netpreserve.sitewalker.config.JobConfig;
import org.netpreserve.sitewalker.config.ResumeMode;
import org.netpreserve.sitewalker.fetch.ContentSink;
import org.netpreserve.sitewalker.fetch.FetchResult;
import org.netpreserve.sitewalker.util.Json;
import org.netpreserve.sitewalker.util.Url;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CrawlTest {
    private static final String SEED = "https://example.com/";
    @TempDir
    Path jobDir;

    private static JobConfig config(String yaml) throws ConfigException {
        return new ConfigLoader().mergeYaml("""
                seeds: ["https://example.com/"]
                rateLimit: {delay: 0}
                retry: {maxRetries: 2, backoff: 0}
                checkpoint: {period: null}
                """).mergeYaml(yaml).build();
    }

    private CrawlReport crawl(JobConfig config, ScriptedFetcher fetcher) throws Exception {
        return crawl(jobDir, config, fetcher, result -> {
        });
    }

    private static CrawlReport crawl(Path dir, JobConfig config, ScriptedFetcher fetcher, ContentSink sink)
            throws Exception {
        try (var crawl = new Crawl(dir, config, fetcher, sink)) {
            return crawl.run();
        }
    }

    /**
     * Seed linking to p1..pN, which link nowhere.
     */
    private static ScriptedFetcher site(int pages) {
        var fetcher = new ScriptedFetcher();
        var links = new String[pages];
        for (int i = 1; i <= pages; i++) {
            links[i - 1] = SEED + "p" + i;
            fetcher.page(SEED + "p" + i);
        }
        fetcher.page(SEED, links);
        return fetcher;
    }

    private Checkpoint readCheckpoint(Path dir) throws IOException {
        return Json.MAPPER.readValue(dir.resolve("checkpoint.json").toFile(), Checkpoint.class);
    }

    @Test
    void testDepthAndPageLimit() throws Exception {
        var fetcher = new ScriptedFetcher()
                .page(SEED, SEED + "a", SEED + "b", SEED + "c", SEED + "d")
                .page(SEED + "a", SEED + "a/1", SEED + "a/2")
                .page(SEED + "b", SEED + "b/1")
                .page(SEED + "c")
                .page(SEED + "d", SEED + "d/1");

        var report = crawl(config("crawl: {depth: 1, limits: {pages: 5}}"), fetcher);

        assertEquals(CrawlOutcome.PAGE_LIMIT, report.outcome());
        assertEquals(5, report.processed());
        assertEquals(Set.of(SEED, SEED + "a", SEED + "b", SEED + "c", SEED + "d"),
                fetcher.fetchedUrls().stream().map(Url::toString).collect(Collectors.toSet()));
        assertEquals(5, fetcher.fetches.size());
    }

    @Test
    void testCompletesWhenFrontierIsExhausted() throws Exception {
        var report = crawl(config("crawl: {depth: 1}"), site(3));
        assertEquals(CrawlOutcome.COMPLETED, report.outcome());
        assertEquals(4, report.processed());
        assertEquals(0, report.pending());
        assertEquals(4, report.cacheStats().count(CacheStatus.SUCCESS));
    }

    @Test
    void testLinkFromTwoParentsFetchedOnce() throws Exception {
        var fetcher = new ScriptedFetcher()
                .page(SEED, SEED + "a", SEED + "b")
                .page(SEED + "a", SEED + "shared")
                .page(SEED + "b", SEED + "shared#fragment")
                .page(SEED + "shared");

        var report = crawl(config("crawl: {depth: 2, concurrency: 4}"), fetcher);

        assertEquals(1, fetcher.count(SEED + "shared"));
        assertEquals(4, report.cacheStats().total());
        assertEquals(4, fetcher.fetches.size());
    }

    @Test
    void testEveryUrlFetchedExactlyOnceWithManyWorkers() throws Exception {
        var fetcher = new ScriptedFetcher();
        int pages = 60;
        for (int i = 0; i < pages; i++) {
            String host = i % 2 == 0 ? "https://example.com/" : "https://docs.example.com/";
            fetcher.page(host + i,
                    "https://example.com/" + ((i * 7 + 1) % pages),
                    "https://docs.example.com/" + ((i * 11 + 3) % pages),
                    "https://example.com/" + ((i + 1) % pages));
        }
        fetcher.page(SEED, "https://example.com/0", "https://docs.example.com/1");

        var report = crawl(config("crawl: {depth: 50, concurrency: 6}"), fetcher);

        assertEquals(CrawlOutcome.COMPLETED, report.outcome());
        var counts = new HashMap<String, Integer>();
        for (var url : fetcher.fetchedUrls()) counts.merge(url.toString(), 1, Integer::sum);
        counts.forEach((url, count) -> assertEquals(1, count, url));
        assertEquals(counts.size(), report.cacheStats().total());
        assertEquals(report.processed(), report.cacheStats().total());
    }

    @Test
    void testPolitenessGaps() throws Exception {
        var fetcher = site(4);
        crawl(config("""
                crawl: {depth: 1, concurrency: 3}
                rateLimit: {delay: 200ms}
                """), fetcher);

        var times = fetcher.fetches.stream().mapToLong(ScriptedFetcher.Fetch::nanoTime).sorted().toArray();
        assertEquals(5, times.length);
        for (int i = 1; i < times.length; i++) {
            long gapMillis = TimeUnit.NANOSECONDS.toMillis(times[i] - times[i - 1]);
            assertTrue(gapMillis >= 150, "requests only " + gapMillis + "ms apart");
        }
    }

    @Test
    void testConcurrentWorkersRespectCooldown() throws Exception {
        var fetcher = site(3).script(SEED + "p1", 429);
        crawl(config("""
                crawl: {depth: 1, concurrency: 2}
                rateLimit: {delay: 300ms, maxDelay: 5s}
                """), fetcher);

        var fetches = new ArrayList<>(fetcher.fetches);
        fetches.sort(Comparator.comparingLong(ScriptedFetcher.Fetch::nanoTime));
        assertEquals(5, fetches.size());
        long rateLimitedAt = fetches.stream().filter(f -> f.url().toString().equals(SEED + "p1"))
                .mapToLong(ScriptedFetcher.Fetch::nanoTime).min().orElseThrow();
        for (var fetch : fetches) {
            if (fetch.nanoTime() <= rateLimitedAt) continue;
            long gapMillis = TimeUnit.NANOSECONDS.toMillis(fetch.nanoTime() - rateLimitedAt);
            // one second of backoff after the 429, minus scheduling slack
            assertTrue(gapMillis >= 900, fetch.url() + " fetched " + gapMillis + "ms after the 429");
        }
    }

    @Test
    void testPermanentFailureIsNotRetried() throws Exception {
        var fetcher = new ScriptedFetcher().page(SEED, SEED + "missing");
        var report = crawl(config(""), fetcher);
        assertEquals(1, fetcher.count(SEED + "missing"));
        assertEquals(1, report.cacheStats().count(CacheStatus.FAILED_PERMANENT));
    }

    @Test
    void testRedirectTargetIsCrawledAndUnfollowedRedirectFails() throws Exception {
        var fetcher = new ScriptedFetcher()
                .page(SEED, SEED + "old", SEED + "gone")
                .script(SEED + "old", new FetchResult(new Url(SEED + "old"), 301, null, "",
                        List.of(new Url("http://example.com/new")), null))
                .script(SEED + "gone", 302)
                .page("http://example.com/new");
        var report = crawl(config("crawl: {depth: 2}"), fetcher);
        assertEquals(1, fetcher.count("http://example.com/new"));
        assertEquals(3, report.cacheStats().count(CacheStatus.SUCCESS));
        assertEquals(1, report.cacheStats().count(CacheStatus.FAILED_PERMANENT));
    }

    @Test
    void testRetriesAreExhausted() throws Exception {
        var fetcher = new ScriptedFetcher()
                .page(SEED, SEED + "flaky")
                .script(SEED + "flaky", 500, 500, 500, 500);
        var report = crawl(config("retry: {maxRetries: 2}"), fetcher);
        assertEquals(3, fetcher.count(SEED + "flaky"));
        assertEquals(1, report.cacheStats().count(CacheStatus.FAILED_RETRYABLE_EXHAUSTED));
        assertEquals(CrawlOutcome.COMPLETED, report.outcome());
    }

    @Test
    void testTransientFailureRecovers() throws Exception {
        var fetcher = new ScriptedFetcher()
                .page(SEED, SEED + "flaky")
                .page(SEED + "flaky")
                .script(SEED + "flaky", new IOException("connection reset"));
        var report = crawl(config(""), fetcher);
        assertEquals(2, fetcher.count(SEED + "flaky"));
        assertEquals(2, report.cacheStats().count(CacheStatus.SUCCESS));
    }

    @Test
    void testPageTimeout() throws Exception {
        var fetcher = new ScriptedFetcher()
                .page(SEED, SEED + "slow")
                .page(SEED + "slow")
                .beforeFetch(url -> {
                    if (url.toString().endsWith("slow")) {
                        try {
                            Thread.sleep(5000);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                });
        var report = crawl(config("""
                crawl: {pageTimeout: 200ms}
                retry: {maxRetries: 0}
                """), fetcher);
        assertEquals(1, report.cacheStats().count(CacheStatus.FAILED_RETRYABLE_EXHAUSTED));
        assertTrue(report.elapsed().toMillis() < 5000);
    }

    @Test
    void testRateLimitDoesNotUseRetryBudget() throws Exception {
        var fetcher = new ScriptedFetcher()
                .page(SEED, SEED + "busy")
                .page(SEED + "busy")
                .script(SEED + "busy", 503);
        var report = crawl(config("retry: {maxRetries: 0}"), fetcher);
        assertEquals(2, fetcher.count(SEED + "busy"));
        assertEquals(2, report.cacheStats().count(CacheStatus.SUCCESS));
    }

    @Test
    void testDomainSkippedAfterRepeatedRateLimiting() throws Exception {
        var fetcher = new ScriptedFetcher()
                .page(SEED, SEED + "a", SEED + "b")
                .otherwise(429);
        var report = crawl(config("rateLimit: {maxDomainErrors: 1}"), fetcher);
        assertEquals(CrawlOutcome.COMPLETED, report.outcome());
        assertEquals(1, fetcher.count(SEED + "a"));
        assertEquals(1, fetcher.count(SEED + "b"));
        assertEquals(2, report.cacheStats().count(CacheStatus.SKIPPED));
        assertEquals(3, report.processed());
    }

    @Test
    void testConsecutiveErrorsAbortCrawl() throws Exception {
        var fetcher = new ScriptedFetcher().otherwise(new IOException("connection refused"));
        var report = crawl(config("""
                crawl: {maxConsecutiveErrors: 2}
                retry: {maxRetries: 10}
                """), fetcher);
        assertEquals(CrawlOutcome.ERROR_THRESHOLD, report.outcome());
        assertEquals(2, report.outcome().exitCode());
        assertEquals(3, fetcher.fetches.size());

        // the seed wasn't resolved, so it must still be in the final checkpoint
        var checkpoint = readCheckpoint(jobDir);
        assertEquals(List.of(new Url(SEED)), checkpoint.frontier().stream().map(UrlTask::url).toList());
        assertEquals(3, checkpoint.frontier().get(0).retryCount());
    }

    @Test
    void testSuccessfulPagesReachContentSink() throws Exception {
        ContentSink sink = mock(ContentSink.class);
        doThrow(new RuntimeException("sink broken")).when(sink).accept(argThat(r -> r.url().toString().endsWith("p1")));
        var report = crawl(jobDir, config("crawl: {depth: 1}"), site(4), sink);
        assertEquals(CrawlOutcome.COMPLETED, report.outcome());
        verify(sink, timeout(5000).times(5)).accept(any(FetchResult.class));
    }

    @Test
    void testCancelInterruptsRateLimitWait() throws Exception {
        var fetched = new CountDownLatch(1);
        var fetcher = site(2).beforeFetch(url -> fetched.countDown());
        var config = config("""
                crawl: {depth: 1}
                rateLimit: {delay: 1h, maxDelay: 1h}
                """);
        var executor = Executors.newSingleThreadExecutor();
        try (var crawl = new Crawl(jobDir, config, fetcher, result -> {
        })) {
            Future<CrawlReport> future = executor.submit(crawl::run);
            assertTrue(fetched.await(5, TimeUnit.SECONDS));
            Thread.sleep(200);
            crawl.cancel();
            CrawlReport report = future.get(5, TimeUnit.SECONDS);
            assertEquals(CrawlOutcome.CANCELLED, report.outcome());
            assertEquals(1, fetcher.fetches.size());
        } finally {
            executor.shutdownNow();
        }
        var checkpoint = readCheckpoint(jobDir);
        assertEquals(2, checkpoint.frontier().size());
        assertEquals(1, checkpoint.processedCount());
    }

    @Test
    void testTimeLimit() throws Exception {
        var fetcher = site(2);
        var report = crawl(config("""
                crawl: {depth: 1, limits: {time: 300ms}}
                rateLimit: {delay: 1h, maxDelay: 1h}
                """), fetcher);
        assertEquals(CrawlOutcome.TIME_LIMIT, report.outcome());
        assertEquals(1, report.processed());
        assertEquals(2, report.pending());
    }

    @Test
    void testResumeAfterCrash() throws Exception {
        Path crashed = Files.createDirectory(jobDir.resolve("crashed"));
        Path first = Files.createDirectory(jobDir.resolve("first"));
        var config = config("""
                crawl: {depth: 1}
                checkpoint: {interval: 3}
                """);

        // copy the state away as it is when the 4th fetch begins, as if the process was killed there
        var fetcher = site(9).beforeFetch(url -> {
            if (url.toString().equals(SEED + "p3")) {
                try {
                    Files.copy(first.resolve("checkpoint.json"), crashed.resolve("checkpoint.json"));
                    Files.copy(first.resolve("url_cache.json"), crashed.resolve("url_cache.json"),
                            StandardCopyOption.REPLACE_EXISTING);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        });
        crawl(first, config, fetcher, result -> {
        });
        assertEquals(10, fetcher.fetches.size());
        assertEquals(3, readCheckpoint(crashed).processedCount());

        var resumed = site(9);
        var report = crawl(crashed, config.withResume(ResumeMode.CONTINUE), resumed, result -> {
        });
        assertEquals(10, report.processed());
        assertEquals(7, resumed.fetches.size());
        var refetched = new HashSet<>(resumed.fetchedUrls().stream().map(Url::toString).toList());
        assertEquals(7, refetched.size());
        assertFalse(refetched.contains(SEED));
        assertFalse(refetched.contains(SEED + "p1"));
        assertFalse(refetched.contains(SEED + "p2"));
    }

    @Test
    void testRerunWithCacheFetchesNothing() throws Exception {
        var config = config("crawl: {depth: 1}");
        crawl(config, site(3));

        var again = site(3);
        var report = crawl(config.withResume(ResumeMode.DISABLED), again);
        assertEquals(0, again.fetches.size());
        assertEquals(CrawlOutcome.COMPLETED, report.outcome());

        var continued = site(3);
        crawl(config.withResume(ResumeMode.CONTINUE), continued);
        assertEquals(0, continued.fetches.size());
    }

    @Test
    void testClearStartsOver() throws Exception {
        var config = config("crawl: {depth: 1}");
        crawl(config, site(3));

        var again = site(3);
        crawl(config.withResume(ResumeMode.CLEAR), again);
        assertEquals(4, again.fetches.size());
    }

    @Test
    void testMergedCacheIsHonoured() throws Exception {
        Path other = Files.createDirectory(jobDir.resolve("other"));
        crawl(other, config("crawl: {depth: 1}"), site(3), result -> {
        });

        var fetcher = site(3);
        crawl(config("""
                crawl: {depth: 1}
                storage: {mergeCaches: [other/url_cache.json]}
                """), fetcher);
        assertEquals(0, fetcher.fetches.size());
    }
}
