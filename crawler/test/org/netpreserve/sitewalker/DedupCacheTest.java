package org.netpreserve.sitewalker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.sitewalker.util.Url;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DedupCacheTest {
    @TempDir
    Path dir;
    private final MutableClock clock = new MutableClock();

    @Test
    public void testMarkLastWriteWins() {
        var cache = new DedupCache(null, clock);
        Url url = new Url("https://example.com/");
        assertFalse(cache.contains(url));
        assertTrue(cache.mark(url, CacheStatus.FAILED_RETRYABLE_EXHAUSTED));
        assertFalse(cache.mark(url, CacheStatus.SUCCESS));
        assertEquals(CacheStatus.SUCCESS, cache.get(url).status());
        assertEquals(1, cache.size());
    }

    @Test
    public void testPersistAndLoad() throws IOException {
        Path file = dir.resolve("url_cache.json");
        var cache = new DedupCache(file, clock);
        cache.mark(new Url("https://example.com/"), CacheStatus.SUCCESS);
        cache.mark(new Url("https://example.com/missing"), CacheStatus.FAILED_PERMANENT);
        cache.persist();

        String json = Files.readString(file);
        assertTrue(json.contains("\"https://example.com/missing\""), json);
        assertTrue(json.contains("\"failed_permanent\""), json);

        var reloaded = new DedupCache(file, clock);
        assertEquals(2, reloaded.load());
        assertEquals(CacheStatus.SUCCESS, reloaded.get(new Url("https://example.com/")).status());
        assertEquals(clock.instant(), reloaded.get(new Url("https://example.com/")).timestamp());
        assertEquals(0, Files.list(dir).filter(p -> p.toString().endsWith(".tmp")).count());
    }

    @Test
    public void testLoadNormalizesForeignKeys() throws IOException {
        Path foreign = dir.resolve("foreign.json");
        Files.writeString(foreign, """
                {
                  "https://EXAMPLE.com/page?b=2&a=1#x": {"status": "skipped", "timestamp": "2024-01-01T00:00:00Z"},
                  "https://example.com:443/page?a=1&b=2": {"status": "success", "timestamp": "2024-02-01T00:00:00Z"},
                  "https://exa mple.com/": {"status": "success", "timestamp": "2024-02-01T00:00:00Z"}
                }
                """);
        var cache = new DedupCache(null, clock);
        assertEquals(2, cache.load(foreign));
        assertEquals(1, cache.size());
        assertEquals(CacheStatus.SUCCESS, cache.get(new Url("https://example.com/page?a=1&b=2")).status());

        var frontier = new Frontier(cache, url -> true, null, 0, clock);
        assertFalse(frontier.enqueue(new Url("https://example.com/page?a=1&b=2"), 1));
        assertFalse(frontier.enqueue(new Url("https://Example.com/page?b=2&a=1"), 1));
    }

    @Test
    public void testLoadKeepsMostRecent() throws IOException {
        Url url = new Url("https://example.com/page");
        var other = new DedupCache(dir.resolve("other.json"), clock);
        other.mark(url, CacheStatus.FAILED_PERMANENT);
        other.mark(new Url("https://example.com/new"), CacheStatus.SUCCESS);
        other.persist();

        clock.advance(Duration.ofMinutes(1));
        var cache = new DedupCache(dir.resolve("url_cache.json"), clock);
        cache.mark(url, CacheStatus.SUCCESS);
        assertEquals(1, cache.load(dir.resolve("other.json")));
        assertEquals(CacheStatus.SUCCESS, cache.get(url).status());
        assertTrue(cache.contains(new Url("https://example.com/new")));

        clock.advance(Duration.ofMinutes(1));
        other.mark(url, CacheStatus.SKIPPED);
        other.persist();
        assertEquals(1, cache.load(dir.resolve("other.json")));
        assertEquals(CacheStatus.SKIPPED, cache.get(url).status());
    }

    @Test
    public void testCorruptOrMissingFileIsIgnored() throws IOException {
        Path file = dir.resolve("url_cache.json");
        var cache = new DedupCache(file, clock);
        assertEquals(0, cache.load());

        Files.writeString(file, "{\"https://example.com/\": {\"status\": \"succ");
        assertEquals(0, cache.load());
        assertEquals(0, cache.size());
    }

    @Test
    public void testStatsAndDelete() throws IOException {
        Path file = dir.resolve("url_cache.json");
        var cache = new DedupCache(file, clock);
        cache.mark(new Url("https://example.com/1"), CacheStatus.SUCCESS);
        cache.mark(new Url("https://example.com/2"), CacheStatus.SUCCESS);
        cache.mark(new Url("https://example.com/3"), CacheStatus.SKIPPED);
        var stats = cache.stats();
        assertEquals(3, stats.total());
        assertEquals(2, stats.count(CacheStatus.SUCCESS));
        assertEquals(1, stats.count(CacheStatus.SKIPPED));
        assertEquals(0, stats.count(CacheStatus.FAILED_PERMANENT));
        assertEquals("3 urls, 2 success, 1 skipped", stats.toString());

        cache.persist();
        cache.delete();
        assertFalse(Files.exists(file));
        assertEquals(0, cache.size());
    }
}
