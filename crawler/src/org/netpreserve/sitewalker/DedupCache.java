package org.netpreserve.sitewalker;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.util.AtomicFiles;
import org.netpreserve.sitewalker.util.Json;
import org.netpreserve.sitewalker.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.*;

/**
 * Records the terminal status of every URL attempted, keyed by normalized URL. Persisted as a JSON object of
 * {@code url -> {status, timestamp}}.
 */
public class DedupCache {
    private static final Logger log = LoggerFactory.getLogger(DedupCache.class);
    private static final TypeReference<Map<String, CacheEntry>> ENTRIES_TYPE = new TypeReference<>() {
    };
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final Object persistLock = new Object();
    private final @Nullable Path file;
    private final Clock clock;

    public DedupCache(@Nullable Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public DedupCache(@Nullable Path file) {
        this(file, Clock.systemUTC());
    }

    public @Nullable Path file() {
        return file;
    }

    public synchronized boolean contains(Url url) {
        return entries.containsKey(url.toString());
    }

    public synchronized @Nullable CacheEntry get(Url url) {
        return entries.get(url.toString());
    }

    /**
     * Records a terminal status. The latest call wins if the URL was already present.
     *
     * @return true if the URL was not in the cache before
     */
    public synchronized boolean mark(Url url, CacheStatus status) {
        var previous = entries.put(url.toString(), new CacheEntry(status, clock.instant()));
        if (previous != null && previous.status() != status) {
            log.debug("Overwrote {} status {} with {}", url, previous.status(), status);
        }
        return previous == null;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Map<String, CacheEntry> snapshot() {
        return new TreeMap<>(entries);
    }

    public synchronized void restore(Map<String, CacheEntry> snapshot) {
        entries.clear();
        entries.putAll(snapshot);
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Loads this cache's own file, if there is one.
     */
    public int load() {
        if (file == null) return 0;
        return load(file);
    }

    /**
     * Merges the entries of a cache file into this one, keeping the most recent entry for each URL. A missing
     * file is treated as empty; a corrupt one is logged and ignored.
     *
     * @return the number of entries that were added or replaced
     */
    public int load(Path path) {
        Map<String, CacheEntry> loaded;
        try {
            loaded = Json.MAPPER.readValue(Files.readAllBytes(path), ENTRIES_TYPE);
        } catch (NoSuchFileException e) {
            return 0;
        } catch (JacksonException e) {
            log.warn("Ignoring corrupt cache file {}: {}", path, e.getOriginalMessage());
            return 0;
        } catch (IOException e) {
            log.warn("Unable to read cache file {}", path, e);
            return 0;
        }
        if (loaded == null) return 0;
        int changed = merge(loaded);
        log.info("Loaded {} cache entries from {} ({} new or newer)", loaded.size(), path, changed);
        return changed;
    }

    /**
     * Merges entries keyed by URLs that may not be normalized, e.g. from a cache written by another tool.
     * Keys that normalize to the same URL keep the most recent entry. Malformed keys are skipped.
     */
    synchronized int merge(Map<String, CacheEntry> other) {
        int changed = 0;
        int malformed = 0;
        for (var entry : other.entrySet()) {
            CacheEntry incoming = entry.getValue();
            if (incoming == null || incoming.status() == null || incoming.timestamp() == null) continue;
            String key;
            try {
                key = new Url(entry.getKey()).withoutFragment().normalized().toString();
            } catch (URISyntaxException e) {
                log.debug("Skipping malformed cache key {}", entry.getKey());
                malformed++;
                continue;
            }
            CacheEntry existing = entries.get(key);
            if (incoming.isNewerThan(existing)) {
                entries.put(key, incoming);
                changed++;
            }
        }
        if (malformed > 0) log.warn("Skipped {} malformed URLs while merging cache entries", malformed);
        return changed;
    }

    /**
     * Writes the cache to its file atomically.
     */
    public void persist() throws IOException {
        persist(snapshot());
    }

    /**
     * Writes a previously taken snapshot, so the file matches a checkpoint taken at the same moment.
     */
    void persist(Map<String, CacheEntry> snapshot) throws IOException {
        if (file == null) return;
        synchronized (persistLock) {
            AtomicFiles.writeJson(file, Json.MAPPER.writer(), snapshot);
        }
    }

    /**
     * Deletes the persisted file and forgets all entries.
     */
    public void delete() throws IOException {
        synchronized (persistLock) {
            clear();
            if (file != null) Files.deleteIfExists(file);
        }
    }

    public synchronized CacheStats stats() {
        var byStatus = new EnumMap<CacheStatus, Long>(CacheStatus.class);
        for (var status : CacheStatus.values()) byStatus.put(status, 0L);
        for (var entry : entries.values()) {
            byStatus.merge(entry.status(), 1L, Long::sum);
        }
        return new CacheStats(entries.size(), byStatus);
    }

    public record CacheStats(long total, Map<CacheStatus, Long> byStatus) {
        public long count(CacheStatus status) {
            return byStatus.getOrDefault(status, 0L);
        }

        @Override
        public String toString() {
            var builder = new StringBuilder().append(total).append(" urls");
            byStatus.forEach((status, count) -> {
                if (count > 0) builder.append(", ").append(count).append(' ').append(status.value());
            });
            return builder.toString();
        }
    }
}
