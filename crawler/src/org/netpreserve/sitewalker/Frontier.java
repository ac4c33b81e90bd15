package org.netpreserve.sitewalker;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Queue of URLs waiting to be fetched. Shallower depths are always served first and each depth is FIFO.
 * <p>
 * A URL is admitted at most once per run: it is rejected while it is pending or in flight, and once it reaches a
 * terminal state the {@link DedupCache} rejects it. The cache check and the insert happen under the frontier lock so
 * two workers discovering the same link can't both enqueue it.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final NavigableMap<Integer, Deque<UrlTask>> pending = new TreeMap<>();
    private final Set<String> known = new HashSet<>();
    private final Map<String, UrlTask> inFlight = new HashMap<>();
    private final DedupCache cache;
    private final Predicate<Url> scope;
    private final @Nullable Integer maxDepth;
    private final long pageBudget;
    private final Clock clock;
    private int pendingCount;
    private long processed;
    private boolean budgetReached;
    private boolean closed;

    /**
     * @param maxDepth   deepest link depth admitted, null for unlimited
     * @param pageBudget maximum number of URLs processed in the run, 0 for unlimited
     */
    public Frontier(DedupCache cache, Predicate<Url> scope, @Nullable Integer maxDepth, long pageBudget, Clock clock) {
        this.cache = cache;
        this.scope = scope;
        this.maxDepth = maxDepth;
        this.pageBudget = pageBudget;
        this.clock = clock;
    }

    public boolean enqueue(Url url, int depth) {
        return enqueue(url, depth, null);
    }

    /**
     * Adds a URL unless it is too deep, already known, out of scope, not http(s) or the page budget is used up.
     * A malformed http(s) URL is recorded in the cache as a permanent failure.
     *
     * @return true if the URL was added
     */
    public boolean enqueue(Url url, int depth, @Nullable Url via) {
        if (depth < 0) throw new IllegalArgumentException("negative depth");
        if (maxDepth != null && depth > maxDepth) return false;
        if (!url.isHttp()) return false;

        Url normalized;
        String domain;
        try {
            normalized = url.withoutFragment().normalized();
            domain = normalized.host();
        } catch (URISyntaxException e) {
            lock.lock();
            try {
                if (cache.mark(url, CacheStatus.FAILED_PERMANENT)) {
                    log.atInfo().addKeyValue("url", url).addKeyValue("via", via).log("Malformed URL");
                }
            } finally {
                lock.unlock();
            }
            return false;
        }

        lock.lock();
        try {
            String key = normalized.toString();
            if (known.contains(key) || cache.contains(normalized)) return false;
            if (!scope.test(normalized)) return false;
            if (pageBudget > 0 && processed + pendingCount + inFlight.size() >= pageBudget) {
                if (!budgetReached) log.info("Page budget of {} reached, no longer adding URLs", pageBudget);
                budgetReached = true;
                return false;
            }
            add(new UrlTask(normalized, depth, domain, 0, clock.instant(), via, null), false);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int enqueueAll(Collection<Url> urls, int depth, @Nullable Url via) {
        int novel = 0;
        for (var url : urls) {
            if (enqueue(url, depth, via)) novel++;
        }
        log.info("Added {} new URLs from {} extracted links", novel, urls.size());
        return novel;
    }

    private void add(UrlTask task, boolean first) {
        var queue = pending.computeIfAbsent(task.depth(), d -> new ArrayDeque<>());
        if (first) {
            queue.addFirst(task);
        } else {
            queue.addLast(task);
        }
        known.add(task.url().toString());
        pendingCount++;
        changed.signalAll();
    }

    /**
     * Takes the next task that is ready to be dispatched, waiting until one is.
     *
     * @return the task, or null once the frontier is empty with nothing in flight or it has been closed
     * @throws CrawlLimitException if the page budget has been used up
     */
    public @Nullable UrlTask take() throws InterruptedException, CrawlLimitException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (closed) return null;
                if (pageBudget > 0 && processed >= pageBudget) {
                    throw new CrawlLimitException("page limit of " + pageBudget + " reached");
                }
                Instant now = clock.instant();
                UrlTask task = pollReady(now);
                if (task != null) {
                    inFlight.put(task.url().toString(), task);
                    return task;
                }
                if (pendingCount == 0 && inFlight.isEmpty()) {
                    if (budgetReached) throw new CrawlLimitException("page limit of " + pageBudget + " reached");
                    return null;
                }
                Instant earliest = earliestNotBefore();
                if (earliest == null) {
                    changed.await();
                } else {
                    long millis = Math.max(1, Duration.between(now, earliest).toMillis());
                    changed.await(millis, TimeUnit.MILLISECONDS);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next ready task without waiting.
     *
     * @return the task, or null if none is ready or the frontier is closed
     */
    public @Nullable UrlTask takeNext() {
        lock.lock();
        try {
            if (closed) return null;
            UrlTask task = pollReady(clock.instant());
            if (task != null) inFlight.put(task.url().toString(), task);
            return task;
        } finally {
            lock.unlock();
        }
    }

    private @Nullable UrlTask pollReady(Instant now) {
        for (var it = pending.values().iterator(); it.hasNext(); ) {
            var queue = it.next();
            for (var taskIt = queue.iterator(); taskIt.hasNext(); ) {
                UrlTask task = taskIt.next();
                if (task.isReady(now)) {
                    taskIt.remove();
                    if (queue.isEmpty()) it.remove();
                    pendingCount--;
                    return task;
                }
            }
        }
        return null;
    }

    private @Nullable Instant earliestNotBefore() {
        Instant earliest = null;
        for (var queue : pending.values()) {
            for (var task : queue) {
                if (task.notBefore() != null && (earliest == null || task.notBefore().isBefore(earliest))) {
                    earliest = task.notBefore();
                }
            }
        }
        return earliest;
    }

    /**
     * Sends an in-flight task back to the queue after a transient failure, with its retry count incremented.
     * Retries don't count against the page budget a second time.
     */
    public void retry(UrlTask task, @Nullable Instant notBefore) {
        returnToQueue(task, task.withRetry(notBefore), false);
    }

    /**
     * Sends an in-flight task back to the queue without consuming a retry, e.g. when the server rate limited us.
     */
    public void requeue(UrlTask task) {
        returnToQueue(task, task, false);
    }

    /**
     * Puts an in-flight task back at the head of its depth without any change, e.g. when the crawl is stopping.
     */
    public void release(UrlTask task) {
        returnToQueue(task, task, true);
    }

    private void returnToQueue(UrlTask inFlightTask, UrlTask task, boolean first) {
        lock.lock();
        try {
            if (inFlight.remove(inFlightTask.url().toString()) == null) {
                throw new IllegalStateException("Task not in flight: " + inFlightTask.url());
            }
            known.remove(inFlightTask.url().toString());
            add(task, first);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records that an in-flight task reached a terminal state.
     *
     * @return the number of processed tasks
     */
    public long complete(UrlTask task) {
        lock.lock();
        try {
            if (inFlight.remove(task.url().toString()) == null) {
                throw new IllegalStateException("Task not in flight: " + task.url());
            }
            known.remove(task.url().toString());
            processed++;
            changed.signalAll();
            return processed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every pending task for the host, recording each in the cache as skipped.
     *
     * @return the number of tasks removed
     */
    public int drainDomain(String domain) {
        lock.lock();
        try {
            int drained = 0;
            for (var it = pending.values().iterator(); it.hasNext(); ) {
                var queue = it.next();
                for (var taskIt = queue.iterator(); taskIt.hasNext(); ) {
                    UrlTask task = taskIt.next();
                    if (!task.domain().equals(domain)) continue;
                    taskIt.remove();
                    known.remove(task.url().toString());
                    cache.mark(task.url(), CacheStatus.SKIPPED);
                    pendingCount--;
                    processed++;
                    drained++;
                }
                if (queue.isEmpty()) it.remove();
            }
            if (drained > 0) {
                log.info("Drained {} pending URLs for skipped host {}", drained, domain);
                changed.signalAll();
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of pending tasks, not counting those in flight.
     */
    public int size() {
        lock.lock();
        try {
            return pendingCount;
        } finally {
            lock.unlock();
        }
    }

    public int inFlight() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public long processed() {
        lock.lock();
        try {
            return processed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes all waiting takers and makes them return null. Links can still be added so that pages finishing after
     * the close keep their discoveries for the final checkpoint.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Captures the pending and in-flight tasks together with the cache contents, as one consistent state.
     * In-flight tasks are included so an interrupted fetch is retried after a resume.
     */
    public Snapshot snapshot() {
        lock.lock();
        try {
            var tasks = new ArrayList<UrlTask>(pendingCount + inFlight.size());
            for (var queue : pending.values()) tasks.addAll(queue);
            tasks.addAll(inFlight.values());
            tasks.sort(Comparator.comparingInt(UrlTask::depth));
            return new Snapshot(tasks, processed, cache.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the frontier contents with previously snapshotted tasks. Tasks whose URL is already in the cache are
     * counted as processed instead.
     */
    public void restore(List<UrlTask> tasks, long processedCount) {
        lock.lock();
        try {
            pending.clear();
            known.clear();
            inFlight.clear();
            pendingCount = 0;
            processed = processedCount;
            for (var task : tasks) {
                if (cache.contains(task.url())) {
                    processed++;
                } else if (!known.contains(task.url().toString())) {
                    add(task, false);
                }
            }
            log.info("Restored {} pending URLs, {} already processed", pendingCount, processed);
        } finally {
            lock.unlock();
        }
    }

    public record Snapshot(List<UrlTask> tasks, long processed, Map<String, CacheEntry> cache) {
    }
}
