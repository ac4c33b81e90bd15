package org.netpreserve.sitewalker;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.config.CrawlConfig;
import org.netpreserve.sitewalker.config.RetryConfig;
import org.netpreserve.sitewalker.fetch.*;
import org.netpreserve.sitewalker.util.NamedThreadFactory;
import org.netpreserve.sitewalker.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a fixed pool of {@link Worker}s against the frontier until it is exhausted or something stops the crawl:
 * the page budget, the time limit, too many consecutive errors or cancellation.
 */
public class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
    final CrawlConfig crawlConfig;
    final RetryConfig retryConfig;
    final Frontier frontier;
    final DedupCache cache;
    final RateLimiter rateLimiter;
    final ErrorClassifier classifier;
    final Clock clock;
    private final Fetcher fetcher;
    private final ContentSink contentSink;
    private final ProgressListener progressListener;
    private final FetchOptions fetchOptions;
    private final AtomicInteger consecutiveErrors = new AtomicInteger();
    private final CountDownLatch stopping = new CountDownLatch(1);
    private final List<Worker> workers = new ArrayList<>();
    private final ExecutorService fetchExecutor;
    private final ExecutorService sinkExecutor;
    private final ScheduledExecutorService timer;
    private CrawlOutcome outcome;
    private SitewalkerException failure;

    /**
     * Called after each URL reaches a terminal state, with the total processed so far.
     */
    @FunctionalInterface
    public interface ProgressListener {
        void processed(long count) throws SitewalkerException;
    }

    public Dispatcher(CrawlConfig crawlConfig, RetryConfig retryConfig, Frontier frontier, DedupCache cache,
                      RateLimiter rateLimiter, ErrorClassifier classifier, Fetcher fetcher, ContentSink contentSink,
                      @Nullable ProgressListener progressListener, Clock clock) {
        this.crawlConfig = crawlConfig;
        this.retryConfig = retryConfig;
        this.frontier = frontier;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.classifier = classifier;
        this.fetcher = fetcher;
        this.contentSink = contentSink;
        this.progressListener = progressListener == null ? count -> {
        } : progressListener;
        this.clock = clock;
        this.fetchOptions = new FetchOptions(crawlConfig.pageTimeout(), crawlConfig.userAgent());
        this.fetchExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("fetch"));
        this.sinkExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("content-sink"));
        this.timer = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("crawl-timer"));
    }

    /**
     * Runs the crawl, blocking until every worker has exited.
     *
     * @throws SitewalkerException if the crawl was aborted by a failure such as a mandatory checkpoint not being
     *                             written
     */
    public CrawlOutcome run(Cancellation cancellation) throws InterruptedException, SitewalkerException {
        int concurrency = Math.max(1, crawlConfig.concurrency());
        cancellation.onCancel(() -> stop(CrawlOutcome.CANCELLED));
        Duration timeLimit = crawlConfig.limits().time();
        if (timeLimit != null && !timeLimit.isZero()) {
            timer.schedule(() -> stop(CrawlOutcome.TIME_LIMIT), timeLimit.toMillis(), TimeUnit.MILLISECONDS);
        }

        synchronized (this) {
            for (int i = 0; i < concurrency; i++) {
                workers.add(new Worker(String.valueOf(i), this));
            }
        }
        log.info("Starting {} workers with {} URLs queued", concurrency, frontier.size());
        for (var worker : workers) {
            worker.start();
        }
        try {
            for (var worker : workers) {
                worker.join();
            }
        } catch (InterruptedException e) {
            stop(CrawlOutcome.CANCELLED);
            for (var worker : workers) {
                worker.close();
            }
            throw e;
        } finally {
            timer.shutdownNow();
        }

        synchronized (this) {
            if (failure != null) throw failure;
            if (outcome == null) outcome = CrawlOutcome.COMPLETED;
            return outcome;
        }
    }

    /**
     * Stops the crawl. Workers finish the fetch they are in the middle of and then exit. Only the first reason
     * is kept.
     */
    public void stop(CrawlOutcome reason) {
        synchronized (this) {
            if (outcome != null) return;
            outcome = reason;
        }
        log.info("Stopping crawl: {}", reason);
        stopping.countDown();
        frontier.close();
    }

    void fail(SitewalkerException e) {
        synchronized (this) {
            if (failure == null) failure = e;
        }
        stop(CrawlOutcome.CANCELLED);
    }

    public boolean isStopping() {
        return stopping.getCount() == 0;
    }

    public synchronized @Nullable CrawlOutcome outcome() {
        return outcome;
    }

    /**
     * Waits for the given duration unless the crawl is stopped first.
     *
     * @return true if the full duration elapsed, false if the crawl is stopping
     */
    boolean sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) return !isStopping();
        return !stopping.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Fetches a URL on the fetch executor, giving up after the page timeout.
     */
    FetchResult fetch(Url url) throws Exception {
        Future<FetchResult> future = fetchExecutor.submit(() -> fetcher.fetch(url, fetchOptions));
        try {
            return future.get(crawlConfig.pageTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FetchTimedOutException(url, "Timed out after " + crawlConfig.pageTimeout());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) throw cause;
            throw e;
        }
    }

    /**
     * Updates the global consecutive error count and trips the breaker if it is exceeded.
     */
    void recordOutcome(ErrorClassifier.Classification classification) {
        if (classification.verdict() == ErrorClassifier.Verdict.SUCCESS) {
            consecutiveErrors.set(0);
        } else if (classification.countsAsError()) {
            int errors = consecutiveErrors.incrementAndGet();
            int max = crawlConfig.maxConsecutiveErrors();
            if (max > 0 && errors > max) {
                log.error("{} consecutive fetch errors, aborting crawl", errors);
                stop(CrawlOutcome.ERROR_THRESHOLD);
            }
        }
    }

    void processed(long count) {
        try {
            progressListener.processed(count);
        } catch (SitewalkerException e) {
            log.error("Aborting crawl", e);
            fail(e);
        }
    }

    /**
     * Hands a page to the content sink without waiting for it.
     */
    void publish(FetchResult result) {
        try {
            sinkExecutor.execute(() -> {
                try {
                    contentSink.accept(result);
                } catch (Exception e) {
                    log.warn("Content sink failed for {}", result.url(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Content sink closed, dropping {}", result.url());
        }
    }

    /**
     * Releases the executors, giving queued content a short time to drain.
     */
    public void close() {
        timer.shutdownNow();
        fetchExecutor.shutdownNow();
        sinkExecutor.shutdown();
        try {
            if (!sinkExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Content sink still busy, abandoning remaining pages");
                sinkExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sinkExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            fetcher.close();
        } catch (RuntimeException e) {
            log.error("Failed to close fetcher", e);
        }
    }
}
