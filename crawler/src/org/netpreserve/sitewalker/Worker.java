package org.netpreserve.sitewalker;

import org.netpreserve.sitewalker.ErrorClassifier.Classification;
import org.netpreserve.sitewalker.fetch.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Pulls tasks from the frontier one at a time: waits for the host's rate-limit slot, fetches, classifies the
 * outcome and records it.
 */
class Worker {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    final String id;
    private final Dispatcher dispatcher;
    private final Frontier frontier;
    private final DedupCache cache;
    private final RateLimiter rateLimiter;
    private Thread thread;

    Worker(String id, Dispatcher dispatcher) {
        this.id = id;
        this.dispatcher = dispatcher;
        this.frontier = dispatcher.frontier;
        this.cache = dispatcher.cache;
        this.rateLimiter = dispatcher.rateLimiter;
    }

    synchronized void start() {
        log.debug("Starting worker {}", id);
        thread = new Thread(() -> {
            try {
                run();
            } catch (InterruptedException e) {
                log.debug("Worker {} interrupted", id);
            } catch (Exception e) {
                log.error("Worker crashed", e);
                dispatcher.stop(CrawlOutcome.CANCELLED);
            }
        }, "Worker-" + id);
        thread.start();
    }

    void join() throws InterruptedException {
        thread.join();
    }

    void close() {
        thread.interrupt();
        try {
            thread.join(10000);
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for worker {} to close", id);
            Thread.currentThread().interrupt();
        }
    }

    void run() throws InterruptedException {
        while (!dispatcher.isStopping()) {
            UrlTask task;
            try {
                task = frontier.take();
            } catch (CrawlLimitException e) {
                dispatcher.stop(CrawlOutcome.PAGE_LIMIT);
                return;
            }
            if (task == null) {
                log.debug("No more work for worker {}", id);
                return;
            }
            process(task);
        }
    }

    void process(UrlTask task) throws InterruptedException {
        if (rateLimiter.isSkipped(task.domain())) {
            cache.mark(task.url(), CacheStatus.SKIPPED);
            done(task);
            return;
        }

        Duration wait = rateLimiter.reserve(task.domain());
        while (!wait.isZero()) {
            if (!dispatcher.sleep(wait)) {
                frontier.release(task);
                return;
            }
            wait = rateLimiter.recheck(task.domain());
        }
        if (dispatcher.isStopping()) {
            frontier.release(task);
            return;
        }
        if (rateLimiter.isSkipped(task.domain())) {
            cache.mark(task.url(), CacheStatus.SKIPPED);
            done(task);
            return;
        }

        log.atInfo().addKeyValue("url", task.url()).addKeyValue("depth", task.depth())
                .addKeyValue("retry", task.retryCount()).log("Fetching");

        FetchResult result = null;
        Classification classification;
        try {
            result = dispatcher.fetch(task.url());
            classification = dispatcher.classifier.classify(result);
        } catch (InterruptedException e) {
            frontier.release(task);
            throw e;
        } catch (Exception e) {
            classification = dispatcher.classifier.classify(e);
        }

        boolean domainSkipped = rateLimiter.record(task.domain(),
                classification.verdict() == ErrorClassifier.Verdict.RATE_LIMITED);

        switch (classification.verdict()) {
            case SUCCESS -> {
                // links go in before the page is completed so the frontier is never seen as exhausted in between
                frontier.enqueueAll(result.links(), task.depth() + 1, task.url());
                cache.mark(task.url(), CacheStatus.SUCCESS);
                done(task);
                dispatcher.publish(result);
            }
            case PERMANENT -> {
                logFailure(task, classification);
                cache.mark(task.url(), CacheStatus.FAILED_PERMANENT);
                done(task);
            }
            case RETRY -> {
                int maxRetries = dispatcher.retryConfig.maxRetries();
                if (task.retryCount() + 1 > maxRetries) {
                    logFailure(task, classification);
                    cache.mark(task.url(), CacheStatus.FAILED_RETRYABLE_EXHAUSTED);
                    done(task);
                } else {
                    Duration backoff = dispatcher.retryConfig.backoffFor(task.retryCount() + 1);
                    Instant notBefore = backoff.isZero() ? null : dispatcher.clock.instant().plus(backoff);
                    log.atInfo().addKeyValue("url", task.url()).addKeyValue("status", classification.status())
                            .addKeyValue("reason", classification.reason()).addKeyValue("backoff", backoff)
                            .log("Will retry");
                    frontier.retry(task, notBefore);
                }
            }
            case RATE_LIMITED -> {
                if (domainSkipped || rateLimiter.isSkipped(task.domain())) {
                    cache.mark(task.url(), CacheStatus.SKIPPED);
                    done(task);
                    frontier.drainDomain(task.domain());
                } else {
                    frontier.requeue(task);
                }
            }
        }
        dispatcher.recordOutcome(classification);
    }

    private void done(UrlTask task) {
        long processed = frontier.complete(task);
        dispatcher.processed(processed);
    }

    private void logFailure(UrlTask task, Classification classification) {
        log.atWarn().addKeyValue("url", task.url()).addKeyValue("status", classification.status())
                .addKeyValue("retries", task.retryCount()).addKeyValue("reason", classification.reason())
                .log("Failed");
    }
}
