package org.netpreserve.sitewalker;

import org.netpreserve.sitewalker.config.JobConfig;
import org.netpreserve.sitewalker.config.ResumeMode;
import org.netpreserve.sitewalker.config.SeedConfig;
import org.netpreserve.sitewalker.fetch.ContentSink;
import org.netpreserve.sitewalker.fetch.Fetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A crawl job: wires the components together from the configuration, sets up or resumes state in the job
 * directory and runs the dispatcher.
 */
public class Crawl implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Crawl.class);
    private final Path jobDir;
    private final JobConfig config;
    private final Clock clock;
    private final DedupCache cache;
    private final Scope scope;
    private final RateLimiter rateLimiter;
    private final Frontier frontier;
    private final CheckpointManager checkpointManager;
    private final Dispatcher dispatcher;
    private final Cancellation cancellation = new Cancellation();
    private final Lock startStopLock = new ReentrantLock();
    private boolean started;

    public Crawl(Path jobDir, JobConfig config, Fetcher fetcher, ContentSink contentSink) {
        this(jobDir, config, fetcher, contentSink, Clock.systemUTC());
    }

    Crawl(Path jobDir, JobConfig config, Fetcher fetcher, ContentSink contentSink, Clock clock) {
        this.jobDir = jobDir;
        this.config = config;
        this.clock = clock;
        this.cache = new DedupCache(jobDir.resolve(config.storage().cacheFile()), clock);
        this.scope = new Scope(config.scope());
        this.rateLimiter = new RateLimiter(config.rateLimit(), clock);
        this.frontier = new Frontier(cache, scope, config.crawl().depth(), config.crawl().limits().pageBudget(), clock);
        this.checkpointManager = new CheckpointManager(jobDir.resolve(config.checkpoint().file()), config.checkpoint(),
                config.fingerprint(), frontier, cache, rateLimiter, scope::seeds, clock);
        this.dispatcher = new Dispatcher(config.crawl(), config.retry(), frontier, cache, rateLimiter,
                new ErrorClassifier(config.rateLimit().statusCodes()), fetcher, contentSink,
                checkpointManager::onProgress, clock);
    }

    public Frontier frontier() {
        return frontier;
    }

    public DedupCache cache() {
        return cache;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    /**
     * Prepares state according to the resume mode, enqueues the seeds and crawls until the crawl stops.
     * A final checkpoint is always written.
     */
    public CrawlReport run() throws SitewalkerException, IOException, InterruptedException {
        startStopLock.lock();
        try {
            if (started) throw new IllegalStateException("Crawl already run");
            started = true;
            Instant start = clock.instant();
            prepare();

            checkpointManager.start();
            CrawlOutcome outcome = null;
            try {
                outcome = dispatcher.run(cancellation);
            } finally {
                try {
                    checkpointManager.checkpoint();
                } catch (CheckpointException e) {
                    if (outcome != null) throw e;
                    log.error("Final checkpoint failed", e);
                }
            }

            var report = new CrawlReport(outcome, frontier.processed(), frontier.size(), cache.stats(),
                    Duration.between(start, clock.instant()));
            log.info("Crawl finished: {}", report);
            return report;
        } finally {
            startStopLock.unlock();
        }
    }

    void prepare() throws IOException {
        ResumeMode resume = config.resume();
        if (resume == ResumeMode.CLEAR) {
            checkpointManager.clear();
        } else {
            cache.load();
        }
        for (String mergeCache : config.storage().mergeCaches()) {
            cache.load(jobDir.resolve(mergeCache));
        }

        for (var seed : config.seeds()) {
            scope.addSeed(seed);
        }
        if (resume == ResumeMode.CONTINUE) {
            checkpointManager.load().ifPresent(checkpoint -> {
                for (var seed : checkpoint.seeds()) {
                    scope.addSeed(seed);
                }
                checkpointManager.restore(checkpoint);
            });
        }

        for (SeedConfig seed : config.seeds()) {
            if (!frontier.enqueue(seed.url(), 0)) {
                log.info("Not adding seed {}: already crawled or queued", seed.url());
            }
        }
        log.info("Cache has {}", cache.stats());
    }

    /**
     * Stops the crawl. Safe to call from any thread, including a shutdown hook.
     */
    public void cancel() {
        cancellation.cancel();
    }

    @Override
    public void close() {
        cancel();
        startStopLock.lock();
        try {
            checkpointManager.close();
            dispatcher.close();
        } finally {
            startStopLock.unlock();
        }
    }
}
