package org.netpreserve.sitewalker;

import com.fasterxml.jackson.core.JacksonException;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.config.CheckpointConfig;
import org.netpreserve.sitewalker.config.SeedConfig;
import org.netpreserve.sitewalker.util.AtomicFiles;
import org.netpreserve.sitewalker.util.Json;
import org.netpreserve.sitewalker.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically writes the frontier, cache and rate limiter state so an interrupted crawl can be resumed.
 * <p>
 * A checkpoint is taken every {@link CheckpointConfig#interval()} processed URLs and at least every
 * {@link CheckpointConfig#period()}. Write failures are logged and the crawl carries on in memory, unless
 * checkpoints are mandatory.
 */
public class CheckpointManager implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);
    private final Path file;
    private final CheckpointConfig config;
    private final String fingerprint;
    private final Frontier frontier;
    private final DedupCache cache;
    private final RateLimiter rateLimiter;
    private final Supplier<List<SeedConfig>> seeds;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private long lastCheckpointCount;
    private volatile CheckpointException scheduledFailure;

    public CheckpointManager(Path file, CheckpointConfig config, String fingerprint, Frontier frontier,
                             DedupCache cache, RateLimiter rateLimiter, Supplier<List<SeedConfig>> seeds, Clock clock) {
        this.file = file;
        this.config = config;
        this.fingerprint = fingerprint;
        this.frontier = frontier;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.seeds = seeds;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("checkpoint"));
    }

    public Path file() {
        return file;
    }

    /**
     * Starts the periodic checkpoint timer, if a period is configured.
     */
    public void start() {
        Duration period = config.period();
        if (period == null || period.isZero() || period.isNegative()) return;
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                checkpoint();
            } catch (CheckpointException e) {
                scheduledFailure = e;
            } catch (RuntimeException e) {
                log.error("Periodic checkpoint failed", e);
            }
        }, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Called after each processed URL. Takes a checkpoint when the interval has been reached.
     *
     * @throws CheckpointException if a mandatory checkpoint couldn't be written, here or by the timer
     */
    public void onProgress(long processed) throws CheckpointException {
        throwIfFailed();
        if (config.interval() <= 0) return;
        synchronized (this) {
            if (processed - lastCheckpointCount < config.interval()) return;
        }
        checkpoint();
    }

    public void throwIfFailed() throws CheckpointException {
        CheckpointException failure = scheduledFailure;
        if (failure != null) throw failure;
    }

    /**
     * Writes the cache and then the checkpoint referring to it.
     *
     * @return the checkpoint, or null if it couldn't be written and checkpoints aren't mandatory
     */
    public synchronized @Nullable Checkpoint checkpoint() throws CheckpointException {
        var snapshot = frontier.snapshot();
        Path cacheFile = cache.file();
        var checkpoint = new Checkpoint(fingerprint, clock.instant(), snapshot.processed(),
                cacheFile == null ? null : cacheFile.getFileName().toString(),
                snapshot.tasks(), rateLimiter.snapshot(), seeds.get());
        try {
            cache.persist(snapshot.cache());
            AtomicFiles.writeJson(file, Json.MAPPER.writerWithDefaultPrettyPrinter(), checkpoint);
        } catch (IOException e) {
            if (config.mandatory()) {
                throw new CheckpointException("Failed to write checkpoint " + file, e);
            }
            log.warn("Failed to write checkpoint {}, continuing in memory", file, e);
            return null;
        }
        lastCheckpointCount = snapshot.processed();
        log.atInfo().addKeyValue("processed", snapshot.processed()).addKeyValue("pending", snapshot.tasks().size())
                .log("Checkpoint written");
        return checkpoint;
    }

    /**
     * Reads the checkpoint file. A missing, corrupt or mismatched checkpoint is treated as absent.
     */
    public Optional<Checkpoint> load() {
        Checkpoint checkpoint;
        try {
            checkpoint = Json.MAPPER.readValue(Files.readAllBytes(file), Checkpoint.class);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (JacksonException e) {
            log.warn("Ignoring corrupt checkpoint {}: {}", file, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unable to read checkpoint {}", file, e);
            return Optional.empty();
        }
        if (checkpoint == null) return Optional.empty();
        if (!fingerprint.equals(checkpoint.configFingerprint())) {
            log.info("Ignoring checkpoint {} taken with a different configuration", file);
            return Optional.empty();
        }
        return Optional.of(checkpoint);
    }

    /**
     * Loads the state of a checkpoint into the rate limiter and frontier. The cache must already be loaded.
     */
    public void restore(Checkpoint checkpoint) {
        rateLimiter.restore(checkpoint.domains());
        frontier.restore(checkpoint.frontier(), checkpoint.processedCount());
        synchronized (this) {
            lastCheckpointCount = frontier.processed();
        }
        log.info("Resumed from checkpoint of {} with {} processed", checkpoint.created(), checkpoint.processedCount());
    }

    /**
     * Deletes the checkpoint and the cache.
     */
    public void clear() throws IOException {
        Files.deleteIfExists(file);
        cache.delete();
        log.info("Cleared checkpoint {} and cache {}", file, cache.file());
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
