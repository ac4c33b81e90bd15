package org.netpreserve.sitewalker;

import org.netpreserve.sitewalker.config.ConfigException;
import org.netpreserve.sitewalker.config.ConfigLoader;
import org.netpreserve.sitewalker.config.JobConfig;
import org.netpreserve.sitewalker.config.ResumeMode;
import org.netpreserve.sitewalker.config.SeedConfig;
import org.netpreserve.sitewalker.fetch.HttpFetcher;
import org.netpreserve.sitewalker.fetch.LoggingContentSink;
import org.netpreserve.sitewalker.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class Sitewalker {
    private static final Logger log = LoggerFactory.getLogger(Sitewalker.class);

    public static void main(String[] args) throws Exception {
        Path jobDir = Path.of("data");
        var seeds = new ArrayList<SeedConfig>();
        var mergeCaches = new ArrayList<String>();
        var overrides = new LinkedHashMap<String, Object>();
        boolean dumpConfig = false;
        ResumeMode resume = null;

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--dump-config" -> dumpConfig = true;
                    case "--job-dir", "-j" -> jobDir = Path.of(args[++i]);
                    case "--resume", "-r" -> resume = ResumeMode.fromString(args[++i]);
                    case "--depth", "-d" -> overrides.put("crawl.depth", Integer.parseInt(args[++i]));
                    case "--limit", "-l" -> overrides.put("crawl.limits.pages", Long.parseLong(args[++i]));
                    case "--delay" -> overrides.put("rateLimit.delay", args[++i]);
                    case "--concurrency", "-c" -> overrides.put("crawl.concurrency", Integer.parseInt(args[++i]));
                    case "--merge-cache" -> mergeCaches.add(args[++i]);
                    case "--help", "-h" -> {
                        System.out.println("Usage: sitewalker [options] URL...");
                        System.out.println("Options:");
                        System.out.println("  -c, --concurrency N      Number of pages to fetch at once");
                        System.out.println("  -d, --depth N            Maximum link depth from the seeds");
                        System.out.println("      --delay DURATION     Minimum delay between requests to a host (e.g. 1s)");
                        System.out.println("      --dump-config        Print the effective configuration and exit");
                        System.out.println("  -h, --help");
                        System.out.println("  -j, --job-dir DIR        Directory for config, cache and checkpoint");
                        System.out.println("  -l, --limit N            Maximum number of pages, 0 for no limit");
                        System.out.println("      --merge-cache FILE   Merge another run's URL cache before starting");
                        System.out.println("  -r, --resume MODE        disabled, continue or clear");
                        System.exit(0);
                    }
                    default -> {
                        if (args[i].startsWith("-")) {
                            System.err.println("Unknown option: " + args[i]);
                            System.exit(1);
                        }
                        seeds.add(new SeedConfig(new Url(withScheme(args[i])), null));
                    }
                }
            }
        } catch (ArrayIndexOutOfBoundsException e) {
            System.err.println("Missing value for " + args[args.length - 1]);
            System.exit(1);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid argument: " + e.getMessage());
            System.exit(1);
        }

        ConfigLoader loader;
        JobConfig config;
        try {
            loader = new ConfigLoader();
            config = loadConfig(loader, jobDir, overrides, seeds, mergeCaches, resume);
        } catch (ConfigException e) {
            log.error("{}", e.getMessage());
            System.exit(1);
            return;
        }
        if (dumpConfig) {
            System.out.println(loader.dump(config));
            System.exit(0);
        }
        if (config.seeds().isEmpty() && config.resume() != ResumeMode.CONTINUE) {
            System.err.println("No seed URLs given");
            System.exit(1);
        }

        Files.createDirectories(jobDir);
        var crawl = new Crawl(jobDir, config, new HttpFetcher(), new LoggingContentSink());
        var finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            crawl.cancel();
            try {
                if (!finished.await(60, TimeUnit.SECONDS)) {
                    System.err.println("Timed out waiting for the final checkpoint");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook"));

        int exitCode;
        try {
            CrawlReport report = crawl.run();
            exitCode = report.outcome().exitCode();
        } catch (SitewalkerException e) {
            log.error("Crawl aborted", e);
            exitCode = 1;
        } finally {
            crawl.close();
            finished.countDown();
        }
        System.exit(exitCode);
    }

    /**
     * Command-line options override the job's config.yaml, which overrides the bundled defaults.
     */
    static JobConfig loadConfig(ConfigLoader loader, Path jobDir, Map<String, Object> overrides,
                                List<SeedConfig> seeds, List<String> mergeCaches, ResumeMode resume)
            throws ConfigException {
        loader.mergeFile(jobDir.resolve("config.yaml"));
        overrides.forEach(loader::set);
        if (!mergeCaches.isEmpty()) {
            loader.set("storage.mergeCaches", mergeCaches);
        }
        JobConfig config = loader.build();
        if (!seeds.isEmpty()) {
            var allSeeds = new ArrayList<>(config.seeds());
            allSeeds.addAll(seeds);
            config = config.withSeeds(allSeeds);
        }
        if (resume != null) {
            config = config.withResume(resume);
        }
        return config.validate();
    }

    static String withScheme(String url) {
        if (url.contains("://")) return url;
        return "https://" + url;
    }
}
