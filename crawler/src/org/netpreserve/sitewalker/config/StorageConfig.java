package org.netpreserve.sitewalker.config;

import java.util.List;

/**
 * Storage configuration.
 *
 * @param cacheFile   dedup cache filename, relative to the job directory
 * @param mergeCaches cache files from other runs merged in at startup
 */
public record StorageConfig(
        String cacheFile,
        List<String> mergeCaches
) {
    public StorageConfig {
        if (cacheFile == null) cacheFile = "url_cache.json";
        if (mergeCaches == null) mergeCaches = List.of();
    }
}
