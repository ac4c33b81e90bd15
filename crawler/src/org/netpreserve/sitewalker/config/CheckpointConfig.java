package org.netpreserve.sitewalker.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.util.DurationDeserializer;

import java.time.Duration;

/**
 * When and where crawl state is snapshotted.
 *
 * @param file      checkpoint filename, relative to the job directory
 * @param interval  checkpoint after this many processed pages (0 disables)
 * @param period    checkpoint at least this often (null disables)
 * @param mandatory abort the crawl if a checkpoint can't be written
 */
public record CheckpointConfig(
        String file,
        int interval,
        @JsonDeserialize(using = DurationDeserializer.class)
        @Nullable Duration period,
        boolean mandatory) {

    public CheckpointConfig {
        if (file == null) file = "checkpoint.json";
    }
}
