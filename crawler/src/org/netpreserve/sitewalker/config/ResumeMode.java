package org.netpreserve.sitewalker.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What to do with state left behind by a previous run.
 */
public enum ResumeMode {
    /**
     * Start a new frontier from the seeds. The dedup cache is still honoured.
     */
    DISABLED,
    /**
     * Restore the last checkpoint if its configuration fingerprint matches.
     */
    CONTINUE,
    /**
     * Delete the checkpoint and the dedup cache before starting.
     */
    CLEAR;

    @JsonCreator
    public static ResumeMode fromString(String value) {
        return value == null ? null : valueOf(value.toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
