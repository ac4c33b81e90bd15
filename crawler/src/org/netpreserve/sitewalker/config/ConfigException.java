package org.netpreserve.sitewalker.config;

import org.netpreserve.sitewalker.SitewalkerException;

/**
 * The job configuration is unreadable or invalid. Fatal at startup.
 */
public class ConfigException extends SitewalkerException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
