package org.netpreserve.sitewalker;

public abstract class SitewalkerException extends Exception {
    public SitewalkerException(String message) {
        super(message);
    }

    public SitewalkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
