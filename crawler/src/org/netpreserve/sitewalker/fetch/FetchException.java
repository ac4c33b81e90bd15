package org.netpreserve.sitewalker.fetch;

import org.netpreserve.sitewalker.SitewalkerException;
import org.netpreserve.sitewalker.util.Url;

/**
 * A fetch failed without producing a response. Permanent failures (policy refusal, unsupported URL) are never
 * retried; everything else is treated as transient.
 */
public class FetchException extends SitewalkerException {
    protected final Url url;
    private final boolean permanent;

    public FetchException(Url url, String message, boolean permanent) {
        super(message + " for " + url);
        this.url = url;
        this.permanent = permanent;
    }

    public FetchException(Url url, String message, Throwable cause) {
        super(message + " for " + url, cause);
        this.url = url;
        this.permanent = false;
    }

    public Url url() {
        return url;
    }

    public boolean isPermanent() {
        return permanent;
    }
}
