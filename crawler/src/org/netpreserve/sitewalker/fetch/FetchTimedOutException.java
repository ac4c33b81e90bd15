package org.netpreserve.sitewalker.fetch;

import org.netpreserve.sitewalker.util.Url;

public class FetchTimedOutException extends FetchException {
    public FetchTimedOutException(Url url, String message) {
        super(url, message, false);
    }
}
