package org.netpreserve.sitewalker;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitewalker.fetch.FetchException;
import org.netpreserve.sitewalker.fetch.FetchResult;

import java.io.IOException;
import java.net.URISyntaxException;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Decides what happens to a URL after a fetch attempt.
 */
public class ErrorClassifier {
    public enum Verdict {
        /** The page was fetched and its links may be followed. */
        SUCCESS,
        /** Transient failure, try again later with the task's own retry budget. */
        RETRY,
        /** The server asked us to slow down. Back off the host and try again without using a retry. */
        RATE_LIMITED,
        /** Never going to work, record and move on. */
        PERMANENT
    }

    public record Classification(Verdict verdict, int status, @Nullable String reason) {
        public boolean countsAsError() {
            return verdict == Verdict.RETRY || verdict == Verdict.RATE_LIMITED;
        }
    }

    private final Set<Integer> rateLimitStatuses;

    public ErrorClassifier(Set<Integer> rateLimitStatuses) {
        this.rateLimitStatuses = Set.copyOf(rateLimitStatuses);
    }

    public Classification classify(FetchResult result) {
        int status = result.status();
        if (status <= 0) {
            return new Classification(Verdict.RETRY, status, result.error() == null ? "no response" : result.error());
        }
        if (rateLimitStatuses.contains(status)) {
            return new Classification(Verdict.RATE_LIMITED, status, "rate limited");
        }
        if (status >= 300 && status < 400 && result.links().isEmpty()) {
            return new Classification(Verdict.PERMANENT, status, "unfollowed redirect");
        }
        if (status < 400) {
            return new Classification(Verdict.SUCCESS, status, null);
        }
        if (status == 408 || status >= 500) {
            return new Classification(Verdict.RETRY, status, "server error");
        }
        return new Classification(Verdict.PERMANENT, status, "client error");
    }

    public Classification classify(Throwable error) {
        if (error instanceof FetchException fetchException && fetchException.isPermanent()) {
            return new Classification(Verdict.PERMANENT, 0, error.getMessage());
        }
        if (error instanceof URISyntaxException || error instanceof IllegalArgumentException) {
            return new Classification(Verdict.PERMANENT, 0, error.getMessage());
        }
        if (error instanceof IOException || error instanceof TimeoutException || error instanceof FetchException) {
            return new Classification(Verdict.RETRY, 0, error.toString());
        }
        return new Classification(Verdict.RETRY, 0, "unexpected " + error);
    }
}
