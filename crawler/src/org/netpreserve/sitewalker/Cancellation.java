package org.netpreserve.sitewalker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Request to stop a crawl, e.g. from a shutdown hook. Listeners run once, on the cancelling thread.
 */
public class Cancellation {
    private static final Logger log = LoggerFactory.getLogger(Cancellation.class);
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        for (var listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Cancellation listener failed", e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a listener, running it immediately if cancellation already happened.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }
}
