package org.netpreserve.sitewalker;

import org.netpreserve.sitewalker.fetch.FetchException;
import org.netpreserve.sitewalker.fetch.FetchOptions;
import org.netpreserve.sitewalker.fetch.FetchResult;
import org.netpreserve.sitewalker.fetch.Fetcher;
import org.netpreserve.sitewalker.util.Url;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory site. Pages return 200 with their links, unknown URLs 404. Individual URLs can be scripted to return a
 * sequence of statuses or exceptions before falling back to the page.
 */
class ScriptedFetcher implements Fetcher {
    private final Map<String, List<Url>> pages = new ConcurrentHashMap<>();
    private final Map<String, Deque<Object>> scripts = new ConcurrentHashMap<>();
    private final List<Object> defaultScript = new CopyOnWriteArrayList<>();
    final List<Fetch> fetches = new CopyOnWriteArrayList<>();
    private volatile Consumer<Url> beforeFetch = url -> {
    };

    record Fetch(Url url, long nanoTime) {
    }

    ScriptedFetcher page(String url, String... links) {
        pages.put(url, Arrays.stream(links).map(Url::new).toList());
        return this;
    }

    /**
     * Responses for the next fetches of a URL: an Integer status, a FetchResult or an Exception to throw.
     */
    ScriptedFetcher script(String url, Object... outcomes) {
        scripts.computeIfAbsent(url, u -> new ArrayDeque<>()).addAll(Arrays.asList(outcomes));
        return this;
    }

    /**
     * Outcome for every fetch of a URL that isn't a page or otherwise scripted.
     */
    ScriptedFetcher otherwise(Object outcome) {
        defaultScript.clear();
        defaultScript.add(outcome);
        return this;
    }

    ScriptedFetcher beforeFetch(Consumer<Url> hook) {
        this.beforeFetch = hook;
        return this;
    }

    @Override
    public FetchResult fetch(Url url, FetchOptions options) throws FetchException, IOException, InterruptedException {
        fetches.add(new Fetch(url, System.nanoTime()));
        beforeFetch.accept(url);
        Object outcome = null;
        Deque<Object> script = scripts.get(url.toString());
        if (script != null) {
            synchronized (script) {
                outcome = script.pollFirst();
            }
        }
        if (outcome == null) {
            List<Url> links = pages.get(url.toString());
            if (links != null) return FetchResult.ok(url, "<html><title>" + url + "</title></html>", links);
            outcome = defaultScript.isEmpty() ? 404 : defaultScript.get(0);
        }
        if (outcome instanceof Integer status) return FetchResult.status(url, status);
        if (outcome instanceof FetchResult result) return result;
        if (outcome instanceof FetchException e) throw e;
        if (outcome instanceof IOException e) throw e;
        if (outcome instanceof InterruptedException e) throw e;
        if (outcome instanceof RuntimeException e) throw e;
        throw new IllegalArgumentException("bad script outcome " + outcome);
    }

    List<Url> fetchedUrls() {
        return fetches.stream().map(Fetch::url).toList();
    }

    int count(String url) {
        return (int) fetches.stream().filter(f -> f.url().toString().equals(url)).count();
    }
}
