package org.netpreserve.sitewalker.fetch;

import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingContentSink implements ContentSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingContentSink.class);

    @Override
    public void accept(FetchResult result) {
        String title = result.isHtml() ? Jsoup.parse(result.content()).title() : "";
        log.atInfo().addKeyValue("url", result.url())
                .addKeyValue("title", title)
                .addKeyValue("size", result.content().length())
                .addKeyValue("links", result.links().size())
                .log("Page content");
    }
}
