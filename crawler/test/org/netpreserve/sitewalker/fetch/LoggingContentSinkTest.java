package org.netpreserve.sitewalker.fetch;

import org.junit.jupiter.api.Test;
import org.netpreserve.sitewalker.util.Url;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class LoggingContentSinkTest {
    @Test
    void testAcceptsHtmlAndOtherContent() {
        var sink = new LoggingContentSink();
        Url url = new Url("https://example.com/");
        assertDoesNotThrow(() -> sink.accept(FetchResult.ok(url, "<title>Hi</title>", List.of(url))));
        assertDoesNotThrow(() -> sink.accept(new FetchResult(url, 200, "image/png", null, null, null)));
    }
}
