package org.netpreserve.sitewalker.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationDeserializerTest {
    @Test
    public void testParse() {
        assertEquals(Duration.ofSeconds(2), DurationDeserializer.parse("2s"));
        assertEquals(Duration.ofMillis(250), DurationDeserializer.parse("250ms"));
        assertEquals(Duration.ofSeconds(90), DurationDeserializer.parse("1m30s"));
        assertEquals(Duration.ofHours(1), DurationDeserializer.parse("PT1H"));
        assertEquals(Duration.ofDays(1), DurationDeserializer.parse("P1D"));
    }
}
