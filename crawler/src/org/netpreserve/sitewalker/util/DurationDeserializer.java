package org.netpreserve.sitewalker.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads a duration either as a number of milliseconds or as a short string such as "2s", "1m30s" or "250ms".
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim();
        try {
            return parse(text);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw deserializationContext.weirdStringException(text, Duration.class, "expected a duration like 2s or 1m30s");
        }
    }

    public static Duration parse(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.startsWith("P")) return Duration.parse(upper);
        if (upper.endsWith("MS")) {
            return Duration.ofMillis(Long.parseLong(upper.substring(0, upper.length() - 2).trim()));
        }
        return Duration.parse("PT" + upper);
    }
}
