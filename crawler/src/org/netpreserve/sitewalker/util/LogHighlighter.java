package org.netpreserve.sitewalker.util;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.color.ForegroundCompositeConverterBase;

import static ch.qos.logback.classic.Level.*;
import static ch.qos.logback.core.pattern.color.ANSIConstants.*;

/**
 * Level colours for the console appender, referenced from logback.xml. Trace output is dimmed so per-URL
 * detail doesn't drown out the crawl progress.
 */
public class LogHighlighter extends ForegroundCompositeConverterBase<ILoggingEvent> {
    @Override
    protected String getForegroundColorCode(ILoggingEvent event) {
        return switch (event.getLevel().toInt()) {
            case ERROR_INT -> BOLD + RED_FG;
            case WARN_INT -> YELLOW_FG;
            case INFO_INT -> CYAN_FG;
            case DEBUG_INT -> BLUE_FG;
            default -> BLACK_FG;
        };
    }
}
