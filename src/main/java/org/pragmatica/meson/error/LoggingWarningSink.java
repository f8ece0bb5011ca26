package org.pragmatica.meson.error;

import org.pragmatica.meson.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default warning sink: one WARN record per warning.
 */
final class LoggingWarningSink implements WarningSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingWarningSink.class);

    static final LoggingWarningSink INSTANCE = new LoggingWarningSink();

    private LoggingWarningSink() {}

    @Override
    public void warn(String message, String filename, SourceLocation location) {
        log.warn("{}", Diagnostic.warning(message, filename, location)
                                 .formatSimple());
    }
}
