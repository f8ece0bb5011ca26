package org.pragmatica.meson.error;

import org.pragmatica.meson.tree.SourceLocation;

import java.util.List;

/**
 * Destination for non-fatal diagnostics: deprecated syntax, reserved identifiers, duplicate or
 * misordered arguments. Reporting a warning never aborts parsing.
 */
@FunctionalInterface
public interface WarningSink {

    void warn(String message, String filename, SourceLocation location);

    /**
     * Sink that logs through SLF4J.
     */
    static WarningSink logging() {
        return LoggingWarningSink.INSTANCE;
    }

    /**
     * Sink that stores warnings as diagnostics in the given list.
     */
    static WarningSink collecting(List<Diagnostic> target) {
        return (message, filename, location) -> target.add(Diagnostic.warning(message, filename, location));
    }
}
