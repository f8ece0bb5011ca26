package org.pragmatica.meson.lexer;

import org.pragmatica.meson.tree.ByteSpan;
import org.pragmatica.meson.tree.SourceLocation;

/**
 * A comment collected by the lexer, including its leading {@code #}.
 */
public record Comment(int lineStart, int line, int column, ByteSpan span, String text) {

    public SourceLocation location() {
        return SourceLocation.at(line, column);
    }
}
