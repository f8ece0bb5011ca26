package org.pragmatica.meson.error;

/**
 * Unexpected token or malformed construct.
 */
public final class ParseError extends SyntaxError {

    public ParseError(String reason, String filename, String sourceLine, int line, int column) {
        super(caretMessage(reason, sourceLine, column), reason, filename, sourceLine, line, column);
    }
}
