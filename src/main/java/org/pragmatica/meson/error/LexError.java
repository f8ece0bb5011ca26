package org.pragmatica.meson.error;

/**
 * Input that matches no token rule, or a token rule that rejects its match outright.
 */
public final class LexError extends SyntaxError {

    public LexError(String reason, String filename, String sourceLine, int line, int column) {
        super(caretMessage(reason, sourceLine, column), reason, filename, sourceLine, line, column);
    }
}
