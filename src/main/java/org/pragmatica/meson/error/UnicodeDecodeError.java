package org.pragmatica.meson.error;

/**
 * Malformed escape sequence inside a string literal.
 */
public final class UnicodeDecodeError extends SyntaxError {
    private final String escape;

    public UnicodeDecodeError(String escape,
                              String literal,
                              String filename,
                              String sourceLine,
                              int line,
                              int column) {
        super(caretMessage(reasonFor(escape, literal), sourceLine, column),
              reasonFor(escape, literal),
              filename,
              sourceLine,
              line,
              column);
        this.escape = escape;
    }

    private static String reasonFor(String escape, String literal) {
        return "Failed to parse escape sequence: '" + escape + "' in string:\n  " + literal;
    }

    /**
     * The offending escape sequence, including its backslash.
     */
    public String escape() {
        return escape;
    }
}
