package org.pragmatica.meson.error;

import org.pragmatica.meson.tree.SourceLocation;

/**
 * Fatal error raised while lexing or parsing. Parsing never continues after one of these.
 *
 * <p>The exception message always contains the offending source line and a caret under the
 * offending column, so the error can be located without further tooling.
 */
public abstract sealed class SyntaxError extends RuntimeException
    permits LexError, ParseError, BlockParseError, UnicodeDecodeError {

    private final String reason;
    private final String filename;
    private final String sourceLine;
    private final int line;
    private final int column;

    protected SyntaxError(String message, String reason, String filename, String sourceLine, int line, int column) {
        super(message);
        this.reason = reason;
        this.filename = filename;
        this.sourceLine = sourceLine;
        this.line = line;
        this.column = column;
    }

    /**
     * Message followed by the source line and a caret under the offending column.
     */
    protected static String caretMessage(String reason, String sourceLine, int column) {
        return reason + "\n" + sourceLine + "\n" + caret(column);
    }

    protected static String caret(int column) {
        return " ".repeat(Math.max(0, column)) + "^";
    }

    /**
     * The error text without the source excerpt.
     */
    public String reason() {
        return reason;
    }

    public String filename() {
        return filename;
    }

    public String sourceLine() {
        return sourceLine;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column);
    }

    /**
     * Labelled diagnostic for rendering with {@link Diagnostic#format(String)}.
     */
    public Diagnostic toDiagnostic() {
        return Diagnostic.error(reason, filename, location())
                         .withLabel("here");
    }

    /**
     * Single-line summary in {@code file:line:column: error: reason} form.
     */
    public String summary() {
        return filename + ":" + line + ":" + column + ": error: " + reason.lines()
                                                                             .findFirst()
                                                                             .orElse(reason);
    }
}
