package org.pragmatica.meson.tree;

/**
 * A position in source text: 1-based line, 0-based column.
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation START = new SourceLocation(1, 0);

    public static SourceLocation at(int line, int column) {
        return new SourceLocation(line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
