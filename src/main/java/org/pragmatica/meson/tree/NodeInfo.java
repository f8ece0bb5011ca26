package org.pragmatica.meson.tree;

import org.pragmatica.meson.lexer.Token;

/**
 * Source attribution shared by every AST node.
 *
 * @param filename originating file, used for diagnostics only
 * @param start    position of the first character of the node
 * @param end      position just past the last token of the node; equals {@code start} when unknown
 * @param span     char offset range covered by the node
 */
public record NodeInfo(String filename, SourceLocation start, SourceLocation end, ByteSpan span) {

    public static NodeInfo of(String filename, SourceLocation start, SourceLocation end, ByteSpan span) {
        return new NodeInfo(filename, start, end, span);
    }

    /**
     * Node info without a distinct end position.
     */
    public static NodeInfo at(String filename, SourceLocation start, ByteSpan span) {
        return new NodeInfo(filename, start, start, span);
    }

    /**
     * Node info covering exactly one token.
     */
    public static NodeInfo of(Token token) {
        return new NodeInfo(token.filename(), token.location(), token.endLocation(), token.span());
    }

    public int line() {
        return start.line();
    }

    public int column() {
        return start.column();
    }
}
