package org.pragmatica.meson.lexer;

import org.pragmatica.meson.tree.ByteSpan;
import org.pragmatica.meson.tree.SourceLocation;

/**
 * A lexed token.
 *
 * @param kind      token kind
 * @param filename  originating file
 * @param lineStart offset of the first character of the line the token starts on
 * @param line      1-based line of the token start
 * @param column    0-based column of the token start
 * @param endLine   line of the token end (differs from {@code line} for multi-line literals)
 * @param endColumn column just past the last character of the token
 * @param span      char offset range of the token
 * @param value     value matching {@link TokenKind#valueType()}
 */
public record Token(
    TokenKind kind,
    String filename,
    int lineStart,
    int line,
    int column,
    int endLine,
    int endColumn,
    ByteSpan span,
    TokenValue value) {

    public Token {
        if (value.type() != kind.valueType()) {
            throw new IllegalArgumentException(
                "Token " + kind.display() + " must carry " + kind.valueType() + " value, got " + value.type());
        }
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column);
    }

    public SourceLocation endLocation() {
        return SourceLocation.at(endLine, endColumn);
    }

    public String text() {
        if (value instanceof TokenValue.Text text) {
            return text.value();
        }
        throw new IllegalStateException("Token " + kind.display() + " carries no text");
    }

    public long intValue() {
        if (value instanceof TokenValue.Int number) {
            return number.value();
        }
        throw new IllegalStateException("Token " + kind.display() + " carries no integer");
    }

    public boolean boolValue() {
        if (value instanceof TokenValue.Bool bool) {
            return bool.value();
        }
        throw new IllegalStateException("Token " + kind.display() + " carries no boolean");
    }

    @Override
    public String toString() {
        return kind.display() + "@" + line + ":" + column;
    }
}
