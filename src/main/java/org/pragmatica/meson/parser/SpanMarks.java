package org.pragmatica.meson.parser;

import org.pragmatica.meson.lexer.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of tokens at which not yet finished composite nodes started. Every mark must be closed
 * in reverse order of opening.
 */
final class SpanMarks {
    private final Deque<Token> marks = new ArrayDeque<>();

    Token open(Token token) {
        marks.push(token);
        return token;
    }

    Token top() {
        var top = marks.peek();
        if (top == null) {
            throw new IllegalStateException("No open span mark");
        }
        return top;
    }

    /**
     * Remove the most recent mark, which must be the given one.
     */
    void close(Token expected) {
        var top = marks.poll();
        if (top != expected) {
            throw new IllegalStateException("Unbalanced span marks: closing " + expected + " but top is " + top);
        }
    }

    boolean isEmpty() {
        return marks.isEmpty();
    }

    int depth() {
        return marks.size();
    }
}
