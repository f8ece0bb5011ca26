package org.pragmatica.meson.lexer;

/**
 * Value carried by a token. The variant is fixed by the token kind.
 */
public sealed interface TokenValue {

    Type type();

    enum Type {
        NONE,
        BOOL,
        INT,
        TEXT
    }

    record None() implements TokenValue {
        @Override
        public Type type() {
            return Type.NONE;
        }
    }

    record Bool(boolean value) implements TokenValue {
        @Override
        public Type type() {
            return Type.BOOL;
        }
    }

    record Int(long value) implements TokenValue {
        @Override
        public Type type() {
            return Type.INT;
        }
    }

    record Text(String value) implements TokenValue {
        @Override
        public Type type() {
            return Type.TEXT;
        }
    }

    TokenValue NONE = new None();

    static TokenValue bool(boolean value) {
        return new Bool(value);
    }

    static TokenValue integer(long value) {
        return new Int(value);
    }

    static TokenValue text(String value) {
        return new Text(value);
    }
}
