package org.pragmatica.meson.lexer;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Token kinds of the Meson build-definition language.
 */
public enum TokenKind {
    // Literals
    ID("id", TokenValue.Type.TEXT),
    NUMBER("number", TokenValue.Type.INT),
    STRING("string", TokenValue.Type.TEXT),
    FSTRING("fstring", TokenValue.Type.TEXT),
    MULTILINE_STRING("multiline_string", TokenValue.Type.TEXT),
    MULTILINE_FSTRING("multiline_fstring", TokenValue.Type.TEXT),

    // Keywords
    TRUE("true", TokenValue.Type.BOOL),
    FALSE("false", TokenValue.Type.BOOL),
    IF("if"),
    ELSE("else"),
    ELIF("elif"),
    ENDIF("endif"),
    AND("and"),
    OR("or"),
    NOT("not"),
    FOREACH("foreach"),
    ENDFOREACH("endforeach"),
    IN("in"),
    CONTINUE("continue"),
    BREAK("break"),

    // Punctuation
    LPAREN("lparen"),
    RPAREN("rparen"),
    LBRACKET("lbracket"),
    RBRACKET("rbracket"),
    LCURL("lcurl"),
    RCURL("rcurl"),
    COMMA("comma"),
    DOT("dot"),
    COLON("colon"),
    QUESTION_MARK("questionmark"),

    // Operators
    PLUS_ASSIGN("plusassign"),
    ASSIGN("assign"),
    PLUS("plus"),
    DASH("dash"),
    STAR("star"),
    PERCENT("percent"),
    FSLASH("fslash"),
    EQUAL("equal"),
    NOT_EQUAL("nequal"),
    LT("lt"),
    LE("le"),
    GT("gt"),
    GE("ge"),

    EOL("eol"),
    EOF("eof");

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
        Map.entry("true", TRUE),
        Map.entry("false", FALSE),
        Map.entry("if", IF),
        Map.entry("else", ELSE),
        Map.entry("elif", ELIF),
        Map.entry("endif", ENDIF),
        Map.entry("and", AND),
        Map.entry("or", OR),
        Map.entry("not", NOT),
        Map.entry("foreach", FOREACH),
        Map.entry("endforeach", ENDFOREACH),
        Map.entry("in", IN),
        Map.entry("continue", CONTINUE),
        Map.entry("break", BREAK));

    private static final Set<String> FUTURE_KEYWORDS = Set.of("return");

    private final String display;
    private final TokenValue.Type valueType;

    TokenKind(String display) {
        this(display, TokenValue.Type.NONE);
    }

    TokenKind(String display, TokenValue.Type valueType) {
        this.display = display;
        this.valueType = valueType;
    }

    /**
     * Name used in diagnostics, e.g. "Expecting rparen got eol.".
     */
    public String display() {
        return display;
    }

    public TokenValue.Type valueType() {
        return valueType;
    }

    public static Optional<TokenKind> keyword(String identifier) {
        return Optional.ofNullable(KEYWORDS.get(identifier));
    }

    public static boolean isFutureKeyword(String identifier) {
        return FUTURE_KEYWORDS.contains(identifier);
    }
}
