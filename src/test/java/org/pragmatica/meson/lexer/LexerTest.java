package org.pragmatica.meson.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pragmatica.meson.error.Diagnostic;
import org.pragmatica.meson.error.LexError;
import org.pragmatica.meson.error.UnicodeDecodeError;
import org.pragmatica.meson.error.WarningSink;
import org.pragmatica.meson.tree.ByteSpan;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.meson.lexer.TokenKind.*;

class LexerTest {
    private final List<Diagnostic> warnings = new ArrayList<>();

    private List<Token> tokenize(String code) {
        return Lexer.tokenize(code, "meson.build", WarningSink.collecting(warnings));
    }

    private List<TokenKind> kinds(String code) {
        return tokenize(code).stream()
                             .map(Token::kind)
                             .toList();
    }

    // === Token kinds ===

    @Test
    void tokenize_assignment_producesIdAssignNumberEol() {
        assertThat(kinds("x = 1\n")).containsExactly(ID, ASSIGN, NUMBER, EOL, EOF);
    }

    @Test
    void tokenize_keywords_arePromotedFromIdentifiers() {
        assertThat(kinds("if true and not false or x in y")).containsExactly(
            IF, TRUE, AND, NOT, FALSE, OR, ID, IN, ID, EOF);
        assertThat(kinds("foreach elif else endif endforeach continue break")).containsExactly(
            FOREACH, ELIF, ELSE, ENDIF, ENDFOREACH, CONTINUE, BREAK, EOF);
    }

    @Test
    void tokenize_operators_preferLongestForm() {
        assertThat(kinds("a += b == c != d <= e >= f < g > h")).containsExactly(
            ID, PLUS_ASSIGN, ID, EQUAL, ID, NOT_EQUAL, ID, LE, ID, GE, ID, LT, ID, GT, ID, EOF);
        assertThat(kinds("a ? b : c - d * e / f % g")).containsExactly(
            ID, QUESTION_MARK, ID, COLON, ID, DASH, ID, STAR, ID, FSLASH, ID, PERCENT, ID, EOF);
    }

    @Test
    void tokenize_nonAsciiSource_spansCountChars() {
        var tokens = tokenize("x = '\u00e9'\ny");

        assertThat(tokens.get(4)
                         .kind()).isEqualTo(ID);
        assertThat(tokens.get(4)
                         .span()).isEqualTo(ByteSpan.of(8, 9));
    }

    @Test
    void tokenize_newlinesInsideBrackets_areSuppressed() {
        assertThat(kinds("foo(a,\n  [b,\n  {c: d}])\n")).containsExactly(
            ID, LPAREN, ID, COMMA, LBRACKET, ID, COMMA, LCURL, ID, COLON, ID, RCURL, RBRACKET, RPAREN, EOL, EOF);
    }

    @Test
    void tokenize_lineContinuation_joinsLines() {
        assertThat(kinds("x = 1 + \\\n  2\n")).containsExactly(ID, ASSIGN, NUMBER, PLUS, NUMBER, EOL, EOF);
    }

    // === Values ===

    @ParameterizedTest
    @CsvSource({
        "0x1F, 31",
        "0b101, 5",
        "0o17, 15",
        "0, 0",
        "42, 42"
    })
    void tokenize_numberLiterals_decodeRadixPrefix(String literal, long expected) {
        var token = tokenize(literal).get(0);

        assertThat(token.kind()).isEqualTo(NUMBER);
        assertThat(token.intValue()).isEqualTo(expected);
    }

    @Test
    void tokenize_numberOverflow_raisesLexError() {
        assertThatThrownBy(() -> tokenize("x = 99999999999999999999"))
            .isInstanceOf(LexError.class)
            .hasMessageContaining("Number literal out of range");
    }

    @Test
    void tokenize_stringEscapes_areDecoded() {
        var token = tokenize("'it\\'s\\\\'").get(0);

        assertThat(token.kind()).isEqualTo(STRING);
        assertThat(token.text()).isEqualTo("it's\\");
    }

    @Test
    void tokenize_unicodeEscapes_areDecoded() {
        var token = tokenize("'\\u0041\\x42\\N{LATIN SMALL LETTER C}\\101'").get(0);

        assertThat(token.text()).isEqualTo("ABcA");
    }

    @Test
    void tokenize_unknownEscape_isKeptVerbatim() {
        assertThat(tokenize("'a\\qb'").get(0)
                                      .text()).isEqualTo("a\\qb");
    }

    @Test
    void tokenize_unknownCharacterName_raisesUnicodeDecodeError() {
        assertThatThrownBy(() -> tokenize("x = '\\N{NO SUCH CHARACTER NAME}'"))
            .isInstanceOfSatisfying(UnicodeDecodeError.class, error -> {
                assertThat(error.escape()).isEqualTo("\\N{NO SUCH CHARACTER NAME}");
                assertThat(error.line()).isEqualTo(1);
                assertThat(error.column()).isEqualTo(4);
            });
    }

    @Test
    void tokenize_formatString_keepsPlaceholders() {
        var token = tokenize("f'hello @name@'").get(0);

        assertThat(token.kind()).isEqualTo(FSTRING);
        assertThat(token.text()).isEqualTo("hello @name@");
    }

    @Test
    void tokenize_multilineString_keepsRawTextAndCountsLines() {
        var tokens = tokenize("x = '''a\\n\nb'''\ny\n");

        var literal = tokens.get(2);
        assertThat(literal.kind()).isEqualTo(MULTILINE_STRING);
        assertThat(literal.text()).isEqualTo("a\\n\nb");
        assertThat(literal.line()).isEqualTo(1);
        assertThat(literal.endLine()).isEqualTo(2);
        assertThat(literal.endColumn()).isEqualTo(4);

        var next = tokens.get(4);
        assertThat(next.kind()).isEqualTo(ID);
        assertThat(next.line()).isEqualTo(3);
        assertThat(next.column()).isEqualTo(0);
    }

    @Test
    void tokenize_multilineFormatString_isDistinctKind() {
        var token = tokenize("f'''x\n@y@'''").get(0);

        assertThat(token.kind()).isEqualTo(MULTILINE_FSTRING);
        assertThat(token.text()).isEqualTo("x\n@y@");
    }

    // === Positions ===

    @Test
    void tokenize_positions_areOneBasedLinesZeroBasedColumns() {
        var tokens = tokenize("a = 1\n  b = 2\n");

        var b = tokens.get(4);
        assertThat(b.text()).isEqualTo("b");
        assertThat(b.line()).isEqualTo(2);
        assertThat(b.column()).isEqualTo(2);
        assertThat(b.span()).isEqualTo(ByteSpan.of(8, 9));
    }

    @Test
    void tokenize_eol_endsAtStartOfNextLine() {
        var eol = tokenize("x\n").get(1);

        assertThat(eol.kind()).isEqualTo(EOL);
        assertThat(eol.line()).isEqualTo(1);
        assertThat(eol.endLine()).isEqualTo(2);
        assertThat(eol.endColumn()).isZero();
    }

    @Test
    void next_atEndOfInput_keepsReturningEof() {
        var lexer = new Lexer("x", "meson.build", WarningSink.collecting(warnings));

        assertThat(lexer.next()
                        .kind()).isEqualTo(ID);
        var eof = lexer.next();
        assertThat(eof.kind()).isEqualTo(EOF);
        assertThat(eof.span()).isEqualTo(ByteSpan.at(1));
        assertThat(lexer.next()
                        .kind()).isEqualTo(EOF);
    }

    // === Comments ===

    @Test
    void tokenize_comments_areCollectedOnSideList() {
        var lexer = new Lexer("x = 1 # note\n# own line\n", "meson.build", WarningSink.collecting(warnings));
        Token token;
        do {
            token = lexer.next();
        } while (!token.is(EOF));

        var comments = lexer.comments();
        assertThat(comments).hasSize(2);
        assertThat(comments.get(0)
                           .text()).isEqualTo("# note");
        assertThat(comments.get(0)
                           .line()).isEqualTo(1);
        assertThat(comments.get(0)
                           .column()).isEqualTo(6);
        assertThat(comments.get(1)
                           .text()).isEqualTo("# own line");
        assertThat(comments.get(1)
                           .line()).isEqualTo(2);
    }

    // === Errors and warnings ===

    @Test
    void tokenize_doubleQuote_isRejectedWithHint() {
        assertThatThrownBy(() -> tokenize("x = \"a\""))
            .isInstanceOfSatisfying(LexError.class, error -> {
                assertThat(error.reason()).isEqualTo("Double quotes are not supported. Use single quotes.");
                assertThat(error.column()).isEqualTo(4);
            });
    }

    @Test
    void tokenize_unexpectedCharacter_raisesLexErrorWithCaret() {
        assertThatThrownBy(() -> tokenize("x = $"))
            .isInstanceOf(LexError.class)
            .hasMessage("Unexpected character '$'\nx = $\n    ^");
    }

    @Test
    void tokenize_newlineInSingleLineString_warns() {
        var tokens = tokenize("x = 'a\nb'\ny\n");

        assertThat(tokens.get(2)
                         .text()).isEqualTo("a\nb");
        assertThat(tokens.get(4)
                         .line()).isEqualTo(3);
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)
                           .message()).startsWith("Newline character in a string detected");
    }

    @Test
    void tokenize_futureKeyword_warnsButStaysIdentifier() {
        var tokens = tokenize("return = 1");

        assertThat(tokens.get(0)
                         .kind()).isEqualTo(ID);
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)
                           .message()).contains("'return'", "reserved keyword");
    }

    @Test
    void token_withValueOfWrongType_isRejected() {
        assertThatThrownBy(() -> new Token(NUMBER, "f", 0, 1, 0, 1, 1, ByteSpan.of(0, 1), TokenValue.text("1")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decodeEscape_simpleEscapes_mapToControlCharacters() {
        assertThat(Lexer.decodeEscape("\\n")).isEqualTo("\n");
        assertThat(Lexer.decodeEscape("\\t")).isEqualTo("\t");
        assertThat(Lexer.decodeEscape("\\a")).isEqualTo("\u0007");
        assertThat(Lexer.decodeEscape("\\U0001F600")).isEqualTo(new String(Character.toChars(0x1F600)));
    }
}
