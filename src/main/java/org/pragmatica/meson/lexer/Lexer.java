package org.pragmatica.meson.lexer;

import org.pragmatica.meson.error.LexError;
import org.pragmatica.meson.error.UnicodeDecodeError;
import org.pragmatica.meson.error.WarningSink;
import org.pragmatica.meson.tree.ByteSpan;
import org.pragmatica.meson.tree.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for Meson build definitions.
 *
 * <p>Pull-based: every call to {@link #next()} produces one token; once the input is exhausted it
 * keeps returning {@link TokenKind#EOF}. Comments never appear in the token stream, they are
 * collected into {@link #comments()} as they are passed.
 *
 * <p>A newline is an end-of-line token only outside parentheses, brackets and braces. Inside any
 * of them it is a plain continuation.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 16_000_000;

    private static final Pattern ESCAPE_SEQUENCE = Pattern.compile(
        "\\\\U[A-Fa-f0-9]{8}"
        + "|\\\\u[A-Fa-f0-9]{4}"
        + "|\\\\x[A-Fa-f0-9]{2}"
        + "|\\\\[0-7]{1,3}"
        + "|\\\\N\\{[^}]+}"
        + "|\\\\[\\\\'abfnrtv]");

    /**
     * Token rules in priority order. The first rule matching at the current position wins, so
     * longer and more specific patterns come first.
     */
    private enum Rule {
        BLANK("[ \\t]"),
        MULTILINE_FSTRING("f'''(?s:.*?)'''"),
        FSTRING("f'[^'\\\\]*+(?:\\\\[^\\n][^'\\\\]*+)*+'"),
        ID("[_a-zA-Z][_0-9a-zA-Z]*"),
        NUMBER("0[bB][01]+|0[oO][0-7]+|0[xX][0-9a-fA-F]+|0|[1-9][0-9]*"),
        CONTINUATION("\\\\\\n"),
        NEWLINE("\\n"),
        MULTILINE_STRING("'''(?s:.*?)'''"),
        COMMENT("#[^\\n]*"),
        LPAREN("\\("),
        RPAREN("\\)"),
        LBRACKET("\\["),
        RBRACKET("]"),
        LCURL("\\{"),
        RCURL("}"),
        DOUBLE_QUOTE("\""),
        STRING("'[^'\\\\]*+(?:\\\\[^\\n][^'\\\\]*+)*+'"),
        COMMA(","),
        PLUS_ASSIGN("\\+="),
        DOT("\\."),
        PLUS("\\+"),
        DASH("-"),
        STAR("\\*"),
        PERCENT("%"),
        FSLASH("/"),
        COLON(":"),
        EQUAL("=="),
        NOT_EQUAL("!="),
        ASSIGN("="),
        LE("<="),
        LT("<"),
        GE(">="),
        GT(">"),
        QUESTION_MARK("\\?");

        private final Pattern pattern;

        Rule(String regex) {
            this.pattern = Pattern.compile(regex);
        }
    }

    private static final Rule[] RULES = Rule.values();

    private final String code;
    private final String filename;
    private final WarningSink warnings;
    private final Matcher[] matchers;
    private final List<Comment> comments = new ArrayList<>();

    private int loc;
    private int line;
    private int lineStart;
    private int parenDepth;
    private int bracketDepth;
    private int curlDepth;

    public Lexer(String code, String filename, WarningSink warnings) {
        if (code.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException("Input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        this.code = code;
        this.filename = filename;
        this.warnings = warnings;
        this.matchers = new Matcher[RULES.length];
        for (int i = 0; i < RULES.length; i++) {
            matchers[i] = RULES[i].pattern.matcher(code);
        }
        this.loc = 0;
        this.line = 1;
        this.lineStart = 0;
    }

    /**
     * Lex the whole input, including the trailing EOF token.
     */
    public static List<Token> tokenize(String code, String filename, WarningSink warnings) {
        var lexer = new Lexer(code, filename, warnings);
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (!token.is(TokenKind.EOF));
        return tokens;
    }

    /**
     * Comments passed so far, in source order.
     */
    public List<Comment> comments() {
        return Collections.unmodifiableList(comments);
    }

    public String filename() {
        return filename;
    }

    /**
     * Text of the line starting at the given offset, without its newline.
     */
    public String lineAt(int offset) {
        int end = code.indexOf('\n', offset);
        return code.substring(offset, end < 0
                                      ? code.length()
                                      : end);
    }

    public Token next() {
        while (loc < code.length()) {
            var rule = matchAt(loc);
            int start = loc;
            int end = matchers[rule.ordinal()].end();
            int tokenLine = line;
            int tokenLineStart = lineStart;
            int column = start - lineStart;
            var span = ByteSpan.of(start, end);
            var text = code.substring(start, end);
            loc = end;

            switch (rule) {
                case BLANK:
                    continue;
                case CONTINUATION:
                    newLine(end);
                    continue;
                case COMMENT:
                    comments.add(new Comment(tokenLineStart, tokenLine, column, span, text));
                    continue;
                case NEWLINE:
                    newLine(end);
                    if (parenDepth > 0 || bracketDepth > 0 || curlDepth > 0) {
                        continue;
                    }
                    return new Token(TokenKind.EOL,
                                     filename,
                                     tokenLineStart,
                                     tokenLine,
                                     column,
                                     line,
                                     0,
                                     span,
                                     TokenValue.NONE);
                case DOUBLE_QUOTE:
                    throw new LexError("Double quotes are not supported. Use single quotes.",
                                       filename,
                                       lineAt(tokenLineStart),
                                       tokenLine,
                                       column);
                case LPAREN:
                    parenDepth++ ;
                    break;
                case RPAREN:
                    parenDepth-- ;
                    break;
                case LBRACKET:
                    bracketDepth++ ;
                    break;
                case RBRACKET:
                    bracketDepth-- ;
                    break;
                case LCURL:
                    curlDepth++ ;
                    break;
                case RCURL:
                    curlDepth-- ;
                    break;
                default:
                    break;
            }

            var kind = kindOf(rule, text);
            var value = valueOf(rule, kind, text, tokenLine, tokenLineStart, column);
            if (text.indexOf('\n') >= 0) {
                // Multi-line literals move the line counter; later columns count from the last line
                advanceLines(text, end);
            }
            return new Token(kind, filename, tokenLineStart, tokenLine, column, line, end - lineStart, span, value);
        }
        return eof();
    }

    private Rule matchAt(int position) {
        for (var rule : RULES) {
            var matcher = matchers[rule.ordinal()];
            matcher.region(position, code.length());
            if (matcher.lookingAt()) {
                return rule;
            }
        }
        throw new LexError("Unexpected character '" + code.charAt(position) + "'",
                           filename,
                           lineAt(lineStart),
                           line,
                           position - lineStart);
    }

    private Token eof() {
        return new Token(TokenKind.EOF,
                         filename,
                         lineStart,
                         line,
                         code.length() - lineStart,
                         line,
                         code.length() - lineStart,
                         ByteSpan.at(code.length()),
                         TokenValue.NONE);
    }

    private void newLine(int nextLineStart) {
        line++ ;
        lineStart = nextLineStart;
    }

    private void advanceLines(String text, int end) {
        int newlines = 0;
        int lastNewline = -1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                newlines++ ;
                lastNewline = i;
            }
        }
        line += newlines;
        lineStart = end - (text.length() - lastNewline - 1);
    }

    private static TokenKind kindOf(Rule rule, String text) {
        return switch (rule) {
            case MULTILINE_FSTRING -> TokenKind.MULTILINE_FSTRING;
            case FSTRING -> TokenKind.FSTRING;
            case ID -> TokenKind.keyword(text)
                                .orElse(TokenKind.ID);
            case NUMBER -> TokenKind.NUMBER;
            case MULTILINE_STRING -> TokenKind.MULTILINE_STRING;
            case STRING -> TokenKind.STRING;
            case LPAREN -> TokenKind.LPAREN;
            case RPAREN -> TokenKind.RPAREN;
            case LBRACKET -> TokenKind.LBRACKET;
            case RBRACKET -> TokenKind.RBRACKET;
            case LCURL -> TokenKind.LCURL;
            case RCURL -> TokenKind.RCURL;
            case COMMA -> TokenKind.COMMA;
            case PLUS_ASSIGN -> TokenKind.PLUS_ASSIGN;
            case DOT -> TokenKind.DOT;
            case PLUS -> TokenKind.PLUS;
            case DASH -> TokenKind.DASH;
            case STAR -> TokenKind.STAR;
            case PERCENT -> TokenKind.PERCENT;
            case FSLASH -> TokenKind.FSLASH;
            case COLON -> TokenKind.COLON;
            case EQUAL -> TokenKind.EQUAL;
            case NOT_EQUAL -> TokenKind.NOT_EQUAL;
            case ASSIGN -> TokenKind.ASSIGN;
            case LE -> TokenKind.LE;
            case LT -> TokenKind.LT;
            case GE -> TokenKind.GE;
            case GT -> TokenKind.GT;
            case QUESTION_MARK -> TokenKind.QUESTION_MARK;
            case BLANK, CONTINUATION, NEWLINE, COMMENT, DOUBLE_QUOTE ->
                throw new IllegalStateException("Rule " + rule + " does not produce a token");
        };
    }

    private TokenValue valueOf(Rule rule, TokenKind kind, String text, int tokenLine, int tokenLineStart, int column) {
        switch (rule) {
            case STRING:
            case FSTRING: {
                if (text.indexOf('\n') >= 0) {
                    warnings.warn("Newline character in a string detected, use ''' (three single quotes) "
                                  + "for multiline strings instead.\n"
                                  + "This will become a hard error in a future Meson release.",
                                  filename,
                                  SourceLocation.at(tokenLine, column));
                }
                var raw = text.substring(rule == Rule.FSTRING
                                         ? 2
                                         : 1, text.length() - 1);
                return TokenValue.text(decodeEscapes(raw, text, tokenLine, tokenLineStart, column));
            }
            case MULTILINE_STRING:
                return TokenValue.text(text.substring(3, text.length() - 3));
            case MULTILINE_FSTRING:
                return TokenValue.text(text.substring(4, text.length() - 3));
            case NUMBER:
                return TokenValue.integer(parseNumber(text, tokenLine, tokenLineStart, column));
            case ID:
                if (kind == TokenKind.TRUE || kind == TokenKind.FALSE) {
                    return TokenValue.bool(kind == TokenKind.TRUE);
                }
                if (kind != TokenKind.ID) {
                    return TokenValue.NONE;
                }
                if (TokenKind.isFutureKeyword(text)) {
                    warnings.warn("Identifier '" + text + "' will become a reserved keyword in a future release. "
                                  + "Please rename it.",
                                  filename,
                                  SourceLocation.at(tokenLine, column));
                }
                return TokenValue.text(text);
            default:
                return TokenValue.NONE;
        }
    }

    private long parseNumber(String text, int tokenLine, int tokenLineStart, int column) {
        try{
            if (text.length() > 1 && text.charAt(0) == '0') {
                int radix = switch (Character.toLowerCase(text.charAt(1))) {
                    case 'b' -> 2;
                    case 'o' -> 8;
                    default -> 16;
                };
                return Long.parseLong(text.substring(2), radix);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new LexError("Number literal out of range: " + text,
                               filename,
                               lineAt(tokenLineStart),
                               tokenLine,
                               column);
        }
    }

    private String decodeEscapes(String raw, String literal, int tokenLine, int tokenLineStart, int column) {
        var matcher = ESCAPE_SEQUENCE.matcher(raw);
        var sb = new StringBuilder(raw.length());
        int last = 0;
        while (matcher.find()) {
            sb.append(raw, last, matcher.start());
            var escape = matcher.group();
            try{
                sb.append(decodeEscape(escape));
            } catch (IllegalArgumentException e) {
                throw new UnicodeDecodeError(escape, literal, filename, lineAt(tokenLineStart), tokenLine, column);
            }
            last = matcher.end();
        }
        sb.append(raw, last, raw.length());
        return sb.toString();
    }

    /**
     * Decode one escape sequence matched by {@link #ESCAPE_SEQUENCE}.
     *
     * @throws IllegalArgumentException when the escape names no valid character
     */
    static String decodeEscape(String escape) {
        char marker = escape.charAt(1);
        return switch (marker) {
            case 'U' -> codePoint(Long.parseLong(escape.substring(2), 16));
            case 'u', 'x' -> String.valueOf((char) Integer.parseInt(escape.substring(2), 16));
            case 'N' -> codePoint(Character.codePointOf(escape.substring(3, escape.length() - 1)));
            case '\\' -> "\\";
            case '\'' -> "'";
            case 'a' -> "\u0007";
            case 'b' -> "\b";
            case 'f' -> "\f";
            case 'n' -> "\n";
            case 'r' -> "\r";
            case 't' -> "\t";
            case 'v' -> "\u000B";
            default -> String.valueOf((char) Integer.parseInt(escape.substring(1), 8));
        };
    }

    private static String codePoint(long codePoint) {
        if (codePoint < 0 || codePoint > Character.MAX_CODE_POINT) {
            throw new IllegalArgumentException("Code point out of range: " + codePoint);
        }
        return new String(Character.toChars((int) codePoint));
    }
}
