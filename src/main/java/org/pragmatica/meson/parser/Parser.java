package org.pragmatica.meson.parser;

import org.pragmatica.meson.error.BlockParseError;
import org.pragmatica.meson.error.ParseError;
import org.pragmatica.meson.error.WarningSink;
import org.pragmatica.meson.lexer.Comment;
import org.pragmatica.meson.lexer.Lexer;
import org.pragmatica.meson.lexer.Token;
import org.pragmatica.meson.lexer.TokenKind;
import org.pragmatica.meson.tree.ArgumentsBuilder;
import org.pragmatica.meson.tree.ArithmeticOperator;
import org.pragmatica.meson.tree.ByteSpan;
import org.pragmatica.meson.tree.ComparisonOperator;
import org.pragmatica.meson.tree.Node;
import org.pragmatica.meson.tree.Node.AndNode;
import org.pragmatica.meson.tree.Node.ArgumentNode;
import org.pragmatica.meson.tree.Node.ArithmeticNode;
import org.pragmatica.meson.tree.Node.ArrayNode;
import org.pragmatica.meson.tree.Node.AssignmentNode;
import org.pragmatica.meson.tree.Node.BooleanNode;
import org.pragmatica.meson.tree.Node.BreakNode;
import org.pragmatica.meson.tree.Node.CodeBlockNode;
import org.pragmatica.meson.tree.Node.ComparisonNode;
import org.pragmatica.meson.tree.Node.ContinueNode;
import org.pragmatica.meson.tree.Node.DictNode;
import org.pragmatica.meson.tree.Node.EmptyNode;
import org.pragmatica.meson.tree.Node.ForeachClauseNode;
import org.pragmatica.meson.tree.Node.FormatStringNode;
import org.pragmatica.meson.tree.Node.FunctionNode;
import org.pragmatica.meson.tree.Node.IdNode;
import org.pragmatica.meson.tree.Node.IfClauseNode;
import org.pragmatica.meson.tree.Node.IfNode;
import org.pragmatica.meson.tree.Node.IndexNode;
import org.pragmatica.meson.tree.Node.MethodNode;
import org.pragmatica.meson.tree.Node.MultilineFormatStringNode;
import org.pragmatica.meson.tree.Node.NotNode;
import org.pragmatica.meson.tree.Node.NumberNode;
import org.pragmatica.meson.tree.Node.OrNode;
import org.pragmatica.meson.tree.Node.ParenthesizedNode;
import org.pragmatica.meson.tree.Node.PlusAssignmentNode;
import org.pragmatica.meson.tree.Node.StringNode;
import org.pragmatica.meson.tree.Node.TernaryNode;
import org.pragmatica.meson.tree.Node.UMinusNode;
import org.pragmatica.meson.tree.NodeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.pragmatica.meson.lexer.TokenKind.*;

/**
 * Recursive-descent parser for Meson build definitions.
 *
 * <p>Precedence, lowest first:
 * <pre>
 *   assignment, +=, ternary        right side parsed recursively
 *   or
 *   and
 *   comparison                     at most one per expression
 *   + -
 *   * / %
 *   not, unary -
 *   call, .method(), [index]
 *   ( ), [ ], { }
 *   literals and identifiers
 * </pre>
 * All binary operators fold to the left.
 *
 * <p>A parser instance parses once. Comments collected by the lexer are attached to the produced
 * tree before {@link #parse()} returns.
 */
public final class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private static final Map<TokenKind, ComparisonOperator> COMPARISONS = Map.of(
        EQUAL, ComparisonOperator.EQUAL,
        NOT_EQUAL, ComparisonOperator.NOT_EQUAL,
        LT, ComparisonOperator.LESS,
        LE, ComparisonOperator.LESS_OR_EQUAL,
        GT, ComparisonOperator.GREATER,
        GE, ComparisonOperator.GREATER_OR_EQUAL,
        IN, ComparisonOperator.IN);

    private final String code;
    private final String filename;
    private final WarningSink warnings;
    private final Lexer lexer;
    private final SpanMarks marks = new SpanMarks();
    private final List<Node> nodes = new ArrayList<>();

    private Token current;
    private Token previous;
    private boolean inTernary;
    private boolean used;

    public Parser(String code, String filename, WarningSink warnings) {
        this.code = code;
        this.filename = filename;
        this.warnings = warnings;
        this.lexer = new Lexer(code, filename, warnings);
    }

    public Parser(String code, String filename) {
        this(code, filename, WarningSink.logging());
    }

    /**
     * Parse the whole input into the top-level code block.
     *
     * @throws org.pragmatica.meson.error.SyntaxError on the first lexical or syntax error
     */
    public CodeBlockNode parse() {
        if (used) {
            throw new IllegalStateException("Parser for " + filename + " has already been used");
        }
        used = true;
        current = lexer.next();

        var block = codeblock();
        expect(EOF);

        if (!marks.isEmpty()) {
            throw new IllegalStateException(marks.depth() + " span marks left open after parsing " + filename);
        }

        var comments = lexer.comments();
        new CommentAttacher(nodes).attach(comments);
        log.debug("Parsed {}: {} nodes, {} comments", filename, nodes.size(), comments.size());
        nodes.clear();
        return block;
    }

    /**
     * Comments seen by the lexer, in source order.
     */
    public List<Comment> comments() {
        return lexer.comments();
    }

    // === Token handling ===

    private void advance() {
        previous = current;
        current = lexer.next();
    }

    private boolean accept(TokenKind kind) {
        if (current.is(kind)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenKind kind) {
        if (!accept(kind)) {
            throw new ParseError(expectation(kind),
                                 filename,
                                 lexer.lineAt(current.lineStart()),
                                 current.line(),
                                 current.column());
        }
    }

    private void blockExpect(TokenKind kind, Token blockStart) {
        if (!accept(kind)) {
            throw new BlockParseError(expectation(kind),
                                      filename,
                                      lexer.lineAt(current.lineStart()),
                                      current.line(),
                                      current.column(),
                                      lexer.lineAt(blockStart.lineStart()),
                                      blockStart.line(),
                                      blockStart.column());
        }
    }

    private String expectation(TokenKind kind) {
        return "Expecting " + kind.display() + " got " + current.kind()
                                                               .display() + ".";
    }

    private ParseError errorAt(String reason, Node node) {
        return new ParseError(reason, filename, sourceLineAt(node.span()
                                                                 .start()), node.line(), node.column());
    }

    private String sourceLineAt(int offset) {
        return lexer.lineAt(code.lastIndexOf('\n', offset - 1) + 1);
    }

    // === Spans ===

    private Token mark() {
        return marks.open(current);
    }

    /**
     * Attribution from the given mark up to the current token, leaving the mark open.
     */
    private NodeInfo extend(Token start) {
        if (marks.top() != start) {
            throw new IllegalStateException("Span mark " + start + " is not the innermost one");
        }
        var end = current == start
                  ? start.location()
                  : previous.endLocation();
        return NodeInfo.of(filename,
                           start.location(),
                           end,
                           ByteSpan.of(start.span()
                                            .start(),
                                       current.span()
                                              .start()));
    }

    private NodeInfo close(Token start) {
        var info = extend(start);
        marks.close(start);
        return info;
    }

    private <T extends Node> T register(T node) {
        nodes.add(node);
        return node;
    }

    private EmptyNode empty() {
        return new EmptyNode(NodeInfo.at(filename, current.location(), ByteSpan.at(current.span()
                                                                                          .start())));
    }

    // === Statements ===

    private CodeBlockNode codeblock() {
        var start = mark();
        var lines = new ArrayList<Node>();
        do {
            var line = line();
            if (!(line instanceof EmptyNode)) {
                lines.add(line);
            }
        } while (accept(EOL));
        return register(new CodeBlockNode(close(start), lines));
    }

    private Node line() {
        var blockStart = current;
        if (current.is(EOL)) {
            return empty();
        }
        if (current.is(IF)) {
            var start = mark();
            advance();
            var clause = ifClause(start);
            blockExpect(ENDIF, blockStart);
            return register(new IfClauseNode(close(start), clause.ifs(), clause.elseBlock()));
        }
        if (current.is(FOREACH)) {
            var start = mark();
            advance();
            var loop = foreachClause();
            blockExpect(ENDFOREACH, blockStart);
            return register(new ForeachClauseNode(close(start), loop.variables(), loop.items(), loop.block()));
        }
        if (accept(CONTINUE)) {
            return register(new ContinueNode(NodeInfo.of(previous)));
        }
        if (accept(BREAK)) {
            return register(new BreakNode(NodeInfo.of(previous)));
        }
        return statement();
    }

    private record IfParts(List<IfNode> ifs, Optional<CodeBlockNode> elseBlock) {}

    private record ForeachParts(List<IdNode> variables, Node items, CodeBlockNode block) {}

    /**
     * Branches of an if clause. The if branch shares its mark with the whole clause.
     */
    private IfParts ifClause(Token clauseStart) {
        var ifs = new ArrayList<IfNode>();
        ifs.add(ifBranch(marks.open(clauseStart)));

        while (current.is(ELIF)) {
            var start = mark();
            advance();
            ifs.add(ifBranch(start));
        }

        Optional<CodeBlockNode> elseBlock = Optional.empty();
        if (accept(ELSE)) {
            expect(EOL);
            elseBlock = Optional.of(codeblock());
        }
        return new IfParts(ifs, elseBlock);
    }

    private IfNode ifBranch(Token start) {
        var condition = statement();
        expect(EOL);
        var block = codeblock();
        return register(new IfNode(close(start), condition, block));
    }

    private ForeachParts foreachClause() {
        var variables = new ArrayList<IdNode>();
        variables.add(loopVariable());
        if (accept(COMMA)) {
            variables.add(loopVariable());
        }
        expect(COLON);
        var items = statement();
        var block = codeblock();
        return new ForeachParts(variables, items, block);
    }

    private IdNode loopVariable() {
        expect(ID);
        return register(new IdNode(NodeInfo.of(previous), previous.text()));
    }

    private Node statement() {
        return assignment();
    }

    // === Expressions ===

    private Node assignment() {
        var start = mark();
        var left = or();

        if (accept(PLUS_ASSIGN)) {
            var value = assignment();
            if (!(left instanceof IdNode target)) {
                throw errorAt("Plusassignment target must be an id.", left);
            }
            return register(new PlusAssignmentNode(close(start), target, value));
        }
        if (accept(ASSIGN)) {
            var value = assignment();
            if (!(left instanceof IdNode target)) {
                throw errorAt("Assignment target must be an id.", left);
            }
            return register(new AssignmentNode(close(start), target, value));
        }
        if (accept(QUESTION_MARK)) {
            if (inTernary) {
                throw errorAt("Nested ternary operators are not allowed.", left);
            }
            inTernary = true;
            var trueBlock = assignment();
            expect(COLON);
            var falseBlock = assignment();
            inTernary = false;
            return register(new TernaryNode(close(start), left, trueBlock, falseBlock));
        }
        marks.close(start);
        return left;
    }

    private Node or() {
        var start = mark();
        var left = and();
        while (accept(OR)) {
            if (left instanceof EmptyNode) {
                throw errorAt("Invalid or clause.", left);
            }
            var right = and();
            left = register(new OrNode(extend(start), left, right));
        }
        marks.close(start);
        return left;
    }

    private Node and() {
        var start = mark();
        var left = comparison();
        while (accept(AND)) {
            if (left instanceof EmptyNode) {
                throw errorAt("Invalid and clause.", left);
            }
            var right = comparison();
            left = register(new AndNode(extend(start), left, right));
        }
        marks.close(start);
        return left;
    }

    private Node comparison() {
        var start = mark();
        var left = additive();

        var operator = COMPARISONS.get(current.kind());
        if (operator != null) {
            advance();
            var right = additive();
            return register(new ComparisonNode(close(start), operator, left, right));
        }
        if (accept(NOT)) {
            expect(IN);
            var right = additive();
            return register(new ComparisonNode(close(start), ComparisonOperator.NOT_IN, left, right));
        }
        marks.close(start);
        return left;
    }

    private Node additive() {
        var start = mark();
        var left = multiplicative();
        while (true) {
            ArithmeticOperator operator;
            if (accept(PLUS)) {
                operator = ArithmeticOperator.ADD;
            } else if (accept(DASH)) {
                operator = ArithmeticOperator.SUB;
            } else {
                break;
            }
            var right = multiplicative();
            left = register(new ArithmeticNode(extend(start), operator, left, right));
        }
        marks.close(start);
        return left;
    }

    private Node multiplicative() {
        var start = mark();
        var left = unary();
        while (true) {
            ArithmeticOperator operator;
            if (accept(STAR)) {
                operator = ArithmeticOperator.MUL;
            } else if (accept(FSLASH)) {
                operator = ArithmeticOperator.DIV;
            } else if (accept(PERCENT)) {
                operator = ArithmeticOperator.MOD;
            } else {
                break;
            }
            var right = unary();
            left = register(new ArithmeticNode(extend(start), operator, left, right));
        }
        marks.close(start);
        return left;
    }

    private Node unary() {
        if (current.is(NOT)) {
            var start = mark();
            advance();
            var value = unary();
            return register(new NotNode(close(start), value));
        }
        if (current.is(DASH)) {
            var start = mark();
            advance();
            var value = unary();
            return register(new UMinusNode(close(start), value));
        }
        return postfix();
    }

    private Node postfix() {
        var start = mark();
        var left = primary();

        var callStart = current;
        if (accept(LPAREN)) {
            var args = arguments();
            blockExpect(RPAREN, callStart);
            if (!(left instanceof IdNode name)) {
                throw errorAt("Function call must be applied to plain id", left);
            }
            left = register(new FunctionNode(extend(start), name, args));
        }

        while (true) {
            if (accept(DOT)) {
                left = methodCall(start, left);
            } else if (current.is(LBRACKET)) {
                var bracket = current;
                advance();
                var index = statement();
                blockExpect(RBRACKET, bracket);
                left = register(new IndexNode(extend(start), left, index));
            } else {
                break;
            }
        }
        marks.close(start);
        return left;
    }

    private MethodNode methodCall(Token start, Node source) {
        var name = atom();
        if (!(name instanceof IdNode method)) {
            throw new ParseError("Method name must be plain id",
                                 filename,
                                 lexer.lineAt(current.lineStart()),
                                 current.line(),
                                 current.column());
        }
        var callStart = current;
        expect(LPAREN);
        var args = arguments();
        blockExpect(RPAREN, callStart);
        return register(new MethodNode(extend(start), source, method, args));
    }

    private Node primary() {
        var blockStart = current;
        if (current.is(LPAREN)) {
            var start = mark();
            advance();
            var inner = statement();
            blockExpect(RPAREN, blockStart);
            return register(new ParenthesizedNode(close(start), inner));
        }
        if (current.is(LBRACKET)) {
            var start = mark();
            advance();
            var args = arguments();
            blockExpect(RBRACKET, blockStart);
            return register(new ArrayNode(close(start), args));
        }
        if (current.is(LCURL)) {
            var start = mark();
            advance();
            var args = keyValues();
            blockExpect(RCURL, blockStart);
            return register(new DictNode(close(start), args));
        }
        return atom();
    }

    private Node atom() {
        var token = current;
        var info = NodeInfo.of(token);
        switch (token.kind()) {
            case TRUE:
            case FALSE:
                advance();
                return register(new BooleanNode(info, token.boolValue()));
            case ID:
                advance();
                return register(new IdNode(info, token.text()));
            case NUMBER:
                advance();
                return register(new NumberNode(info, token.intValue()));
            case STRING:
                advance();
                return register(new StringNode(info, token.text(), false));
            case MULTILINE_STRING:
                advance();
                return register(new StringNode(info, token.text(), true));
            case FSTRING:
                advance();
                return register(new FormatStringNode(info, token.text()));
            case MULTILINE_FSTRING:
                advance();
                return register(new MultilineFormatStringNode(info, token.text()));
            default:
                return empty();
        }
    }

    // === Argument lists ===

    /**
     * Contents of a call or array: positional arguments, then {@code key : value} pairs with
     * identifier keys.
     */
    private ArgumentNode arguments() {
        var start = mark();
        var builder = ArgumentsBuilder.argumentsAt(filename, current.location(), warnings);

        var node = statement();
        while (!(node instanceof EmptyNode)) {
            if (accept(COMMA)) {
                builder.append(node);
            } else if (accept(COLON)) {
                if (!(node instanceof IdNode key)) {
                    throw errorAt("Dictionary key must be a plain identifier.", node);
                }
                builder.setKwarg(key, statement());
                if (!accept(COMMA)) {
                    break;
                }
            } else {
                builder.append(node);
                break;
            }
            node = statement();
        }
        return register(builder.build(close(start)));
    }

    /**
     * Contents of a dictionary literal: {@code key : value} pairs only.
     */
    private ArgumentNode keyValues() {
        var start = mark();
        var builder = ArgumentsBuilder.argumentsAt(filename, current.location(), warnings);

        var node = statement();
        while (!(node instanceof EmptyNode)) {
            if (!accept(COLON)) {
                throw errorAt("Only key:value pairs are valid in dict construction.", node);
            }
            builder.setKwargNoCheck(node, statement());
            if (!accept(COMMA)) {
                break;
            }
            node = statement();
        }
        return register(builder.build(close(start)));
    }
}
