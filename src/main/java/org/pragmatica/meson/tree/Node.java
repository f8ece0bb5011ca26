package org.pragmatica.meson.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * AST node of a Meson build definition.
 *
 * <p>Every variant carries its source attribution and a mutable comment holder. Composite nodes
 * span from their first token up to (not including) the token following their last one; single-token
 * nodes span exactly their token.
 */
public sealed interface Node {
    NodeInfo info();

    NodeComments comments();

    NodeKind kind();

    void accept(NodeVisitor visitor);

    /**
     * Direct children in source order. Argument lists are the exception, see
     * {@link ArgumentNode#children()}.
     */
    List<Node> children();

    default ByteSpan span() {
        return info().span();
    }

    default String filename() {
        return info().filename();
    }

    default int line() {
        return info().line();
    }

    default int column() {
        return info().column();
    }

    // === Literals ===

    record BooleanNode(NodeInfo info, NodeComments comments, boolean value) implements Node {
        public BooleanNode(NodeInfo info, boolean value) {
            this(info, NodeComments.empty(), value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BOOLEAN;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBoolean(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    record IdNode(NodeInfo info, NodeComments comments, String value) implements Node {
        public IdNode(NodeInfo info, String value) {
            this(info, NodeComments.empty(), value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ID;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitId(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    record NumberNode(NodeInfo info, NodeComments comments, long value) implements Node {
        public NumberNode(NodeInfo info, long value) {
            this(info, NodeComments.empty(), value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NUMBER;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitNumber(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * Plain string literal.
     *
     * @param value     decoded value for single-line literals, raw text for multi-line ones
     * @param multiline whether the literal was written between triple quotes
     */
    record StringNode(NodeInfo info, NodeComments comments, String value, boolean multiline) implements Node {
        public StringNode(NodeInfo info, String value, boolean multiline) {
            this(info, NodeComments.empty(), value, multiline);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.STRING;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitString(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    record FormatStringNode(NodeInfo info, NodeComments comments, String value) implements Node {
        public FormatStringNode(NodeInfo info, String value) {
            this(info, NodeComments.empty(), value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FORMAT_STRING;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitFormatString(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    record MultilineFormatStringNode(NodeInfo info, NodeComments comments, String value) implements Node {
        public MultilineFormatStringNode(NodeInfo info, String value) {
            this(info, NodeComments.empty(), value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MULTILINE_FORMAT_STRING;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitMultilineFormatString(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    // === Statements without operands ===

    record ContinueNode(NodeInfo info, NodeComments comments) implements Node {
        public ContinueNode(NodeInfo info) {
            this(info, NodeComments.empty());
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CONTINUE;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitContinue(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    record BreakNode(NodeInfo info, NodeComments comments) implements Node {
        public BreakNode(NodeInfo info) {
            this(info, NodeComments.empty());
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BREAK;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBreak(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * Placeholder for an absent expression. Never registered for comment attachment and never
     * stored as an argument.
     */
    record EmptyNode(NodeInfo info, NodeComments comments) implements Node {
        public EmptyNode(NodeInfo info) {
            this(info, NodeComments.empty());
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EMPTY;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitEmpty(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    // === Containers ===

    record ArrayNode(NodeInfo info, NodeComments comments, ArgumentNode args) implements Node {
        public ArrayNode(NodeInfo info, ArgumentNode args) {
            this(info, NodeComments.empty(), args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARRAY;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitArray(this);
        }

        @Override
        public List<Node> children() {
            return List.of(args);
        }
    }

    record DictNode(NodeInfo info, NodeComments comments, ArgumentNode args) implements Node {
        public DictNode(NodeInfo info, ArgumentNode args) {
            this(info, NodeComments.empty(), args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DICT;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDict(this);
        }

        @Override
        public List<Node> children() {
            return List.of(args);
        }
    }

    /**
     * Key/value pair of an argument list. Keys are identifiers in calls and arbitrary
     * expressions in dictionaries.
     */
    record KeywordArgument(Node key, Node value) {}

    /**
     * Argument list of a call, array or dictionary.
     *
     * @param arguments  positional arguments in source order
     * @param kwargs     keyword arguments in insertion order
     * @param orderError whether a positional argument followed a keyword argument
     */
    record ArgumentNode(NodeInfo info,
                        NodeComments comments,
                        List<Node> arguments,
                        List<KeywordArgument> kwargs,
                        boolean orderError) implements Node {
        public ArgumentNode {
            arguments = List.copyOf(arguments);
            kwargs = List.copyOf(kwargs);
        }

        public ArgumentNode(NodeInfo info, List<Node> arguments, List<KeywordArgument> kwargs, boolean orderError) {
            this(info, NodeComments.empty(), arguments, kwargs, orderError);
        }

        public boolean isEmpty() {
            return arguments.isEmpty() && kwargs.isEmpty();
        }

        public int size() {
            return arguments.size() + kwargs.size();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARGUMENT;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitArgument(this);
        }

        /**
         * Positional arguments first, then the key and value of each keyword argument. A list
         * with {@link #orderError()} set therefore differs from source order.
         */
        @Override
        public List<Node> children() {
            var result = new ArrayList<Node>(arguments);
            kwargs.forEach(kwarg -> {
                result.add(kwarg.key());
                result.add(kwarg.value());
            });
            return result;
        }
    }

    // === Operators ===

    record OrNode(NodeInfo info, NodeComments comments, Node left, Node right) implements Node {
        public OrNode(NodeInfo info, Node left, Node right) {
            this(info, NodeComments.empty(), left, right);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.OR;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitOr(this);
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }
    }

    record AndNode(NodeInfo info, NodeComments comments, Node left, Node right) implements Node {
        public AndNode(NodeInfo info, Node left, Node right) {
            this(info, NodeComments.empty(), left, right);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.AND;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitAnd(this);
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }
    }

    record ComparisonNode(NodeInfo info,
                          NodeComments comments,
                          ComparisonOperator operator,
                          Node left,
                          Node right) implements Node {
        public ComparisonNode(NodeInfo info, ComparisonOperator operator, Node left, Node right) {
            this(info, NodeComments.empty(), operator, left, right);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMPARISON;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitComparison(this);
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }
    }

    record ArithmeticNode(NodeInfo info,
                          NodeComments comments,
                          ArithmeticOperator operator,
                          Node left,
                          Node right) implements Node {
        public ArithmeticNode(NodeInfo info, ArithmeticOperator operator, Node left, Node right) {
            this(info, NodeComments.empty(), operator, left, right);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARITHMETIC;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitArithmetic(this);
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }
    }

    record NotNode(NodeInfo info, NodeComments comments, Node value) implements Node {
        public NotNode(NodeInfo info, Node value) {
            this(info, NodeComments.empty(), value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NOT;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitNot(this);
        }

        @Override
        public List<Node> children() {
            return List.of(value);
        }
    }

    record UMinusNode(NodeInfo info, NodeComments comments, Node value) implements Node {
        public UMinusNode(NodeInfo info, Node value) {
            this(info, NodeComments.empty(), value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.UMINUS;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitUMinus(this);
        }

        @Override
        public List<Node> children() {
            return List.of(value);
        }
    }

    record TernaryNode(NodeInfo info,
                       NodeComments comments,
                       Node condition,
                       Node trueBlock,
                       Node falseBlock) implements Node {
        public TernaryNode(NodeInfo info, Node condition, Node trueBlock, Node falseBlock) {
            this(info, NodeComments.empty(), condition, trueBlock, falseBlock);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TERNARY;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitTernary(this);
        }

        @Override
        public List<Node> children() {
            return List.of(condition, trueBlock, falseBlock);
        }
    }

    record ParenthesizedNode(NodeInfo info, NodeComments comments, Node inner) implements Node {
        public ParenthesizedNode(NodeInfo info, Node inner) {
            this(info, NodeComments.empty(), inner);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PARENTHESIZED;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitParenthesized(this);
        }

        @Override
        public List<Node> children() {
            return List.of(inner);
        }
    }

    // === Postfix ===

    record IndexNode(NodeInfo info, NodeComments comments, Node object, Node index) implements Node {
        public IndexNode(NodeInfo info, Node object, Node index) {
            this(info, NodeComments.empty(), object, index);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INDEX;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitIndex(this);
        }

        @Override
        public List<Node> children() {
            return List.of(object, index);
        }
    }

    record MethodNode(NodeInfo info, NodeComments comments, Node source, IdNode name, ArgumentNode args)
        implements Node {
        public MethodNode(NodeInfo info, Node source, IdNode name, ArgumentNode args) {
            this(info, NodeComments.empty(), source, name, args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.METHOD;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitMethod(this);
        }

        @Override
        public List<Node> children() {
            return List.of(source, name, args);
        }
    }

    record FunctionNode(NodeInfo info, NodeComments comments, IdNode name, ArgumentNode args) implements Node {
        public FunctionNode(NodeInfo info, IdNode name, ArgumentNode args) {
            this(info, NodeComments.empty(), name, args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNCTION;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitFunction(this);
        }

        @Override
        public List<Node> children() {
            return List.of(name, args);
        }
    }

    // === Statements ===

    record AssignmentNode(NodeInfo info, NodeComments comments, IdNode target, Node value) implements Node {
        public AssignmentNode(NodeInfo info, IdNode target, Node value) {
            this(info, NodeComments.empty(), target, value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ASSIGNMENT;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitAssignment(this);
        }

        @Override
        public List<Node> children() {
            return List.of(target, value);
        }
    }

    record PlusAssignmentNode(NodeInfo info, NodeComments comments, IdNode target, Node value) implements Node {
        public PlusAssignmentNode(NodeInfo info, IdNode target, Node value) {
            this(info, NodeComments.empty(), target, value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PLUS_ASSIGNMENT;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitPlusAssignment(this);
        }

        @Override
        public List<Node> children() {
            return List.of(target, value);
        }
    }

    /**
     * Sequence of statements. Empty statements are not stored.
     */
    record CodeBlockNode(NodeInfo info, NodeComments comments, List<Node> lines) implements Node {
        public CodeBlockNode {
            lines = List.copyOf(lines);
        }

        public CodeBlockNode(NodeInfo info, List<Node> lines) {
            this(info, NodeComments.empty(), lines);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CODE_BLOCK;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitCodeBlock(this);
        }

        @Override
        public List<Node> children() {
            return lines;
        }
    }

    /**
     * {@code foreach} loop over an array (one variable) or a dictionary (key and value variables).
     */
    record ForeachClauseNode(NodeInfo info,
                             NodeComments comments,
                             List<IdNode> variables,
                             Node items,
                             CodeBlockNode block) implements Node {
        public ForeachClauseNode {
            variables = List.copyOf(variables);
        }

        public ForeachClauseNode(NodeInfo info, List<IdNode> variables, Node items, CodeBlockNode block) {
            this(info, NodeComments.empty(), variables, items, block);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FOREACH_CLAUSE;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitForeachClause(this);
        }

        @Override
        public List<Node> children() {
            var result = new ArrayList<Node>(variables);
            result.add(items);
            result.add(block);
            return result;
        }
    }

    record IfNode(NodeInfo info, NodeComments comments, Node condition, CodeBlockNode block) implements Node {
        public IfNode(NodeInfo info, Node condition, CodeBlockNode block) {
            this(info, NodeComments.empty(), condition, block);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IF;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitIf(this);
        }

        @Override
        public List<Node> children() {
            return List.of(condition, block);
        }
    }

    /**
     * {@code if} statement: the {@code if} branch followed by any {@code elif} branches, plus an
     * optional {@code else} block.
     */
    record IfClauseNode(NodeInfo info,
                        NodeComments comments,
                        List<IfNode> ifs,
                        Optional<CodeBlockNode> elseBlock) implements Node {
        public IfClauseNode {
            ifs = List.copyOf(ifs);
        }

        public IfClauseNode(NodeInfo info, List<IfNode> ifs, Optional<CodeBlockNode> elseBlock) {
            this(info, NodeComments.empty(), ifs, elseBlock);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IF_CLAUSE;
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitIfClause(this);
        }

        @Override
        public List<Node> children() {
            var result = new ArrayList<Node>(ifs);
            elseBlock.ifPresent(result::add);
            return result;
        }
    }
}
