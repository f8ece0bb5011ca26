package org.pragmatica.meson.format;

import org.pragmatica.meson.lexer.Comment;
import org.pragmatica.meson.tree.Node;
import org.pragmatica.meson.tree.Node.AndNode;
import org.pragmatica.meson.tree.Node.ArithmeticNode;
import org.pragmatica.meson.tree.Node.AssignmentNode;
import org.pragmatica.meson.tree.Node.BooleanNode;
import org.pragmatica.meson.tree.Node.BreakNode;
import org.pragmatica.meson.tree.Node.CodeBlockNode;
import org.pragmatica.meson.tree.Node.ComparisonNode;
import org.pragmatica.meson.tree.Node.ContinueNode;
import org.pragmatica.meson.tree.Node.DictNode;
import org.pragmatica.meson.tree.Node.EmptyNode;
import org.pragmatica.meson.tree.Node.FormatStringNode;
import org.pragmatica.meson.tree.Node.IdNode;
import org.pragmatica.meson.tree.Node.MultilineFormatStringNode;
import org.pragmatica.meson.tree.Node.NotNode;
import org.pragmatica.meson.tree.Node.NumberNode;
import org.pragmatica.meson.tree.Node.OrNode;
import org.pragmatica.meson.tree.Node.ParenthesizedNode;
import org.pragmatica.meson.tree.Node.PlusAssignmentNode;
import org.pragmatica.meson.tree.Node.StringNode;
import org.pragmatica.meson.tree.Node.TernaryNode;
import org.pragmatica.meson.tree.Node.UMinusNode;
import org.pragmatica.meson.tree.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of the AST pretty-printers.
 *
 * <p>Output is built line by line: text is appended to the current line, and a forced line break
 * emits the current line (unless it is blank) and starts a new one at the current indentation.
 * Emitted lines never carry trailing whitespace.
 *
 * <p>Attached comments are rendered for every node: leading comments on their own lines before
 * it, inline comments at the end of the line the node ends on, trailing comments on their own
 * lines after it. A line carries at most one comment; further inline comments for the same line
 * are emitted on lines of their own right after it.
 */
public abstract class AbstractFormatter implements NodeVisitor {
    private final List<String> lines = new ArrayList<>();
    private final List<String> pendingInline = new ArrayList<>();
    private final StringBuilder line = new StringBuilder();
    private String indent = "";
    private boolean lastLineCommented;
    private boolean used;

    /**
     * Render the tree. A formatter instance formats exactly one tree.
     */
    public List<String> format(CodeBlockNode root) {
        if (used) {
            throw new IllegalStateException(getClass().getSimpleName() + " instance has already been used");
        }
        used = true;
        visit(root);
        forceLineBreak();
        return List.copyOf(lines);
    }

    // === Line buffer ===

    protected final void append(String text) {
        line.append(text);
    }

    protected final void forceLineBreak() {
        var text = line.toString()
                       .stripTrailing();
        if (!pendingInline.isEmpty()) {
            var first = pendingInline.get(0);
            text = text.isBlank()
                   ? line + first
                   : text + " " + first;
        }
        if (!text.isBlank()) {
            lines.add(text);
            lastLineCommented = !pendingInline.isEmpty();
        }
        for (int i = 1; i < pendingInline.size(); i++) {
            lines.add(indent + pendingInline.get(i));
        }
        pendingInline.clear();
        line.setLength(0);
        line.append(indent);
    }

    protected final boolean isLineBlank() {
        return line.toString()
                   .isBlank();
    }

    /**
     * Remove one trailing {@code ", "} left behind by an argument list.
     */
    protected final void trimTrailingSeparator() {
        int length = line.length();
        if (length >= 2 && line.charAt(length - 2) == ',' && line.charAt(length - 1) == ' ') {
            line.setLength(length - 2);
        }
    }

    protected final String indent() {
        return indent;
    }

    /**
     * Change the indentation of lines started from now on.
     */
    protected final void indent(String indent) {
        this.indent = indent;
    }

    // === Dispatch ===

    /**
     * Render a node together with its attached comments.
     */
    protected final void visit(Node node) {
        visit(node, "");
    }

    /**
     * Render a node preceded by a keyword. Leading comments go before the keyword.
     */
    protected final void visit(Node node, String prefix) {
        var comments = node.comments();
        if (!comments.leading()
                     .isEmpty()) {
            forceLineBreak();
            for (var comment : comments.leading()) {
                commentLine(comment);
            }
        }

        append(prefix);
        node.accept(this);

        for (var comment : comments.inline()) {
            addInline(comment);
        }
        if (!comments.trailing()
                     .isEmpty()) {
            forceLineBreak();
            for (var comment : comments.trailing()) {
                commentLine(comment);
            }
        }
    }

    private void commentLine(Comment comment) {
        append(comment.text());
        forceLineBreak();
        lastLineCommented = true;
    }

    private void addInline(Comment comment) {
        // The node already ended its line: the comment belongs on that line
        if (isLineBlank() && pendingInline.isEmpty() && !lines.isEmpty()) {
            if (lastLineCommented) {
                lines.add(line + comment.text());
            } else {
                var last = lines.size() - 1;
                lines.set(last, lines.get(last) + " " + comment.text());
            }
            lastLineCommented = true;
            return;
        }
        pendingInline.add(comment.text());
    }

    // === Shared rendering ===

    static String escape(String value) {
        var sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\'' -> sb.append("\\'");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public void visitBoolean(BooleanNode node) {
        append(node.value()
               ? "true"
               : "false");
    }

    @Override
    public void visitId(IdNode node) {
        append(node.value());
    }

    @Override
    public void visitNumber(NumberNode node) {
        append(Long.toString(node.value()));
    }

    @Override
    public void visitString(StringNode node) {
        if (node.multiline()) {
            append("'''" + node.value() + "'''");
        } else {
            append("'" + escape(node.value()) + "'");
        }
    }

    @Override
    public void visitFormatString(FormatStringNode node) {
        append("f'" + escape(node.value()) + "'");
    }

    @Override
    public void visitMultilineFormatString(MultilineFormatStringNode node) {
        append("f'''" + node.value() + "'''");
    }

    @Override
    public void visitContinue(ContinueNode node) {
        forceLineBreak();
        append("continue");
        forceLineBreak();
    }

    @Override
    public void visitBreak(BreakNode node) {
        forceLineBreak();
        append("break");
        forceLineBreak();
    }

    @Override
    public void visitDict(DictNode node) {
        append("{");
        visit(node.args());
        append("}");
    }

    @Override
    public void visitEmpty(EmptyNode node) {}

    @Override
    public void visitOr(OrNode node) {
        visit(node.left());
        append(" or ");
        visit(node.right());
    }

    @Override
    public void visitAnd(AndNode node) {
        visit(node.left());
        append(" and ");
        visit(node.right());
    }

    @Override
    public void visitComparison(ComparisonNode node) {
        visit(node.left());
        append(" " + node.operator()
                         .symbol() + " ");
        visit(node.right());
    }

    @Override
    public void visitArithmetic(ArithmeticNode node) {
        visit(node.left());
        append(" " + node.operator()
                         .symbol() + " ");
        visit(node.right());
    }

    @Override
    public void visitNot(NotNode node) {
        append("not ");
        visit(node.value());
    }

    @Override
    public void visitUMinus(UMinusNode node) {
        append("-");
        visit(node.value());
    }

    @Override
    public void visitCodeBlock(CodeBlockNode node) {
        for (var statement : node.lines()) {
            visit(statement);
            forceLineBreak();
        }
    }

    @Override
    public void visitAssignment(AssignmentNode node) {
        visit(node.target());
        append(" = ");
        visit(node.value());
    }

    @Override
    public void visitPlusAssignment(PlusAssignmentNode node) {
        visit(node.target());
        append(" += ");
        visit(node.value());
    }

    @Override
    public void visitTernary(TernaryNode node) {
        visit(node.condition());
        append(" ? ");
        visit(node.trueBlock());
        append(" : ");
        visit(node.falseBlock());
    }

    @Override
    public void visitParenthesized(ParenthesizedNode node) {
        append("(");
        visit(node.inner());
        append(")");
    }
}
