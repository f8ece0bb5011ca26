package org.pragmatica.meson.format;

import org.pragmatica.meson.tree.Node.ArgumentNode;
import org.pragmatica.meson.tree.Node.ArrayNode;
import org.pragmatica.meson.tree.Node.CodeBlockNode;
import org.pragmatica.meson.tree.Node.ForeachClauseNode;
import org.pragmatica.meson.tree.Node.FunctionNode;
import org.pragmatica.meson.tree.Node.IfClauseNode;
import org.pragmatica.meson.tree.Node.IfNode;
import org.pragmatica.meson.tree.Node.IndexNode;
import org.pragmatica.meson.tree.Node.MethodNode;

/**
 * Formatter with a fixed style: two-space indentation, argument lists on one line and
 * {@code key : value} keyword arguments.
 */
public final class FixedStyleFormatter extends AbstractFormatter {
    private static final String INDENT = "  ";

    @Override
    public void visitArray(ArrayNode node) {
        append("[");
        visit(node.args());
        append("]");
    }

    @Override
    public void visitIndex(IndexNode node) {
        visit(node.object());
        append("[");
        visit(node.index());
        append("]");
    }

    @Override
    public void visitMethod(MethodNode node) {
        visit(node.source());
        append(".");
        visit(node.name());
        append("(");
        visit(node.args());
        append(")");
    }

    @Override
    public void visitFunction(FunctionNode node) {
        visit(node.name());
        append("(");
        visit(node.args());
        append(")");
    }

    @Override
    public void visitArgument(ArgumentNode node) {
        for (var argument : node.arguments()) {
            visit(argument);
            append(", ");
        }
        for (var kwarg : node.kwargs()) {
            visit(kwarg.key());
            append(" : ");
            visit(kwarg.value());
            append(", ");
        }
        trimTrailingSeparator();
    }

    @Override
    public void visitForeachClause(ForeachClauseNode node) {
        forceLineBreak();
        append("foreach ");
        var first = true;
        for (var variable : node.variables()) {
            if (!first) {
                append(", ");
            }
            visit(variable);
            first = false;
        }
        append(" : ");
        visit(node.items());
        block(node.block());
        append("endforeach");
        forceLineBreak();
    }

    @Override
    public void visitIfClause(IfClauseNode node) {
        var prefix = "if ";
        for (var branch : node.ifs()) {
            visit(branch, prefix);
            prefix = "elif ";
        }
        node.elseBlock()
            .ifPresent(elseBlock -> {
                append("else");
                block(elseBlock);
            });
        append("endif");
    }

    @Override
    public void visitIf(IfNode node) {
        visit(node.condition());
        block(node.block());
    }

    private void block(CodeBlockNode block) {
        var outer = indent();
        indent(outer + INDENT);
        forceLineBreak();
        visit(block);
        indent(outer);
        forceLineBreak();
    }
}
