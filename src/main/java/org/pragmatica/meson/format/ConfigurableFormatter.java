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
 * Formatter driven by a {@link FormatterConfig}.
 *
 * <p>Positional arguments stay on the line of the call. Keyword arguments always go one per line,
 * one level deeper than the call, with the closing bracket on a line of its own:
 * <pre>
 * executable('app', 'main.c',
 *     install: true,
 *     dependencies: deps
 * )
 * </pre>
 */
public final class ConfigurableFormatter extends AbstractFormatter {
    private final FormatterConfig config;

    public ConfigurableFormatter(FormatterConfig config) {
        this.config = config;
    }

    public ConfigurableFormatter() {
        this(FormatterConfig.DEFAULT);
    }

    @Override
    public void visitArray(ArrayNode node) {
        var padded = config.spaceArray() && !node.args()
                                                 .arguments()
                                                 .isEmpty();
        append("[");
        if (padded) {
            append(" ");
        }
        visit(node.args());
        if (padded) {
            append(" ");
        }
        append("]");
    }

    @Override
    public void visitIndex(IndexNode node) {
        visit(node.object());
        append("[");
        if (config.spaceArray()) {
            append(" ");
        }
        visit(node.index());
        if (config.spaceArray()) {
            append(" ");
        }
        append("]");
    }

    @Override
    public void visitMethod(MethodNode node) {
        visit(node.source());
        append(".");
        visit(node.name());
        callArguments(node.args());
    }

    @Override
    public void visitFunction(FunctionNode node) {
        visit(node.name());
        callArguments(node.args());
    }

    private void callArguments(ArgumentNode args) {
        append("(");
        if (!args.isEmpty() || !args.comments()
                                    .isEmpty()) {
            visit(args);
        }
        append(")");
    }

    @Override
    public void visitArgument(ArgumentNode node) {
        for (var argument : node.arguments()) {
            visit(argument);
            append(", ");
        }

        var outer = indent();
        var colon = config.wideColon()
                    ? " : "
                    : ": ";
        indent(outer + config.indentBy());
        var kwargs = node.kwargs();
        for (int i = 0; i < kwargs.size(); i++) {
            var kwarg = kwargs.get(i);
            forceLineBreak();
            visit(kwarg.key());
            append(colon);
            visit(kwarg.value());
            if (i == kwargs.size() - 1) {
                indent(outer);
                forceLineBreak();
            } else {
                append(",");
            }
        }
        indent(outer);
        trimTrailingSeparator();
    }

    @Override
    public void visitForeachClause(ForeachClauseNode node) {
        append("foreach ");
        for (int i = 0; i < node.variables()
                                 .size(); i++) {
            if (i > 0) {
                append(", ");
            }
            visit(node.variables()
                      .get(i));
        }
        append(" : ");
        visit(node.items());
        block(node.block());
        append("endforeach");
    }

    @Override
    public void visitIfClause(IfClauseNode node) {
        var outer = indent();
        var prefix = "if ";
        for (var branch : node.ifs()) {
            indent(outer);
            forceLineBreak();
            visit(branch, prefix);
            prefix = "elif ";
            indent(outer);
            forceLineBreak();
        }
        node.elseBlock()
            .ifPresent(elseBlock -> {
                append("else");
                block(elseBlock);
            });
        indent(outer);
        append("endif");
        forceLineBreak();
    }

    @Override
    public void visitIf(IfNode node) {
        visit(node.condition());
        block(node.block());
    }

    /**
     * Render a nested block one level deeper, then return to the enclosing indentation.
     */
    private void block(CodeBlockNode block) {
        var outer = indent();
        indent(outer + config.indentBy());
        forceLineBreak();
        visit(block);
        indent(outer);
        forceLineBreak();
    }
}
