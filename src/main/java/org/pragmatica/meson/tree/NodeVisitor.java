package org.pragmatica.meson.tree;

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

/**
 * Visitor over every {@link Node} variant. Adding a variant breaks every visitor until it
 * handles the new kind.
 */
public interface NodeVisitor {
    void visitBoolean(BooleanNode node);

    void visitId(IdNode node);

    void visitNumber(NumberNode node);

    void visitString(StringNode node);

    void visitFormatString(FormatStringNode node);

    void visitMultilineFormatString(MultilineFormatStringNode node);

    void visitContinue(ContinueNode node);

    void visitBreak(BreakNode node);

    void visitArray(ArrayNode node);

    void visitDict(DictNode node);

    void visitEmpty(EmptyNode node);

    void visitOr(OrNode node);

    void visitAnd(AndNode node);

    void visitComparison(ComparisonNode node);

    void visitArithmetic(ArithmeticNode node);

    void visitNot(NotNode node);

    void visitUMinus(UMinusNode node);

    void visitCodeBlock(CodeBlockNode node);

    void visitIndex(IndexNode node);

    void visitMethod(MethodNode node);

    void visitFunction(FunctionNode node);

    void visitAssignment(AssignmentNode node);

    void visitPlusAssignment(PlusAssignmentNode node);

    void visitForeachClause(ForeachClauseNode node);

    void visitIfClause(IfClauseNode node);

    void visitIf(IfNode node);

    void visitParenthesized(ParenthesizedNode node);

    void visitTernary(TernaryNode node);

    void visitArgument(ArgumentNode node);
}
