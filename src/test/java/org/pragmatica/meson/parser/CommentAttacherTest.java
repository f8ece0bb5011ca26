package org.pragmatica.meson.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.meson.error.WarningSink;
import org.pragmatica.meson.lexer.Comment;
import org.pragmatica.meson.tree.Node;
import org.pragmatica.meson.tree.Node.AssignmentNode;
import org.pragmatica.meson.tree.Node.CodeBlockNode;
import org.pragmatica.meson.tree.Node.FunctionNode;
import org.pragmatica.meson.tree.Node.IfClauseNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CommentAttacherTest {

    private static CodeBlockNode parse(String code) {
        return new Parser(code, "meson.build", WarningSink.collecting(new ArrayList<>())).parse();
    }

    private static List<String> texts(List<Comment> comments) {
        return comments.stream()
                       .map(Comment::text)
                       .toList();
    }

    @Test
    void ownLineComment_becomesLeadingCommentOfNextStatement() {
        var root = parse("x = 1\n# about y\ny = 2\n");

        var y = root.lines()
                    .get(1);
        assertThat(texts(y.comments()
                          .leading())).containsExactly("# about y");
        assertThat(root.lines()
                       .get(0)
                       .comments()
                       .isEmpty()).isTrue();
    }

    @Test
    void sameLineComment_becomesInlineCommentOfStatement() {
        var root = parse("x = 1 # one\nmessage('hi') # greet\n");

        var assignment = (AssignmentNode) root.lines()
                                              .get(0);
        assertThat(texts(assignment.comments()
                                   .inline())).containsExactly("# one");
        assertThat(assignment.value()
                             .comments()
                             .isEmpty()).isTrue();

        var call = (FunctionNode) root.lines()
                                      .get(1);
        assertThat(texts(call.comments()
                             .inline())).containsExactly("# greet");
        assertThat(call.name()
                       .comments()
                       .isEmpty()).isTrue();
    }

    @Test
    void commentAtEndOfFile_becomesTrailingCommentOfLastStatement() {
        var root = parse("x = 1\n# the end\n");

        var assignment = root.lines()
                             .get(0);
        assertThat(texts(assignment.comments()
                                   .trailing())).containsExactly("# the end");
    }

    @Test
    void commentInsideBlock_attachesToStatementInThatBlock() {
        var root = parse("if a\n  # why\n  x = 1\nendif\n");

        var clause = (IfClauseNode) root.lines()
                                        .get(0);
        var statement = clause.ifs()
                              .get(0)
                              .block()
                              .lines()
                              .get(0);
        assertThat(texts(statement.comments()
                                  .leading())).containsExactly("# why");
        assertThat(clause.comments()
                         .isEmpty()).isTrue();
    }

    @Test
    void commentAfterCondition_attachesInlineToCondition() {
        var root = parse("if a # check\n  x = 1\nendif\n");

        var clause = (IfClauseNode) root.lines()
                                        .get(0);
        var condition = clause.ifs()
                              .get(0)
                              .condition();
        assertThat(texts(condition.comments()
                                  .inline())).containsExactly("# check");
    }

    @Test
    void commentAfterEndif_attachesInlineToClause() {
        var root = parse("if a\n  x = 1\nendif # done\n");

        assertThat(texts(root.lines()
                             .get(0)
                             .comments()
                             .inline())).containsExactly("# done");
    }

    @Test
    void commentBetweenArguments_attachesToPrecedingArgument() {
        var root = parse("foo(a, # first\n  b)\n");

        var call = (FunctionNode) root.lines()
                                      .get(0);
        Node first = call.args()
                         .arguments()
                         .get(0);
        assertThat(texts(first.comments()
                              .inline())).containsExactly("# first");
    }

    @Test
    void commentOnlyFile_attachesToRootBlock() {
        var root = parse("# only\n");

        assertThat(root.lines()).isEmpty();
        assertThat(texts(root.comments()
                             .leading())).containsExactly("# only");
    }

    @Test
    void everyComment_isAttachedExactlyOnce() {
        var root = parse("""
            # header
            project('demo') # name
            if true
              # inside
              x = [
                1, # one
                2,
              ]
            endif # end
            # footer
            """);

        assertThat(countComments(root)).isEqualTo(6);
    }

    private static int countComments(Node node) {
        int count = node.comments()
                        .size();
        for (var child : node.children()) {
            count += countComments(child);
        }
        return count;
    }
}
