package org.pragmatica.meson.parser;

import org.pragmatica.meson.lexer.Comment;
import org.pragmatica.meson.tree.Node;
import org.pragmatica.meson.tree.Node.ArgumentNode;
import org.pragmatica.meson.tree.Node.CodeBlockNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Distributes lexer comments over the nodes of a freshly parsed tree.
 *
 * <p>Each comment is tried against these rules, first match wins:
 * <ol>
 *   <li>innermost node containing the comment and ending on its line: {@code inline}</li>
 *   <li>nearest node ending before the comment on its line: {@code inline}</li>
 *   <li>nearest node starting after the comment, within the innermost node that contains the
 *       comment: {@code leading}</li>
 *   <li>nearest node ending before the comment, within that same node: {@code trailing}</li>
 * </ol>
 * Code blocks and argument lists receive comments only when the tree has no other node. Ties
 * between nodes at the same distance go to the outermost one.
 */
final class CommentAttacher {
    private static final Logger log = LoggerFactory.getLogger(CommentAttacher.class);

    private static final Comparator<Node> BY_LENGTH = Comparator.comparingInt(node -> node.span()
                                                                                          .length());

    private final List<Node> nodes;
    private final List<Node> candidates;

    CommentAttacher(List<Node> nodes) {
        this.nodes = nodes;
        var plain = nodes.stream()
                         .filter(node -> !isContainer(node))
                         .collect(Collectors.toList());
        this.candidates = plain.isEmpty()
                          ? nodes
                          : plain;
    }

    void attach(List<Comment> comments) {
        if (nodes.isEmpty()) {
            if (!comments.isEmpty()) {
                log.debug("No nodes to attach {} comments to, dropping them", comments.size());
            }
            return;
        }
        comments.forEach(this::attach);
    }

    private void attach(Comment comment) {
        var enclosing = enclosingOnLine(comment);
        if (enclosing.isPresent()) {
            enclosing.get()
                     .comments()
                     .addInline(comment);
            return;
        }
        var beforeOnLine = precedingOnLine(comment);
        if (beforeOnLine.isPresent()) {
            beforeOnLine.get()
                        .comments()
                        .addInline(comment);
            return;
        }

        var scope = scopeOf(comment);
        var inScope = scope.map(this::within)
                           .filter(list -> !list.isEmpty())
                           .orElse(candidates);

        var following = following(inScope, comment);
        if (following.isPresent()) {
            following.get()
                     .comments()
                     .addLeading(comment);
            return;
        }
        var preceding = preceding(inScope, comment);
        if (preceding.isPresent()) {
            preceding.get()
                     .comments()
                     .addTrailing(comment);
            return;
        }
        // Only nodes surrounding the comment remain
        scope.orElse(candidates.get(0))
             .comments()
             .addLeading(comment);
    }

    private Optional<Node> enclosingOnLine(Comment comment) {
        return candidates.stream()
                         .filter(node -> node.span()
                                             .touches(comment.span()
                                                             .start()))
                         .filter(node -> node.info()
                                             .end()
                                             .line() == comment.line())
                         .min(BY_LENGTH);
    }

    private Optional<Node> precedingOnLine(Comment comment) {
        return candidates.stream()
                         .filter(node -> endsOnLineBefore(node, comment))
                         .max(Comparator.<Node>comparingInt(node -> node.info()
                                                                        .end()
                                                                        .column())
                                        .thenComparing(BY_LENGTH));
    }

    /**
     * A node ending at column 0 ended with a line break and has no text on that line.
     */
    private static boolean endsOnLineBefore(Node node, Comment comment) {
        var end = node.info()
                      .end();
        return end.line() == comment.line() && end.column() > 0 && end.column() <= comment.column();
    }

    private Optional<Node> scopeOf(Comment comment) {
        return nodes.stream()
                    .filter(node -> node.span()
                                        .encloses(comment.span()))
                    .min(BY_LENGTH);
    }

    private List<Node> within(Node scope) {
        return candidates.stream()
                         .filter(node -> node != scope && scope.span()
                                                               .encloses(node.span()))
                         .collect(Collectors.toList());
    }

    private static Optional<Node> following(List<Node> inScope, Comment comment) {
        return inScope.stream()
                      .filter(node -> node.span()
                                          .start() >= comment.span()
                                                             .end())
                      .min(Comparator.<Node>comparingInt(node -> node.span()
                                                                     .start())
                                     .thenComparing(BY_LENGTH.reversed()));
    }

    private static Optional<Node> preceding(List<Node> inScope, Comment comment) {
        return inScope.stream()
                      .filter(node -> node.span()
                                          .end() <= comment.span()
                                                           .start())
                      .max(Comparator.<Node>comparingInt(node -> node.span()
                                                                     .end())
                                     .thenComparing(BY_LENGTH));
    }

    private static boolean isContainer(Node node) {
        return node instanceof CodeBlockNode || node instanceof ArgumentNode;
    }
}
