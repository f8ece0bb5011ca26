package org.pragmatica.meson.tree;

import org.pragmatica.meson.lexer.Comment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Comments attached to a node after parsing.
 *
 * <ul>
 *   <li>leading - on their own lines before the node</li>
 *   <li>inline - on the same line, after the node</li>
 *   <li>trailing - on their own lines after the node</li>
 * </ul>
 *
 * Lists only grow; they are filled by the comment attacher and read by formatters.
 */
public final class NodeComments {
    private final List<Comment> leading = new ArrayList<>();
    private final List<Comment> inline = new ArrayList<>();
    private final List<Comment> trailing = new ArrayList<>();

    public static NodeComments empty() {
        return new NodeComments();
    }

    public List<Comment> leading() {
        return Collections.unmodifiableList(leading);
    }

    public List<Comment> inline() {
        return Collections.unmodifiableList(inline);
    }

    public List<Comment> trailing() {
        return Collections.unmodifiableList(trailing);
    }

    public void addLeading(Comment comment) {
        leading.add(comment);
    }

    public void addInline(Comment comment) {
        inline.add(comment);
    }

    public void addTrailing(Comment comment) {
        trailing.add(comment);
    }

    public boolean isEmpty() {
        return leading.isEmpty() && inline.isEmpty() && trailing.isEmpty();
    }

    public int size() {
        return leading.size() + inline.size() + trailing.size();
    }

    @Override
    public String toString() {
        return "NodeComments[leading=" + leading.size() + ", inline=" + inline.size() + ", trailing=" + trailing.size() + "]";
    }
}
