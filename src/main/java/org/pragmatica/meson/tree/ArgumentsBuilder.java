package org.pragmatica.meson.tree;

import org.pragmatica.meson.error.WarningSink;
import org.pragmatica.meson.tree.Node.ArgumentNode;
import org.pragmatica.meson.tree.Node.EmptyNode;
import org.pragmatica.meson.tree.Node.IdNode;
import org.pragmatica.meson.tree.Node.KeywordArgument;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable accumulator for the contents of an argument list, frozen into an {@link ArgumentNode}
 * once the closing bracket is reached.
 */
public final class ArgumentsBuilder {
    static final String ORDER_WARNING = "All keyword arguments must be after positional arguments.";

    private final String filename;
    private final SourceLocation location;
    private final WarningSink warnings;
    private final List<Node> arguments = new ArrayList<>();
    private final List<KeywordArgument> kwargs = new ArrayList<>();
    private boolean orderError;

    private ArgumentsBuilder(String filename, SourceLocation location, WarningSink warnings) {
        this.filename = filename;
        this.location = location;
        this.warnings = warnings;
    }

    /**
     * Builder for an argument list starting at the given position. Warnings are reported
     * against that position unless they concern a specific key.
     */
    public static ArgumentsBuilder argumentsAt(String filename, SourceLocation location, WarningSink warnings) {
        return new ArgumentsBuilder(filename, location, warnings);
    }

    public ArgumentsBuilder append(Node argument) {
        if (argument instanceof EmptyNode) {
            return this;
        }
        checkOrder();
        arguments.add(argument);
        return this;
    }

    public ArgumentsBuilder prepend(Node argument) {
        if (argument instanceof EmptyNode) {
            return this;
        }
        checkOrder();
        arguments.add(0, argument);
        return this;
    }

    /**
     * Add a keyword argument of a call. A repeated key is kept, but reported.
     */
    public ArgumentsBuilder setKwarg(IdNode key, Node value) {
        if (hasIdKey(key.value())) {
            warnings.warn("Keyword argument \"" + key.value() + "\" defined multiple times. "
                          + "This will be an error in future Meson releases.",
                          filename,
                          key.info().start());
        }
        kwargs.add(new KeywordArgument(key, value));
        return this;
    }

    /**
     * Add a dictionary entry. Keys are arbitrary expressions and are not checked for duplicates.
     */
    public ArgumentsBuilder setKwargNoCheck(Node key, Node value) {
        kwargs.add(new KeywordArgument(key, value));
        return this;
    }

    public ArgumentNode build(NodeInfo info) {
        return new ArgumentNode(info, arguments, kwargs, orderError);
    }

    private void checkOrder() {
        if (kwargs.isEmpty() || orderError) {
            return;
        }
        orderError = true;
        warnings.warn(ORDER_WARNING, filename, location);
    }

    private boolean hasIdKey(String name) {
        return kwargs.stream()
                     .map(KeywordArgument::key)
                     .anyMatch(key -> key instanceof IdNode id && id.value()
                                                                   .equals(name));
    }
}
