package org.pragmatica.meson.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.meson.error.Diagnostic;
import org.pragmatica.meson.error.WarningSink;
import org.pragmatica.meson.tree.Node.EmptyNode;
import org.pragmatica.meson.tree.Node.IdNode;
import org.pragmatica.meson.tree.Node.NumberNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ArgumentsBuilderTest {
    private static final SourceLocation LIST_START = SourceLocation.at(3, 4);

    private final List<Diagnostic> warnings = new ArrayList<>();

    private ArgumentsBuilder builder() {
        return ArgumentsBuilder.argumentsAt("meson.build", LIST_START, WarningSink.collecting(warnings));
    }

    private static NodeInfo info(int column) {
        return NodeInfo.at("meson.build", SourceLocation.at(3, column), ByteSpan.at(column));
    }

    private static IdNode id(String name, int column) {
        return new IdNode(info(column), name);
    }

    private static NumberNode number(long value, int column) {
        return new NumberNode(info(column), value);
    }

    @Test
    void prepend_afterKeyword_setsOrderErrorAndWarnsOnce() {
        var second = number(2, 11);
        var third = number(3, 14);
        var args = builder().setKwarg(id("a", 5), number(1, 8))
                            .prepend(second)
                            .prepend(third)
                            .build(info(4));

        assertThat(args.orderError()).isTrue();
        assertThat(args.arguments()).containsExactly(third, second);
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)
                           .message()).isEqualTo(ArgumentsBuilder.ORDER_WARNING);
        assertThat(warnings.get(0)
                           .location()).isEqualTo(LIST_START);
    }

    @Test
    void prepend_beforeAnyKeyword_keepsOrder() {
        var args = builder().append(number(1, 5))
                            .prepend(number(0, 2))
                            .setKwarg(id("a", 8), number(2, 11))
                            .build(info(4));

        assertThat(args.orderError()).isFalse();
        assertThat(args.size()).isEqualTo(3);
        assertThat(warnings).isEmpty();
    }

    @Test
    void emptyArgument_isSkippedWithoutOrderCheck() {
        var args = builder().setKwarg(id("a", 5), number(1, 8))
                            .prepend(new EmptyNode(info(10)))
                            .append(new EmptyNode(info(12)))
                            .build(info(4));

        assertThat(args.arguments()).isEmpty();
        assertThat(args.orderError()).isFalse();
        assertThat(warnings).isEmpty();
    }

    @Test
    void setKwarg_duplicateKey_warnsAtKey() {
        var args = builder().setKwarg(id("a", 5), number(1, 8))
                            .setKwarg(id("a", 11), number(2, 14))
                            .build(info(4));

        assertThat(args.kwargs()).hasSize(2);
        assertThat(warnings).singleElement()
                            .satisfies(warning -> {
                                assertThat(warning.message()).startsWith("Keyword argument \"a\" defined multiple times.");
                                assertThat(warning.location()).isEqualTo(SourceLocation.at(3, 11));
                            });
    }

    @Test
    void setKwargNoCheck_acceptsRepeatedKeys() {
        builder().setKwargNoCheck(id("a", 5), number(1, 8))
                 .setKwargNoCheck(id("a", 11), number(2, 14))
                 .build(info(4));

        assertThat(warnings).isEmpty();
    }
}
