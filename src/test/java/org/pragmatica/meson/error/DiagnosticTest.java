package org.pragmatica.meson.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.meson.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticTest {

    @Test
    void format_primaryLabel_underlinesColumn() {
        var diagnostic = new ParseError("Expecting eof got id.", "meson.build", "x = 1 y", 1, 6).toDiagnostic();

        assertThat(diagnostic.format("x = 1 y\n")).isEqualTo("""
            error: Expecting eof got id.
              --> meson.build:1:6
              |
            1 | x = 1 y
              |       ^ here
              |
            """);
    }

    @Test
    void format_withoutFilename_showsPositionOnly() {
        var diagnostic = Diagnostic.error("Unexpected character '$'", null, SourceLocation.at(1, 0));

        assertThat(diagnostic.format("$\n")).startsWith("error: Unexpected character '$'\n  --> 1:0\n");
    }

    @Test
    void format_distantLabels_markSkippedLines() {
        var source = "a = 1\nb = 2\nc = 3\nd = (\n";
        var diagnostic = Diagnostic.error("Expecting rparen got eof.", "meson.build", SourceLocation.at(4, 4))
                                   .withLabel("here")
                                   .withSecondaryLabel(SourceLocation.at(1, 0), "first");

        assertThat(diagnostic.format(source)).isEqualTo("""
            error: Expecting rparen got eof.
              --> meson.build:4:4
              |
            1 | a = 1
              | - first
              ...
            4 | d = (
              |     ^ here
              |
            """);
    }

    @Test
    void formatSimple_isSingleLine() {
        var diagnostic = Diagnostic.warning("Deprecated", "meson.build", SourceLocation.at(2, 3));

        assertThat(diagnostic.formatSimple()).isEqualTo("meson.build:2:3: warning: Deprecated");
    }

    @Test
    void collectingSink_storesWarningsAsDiagnostics() {
        List<Diagnostic> target = new ArrayList<>();

        WarningSink.collecting(target)
                   .warn("Something odd", "meson.build", SourceLocation.at(1, 2));

        assertThat(target).hasSize(1);
        assertThat(target.get(0)
                         .severity()).isEqualTo(Diagnostic.Severity.WARNING);
        assertThat(target.get(0)
                         .location()).isEqualTo(SourceLocation.at(1, 2));
        assertThat(target.get(0)
                         .filename()).isEqualTo("meson.build");
        assertThat(target.get(0)
                         .formatSimple()).isEqualTo("meson.build:1:2: warning: Something odd");
    }

    @Test
    void loggingSink_acceptsWarnings() {
        WarningSink.logging()
                   .warn("Logged warning", "meson.build", SourceLocation.START);

        assertThat(WarningSink.logging()).isSameAs(LoggingWarningSink.INSTANCE);
    }
}
