package org.pragmatica.meson;

import org.pragmatica.meson.error.WarningSink;
import org.pragmatica.meson.format.ConfigurableFormatter;
import org.pragmatica.meson.format.FixedStyleFormatter;
import org.pragmatica.meson.format.FormatterConfig;
import org.pragmatica.meson.parser.Parser;
import org.pragmatica.meson.tree.Node.CodeBlockNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry points for parsing and formatting Meson build definitions.
 *
 * <pre>{@code
 * var root = MesonSyntax.parse(code, "meson.build");
 * var lines = MesonSyntax.format(code, "meson.build", FormatterConfig.DEFAULT);
 * }</pre>
 *
 * All methods throw {@link org.pragmatica.meson.error.SyntaxError} when the input is malformed.
 */
public final class MesonSyntax {
    private static final Logger log = LoggerFactory.getLogger(MesonSyntax.class);

    private MesonSyntax() {}

    /**
     * Parse source text, reporting warnings through SLF4J.
     */
    public static CodeBlockNode parse(String code, String filename) {
        return parse(code, filename, WarningSink.logging());
    }

    /**
     * Parse source text with comments attached to the resulting tree.
     */
    public static CodeBlockNode parse(String code, String filename, WarningSink warnings) {
        return new Parser(code, filename, warnings).parse();
    }

    /**
     * Format source text with the default configurable style.
     */
    public static List<String> format(String code, String filename) {
        return format(code, filename, FormatterConfig.DEFAULT);
    }

    public static List<String> format(String code, String filename, FormatterConfig config) {
        var root = parse(code, filename);
        var lines = new ConfigurableFormatter(config).format(root);
        log.debug("Formatted {} into {} lines", filename, lines.size());
        return lines;
    }

    /**
     * Format source text with the fixed two-space style.
     */
    public static List<String> formatFixed(String code, String filename) {
        var root = parse(code, filename);
        var lines = new FixedStyleFormatter().format(root);
        log.debug("Formatted {} into {} lines (fixed style)", filename, lines.size());
        return lines;
    }

    /**
     * Join formatted lines into file content ending with a newline.
     */
    public static String render(List<String> lines) {
        return lines.isEmpty()
               ? ""
               : String.join("\n", lines) + "\n";
    }
}
