package org.pragmatica.meson.error;

import org.pragmatica.meson.tree.SourceLocation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Diagnostic message rendered with the offending source lines and labelled carets.
 *
 * <p>Example output:
 * <pre>
 * error: Expecting endif got eof.
 *   --> meson.build:3:0
 *    |
 *  1 | if true
 *    | - block started here
 *  3 |
 *    | ^ here
 *    |
 * </pre>
 *
 * @param severity Error severity level
 * @param message  Primary message
 * @param filename Source file name, may be null
 * @param location Where the problem was detected
 * @param labels   Labelled positions shown under the source lines
 */
public record Diagnostic(
    Severity severity,
    String message,
    String filename,
    SourceLocation location,
    List<Label> labels
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labelled position.
     *
     * @param location Position of the label
     * @param message  Label message
     * @param primary  Whether this is the primary label (shown with ^)
     */
    public record Label(SourceLocation location, String message, boolean primary) {
        public static Label primary(SourceLocation location, String message) {
            return new Label(location, message, true);
        }

        public static Label secondary(SourceLocation location, String message) {
            return new Label(location, message, false);
        }
    }

    public static Diagnostic error(String message, String filename, SourceLocation location) {
        return new Diagnostic(Severity.ERROR, message, filename, location, List.of());
    }

    public static Diagnostic warning(String message, String filename, SourceLocation location) {
        return new Diagnostic(Severity.WARNING, message, filename, location, List.of());
    }

    /**
     * Add a primary label at the diagnostic location.
     */
    public Diagnostic withLabel(String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(location, labelMessage));
        return new Diagnostic(severity, message, filename, location, List.copyOf(newLabels));
    }

    /**
     * Add a secondary label at a different position.
     */
    public Diagnostic withSecondaryLabel(SourceLocation labelLocation, String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelLocation, labelMessage));
        return new Diagnostic(severity, message, filename, location, List.copyOf(newLabels));
    }

    /**
     * Format with source excerpts. Only lines carrying a label are shown; skipped lines are
     * marked with an ellipsis.
     *
     * @param source The source text
     */
    public String format(String source) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append(severity.display())
          .append(": ")
          .append(firstLine(message))
          .append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename)
              .append(":");
        }
        sb.append(location.line())
          .append(":")
          .append(location.column())
          .append("\n");

        var shown = effectiveLabels();
        var lineNumbers = shown.stream()
                               .map(label -> label.location()
                                                  .line())
                               .distinct()
                               .sorted()
                               .toList();
        int maxLine = lineNumbers.isEmpty()
                      ? location.line()
                      : lineNumbers.get(lineNumbers.size() - 1);
        int gutterWidth = String.valueOf(maxLine)
                                .length();

        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");

        int previous = -1;
        for (var lineNum : lineNumbers) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            if (previous != -1 && lineNum > previous + 1) {
                sb.append(" ".repeat(gutterWidth))
                  .append(" ...\n");
            }
            previous = lineNum;

            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lineContent)
              .append("\n");

            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(formatMarkers(lineNum, shown))
              .append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");

        return sb.toString();
    }

    private List<Label> effectiveLabels() {
        if (labels.isEmpty()) {
            return List.of(Label.primary(location, ""));
        }
        return labels;
    }

    private static String formatMarkers(int lineNum, List<Label> labels) {
        var sb = new StringBuilder();
        int currentCol = 0;

        var sorted = labels.stream()
                           .filter(label -> label.location()
                                                 .line() == lineNum)
                           .sorted(Comparator.comparingInt(label -> label.location()
                                                                         .column()))
                           .toList();

        for (var label : sorted) {
            int col = label.location()
                           .column();
            while (currentCol < col) {
                sb.append(" ");
                currentCol++ ;
            }
            sb.append(label.primary()
                      ? '^'
                      : '-');
            currentCol++ ;
            if (!label.message()
                      .isEmpty()) {
                sb.append(" ")
                  .append(label.message());
                currentCol += label.message()
                                   .length() + 1;
            }
        }
        return sb.toString();
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline < 0
               ? text
               : text.substring(0, newline);
    }

    /**
     * Single-line format for log output.
     */
    public String formatSimple() {
        return String.format("%s:%d:%d: %s: %s",
                             filename,
                             location.line(),
                             location.column(),
                             severity.display(),
                             message);
    }
}
