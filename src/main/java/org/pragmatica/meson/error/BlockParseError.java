package org.pragmatica.meson.error;

import org.pragmatica.meson.tree.SourceLocation;

/**
 * Block terminator mismatch. Reports both where the error was detected and where the
 * unterminated block started.
 */
public final class BlockParseError extends SyntaxError {
    private final String blockStartLine;
    private final int blockLine;
    private final int blockColumn;

    public BlockParseError(String reason,
                           String filename,
                           String sourceLine,
                           int line,
                           int column,
                           String blockStartLine,
                           int blockLine,
                           int blockColumn) {
        super(render(reason, sourceLine, line, column, blockStartLine, blockLine, blockColumn),
              reason,
              filename,
              sourceLine,
              line,
              column);
        this.blockStartLine = blockStartLine;
        this.blockLine = blockLine;
        this.blockColumn = blockColumn;
    }

    private static String render(String reason,
                                 String sourceLine,
                                 int line,
                                 int column,
                                 String blockStartLine,
                                 int blockLine,
                                 int blockColumn) {
        if (line == blockLine) {
            // Both points on one line: caret at the block start, underscores, caret at the error
            var gap = Math.max(0, column - blockColumn - 1);
            return reason + "\n" + sourceLine + "\n" + " ".repeat(blockColumn) + "^" + "_".repeat(gap) + "^";
        }
        return reason + "\n" + sourceLine + "\n" + caret(column)
               + "\nFor a block that started at " + blockLine + "," + blockColumn
               + "\n" + blockStartLine + "\n" + caret(blockColumn);
    }

    public String blockStartLine() {
        return blockStartLine;
    }

    public int blockLine() {
        return blockLine;
    }

    public int blockColumn() {
        return blockColumn;
    }

    public SourceLocation blockLocation() {
        return SourceLocation.at(blockLine, blockColumn);
    }

    @Override
    public Diagnostic toDiagnostic() {
        return super.toDiagnostic()
                    .withSecondaryLabel(blockLocation(), "block started here");
    }
}
