package org.pragmatica.refactor.error;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.tree.SourceLocation;
import org.pragmatica.refactor.tree.SourceSpan;

/**
 * Error report rendered against the source it refers to.
 *
 * <p>Example output:
 * <pre>
 * error: Unexpected ')' at 3:9, expected expression
 *   --> module.py:3:10
 *    |
 *  3 | x = (1 +)
 *    |          ^ expected expression
 *    |
 * </pre>
 *
 * @param message Primary error message
 * @param span    Source span where the problem occurred
 * @param label   Optional label printed next to the underline
 */
public record Diagnostic(String message, SourceSpan span, @Nullable String label) {

    public static Diagnostic error(String message, SourceLocation location) {
        return new Diagnostic(message, SourceSpan.at(location), null);
    }

    public Diagnostic withLabel(String label) {
        return new Diagnostic(message, span, label);
    }

    /**
     * Render the diagnostic with the offending lines underlined.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     */
    public String format(String source, @Nullable String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\r\n|\r|\n", -1);
        var loc = span.start();

        sb.append("error: ").append(message).append("\n");
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        // columns are displayed 1-based
        sb.append(loc.line()).append(":").append(loc.column() + 1).append("\n");

        int firstLine = span.start().line();
        int lastLine = Math.max(firstLine, span.end().line());
        int gutterWidth = String.valueOf(lastLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (int lineNum = firstLine; lineNum <= lastLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var content = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum)).append(" | ").append(content).append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ").append(underline(lineNum, content)).append("\n");
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        return sb.toString();
    }

    private String underline(int lineNum, String content) {
        int startCol = span.start().line() == lineNum ? span.start().column() : 0;
        int endCol = span.end().line() == lineNum ? span.end().column() : content.length();
        var sb = new StringBuilder(" ".repeat(Math.max(0, startCol)));
        sb.append("^".repeat(Math.max(1, endCol - startCol)));
        if (label != null && lineNum == span.end().line()) {
            sb.append(" ").append(label);
        }
        return sb.toString();
    }
}
