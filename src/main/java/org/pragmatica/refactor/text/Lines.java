package org.pragmatica.refactor.text;

import org.pragmatica.refactor.parser.Token;
import org.pragmatica.refactor.parser.Tokenizer;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Mutable line buffer. Every line keeps its own terminator ({@code \n}, {@code \r\n} or {@code \r}), so
 * {@code Lines.split(text).join()} returns {@code text} for any input.
 */
public final class Lines {
    private final List<String> lines;

    private Lines(List<String> lines) {
        this.lines = lines;
    }

    /**
     * Leading whitespace of a line prefix and the rest of that prefix.
     */
    public record Indent(String indentation, String remainder) {}

    public static Lines split(String source) {
        var result = new ArrayList<String>();
        int start = 0;
        int length = source.length();
        for (int i = 0; i < length; i++) {
            char c = source.charAt(i);
            if (c == '\n') {
                result.add(source.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                if (i + 1 < length && source.charAt(i + 1) == '\n') {
                    i++;
                }
                result.add(source.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < length) {
            result.add(source.substring(start));
        }
        return new Lines(result);
    }

    public static Lines of(List<String> lines) {
        return new Lines(new ArrayList<>(lines));
    }

    public String join() {
        return String.join("", lines);
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public String get(int index) {
        return lines.get(index);
    }

    public void set(int index, String line) {
        lines.set(index, line);
    }

    public List<String> asList() {
        return List.copyOf(lines);
    }

    /**
     * Lines {@code [from, to)} as a new buffer.
     */
    public Lines slice(int from, int to) {
        return new Lines(new ArrayList<>(lines.subList(from, to)));
    }

    /**
     * Replace lines {@code [from, to)} with the given lines.
     */
    public void replace(int from, int to, Lines replacement) {
        var view = lines.subList(from, to);
        view.clear();
        view.addAll(replacement.lines);
    }

    public void insert(int index, Lines inserted) {
        lines.addAll(index, inserted.lines);
    }

    public void remove(int from, int to) {
        lines.subList(from, to).clear();
    }

    /**
     * Newline convention of the buffer: the terminator of the first terminated line, {@code \n} when none.
     */
    public String newline() {
        for (var line : lines) {
            var terminator = terminatorOf(line);
            if (!terminator.isEmpty()) {
                return terminator;
            }
        }
        return "\n";
    }

    /**
     * Whether the last line is terminated (an empty buffer counts as terminated).
     */
    public boolean endsWithNewline() {
        return lines.isEmpty() || !terminatorOf(lines.get(lines.size() - 1)).isEmpty();
    }

    /**
     * Make sure the last line ends with a terminator.
     */
    public void terminate(String newline) {
        if (!endsWithNewline()) {
            int last = lines.size() - 1;
            lines.set(last, lines.get(last) + newline);
        }
    }

    /**
     * Rewrite every existing terminator to the given one.
     */
    public void convertTerminators(String newline) {
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            var terminator = terminatorOf(line);
            if (!terminator.isEmpty() && !terminator.equals(newline)) {
                lines.set(i, stripTerminator(line) + newline);
            }
        }
    }

    public static String terminatorOf(String line) {
        if (line.endsWith("\r\n")) {
            return "\r\n";
        }
        if (line.endsWith("\n") || line.endsWith("\r")) {
            return line.substring(line.length() - 1);
        }
        return "";
    }

    public static String stripTerminator(String line) {
        return line.substring(0, line.length() - terminatorOf(line).length());
    }

    public static Indent findIndent(String prefix) {
        int i = 0;
        while (i < prefix.length() && Character.isWhitespace(prefix.charAt(i))) {
            i++;
        }
        return new Indent(prefix.substring(0, i), prefix.substring(i));
    }

    /**
     * Decorate freshly synthesized lines for splicing into a buffer: the first line gets
     * {@code indentation + startPrefix}, every other line gets {@code indentation} unless it starts inside a
     * multi-line string, and {@code endSuffix} (which may carry the original terminator) is appended to the
     * last line.
     */
    public void applyIndentation(String indentation, String startPrefix, String endSuffix) {
        if (lines.isEmpty()) {
            lines.add("");
        }
        var protectedLines = protectedLines(join());
        for (int i = 0; i < lines.size(); i++) {
            if (i == 0) {
                lines.set(0, indentation + startPrefix + lines.get(0));
            } else if (!protectedLines.get(i)) {
                lines.set(i, indentation + lines.get(i));
            }
        }
        int last = lines.size() - 1;
        lines.set(last, lines.get(last) + endSuffix);
    }

    /**
     * Zero-based indexes of lines that start inside a string literal, where adding or removing whitespace
     * would change the literal's value.
     */
    public static BitSet protectedLines(String text) {
        var result = new BitSet();
        for (var token : Tokenizer.scan(text).tokens()) {
            if (token instanceof Token.Str && token.span().isMultiline()) {
                var span = token.span();
                // spans use 1-based lines, so start.line() is the index of the first continuation line
                result.set(span.start().line(), span.end().line());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return lines.toString();
    }
}
