package org.pragmatica.refactor.unparse;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.Common;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.parser.Token;
import org.pragmatica.refactor.parser.Tokenizer;
import org.pragmatica.refactor.text.Lines;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;
import org.pragmatica.refactor.tree.SourceSpan;
import org.pragmatica.refactor.tree.Trivia;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unparser that prefers the original source text of a node over re-synthesis.
 *
 * <p>For every positioned statement or expression the original segment is re-parsed on its own and reused
 * verbatim (re-indented to the current block) when it describes exactly the same tree. Comment lines that sit
 * directly above or below a retrieved statement, aligned with it, are written along with it, and so is a comment
 * trailing its last line. Everything else goes through the canonical {@link BaseUnparser} path.
 */
public class PreciseUnparser extends BaseUnparser {
    private static final Logger logger = LogManager.getLogger(PreciseUnparser.class);

    private final Set<Integer> visitedCommentLines = new HashSet<>();
    @Nullable
    private AstNode root;
    @Nullable
    private Lines sourceLines;
    @Nullable
    private int[] logicalStarts;
    @Nullable
    private Map<Integer, Trivia.Comment> commentLines;
    @Nullable
    private Map<Integer, Trivia.Comment> inlineComments;

    public PreciseUnparser(@Nullable String source) {
        super(source);
    }

    @Override
    protected void reset() {
        visitedCommentLines.clear();
        root = null;
    }

    @Override
    protected void traverse(AstNode node) {
        if (root == null) {
            root = node;
        }
        if (!retrieve(node)) {
            super.traverse(node);
        }
    }

    @Override
    protected void writeDocstring(AstNode statement) {
        if (!retrieve(statement)) {
            super.writeDocstring(statement);
        }
    }

    /**
     * Write the original text of the node if it can be recovered faithfully.
     */
    private boolean retrieve(AstNode node) {
        if (source == null || !node.hasPosition() || !(node.type().isStatement() || node.type().isExpression())) {
            return false;
        }
        try {
            var span = node.type().isStatement() ? Common.statementSpan(source, node) : node.span();
            var segment = span.extract(source);
            var base = logicalIndent(span.start().line());
            var normalized = reindent(segment, base, "");
            if (!matchesSource(node, normalized)) {
                return false;
            }
            var text = reindent(segment, base, "    ".repeat(indentLevel()));
            if (node.type().isStatement()) {
                writeStatement(node, span, text);
            } else {
                delimitIf("(", ")", needsParens(node, normalized), () -> write(text));
            }
            return true;
        } catch (RuntimeException e) {
            logger.trace("Falling back to synthesis for {} at {}", node.type(), node.span(), e);
            return false;
        }
    }

    private boolean matchesSource(AstNode node, String normalized) {
        try {
            if (node.type().isStatement()) {
                var body = PythonParser.parse(normalized).nodes("body");
                return body.size() == 1 && body.get(0).isSameAs(node);
            }
            var body = PythonParser.parse("(" + normalized + "\n)").nodes("body");
            return body.size() == 1 && body.get(0).is(NodeType.EXPR) && body.get(0).node("value").isSameAs(node);
        } catch (SyntaxErrorException e) {
            logger.trace("Segment of {} doesn't parse on its own: {}", node.type(), e.getMessage());
            return false;
        }
    }

    private boolean needsParens(AstNode node, String text) {
        return getPrecedence(node) > Precedence.of(node).ordinal() && !isEnclosed(text);
    }

    /**
     * Whether the whole text is one bracketed group opened by its first token.
     */
    private static boolean isEnclosed(String text) {
        var tokens = new ArrayList<Token>();
        for (var token : Tokenizer.scan(text).tokens()) {
            if (token instanceof Token.Op || token instanceof Token.Name
                || token instanceof Token.Number || token instanceof Token.Str) {
                tokens.add(token);
            }
        }
        if (tokens.isEmpty() || !tokens.get(0).text().equals("(")) {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            var op = tokens.get(i).text();
            if (tokens.get(i) instanceof Token.Op && ("(".equals(op) || "[".equals(op) || "{".equals(op))) {
                depth++;
            } else if (tokens.get(i) instanceof Token.Op && (")".equals(op) || "]".equals(op) || "}".equals(op))) {
                depth--;
                if (depth == 0) {
                    return i == tokens.size() - 1;
                }
            }
        }
        return false;
    }

    private void writeStatement(AstNode node, SourceSpan span, String text) {
        boolean withComments = node != root;
        if (withComments) {
            writeComments(commentsAbove(span));
        }
        fill();
        write(text);
        if (withComments) {
            writeTrailingComment(span);
            writeComments(commentsBelow(span));
        }
    }

    private void writeComments(List<Trivia.Comment> comments) {
        for (var comment : comments) {
            if (withinRoot(comment) && visitedCommentLines.add(comment.line())) {
                fill(comment.text());
            }
        }
    }

    /**
     * Comment following the statement on its last line, with the original gap in front of it.
     */
    private void writeTrailingComment(SourceSpan span) {
        var comment = inlineComments().get(span.end().line());
        if (comment == null || comment.column() < span.end().column()) {
            return;
        }
        var line = Lines.stripTerminator(sourceLines().get(span.end().line() - 1));
        var gap = line.substring(span.end().column(), comment.column());
        if (gap.isBlank() && withinRoot(comment) && visitedCommentLines.add(comment.line())) {
            write(gap + comment.text());
        }
    }

    /**
     * Comments outside a positioned root stay where they are in the source the output is spliced into.
     */
    private boolean withinRoot(Trivia.Comment comment) {
        var span = root == null ? null : root.span();
        if (span == null) {
            return true;
        }
        int offset = comment.span().start().offset();
        return offset >= span.start().offset() && offset < span.end().offset();
    }

    private List<Trivia.Comment> commentsAbove(SourceSpan span) {
        var result = new ArrayList<Trivia.Comment>();
        for (int line = span.start().line() - 1; line >= 1; line--) {
            var comment = alignedComment(line, span.start().column());
            if (comment == null) {
                break;
            }
            result.add(0, comment);
        }
        return result;
    }

    private List<Trivia.Comment> commentsBelow(SourceSpan span) {
        var result = new ArrayList<Trivia.Comment>();
        for (int line = span.end().line() + 1; ; line++) {
            var comment = alignedComment(line, span.start().column());
            if (comment == null) {
                return result;
            }
            result.add(comment);
        }
    }

    private @Nullable Trivia.Comment alignedComment(int line, int column) {
        var comment = commentLines().get(line);
        return comment != null && comment.column() == column ? comment : null;
    }

    /**
     * Comments that are the only content of their line, by 1-based line.
     */
    private Map<Integer, Trivia.Comment> commentLines() {
        if (commentLines == null) {
            classifyComments();
        }
        return commentLines;
    }

    /**
     * Comments following code on their line, by 1-based line.
     */
    private Map<Integer, Trivia.Comment> inlineComments() {
        if (inlineComments == null) {
            classifyComments();
        }
        return inlineComments;
    }

    private void classifyComments() {
        var lines = sourceLines();
        commentLines = new HashMap<>();
        inlineComments = new HashMap<>();
        for (var comment : tokens().comments()) {
            int index = comment.line() - 1;
            if (index >= lines.size()) {
                continue;
            }
            if (lines.get(index).substring(0, comment.column()).isBlank()) {
                commentLines.put(comment.line(), comment);
            } else {
                inlineComments.put(comment.line(), comment);
            }
        }
    }

    private Lines sourceLines() {
        if (sourceLines == null) {
            sourceLines = Lines.split(source == null ? "" : source);
        }
        return sourceLines;
    }

    /**
     * Leading whitespace of the line where the logical line containing {@code line} starts.
     */
    private String logicalIndent(int line) {
        var starts = logicalStarts();
        int start = line < starts.length && starts[line] > 0 ? starts[line] : line;
        var lines = sourceLines();
        return start <= lines.size() ? Lines.findIndent(Lines.stripTerminator(lines.get(start - 1))).indentation() : "";
    }

    private int[] logicalStarts() {
        if (logicalStarts == null) {
            var starts = new int[sourceLines().size() + 2];
            boolean atStart = true;
            int current = 1;
            for (var token : tokens().tokens()) {
                if (token instanceof Token.Newline) {
                    atStart = true;
                    continue;
                }
                if (token instanceof Token.Indent || token instanceof Token.Dedent
                    || token instanceof Token.EndMarker || token instanceof Token.Error) {
                    continue;
                }
                if (atStart) {
                    current = token.span().start().line();
                    atStart = false;
                }
                for (int l = token.span().start().line(); l <= token.span().end().line() && l < starts.length; l++) {
                    if (starts[l] == 0) {
                        starts[l] = current;
                    }
                }
            }
            logicalStarts = starts;
        }
        return logicalStarts;
    }

    /**
     * Move continuation lines of a segment from {@code base} indentation to {@code indentation}. Lines inside
     * string literals and blank lines are left alone.
     */
    private static String reindent(String segment, String base, String indentation) {
        var lines = Lines.split(segment);
        if (lines.size() < 2) {
            return segment;
        }
        var protectedLines = Lines.protectedLines(segment);
        for (int i = 1; i < lines.size(); i++) {
            var line = lines.get(i);
            if (protectedLines.get(i) || Lines.stripTerminator(line).isBlank()) {
                continue;
            }
            int strip = Math.min(base.length(), Lines.findIndent(line).indentation().length());
            lines.set(i, indentation + line.substring(strip));
        }
        return lines.join();
    }
}
