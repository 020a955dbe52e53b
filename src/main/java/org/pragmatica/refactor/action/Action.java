package org.pragmatica.refactor.action;

import org.pragmatica.refactor.Common;
import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.error.InvalidActionException;
import org.pragmatica.refactor.text.Lines;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.SourceSpan;

/**
 * One textual edit anchored on a node of a source snapshot.
 *
 * <p>An action is a value: it records the node it was built against and produces new source text on demand.
 * Replacement nodes are turned into text by the unparser of the context the action was built against, while
 * the edit itself may land on a stand-in for the original node in a later revision of the source.
 */
public abstract class Action {
    protected final AstNode node;

    protected Action(AstNode node) {
        if (!node.hasPosition()) {
            throw new InvalidActionException("Can't anchor an action on an unpositioned " + node.type() + " node");
        }
        this.node = node;
    }

    /**
     * The node the action was built against.
     */
    public AstNode node() {
        return node;
    }

    /**
     * Apply the action to the source its node was parsed from.
     */
    public String apply(Context context, String source) {
        return splice(node, context, context, source);
    }

    /**
     * Apply the action to {@code source} at {@code anchor}, the node of {@code anchorContext}'s tree standing
     * in for {@link #node()}.
     *
     * @param anchor        where the edit lands
     * @param anchorContext snapshot {@code source} and {@code anchor} belong to
     * @param originContext snapshot the action was built against, used to unparse replacement nodes
     * @param source        text to edit
     */
    public abstract String splice(AstNode anchor, Context anchorContext, Context originContext, String source);

    /**
     * Span an edit of the node covers: statements include their decorators.
     */
    protected static SourceSpan editSpan(String source, AstNode anchor) {
        return anchor.type().isStatement() ? Common.statementSpan(source, anchor) : anchor.span();
    }

    /**
     * Replace the text of {@code span} with {@code text}, keeping what precedes the span on its first line and
     * what follows it on its last line. Continuation lines of the new text get the first line's indentation.
     */
    protected static String replaceSpan(String source, SourceSpan span, String text) {
        var lines = Lines.split(source);
        var first = lines.get(span.start().line() - 1);
        var last = lines.get(span.end().line() - 1);
        var indent = Lines.findIndent(first.substring(0, span.start().column()));
        var endSuffix = last.substring(span.end().column());

        var replacement = Lines.split(text);
        replacement.convertTerminators(lines.newline());
        replacement.applyIndentation(indent.indentation(), indent.remainder(), endSuffix);
        lines.replace(span.start().line() - 1, span.end().line(), replacement);
        return lines.join();
    }

    /**
     * Insert {@code text} as new lines right before or after the lines of {@code span}, indented like the first
     * of them. A missing newline at the end of the source stays missing.
     */
    protected static String insertLines(String source, SourceSpan span, boolean after, String text) {
        var lines = Lines.split(source);
        var newline = lines.newline();
        var first = lines.get(span.start().line() - 1);
        var indentation = Lines.findIndent(first.substring(0, span.start().column())).indentation();

        var inserted = Lines.split(text);
        inserted.convertTerminators(newline);
        inserted.applyIndentation(indentation, "", "");
        int index = after ? span.end().line() : span.start().line() - 1;
        if (index == lines.size() && !lines.endsWithNewline()) {
            lines.terminate(newline);
        } else {
            inserted.terminate(newline);
        }
        lines.insert(index, inserted);
        return lines.join();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + node.type() + " at " + node.span() + "]";
    }
}
