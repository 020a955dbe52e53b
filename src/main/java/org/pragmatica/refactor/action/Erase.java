package org.pragmatica.refactor.action;

import org.pragmatica.refactor.context.Ancestry;
import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.error.InvalidActionException;
import org.pragmatica.refactor.text.Lines;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;

import java.util.List;

/**
 * Removes a statement.
 *
 * <p>A statement alone on its lines is removed with those lines. A statement sharing a line with a sibling
 * ({@code a; b}) loses only its own text and the separating semicolon. Erasing the only statement of a block
 * is invalid since it would leave the block empty.
 */
public class Erase extends Action {
    public Erase(AstNode node) {
        super(node);
        if (!node.type().isStatement()) {
            throw new InvalidActionException("Only statements can be erased, not " + node.type());
        }
    }

    /**
     * Whether the anchor can be removed without emptying its block.
     */
    public boolean isErasable(AstNode anchor, Context anchorContext) {
        var link = parentLink(anchor, anchorContext);
        return link.parent().is(NodeType.MODULE) || link.parent().nodes(link.field()).size() > 1;
    }

    @Override
    public String splice(AstNode anchor, Context anchorContext, Context originContext, String source) {
        if (!isErasable(anchor, anchorContext)) {
            throw new InvalidActionException("Erasing the only statement of a block would leave it empty: "
                                             + anchor.type() + " at " + anchor.span());
        }
        var link = parentLink(anchor, anchorContext);
        var siblings = link.parent().nodes(link.field());
        int index = indexOf(siblings, anchor);
        var span = editSpan(source, anchor);

        var next = index + 1 < siblings.size() ? siblings.get(index + 1) : null;
        if (next != null && next.line() == span.end().line()) {
            return source.substring(0, span.start().offset()) + source.substring(editSpan(source, next).start().offset());
        }
        var previous = index > 0 ? siblings.get(index - 1) : null;
        if (previous != null && previous.endLine() == span.start().line()) {
            return source.substring(0, previous.span().end().offset()) + source.substring(span.end().offset());
        }
        return removeLines(source, span.start().line() - 1, span.end().line());
    }

    private static String removeLines(String source, int from, int to) {
        var lines = Lines.split(source);
        boolean terminated = lines.endsWithNewline();
        lines.remove(from, to);
        if (!terminated && !lines.isEmpty()) {
            int last = lines.size() - 1;
            lines.set(last, Lines.stripTerminator(lines.get(last)));
        }
        return lines.join();
    }

    private static Ancestry.Link parentLink(AstNode anchor, Context context) {
        return context.ancestry()
                      .infer(anchor)
                      .orElseThrow(() -> new InvalidActionException("Can't erase the module itself"));
    }

    private static int indexOf(List<AstNode> siblings, AstNode anchor) {
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == anchor) {
                return i;
            }
        }
        throw new IllegalStateException("Statement is missing from its block");
    }
}
