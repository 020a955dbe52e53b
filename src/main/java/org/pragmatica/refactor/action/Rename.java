package org.pragmatica.refactor.action;

import org.pragmatica.refactor.Common;
import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.error.InvalidActionException;
import org.pragmatica.refactor.text.Lines;
import org.pragmatica.refactor.tree.AstNode;

/**
 * Changes only the name of a function or class definition, leaving the rest of its text untouched. Produced
 * by the action optimizer from a {@link Replace} whose target differs from the original in the name alone.
 *
 * <p>The identifier position belongs to the snapshot the action was built against, so a rename can't be
 * relocated onto another revision of the source.
 */
public final class Rename extends Action {
    private final AstNode target;
    private final Common.Position identifier;

    public Rename(AstNode node, AstNode target, Common.Position identifier) {
        super(node);
        this.target = target;
        this.identifier = identifier;
    }

    public AstNode target() {
        return target;
    }

    /**
     * Where the old name is spelled in the source.
     */
    public Common.Position identifier() {
        return identifier;
    }

    @Override
    public String splice(AstNode anchor, Context anchorContext, Context originContext, String source) {
        if (anchor != node) {
            throw new InvalidActionException("Rename of " + node.type() + " can't be relocated to " + anchor.type());
        }
        if (identifier.line() != identifier.endLine()) {
            throw new InvalidActionException("Identifier spans several lines: " + identifier);
        }
        var lines = Lines.split(source);
        var line = lines.get(identifier.line() - 1);
        lines.set(identifier.line() - 1,
                  line.substring(0, identifier.column()) + target.string("name") + line.substring(identifier.endColumn()));
        return lines.join();
    }
}
