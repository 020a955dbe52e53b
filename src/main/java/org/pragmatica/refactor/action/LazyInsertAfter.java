package org.pragmatica.refactor.action;

import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.error.InvalidActionException;
import org.pragmatica.refactor.tree.AstNode;

/**
 * Adds the tree computed by {@link #build()} as new lines right after the anchor statement, at the anchor's
 * indentation.
 */
public abstract class LazyInsertAfter extends Action {
    protected LazyInsertAfter(AstNode node) {
        super(node);
        if (!node.type().isStatement()) {
            throw new InvalidActionException("Statements can only be inserted after statements, not " + node.type());
        }
    }

    public abstract AstNode build();

    @Override
    public String splice(AstNode anchor, Context anchorContext, Context originContext, String source) {
        return insertLines(source, editSpan(source, anchor), true, originContext.unparse(build()));
    }
}
