package org.pragmatica.refactor.action;

import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.tree.AstNode;

/**
 * Replaces a node with a tree computed by {@link #build()}.
 */
public abstract class LazyReplace extends Action {
    protected LazyReplace(AstNode node) {
        super(node);
    }

    /**
     * Create the replacement node.
     */
    public abstract AstNode build();

    /**
     * Deep copy of the original node, free to be modified into the replacement.
     */
    public AstNode branch() {
        return node.copy();
    }

    @Override
    public String splice(AstNode anchor, Context anchorContext, Context originContext, String source) {
        return replaceSpan(source, editSpan(source, anchor), originContext.unparse(build()));
    }
}
