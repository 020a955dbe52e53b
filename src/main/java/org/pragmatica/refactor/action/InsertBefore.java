package org.pragmatica.refactor.action;

import org.pragmatica.refactor.tree.AstNode;

/**
 * Adds a given tree as new lines right before the anchor statement.
 */
public class InsertBefore extends LazyInsertBefore {
    private final AstNode target;

    public InsertBefore(AstNode node, AstNode target) {
        super(node);
        this.target = target;
    }

    public AstNode target() {
        return target;
    }

    @Override
    public AstNode build() {
        return target;
    }
}
