package org.pragmatica.refactor.action;

import org.pragmatica.refactor.tree.AstNode;

/**
 * Adds a given tree as new lines right after the anchor statement.
 */
public class InsertAfter extends LazyInsertAfter {
    private final AstNode target;

    public InsertAfter(AstNode node, AstNode target) {
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
