package org.pragmatica.refactor.action;

import org.pragmatica.refactor.tree.AstNode;

/**
 * Replaces a node with a given tree.
 */
public class Replace extends LazyReplace {
    private final AstNode target;

    public Replace(AstNode node, AstNode target) {
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
