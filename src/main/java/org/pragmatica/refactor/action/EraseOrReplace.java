package org.pragmatica.refactor.action;

import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Nodes;

/**
 * Erases a statement, or replaces it with a placeholder ({@code pass} unless given) when it is the only
 * statement of its block.
 */
public class EraseOrReplace extends Erase {
    private final AstNode replacement;

    public EraseOrReplace(AstNode node) {
        this(node, Nodes.pass());
    }

    public EraseOrReplace(AstNode node, AstNode replacement) {
        super(node);
        this.replacement = replacement;
    }

    public AstNode replacement() {
        return replacement;
    }

    @Override
    public String splice(AstNode anchor, Context anchorContext, Context originContext, String source) {
        if (isErasable(anchor, anchorContext)) {
            return super.splice(anchor, anchorContext, originContext, source);
        }
        return replaceSpan(source, editSpan(source, anchor), originContext.unparse(replacement));
    }
}
