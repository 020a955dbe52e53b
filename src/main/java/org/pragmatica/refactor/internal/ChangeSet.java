package org.pragmatica.refactor.internal;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.tree.AstNode;

/**
 * One divergence point found by {@link StructuralDiff}.
 *
 * @param type         kind of change
 * @param originalNode node of the baseline holding the change
 * @param newNode      corresponding node of the candidate
 * @param field        field the change is on, absent for {@link ChangeType#FULL} node changes
 * @param index        list index for item changes
 */
public record ChangeSet(ChangeType type, AstNode originalNode, AstNode newNode, @Nullable String field,
                        @Nullable Integer index) {

    static ChangeSet full(AstNode originalNode, AstNode newNode) {
        return new ChangeSet(ChangeType.FULL, originalNode, newNode, null, null);
    }

    static ChangeSet onField(ChangeType type, AstNode originalNode, AstNode newNode, String field) {
        return new ChangeSet(type, originalNode, newNode, field, null);
    }

    static ChangeSet onItem(ChangeType type, AstNode originalNode, AstNode newNode, String field, int index) {
        return new ChangeSet(type, originalNode, newNode, field, index);
    }
}
