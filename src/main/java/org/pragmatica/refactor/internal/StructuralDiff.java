package org.pragmatica.refactor.internal;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Field;
import org.pragmatica.refactor.tree.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classified delta between two revisions of one logical node.
 *
 * <p>Fields are compared in declaration order. A node of a different kind is reported as one
 * {@link ChangeType#FULL} change without looking inside; a list of a different length as one
 * {@link ChangeType#FIELD_SIZE} change without comparing items. Every field reports at most one change of its
 * own, child nodes are compared recursively.
 */
public final class StructuralDiff {
    private final List<ChangeSet> changes = new ArrayList<>();

    private StructuralDiff() {}

    /**
     * @throws IncompleteTreeException when a field holds a node in one revision and a plain value in the other
     */
    public static List<ChangeSet> diff(AstNode baseline, AstNode candidate) {
        var delta = new StructuralDiff();
        delta.compare(baseline, candidate);
        return List.copyOf(delta.changes);
    }

    private void compare(AstNode baseline, AstNode candidate) {
        if (baseline.type() != candidate.type()) {
            changes.add(ChangeSet.full(baseline, candidate));
            return;
        }
        for (var field : baseline.type().fields()) {
            compareField(baseline, candidate, field);
        }
    }

    private void compareField(AstNode baseline, AstNode candidate, Field field) {
        var name = field.name();
        var before = baseline.get(name);
        var after = candidate.get(name);
        if (!isConstantValue(baseline.type(), name)) {
            if (before == null && after != null) {
                changes.add(ChangeSet.onField(ChangeType.FIELD_ADDITION, baseline, candidate, name));
                return;
            }
            if (before != null && after == null) {
                changes.add(ChangeSet.onField(ChangeType.FIELD_REMOVAL, baseline, candidate, name));
                return;
            }
        }
        if (before instanceof AstNode beforeNode) {
            if (!(after instanceof AstNode afterNode)) {
                throw incomplete(baseline, name);
            }
            compare(beforeNode, afterNode);
        } else if (before instanceof List<?> beforeList) {
            if (!(after instanceof List<?> afterList)) {
                throw incomplete(baseline, name);
            }
            compareSequence(baseline, candidate, name, beforeList, afterList);
        } else {
            if (after instanceof AstNode || after instanceof List<?>) {
                throw incomplete(baseline, name);
            }
            if (!Objects.equals(before, after)) {
                changes.add(ChangeSet.onField(ChangeType.FIELD_VALUE, baseline, candidate, name));
            }
        }
    }

    private void compareSequence(AstNode baseline, AstNode candidate, String field, List<?> before, List<?> after) {
        if (before.size() != after.size()) {
            changes.add(ChangeSet.onField(ChangeType.FIELD_SIZE, baseline, candidate, field));
            return;
        }
        for (int index = 0; index < before.size(); index++) {
            var beforeItem = before.get(index);
            var afterItem = after.get(index);
            if (beforeItem == null || beforeItem instanceof AstNode) {
                if (beforeItem == null || afterItem == null) {
                    if (beforeItem != afterItem) {
                        changes.add(ChangeSet.onItem(ChangeType.FULL, baseline, candidate, field, index));
                    }
                } else if (afterItem instanceof AstNode afterNode) {
                    compare((AstNode) beforeItem, afterNode);
                } else {
                    throw incomplete(baseline, field + "[" + index + "]");
                }
            } else if (afterItem instanceof AstNode) {
                throw incomplete(baseline, field + "[" + index + "]");
            } else if (!beforeItem.equals(afterItem)) {
                changes.add(ChangeSet.onItem(ChangeType.ITEM_VALUE, baseline, candidate, field, index));
            }
        }
    }

    /**
     * Constant values may legitimately be {@code None}, so null there is a value, not an absent field.
     */
    private static boolean isConstantValue(NodeType type, String field) {
        return type == NodeType.CONSTANT && "value".equals(field);
    }

    private static IncompleteTreeException incomplete(AstNode node, @Nullable String field) {
        return new IncompleteTreeException("Incompatible values in " + node.type() + "." + field);
    }
}
