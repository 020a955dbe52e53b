package org.pragmatica.refactor.internal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.refactor.action.Action;
import org.pragmatica.refactor.action.Rename;
import org.pragmatica.refactor.action.Replace;
import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Narrows freshly built actions to smaller edits with the same outcome.
 */
public final class ActionOptimizer {
    private static final Logger logger = LogManager.getLogger(ActionOptimizer.class);

    private static final List<BiFunction<Action, Context, Optional<Action>>> OPTIMIZATIONS =
        List.of(ActionOptimizer::renameOptimizer);

    private ActionOptimizer() {}

    public static Action optimize(Action action, Context context) {
        var result = action;
        for (var optimization : OPTIMIZATIONS) {
            var optimized = optimization.apply(result, context);
            if (optimized.isPresent()) {
                logger.debug("Optimized {} into {}", result, optimized.get());
                result = optimized.get();
            }
        }
        return result;
    }

    /**
     * A replace of a function or class definition that only changes its name becomes a {@link Rename}.
     */
    static Optional<Action> renameOptimizer(Action action, Context context) {
        if (!(action instanceof Replace replace)) {
            return Optional.empty();
        }
        var node = replace.node();
        var target = replace.target();
        if (!isNamed(node) || !isNamed(target) || Objects.equals(node.string("name"), target.string("name"))) {
            return Optional.empty();
        }
        List<ChangeSet> changes;
        try {
            changes = StructuralDiff.diff(node, target);
        } catch (IncompleteTreeException e) {
            logger.debug("Can't compare {} with its replacement: {}", node.type(), e.getMessage());
            return Optional.empty();
        }
        if (changes.size() != 1) {
            return Optional.empty();
        }
        var change = changes.get(0);
        if (change.type() != ChangeType.FIELD_VALUE || change.originalNode() != node
            || change.newNode() != target || !"name".equals(change.field())) {
            return Optional.empty();
        }
        return PositionProvider.inferIdentifierPosition(node, node.string("name"), context.source())
                               .<Action>map(position -> new Rename(node, target, position));
    }

    private static boolean isNamed(AstNode node) {
        return node.is(NodeType.FUNCTION_DEF, NodeType.ASYNC_FUNCTION_DEF, NodeType.CLASS_DEF);
    }
}
