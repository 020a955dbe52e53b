package org.pragmatica.refactor.internal;

import org.pragmatica.refactor.context.Ancestry;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Field;
import org.pragmatica.refactor.tree.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Route from the root of a tree to one of its nodes, as a list of field (and list index) accesses. Replaying
 * the route on another revision of the tree finds the node standing at the same place, or fails when a step
 * lands on a node of another kind.
 */
public record GraphPath(List<Step> steps) {

    /** Index of steps through single-node fields. */
    public static final int NO_INDEX = -1;

    public GraphPath {
        steps = List.copyOf(steps);
    }

    /**
     * One access.
     *
     * @param field    field of the current node
     * @param index    position in a list field, {@link #NO_INDEX} for single-node fields
     * @param expected kind of node the access must produce
     */
    public record Step(String field, int index, NodeType expected) {
        AstNode execute(AstNode node) throws AccessFailure {
            var descriptor = node.type().field(field);
            if (descriptor.isEmpty()) {
                throw new AccessFailure(node.type() + " has no field '" + field + "'");
            }
            Object accessed;
            if (index == NO_INDEX) {
                if (descriptor.get().kind() != Field.Kind.NODE) {
                    throw new AccessFailure(node.type() + "." + field + " is not a node field");
                }
                accessed = node.node(field);
            } else {
                if (descriptor.get().kind() != Field.Kind.NODES) {
                    throw new AccessFailure(node.type() + "." + field + " is not a list field");
                }
                var items = node.nodes(field);
                if (index >= items.size()) {
                    throw new AccessFailure(node.type() + "." + field + " has no item " + index);
                }
                accessed = items.get(index);
            }
            if (!(accessed instanceof AstNode found) || found.type() != expected) {
                throw new AccessFailure("Expected " + expected + " at " + node.type() + "." + this);
            }
            return found;
        }

        boolean sameSlot(Step other) {
            return field.equals(other.field) && index == other.index;
        }

        @Override
        public String toString() {
            return index == NO_INDEX ? field : field + "[" + index + "]";
        }
    }

    /**
     * Change in the length of one list field caused by an action already applied: items after
     * {@code pivot} moved by {@code delta}.
     *
     * @param owner path to the node holding the list
     * @param field the list field
     * @param pivot items with a greater index are displaced
     * @param delta signed displacement
     */
    public record Shift(GraphPath owner, String field, int pivot, int delta) {
        /**
         * Shift caused by inserting or removing items around the node the path leads to.
         */
        public static Shift around(GraphPath path, int pivotOffset, int delta) {
            var last = path.last();
            return new Shift(path.parent(), last.field(), last.index() + pivotOffset, delta);
        }
    }

    /**
     * Path from the root of the ancestry's tree to the node.
     */
    public static GraphPath backtrack(Ancestry ancestry, AstNode node) {
        var steps = new ArrayList<Step>();
        var cursor = node;
        for (var link : ancestry.traverse(node)) {
            var parent = link.parent();
            var kind = parent.type().field(link.field()).map(Field::kind).orElseThrow();
            if (kind == Field.Kind.NODES) {
                steps.add(new Step(link.field(), indexOf(parent.nodes(link.field()), cursor), cursor.type()));
            } else {
                steps.add(new Step(link.field(), NO_INDEX, cursor.type()));
            }
            cursor = parent;
        }
        Collections.reverse(steps);
        return new GraphPath(steps);
    }

    private static int indexOf(List<AstNode> items, AstNode node) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == node) {
                return i;
            }
        }
        throw new IllegalStateException(node.type() + " node is missing from its parent list");
    }

    public AstNode resolve(AstNode root) throws AccessFailure {
        var node = root;
        for (var step : steps) {
            node = step.execute(node);
        }
        return node;
    }

    /**
     * The same route with list indexes adjusted for items inserted or removed by earlier edits.
     */
    public GraphPath shifted(List<Shift> shifts) {
        var adjusted = new ArrayList<>(steps);
        for (var shift : shifts) {
            int depth = shift.owner().steps().size();
            if (adjusted.size() <= depth || !startsWith(adjusted, shift.owner().steps())) {
                continue;
            }
            var step = adjusted.get(depth);
            if (step.field().equals(shift.field()) && step.index() != NO_INDEX && shift.pivot() < step.index()) {
                adjusted.set(depth, new Step(step.field(), step.index() + shift.delta(), step.expected()));
            }
        }
        return new GraphPath(adjusted);
    }

    private static boolean startsWith(List<Step> steps, List<Step> prefix) {
        for (int i = 0; i < prefix.size(); i++) {
            if (!steps.get(i).sameSlot(prefix.get(i))) {
                return false;
            }
        }
        return true;
    }

    public GraphPath parent() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("The root has no parent");
        }
        return new GraphPath(steps.subList(0, steps.size() - 1));
    }

    public Step last() {
        if (steps.isEmpty()) {
            throw new IllegalStateException("Empty path");
        }
        return steps.get(steps.size() - 1);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("<root>");
        for (var step : steps) {
            sb.append('.').append(step);
        }
        return sb.toString();
    }
}
