package org.pragmatica.refactor.context;

import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Field;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parent index of the snapshot's tree: for each node, the node holding it and the field it sits in.
 */
public final class Ancestry extends Representative {
    public static final Key<Ancestry> KEY = Key.of("ancestry", Ancestry::new);

    private final Map<AstNode, Link> parents = new IdentityHashMap<>();
    private boolean annotated;

    /**
     * A node's place in its parent.
     *
     * @param field  name of the parent field holding the node (list fields included)
     * @param parent the parent node
     */
    public record Link(String field, AstNode parent) {}

    private Ancestry(Context context) {
        super(context);
    }

    private void ensureAnnotated() {
        if (annotated) {
            return;
        }
        for (var parent : context.tree().walk()) {
            for (var field : parent.type().fields()) {
                if (field.kind() == Field.Kind.NODE) {
                    var child = parent.node(field.name());
                    if (child != null) {
                        parents.put(child, new Link(field.name(), parent));
                    }
                } else if (field.kind() == Field.Kind.NODES) {
                    for (var child : parent.nodes(field.name())) {
                        if (child != null) {
                            parents.put(child, new Link(field.name(), parent));
                        }
                    }
                }
            }
        }
        annotated = true;
    }

    /**
     * Parent field and parent of the node, empty for the root.
     *
     * @throws IllegalArgumentException if the node isn't part of the snapshot's tree
     */
    public Optional<Link> infer(AstNode node) {
        ensureAnnotated();
        if (node == context.tree()) {
            return Optional.empty();
        }
        var link = parents.get(node);
        if (link == null) {
            throw new IllegalArgumentException(node.type() + " node is not part of this tree");
        }
        return Optional.of(link);
    }

    /**
     * Links from the node up to the root, nearest first.
     */
    public List<Link> traverse(AstNode node) {
        var result = new ArrayList<Link>();
        var cursor = infer(node);
        while (cursor.isPresent()) {
            var link = cursor.get();
            result.add(link);
            cursor = infer(link.parent());
        }
        return result;
    }

    public Optional<AstNode> getParent(AstNode node) {
        return infer(node).map(Link::parent);
    }

    public List<AstNode> getParents(AstNode node) {
        var result = new ArrayList<AstNode>();
        for (var link : traverse(node)) {
            result.add(link.parent());
        }
        return result;
    }
}
