package org.pragmatica.refactor.context;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.Common;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lexical scopes of the snapshot's tree.
 *
 * <p>An ancestor opens the scope of a node only when the node sits in the ancestor's {@code body} (or anywhere
 * inside a comprehension), so decorators, default values and annotations of a function belong to the
 * enclosing scope. Each (node, kind, parent) triple maps to a single {@link ScopeInfo} instance.
 */
public final class Scope extends Representative {
    public static final Key<Scope> KEY = Key.of("scope", Scope::new, Ancestry.KEY);

    private final Map<Interned, ScopeInfo> interned = new HashMap<>();

    private Scope(Context context) {
        super(context);
    }

    private record Interned(AstNode node, ScopeType type, @Nullable ScopeInfo parent) {
        @Override
        public boolean equals(Object other) {
            return other instanceof Interned that && node == that.node && type == that.type && parent == that.parent;
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(node), type, System.identityHashCode(parent));
        }
    }

    /**
     * Innermost scope the node belongs to.
     *
     * @throws IllegalArgumentException for the module itself
     */
    public ScopeInfo resolve(AstNode node) {
        if (node.is(NodeType.MODULE)) {
            throw new IllegalArgumentException("Can't resolve Module");
        }
        var owners = new ArrayList<AstNode>();
        for (var link : context.ancestry().traverse(node)) {
            var parent = link.parent();
            if (Common.isContextful(parent) && ("body".equals(link.field()) || Common.isComprehension(parent))) {
                owners.add(parent);
            }
        }
        ScopeInfo scope = null;
        for (int i = owners.size() - 1; i >= 0; i--) {
            var owner = owners.get(i);
            scope = intern(owner, typeOf(owner), scope);
        }
        if (scope == null) {
            throw new IllegalArgumentException(node.type() + " node is not inside any scope");
        }
        return scope;
    }

    public ScopeInfo globalScope() {
        return intern(context.tree(), ScopeType.GLOBAL, null);
    }

    private ScopeInfo intern(AstNode node, ScopeType type, @Nullable ScopeInfo parent) {
        return interned.computeIfAbsent(new Interned(node, type, parent), key -> new ScopeInfo(node, type, parent));
    }

    private static ScopeType typeOf(AstNode node) {
        if (node.is(NodeType.MODULE)) {
            return ScopeType.GLOBAL;
        }
        if (node.is(NodeType.CLASS_DEF)) {
            return ScopeType.CLASS;
        }
        if (Common.isFunction(node)) {
            return ScopeType.FUNCTION;
        }
        return ScopeType.COMPREHENSION;
    }
}
