package org.pragmatica.refactor.context;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.Common;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One lexical scope. Instances are unique per (node, type, parent) within a {@link Scope}, so identity
 * comparison is meaningful.
 */
public final class ScopeInfo {
    private final AstNode node;
    private final ScopeType type;
    @Nullable
    private final ScopeInfo parent;
    @Nullable
    private Map<String, List<AstNode>> definitions;
    @Nullable
    private String name;

    ScopeInfo(AstNode node, ScopeType type, @Nullable ScopeInfo parent) {
        this.node = node;
        this.type = type;
        this.parent = parent;
    }

    public AstNode node() {
        return node;
    }

    public ScopeType type() {
        return type;
    }

    public Optional<ScopeInfo> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * This scope followed by the enclosing function and global scopes. Class scopes in between are skipped.
     */
    private List<ScopeInfo> reachableScopes() {
        var result = new ArrayList<ScopeInfo>();
        result.add(this);
        for (var cursor = parent; cursor != null; cursor = cursor.parent) {
            if (cursor.type == ScopeType.FUNCTION || cursor.type == ScopeType.GLOBAL) {
                result.add(cursor);
            }
        }
        return result;
    }

    /**
     * Whether code in this scope can see definitions made in {@code other}.
     */
    public boolean canReach(ScopeInfo other) {
        for (var scope : reachableScopes()) {
            if (scope == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * Definitions of {@code name} in the nearest reachable scope defining it, empty when there are none.
     */
    public List<AstNode> getDefinitions(String name) {
        for (var scope : reachableScopes()) {
            if (scope.defines(name)) {
                return scope.definitions().get(name);
            }
        }
        return List.of();
    }

    public boolean defines(String name) {
        return definitions().containsKey(name);
    }

    /**
     * Names bound directly in this scope, mapped to the nodes binding them in source order. Bindings made inside
     * nested scopes are not included.
     */
    public Map<String, List<AstNode>> definitions() {
        if (definitions == null) {
            var local = new LinkedHashMap<String, List<AstNode>>();
            for (var candidate : Common.walkScope(node)) {
                for (var identifier : boundNames(candidate)) {
                    local.computeIfAbsent(identifier, key -> new ArrayList<>()).add(candidate);
                }
            }
            local.replaceAll((key, nodes) -> Collections.unmodifiableList(nodes));
            definitions = Collections.unmodifiableMap(local);
        }
        return definitions;
    }

    private static List<String> boundNames(AstNode node) {
        var names = new ArrayList<String>();
        switch (node.type()) {
            case ASSIGN -> node.nodes("targets").forEach(target -> names.addAll(Common.unpackLhs(target)));
            case AUG_ASSIGN, ANN_ASSIGN -> names.addAll(Common.unpackLhs(node.node("target")));
            case NAMED_EXPR -> names.add(node.node("target").string("id"));
            case EXCEPT_HANDLER -> {
                if (node.string("name") != null) {
                    names.add(node.string("name"));
                }
            }
            case IMPORT, IMPORT_FROM -> {
                for (var alias : node.nodes("names")) {
                    var asname = alias.string("asname");
                    names.add(asname != null ? asname : alias.string("name"));
                }
            }
            case WITH, ASYNC_WITH -> {
                for (var item : node.nodes("items")) {
                    var vars = item.node("optional_vars");
                    if (vars != null) {
                        names.addAll(Common.unpackLhs(vars));
                    }
                }
            }
            case FOR, ASYNC_FOR, COMPREHENSION -> names.addAll(Common.unpackLhs(node.node("target")));
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF, CLASS_DEF -> names.add(node.string("name"));
            case ARG -> names.add(node.string("arg"));
            default -> {
            }
        }
        return names;
    }

    /**
     * Qualified name in the style of Python's {@code __qualname__}: {@code <global>}, {@code C.f},
     * {@code f.<locals>.<lambda>}.
     */
    public String name() {
        if (name == null) {
            name = computeName();
        }
        return name;
    }

    private String computeName() {
        if (type == ScopeType.GLOBAL) {
            return "<global>";
        }
        String own;
        if (node.is(NodeType.FUNCTION_DEF, NodeType.ASYNC_FUNCTION_DEF, NodeType.CLASS_DEF)) {
            own = node.string("name");
        } else if (node.is(NodeType.LAMBDA)) {
            own = "<lambda>";
        } else {
            own = "<" + node.type().pyName().toLowerCase(Locale.ROOT) + ">";
        }
        if (parent == null || parent.type == ScopeType.GLOBAL) {
            return own;
        }
        return parent.name() + (parent.type == ScopeType.FUNCTION ? ".<locals>." : ".") + own;
    }

    @Override
    public String toString() {
        return "ScopeInfo[" + name() + ", " + type + "]";
    }
}
