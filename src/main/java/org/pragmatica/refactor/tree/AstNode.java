package org.pragmatica.refactor.tree;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Python syntax tree node. One mutable class for every node kind, tagged by {@link NodeType}.
 *
 * <p>Fields are addressed by their Python {@code ast} names. Node list and value list fields are live
 * mutable lists, so a rule may change a copied subtree in place. Nodes compare by identity; use
 * {@link #isSameAs(AstNode)} for structural comparison.
 */
public final class AstNode {
    private final NodeType type;
    private final Object[] values;
    @Nullable
    private SourceSpan span;

    public AstNode(NodeType type) {
        this.type = type;
        this.values = new Object[type.fields().size()];
        var fields = type.fields();
        for (int i = 0; i < values.length; i++) {
            values[i] = defaultValue(fields.get(i));
        }
    }

    private static @Nullable Object defaultValue(Field field) {
        return switch (field.kind()) {
            case NODES, VALUES -> new ArrayList<>();
            case NODE -> null;
            case VALUE -> switch (field.name()) {
                case "level", "simple", "is_async" -> 0;
                case "conversion" -> -1;
                default -> null;
            };
        };
    }

    public NodeType type() {
        return type;
    }

    public boolean is(NodeType... types) {
        for (var candidate : types) {
            if (candidate == type) {
                return true;
            }
        }
        return false;
    }

    public boolean hasField(String field) {
        return type.field(field).isPresent();
    }

    /**
     * Raw value of a field: a node, a list, an atomic value or {@code null}.
     */
    public @Nullable Object get(String field) {
        return values[type.fieldIndex(field)];
    }

    public @Nullable AstNode node(String field) {
        var value = get(field);
        if (value != null && !(value instanceof AstNode)) {
            throw new IllegalArgumentException(type + "." + field + " is not a node field");
        }
        return (AstNode) value;
    }

    /**
     * Live list of child nodes held by a list field.
     */
    @SuppressWarnings("unchecked")
    public List<AstNode> nodes(String field) {
        requireKind(field, Field.Kind.NODES);
        return (List<AstNode>) values[type.fieldIndex(field)];
    }

    /**
     * Live list of atomic values held by a value list field ({@code Global.names}, {@code Compare.ops}).
     */
    @SuppressWarnings("unchecked")
    public List<Object> values(String field) {
        requireKind(field, Field.Kind.VALUES);
        return (List<Object>) values[type.fieldIndex(field)];
    }

    public @Nullable Object value(String field) {
        return get(field);
    }

    public @Nullable String string(String field) {
        return (String) get(field);
    }

    public int intValue(String field) {
        var value = get(field);
        return value == null ? 0 : ((Number) value).intValue();
    }

    /**
     * Set a field. Lists are copied into a fresh mutable list.
     */
    public AstNode set(String field, @Nullable Object value) {
        var index = type.fieldIndex(field);
        var descriptor = type.fields().get(index);
        switch (descriptor.kind()) {
            case NODES, VALUES -> {
                if (!(value instanceof List<?> list)) {
                    throw new IllegalArgumentException(type + "." + field + " expects a list");
                }
                values[index] = new ArrayList<Object>(list);
            }
            case NODE -> {
                if (value != null && !(value instanceof AstNode)) {
                    throw new IllegalArgumentException(type + "." + field + " expects a node");
                }
                values[index] = value;
            }
            case VALUE -> values[index] = value;
        }
        return this;
    }

    private void requireKind(String field, Field.Kind kind) {
        var descriptor = type.fields().get(type.fieldIndex(field));
        if (descriptor.kind() != kind) {
            throw new IllegalArgumentException(type + "." + field + " is not a " + kind + " field");
        }
    }

    public @Nullable SourceSpan span() {
        return span;
    }

    public boolean hasPosition() {
        return span != null;
    }

    public AstNode setSpan(@Nullable SourceSpan span) {
        this.span = span;
        return this;
    }

    /** 1-based first line; fails for unpositioned nodes. */
    public int line() {
        return position().start().line();
    }

    /** 0-based first column; fails for unpositioned nodes. */
    public int column() {
        return position().start().column();
    }

    public int endLine() {
        return position().end().line();
    }

    public int endColumn() {
        return position().end().column();
    }

    private SourceSpan position() {
        if (span == null) {
            throw new IllegalStateException(type + " node has no source position");
        }
        return span;
    }

    /**
     * Drop positions from this node and everything below it.
     */
    public AstNode clearPositions() {
        for (var node : walk()) {
            node.span = null;
        }
        return this;
    }

    /**
     * Direct child nodes in field order.
     */
    public List<AstNode> children() {
        var result = new ArrayList<AstNode>();
        var fields = type.fields();
        for (int i = 0; i < values.length; i++) {
            var kind = fields.get(i).kind();
            if (kind == Field.Kind.NODE && values[i] != null) {
                result.add((AstNode) values[i]);
            } else if (kind == Field.Kind.NODES) {
                for (var item : (List<?>) values[i]) {
                    if (item != null) {
                        result.add((AstNode) item);
                    }
                }
            }
        }
        return result;
    }

    /**
     * This node and all its descendants, breadth first.
     */
    public List<AstNode> walk() {
        var result = new ArrayList<AstNode>();
        var queue = new ArrayDeque<AstNode>();
        queue.add(this);
        while (!queue.isEmpty()) {
            var node = queue.poll();
            result.add(node);
            queue.addAll(node.children());
        }
        return result;
    }

    /**
     * Deep copy, positions included.
     */
    public AstNode copy() {
        return copyInto(new AstNode(type));
    }

    /**
     * Deep copy retagged as another kind with exactly the same fields, e.g. {@code FunctionDef} to
     * {@code AsyncFunctionDef}.
     */
    public AstNode copyAs(NodeType newType) {
        if (!type.isShapeCompatible(newType)) {
            throw new IllegalArgumentException("Can't retag " + type + " as " + newType);
        }
        return copyInto(new AstNode(newType));
    }

    private AstNode copyInto(AstNode target) {
        for (int i = 0; i < values.length; i++) {
            target.values[i] = copyValue(values[i]);
        }
        target.span = span;
        return target;
    }

    private static @Nullable Object copyValue(@Nullable Object value) {
        if (value instanceof AstNode node) {
            return node.copy();
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * Structural equality ignoring source positions.
     */
    public boolean isSameAs(@Nullable AstNode other) {
        if (other == null || other.type != type) {
            return false;
        }
        for (int i = 0; i < values.length; i++) {
            if (!sameValue(values[i], other.values[i])) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameValue(@Nullable Object left, @Nullable Object right) {
        if (left instanceof AstNode node) {
            return node.isSameAs(right instanceof AstNode other ? other : null);
        }
        if (left instanceof List<?> leftList) {
            if (!(right instanceof List<?> rightList) || leftList.size() != rightList.size()) {
                return false;
            }
            for (int i = 0; i < leftList.size(); i++) {
                if (!sameValue(leftList.get(i), rightList.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    /**
     * Dump in the style of Python's {@code ast.dump}.
     */
    @Override
    public String toString() {
        var sb = new StringBuilder();
        dump(sb, this);
        return sb.toString();
    }

    private static void dump(StringBuilder sb, @Nullable Object value) {
        if (value instanceof AstNode node) {
            sb.append(node.type.pyName()).append('(');
            var fields = node.type.fields();
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(fields.get(i).name()).append('=');
                dump(sb, node.values[i]);
            }
            sb.append(')');
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                dump(sb, list.get(i));
            }
            sb.append(']');
        } else if (value instanceof String text) {
            sb.append('\'').append(text).append('\'');
        } else {
            sb.append(value);
        }
    }
}
