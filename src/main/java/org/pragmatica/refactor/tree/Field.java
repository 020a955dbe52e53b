package org.pragmatica.refactor.tree;

/**
 * Description of one field of a node type.
 *
 * @param name field name, as in Python's {@code ast} module
 * @param kind what the field holds
 */
public record Field(String name, Kind kind) {

    public enum Kind {
        /** Single child node, possibly absent. */
        NODE,
        /** List of child nodes, items may be absent. */
        NODES,
        /** Atomic leaf value. */
        VALUE,
        /** List of atomic leaf values. */
        VALUES
    }

    public static Field node(String name) {
        return new Field(name, Kind.NODE);
    }

    public static Field nodes(String name) {
        return new Field(name, Kind.NODES);
    }

    public static Field value(String name) {
        return new Field(name, Kind.VALUE);
    }

    public static Field valueList(String name) {
        return new Field(name, Kind.VALUES);
    }

    public boolean isList() {
        return kind == Kind.NODES || kind == Kind.VALUES;
    }
}
