package org.pragmatica.refactor.tree;

/**
 * Value of the {@code ...} constant.
 */
public enum Ellipsis {
    INSTANCE;

    @Override
    public String toString() {
        return "...";
    }
}
