package org.pragmatica.refactor.tree;

/**
 * Expression context of names, attributes, subscripts, starred expressions, lists and tuples.
 */
public enum ExprContext {
    LOAD,
    STORE,
    DEL
}
