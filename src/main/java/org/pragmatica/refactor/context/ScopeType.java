package org.pragmatica.refactor.context;

public enum ScopeType {
    GLOBAL,
    CLASS,
    FUNCTION,
    COMPREHENSION
}
