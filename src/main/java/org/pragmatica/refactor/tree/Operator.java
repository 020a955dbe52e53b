package org.pragmatica.refactor.tree;

import java.util.Optional;

/**
 * Boolean, binary, unary and comparison operators with their source symbols.
 */
public enum Operator {
    AND(Kind.BOOL, "and"),
    OR(Kind.BOOL, "or"),

    ADD(Kind.BINARY, "+"),
    SUB(Kind.BINARY, "-"),
    MULT(Kind.BINARY, "*"),
    MAT_MULT(Kind.BINARY, "@"),
    DIV(Kind.BINARY, "/"),
    MOD(Kind.BINARY, "%"),
    POW(Kind.BINARY, "**"),
    LSHIFT(Kind.BINARY, "<<"),
    RSHIFT(Kind.BINARY, ">>"),
    BIT_OR(Kind.BINARY, "|"),
    BIT_XOR(Kind.BINARY, "^"),
    BIT_AND(Kind.BINARY, "&"),
    FLOOR_DIV(Kind.BINARY, "//"),

    INVERT(Kind.UNARY, "~"),
    NOT(Kind.UNARY, "not"),
    UADD(Kind.UNARY, "+"),
    USUB(Kind.UNARY, "-"),

    EQ(Kind.COMPARISON, "=="),
    NOT_EQ(Kind.COMPARISON, "!="),
    LT(Kind.COMPARISON, "<"),
    LT_E(Kind.COMPARISON, "<="),
    GT(Kind.COMPARISON, ">"),
    GT_E(Kind.COMPARISON, ">="),
    IS(Kind.COMPARISON, "is"),
    IS_NOT(Kind.COMPARISON, "is not"),
    IN(Kind.COMPARISON, "in"),
    NOT_IN(Kind.COMPARISON, "not in");

    public enum Kind {
        BOOL,
        BINARY,
        UNARY,
        COMPARISON
    }

    private final Kind kind;
    private final String symbol;

    Operator(Kind kind, String symbol) {
        this.kind = kind;
        this.symbol = symbol;
    }

    public Kind kind() {
        return kind;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Find the binary operator for a symbol such as {@code "//"}; augmented assignment uses this with the trailing '=' removed.
     */
    public static Optional<Operator> binary(String symbol) {
        return find(Kind.BINARY, symbol);
    }

    public static Optional<Operator> comparison(String symbol) {
        return find(Kind.COMPARISON, symbol);
    }

    private static Optional<Operator> find(Kind kind, String symbol) {
        for (var op : values()) {
            if (op.kind == kind && op.symbol.equals(symbol)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
