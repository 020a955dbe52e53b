package org.pragmatica.refactor.unparse;

import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Operator;

/**
 * Expression precedence levels, lowest binding first.
 */
public enum Precedence {
    NAMED_EXPR,
    TUPLE,
    YIELD,
    TEST,
    OR,
    AND,
    NOT,
    CMP,
    /** Also the level of {@code |}. */
    EXPR,
    BXOR,
    BAND,
    SHIFT,
    ARITH,
    TERM,
    FACTOR,
    POWER,
    AWAIT,
    ATOM;

    private static final Precedence[] LEVELS = values();

    public Precedence next() {
        return LEVELS[Math.min(ordinal() + 1, LEVELS.length - 1)];
    }

    public static Precedence of(Operator op) {
        return switch (op) {
            case OR -> OR;
            case AND -> AND;
            case NOT -> NOT;
            case INVERT, UADD, USUB -> FACTOR;
            case ADD, SUB -> ARITH;
            case MULT, MAT_MULT, DIV, MOD, FLOOR_DIV -> TERM;
            case LSHIFT, RSHIFT -> SHIFT;
            case BIT_OR -> EXPR;
            case BIT_XOR -> BXOR;
            case BIT_AND -> BAND;
            case POW -> POWER;
            default -> CMP;
        };
    }

    /**
     * Binding strength of an expression node as written without surrounding parentheses.
     */
    public static Precedence of(AstNode node) {
        return switch (node.type()) {
            case NAMED_EXPR -> NAMED_EXPR;
            case TUPLE -> node.nodes("elts").isEmpty() ? ATOM : TUPLE;
            case YIELD, YIELD_FROM -> YIELD;
            case LAMBDA, IF_EXP -> TEST;
            case BOOL_OP, UNARY_OP, BIN_OP -> of((Operator) node.value("op"));
            case COMPARE -> CMP;
            case AWAIT -> AWAIT;
            case STARRED -> EXPR;
            default -> ATOM;
        };
    }
}
