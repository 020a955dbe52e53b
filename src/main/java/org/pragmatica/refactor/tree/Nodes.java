package org.pragmatica.refactor.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Factory helpers for building unpositioned nodes, mostly used by rules creating replacements.
 */
public final class Nodes {
    private Nodes() {}

    /**
     * Build a node from field values given in field order; missing trailing fields keep their defaults.
     */
    public static AstNode create(NodeType type, Object... fieldValues) {
        var fields = type.fields();
        if (fieldValues.length > fields.size()) {
            throw new IllegalArgumentException(type + " has only " + fields.size() + " fields");
        }
        var node = new AstNode(type);
        for (int i = 0; i < fieldValues.length; i++) {
            node.set(fields.get(i).name(), fieldValues[i]);
        }
        return node;
    }

    public static AstNode name(String id) {
        return name(id, ExprContext.LOAD);
    }

    public static AstNode name(String id, ExprContext ctx) {
        return new AstNode(NodeType.NAME).set("id", id).set("ctx", ctx);
    }

    public static AstNode constant(@Nullable Object value) {
        return new AstNode(NodeType.CONSTANT).set("value", normalize(value));
    }

    private static @Nullable Object normalize(@Nullable Object value) {
        if (value instanceof Integer number) {
            return number.longValue();
        }
        return value;
    }

    public static AstNode attribute(AstNode value, String attr) {
        return new AstNode(NodeType.ATTRIBUTE).set("value", value).set("attr", attr).set("ctx", ExprContext.LOAD);
    }

    public static AstNode call(AstNode func, AstNode... args) {
        return call(func, Arrays.asList(args), List.of());
    }

    public static AstNode call(AstNode func, List<AstNode> args, List<AstNode> keywords) {
        return new AstNode(NodeType.CALL).set("func", func).set("args", args).set("keywords", keywords);
    }

    public static AstNode keyword(@Nullable String arg, AstNode value) {
        return new AstNode(NodeType.KEYWORD).set("arg", arg).set("value", value);
    }

    public static AstNode expr(AstNode value) {
        return new AstNode(NodeType.EXPR).set("value", value);
    }

    public static AstNode await(AstNode value) {
        return new AstNode(NodeType.AWAIT).set("value", value);
    }

    public static AstNode unaryOp(Operator op, AstNode operand) {
        return new AstNode(NodeType.UNARY_OP).set("op", op).set("operand", operand);
    }

    public static AstNode binOp(AstNode left, Operator op, AstNode right) {
        return new AstNode(NodeType.BIN_OP).set("left", left).set("op", op).set("right", right);
    }

    public static AstNode assign(List<AstNode> targets, AstNode value) {
        return new AstNode(NodeType.ASSIGN).set("targets", targets).set("value", value);
    }

    public static AstNode pass() {
        return new AstNode(NodeType.PASS);
    }

    public static AstNode alias(String name) {
        return alias(name, null);
    }

    public static AstNode alias(String name, @Nullable String asname) {
        return new AstNode(NodeType.ALIAS).set("name", name).set("asname", asname);
    }

    public static AstNode importFrom(@Nullable String module, List<AstNode> names) {
        return new AstNode(NodeType.IMPORT_FROM).set("module", module).set("names", names).set("level", 0);
    }

    public static AstNode tuple(List<AstNode> elts) {
        return new AstNode(NodeType.TUPLE).set("elts", elts).set("ctx", ExprContext.LOAD);
    }

    public static AstNode joinedStr(List<AstNode> values) {
        return new AstNode(NodeType.JOINED_STR).set("values", values);
    }

    public static AstNode formattedValue(AstNode value) {
        return new AstNode(NodeType.FORMATTED_VALUE).set("value", value);
    }
}
