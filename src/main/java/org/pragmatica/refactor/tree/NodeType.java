package org.pragmatica.refactor.tree;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.pragmatica.refactor.tree.Field.node;
import static org.pragmatica.refactor.tree.Field.nodes;
import static org.pragmatica.refactor.tree.Field.value;
import static org.pragmatica.refactor.tree.Field.valueList;

/**
 * Node kinds of the Python syntax tree, with their fields in Python's {@code ast} order.
 */
public enum NodeType {
    MODULE("Module", Category.MOD, nodes("body")),

    FUNCTION_DEF("FunctionDef", Category.STMT,
                 value("name"), node("args"), nodes("body"), nodes("decorator_list"), node("returns")),
    ASYNC_FUNCTION_DEF("AsyncFunctionDef", Category.STMT,
                       value("name"), node("args"), nodes("body"), nodes("decorator_list"), node("returns")),
    CLASS_DEF("ClassDef", Category.STMT,
              value("name"), nodes("bases"), nodes("keywords"), nodes("body"), nodes("decorator_list")),
    RETURN("Return", Category.STMT, node("value")),
    DELETE("Delete", Category.STMT, nodes("targets")),
    ASSIGN("Assign", Category.STMT, nodes("targets"), node("value")),
    AUG_ASSIGN("AugAssign", Category.STMT, node("target"), value("op"), node("value")),
    ANN_ASSIGN("AnnAssign", Category.STMT, node("target"), node("annotation"), node("value"), value("simple")),
    FOR("For", Category.STMT, node("target"), node("iter"), nodes("body"), nodes("orelse")),
    ASYNC_FOR("AsyncFor", Category.STMT, node("target"), node("iter"), nodes("body"), nodes("orelse")),
    WHILE("While", Category.STMT, node("test"), nodes("body"), nodes("orelse")),
    IF("If", Category.STMT, node("test"), nodes("body"), nodes("orelse")),
    WITH("With", Category.STMT, nodes("items"), nodes("body")),
    ASYNC_WITH("AsyncWith", Category.STMT, nodes("items"), nodes("body")),
    RAISE("Raise", Category.STMT, node("exc"), node("cause")),
    TRY("Try", Category.STMT, nodes("body"), nodes("handlers"), nodes("orelse"), nodes("finalbody")),
    ASSERT("Assert", Category.STMT, node("test"), node("msg")),
    IMPORT("Import", Category.STMT, nodes("names")),
    IMPORT_FROM("ImportFrom", Category.STMT, value("module"), nodes("names"), value("level")),
    GLOBAL("Global", Category.STMT, valueList("names")),
    NONLOCAL("Nonlocal", Category.STMT, valueList("names")),
    EXPR("Expr", Category.STMT, node("value")),
    PASS("Pass", Category.STMT),
    BREAK("Break", Category.STMT),
    CONTINUE("Continue", Category.STMT),

    BOOL_OP("BoolOp", Category.EXPR, value("op"), nodes("values")),
    NAMED_EXPR("NamedExpr", Category.EXPR, node("target"), node("value")),
    BIN_OP("BinOp", Category.EXPR, node("left"), value("op"), node("right")),
    UNARY_OP("UnaryOp", Category.EXPR, value("op"), node("operand")),
    LAMBDA("Lambda", Category.EXPR, node("args"), node("body")),
    IF_EXP("IfExp", Category.EXPR, node("test"), node("body"), node("orelse")),
    DICT("Dict", Category.EXPR, nodes("keys"), nodes("values")),
    SET("Set", Category.EXPR, nodes("elts")),
    LIST_COMP("ListComp", Category.EXPR, node("elt"), nodes("generators")),
    SET_COMP("SetComp", Category.EXPR, node("elt"), nodes("generators")),
    DICT_COMP("DictComp", Category.EXPR, node("key"), node("value"), nodes("generators")),
    GENERATOR_EXP("GeneratorExp", Category.EXPR, node("elt"), nodes("generators")),
    AWAIT("Await", Category.EXPR, node("value")),
    YIELD("Yield", Category.EXPR, node("value")),
    YIELD_FROM("YieldFrom", Category.EXPR, node("value")),
    COMPARE("Compare", Category.EXPR, node("left"), valueList("ops"), nodes("comparators")),
    CALL("Call", Category.EXPR, node("func"), nodes("args"), nodes("keywords")),
    FORMATTED_VALUE("FormattedValue", Category.EXPR, node("value"), value("conversion"), node("format_spec")),
    JOINED_STR("JoinedStr", Category.EXPR, nodes("values")),
    CONSTANT("Constant", Category.EXPR, value("value"), value("kind")),
    ATTRIBUTE("Attribute", Category.EXPR, node("value"), value("attr"), value("ctx")),
    SUBSCRIPT("Subscript", Category.EXPR, node("value"), node("slice"), value("ctx")),
    STARRED("Starred", Category.EXPR, node("value"), value("ctx")),
    NAME("Name", Category.EXPR, value("id"), value("ctx")),
    LIST("List", Category.EXPR, nodes("elts"), value("ctx")),
    TUPLE("Tuple", Category.EXPR, nodes("elts"), value("ctx")),
    SLICE("Slice", Category.EXPR, node("lower"), node("upper"), node("step")),

    COMPREHENSION("comprehension", Category.OTHER, node("target"), node("iter"), nodes("ifs"), value("is_async")),
    EXCEPT_HANDLER("ExceptHandler", Category.HANDLER, node("type"), value("name"), nodes("body")),
    ARGUMENTS("arguments", Category.OTHER,
              nodes("posonlyargs"), nodes("args"), node("vararg"), nodes("kwonlyargs"),
              nodes("kw_defaults"), node("kwarg"), nodes("defaults")),
    ARG("arg", Category.POSITIONED, value("arg"), node("annotation")),
    KEYWORD("keyword", Category.POSITIONED, value("arg"), node("value")),
    ALIAS("alias", Category.POSITIONED, value("name"), value("asname")),
    WITH_ITEM("withitem", Category.OTHER, node("context_expr"), node("optional_vars"));

    public enum Category {
        MOD,
        STMT,
        EXPR,
        HANDLER,
        /** Non statement, non expression kinds that still carry a source position. */
        POSITIONED,
        OTHER
    }

    private static final Map<String, NodeType> BY_NAME = new HashMap<>();

    static {
        for (var type : values()) {
            BY_NAME.put(type.pyName, type);
        }
    }

    private final String pyName;
    private final Category category;
    private final List<Field> fields;

    NodeType(String pyName, Category category, Field... fields) {
        this.pyName = pyName;
        this.category = category;
        this.fields = List.of(fields);
    }

    /** Name of the node class in Python's {@code ast} module. */
    public String pyName() {
        return pyName;
    }

    public Category category() {
        return category;
    }

    public List<Field> fields() {
        return fields;
    }

    public Optional<Field> field(String name) {
        for (var field : fields) {
            if (field.name().equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    int fieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(name)) {
                return i;
            }
        }
        throw new IllegalArgumentException(pyName + " has no field '" + name + "'");
    }

    public boolean isStatement() {
        return category == Category.STMT;
    }

    public boolean isExpression() {
        return category == Category.EXPR;
    }

    /** Whether nodes of this kind carry source positions when produced by the parser. */
    public boolean isPositioned() {
        return category == Category.STMT
               || category == Category.EXPR
               || category == Category.HANDLER
               || category == Category.POSITIONED;
    }

    /** Whether both kinds have exactly the same fields, so a node can be retagged from one to the other. */
    public boolean isShapeCompatible(NodeType other) {
        return fields.equals(other.fields);
    }

    public static Optional<NodeType> byPyName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    @Override
    public String toString() {
        return pyName;
    }
}
