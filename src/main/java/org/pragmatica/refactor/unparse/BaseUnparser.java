package org.pragmatica.refactor.unparse;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.parser.Tokenizer;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Ellipsis;
import org.pragmatica.refactor.tree.NodeType;
import org.pragmatica.refactor.tree.Operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Re-synthesizes source text from a tree in canonical formatting.
 *
 * <p>Subclasses customize the output by overriding {@code visitXxx} methods and composing the protected
 * writing helpers ({@link #fill(String)}, {@link #delimit(String, String, Runnable)}, {@link #block(Runnable)}
 * and friends). An instance can be reused: every {@link #unparse(AstNode)} call starts from a clean state.
 */
public class BaseUnparser {
    private static final List<String> ALL_QUOTES = List.of("'", "\"", "\"\"\"", "'''");
    private static final List<String> MULTI_QUOTES = List.of("\"\"\"", "'''");

    @Nullable
    protected final String source;
    private final boolean avoidBackslashes;
    private final Map<AstNode, Precedence> precedences = new IdentityHashMap<>();
    private StringBuilder out = new StringBuilder();
    private int indent;
    @Nullable
    private Tokenizer.Tokenized tokenized;

    public BaseUnparser(@Nullable String source) {
        this(source, false);
    }

    protected BaseUnparser(@Nullable String source, boolean avoidBackslashes) {
        this.source = source;
        this.avoidBackslashes = avoidBackslashes;
    }

    public String unparse(AstNode node) {
        out = new StringBuilder();
        indent = 0;
        precedences.clear();
        reset();
        traverse(node);
        return out.toString();
    }

    /**
     * Hook for subclasses keeping per-call state.
     */
    protected void reset() {}

    /**
     * Tokens and trivia of the source this unparser was created for, computed once.
     */
    public Tokenizer.Tokenized tokens() {
        if (tokenized == null) {
            tokenized = Tokenizer.tokenize(source == null ? "" : source);
        }
        return tokenized;
    }

    // === Writing helpers ===

    protected void write(String... texts) {
        for (var text : texts) {
            out.append(text);
        }
    }

    protected void maybeNewline() {
        if (out.length() > 0) {
            write("\n");
        }
    }

    /**
     * Start a new line at the current indentation and write {@code text}.
     */
    protected void fill(String text) {
        maybeNewline();
        write("    ".repeat(indent), text);
    }

    protected void fill() {
        fill("");
    }

    protected int indentLevel() {
        return indent;
    }

    protected void indented(Runnable body) {
        indent++;
        try {
            body.run();
        } finally {
            indent--;
        }
    }

    /**
     * Write a colon and run {@code body} one level deeper.
     */
    protected void block(Runnable body) {
        write(":");
        indented(body);
    }

    protected void delimit(String open, String close, Runnable body) {
        write(open);
        body.run();
        write(close);
    }

    protected void delimitIf(String open, String close, boolean condition, Runnable body) {
        if (condition) {
            delimit(open, close, body);
        } else {
            body.run();
        }
    }

    protected void requireParens(Precedence precedence, AstNode node, Runnable body) {
        delimitIf("(", ")", getPrecedence(node) > precedence.ordinal(), body);
    }

    protected <T> void interleave(Runnable separator, Consumer<T> action, List<T> items) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                separator.run();
            }
            action.accept(items.get(i));
        }
    }

    protected void setPrecedence(Precedence precedence, AstNode... nodes) {
        for (var node : nodes) {
            if (node != null) {
                precedences.put(node, precedence);
            }
        }
    }

    protected void setPrecedence(Precedence precedence, List<AstNode> nodes) {
        setPrecedence(precedence, nodes.toArray(new AstNode[0]));
    }

    /**
     * Precedence ordinal required by the context the node is written in.
     */
    protected int getPrecedence(AstNode node) {
        return precedences.getOrDefault(node, Precedence.TEST).ordinal();
    }

    /**
     * Run {@code body} against a scratch buffer and return what it wrote.
     */
    protected String buffered(Runnable body) {
        var saved = out;
        out = new StringBuilder();
        try {
            body.run();
            return out.toString();
        } finally {
            out = saved;
        }
    }

    // === Traversal ===

    protected void traverse(List<AstNode> nodes) {
        for (var node : nodes) {
            traverse(node);
        }
    }

    protected void traverse(AstNode node) {
        visit(node);
    }

    protected void visit(AstNode node) {
        switch (node.type()) {
            case MODULE -> visitModule(node);
            case FUNCTION_DEF -> functionHelper(node, "def");
            case ASYNC_FUNCTION_DEF -> functionHelper(node, "async def");
            case CLASS_DEF -> visitClassDef(node);
            case RETURN -> visitReturn(node);
            case DELETE -> visitDelete(node);
            case ASSIGN -> visitAssign(node);
            case AUG_ASSIGN -> visitAugAssign(node);
            case ANN_ASSIGN -> visitAnnAssign(node);
            case FOR -> forHelper("for ", node);
            case ASYNC_FOR -> forHelper("async for ", node);
            case WHILE -> visitWhile(node);
            case IF -> visitIf(node);
            case WITH -> withHelper("with ", node);
            case ASYNC_WITH -> withHelper("async with ", node);
            case RAISE -> visitRaise(node);
            case TRY -> visitTry(node);
            case ASSERT -> visitAssert(node);
            case IMPORT -> visitImport(node);
            case IMPORT_FROM -> visitImportFrom(node);
            case GLOBAL -> namesHelper("global ", node);
            case NONLOCAL -> namesHelper("nonlocal ", node);
            case EXPR -> visitExpr(node);
            case PASS -> fill("pass");
            case BREAK -> fill("break");
            case CONTINUE -> fill("continue");
            case BOOL_OP -> visitBoolOp(node);
            case NAMED_EXPR -> visitNamedExpr(node);
            case BIN_OP -> visitBinOp(node);
            case UNARY_OP -> visitUnaryOp(node);
            case LAMBDA -> visitLambda(node);
            case IF_EXP -> visitIfExp(node);
            case DICT -> visitDict(node);
            case SET -> visitSet(node);
            case LIST_COMP -> comprehensionHelper("[", "]", node);
            case SET_COMP -> comprehensionHelper("{", "}", node);
            case GENERATOR_EXP -> comprehensionHelper("(", ")", node);
            case DICT_COMP -> visitDictComp(node);
            case AWAIT -> prefixHelper("await", Precedence.AWAIT, node);
            case YIELD -> prefixHelper("yield", Precedence.YIELD, node);
            case YIELD_FROM -> visitYieldFrom(node);
            case COMPARE -> visitCompare(node);
            case CALL -> visitCall(node);
            case FORMATTED_VALUE -> visitFormattedValue(node);
            case JOINED_STR -> visitJoinedStr(node);
            case CONSTANT -> visitConstant(node);
            case ATTRIBUTE -> visitAttribute(node);
            case SUBSCRIPT -> visitSubscript(node);
            case STARRED -> visitStarred(node);
            case NAME -> write(node.string("id"));
            case LIST -> visitList(node);
            case TUPLE -> visitTuple(node);
            case SLICE -> visitSlice(node);
            case COMPREHENSION -> visitComprehension(node);
            case EXCEPT_HANDLER -> visitExceptHandler(node);
            case ARGUMENTS -> visitArguments(node);
            case ARG -> visitArg(node);
            case KEYWORD -> visitKeyword(node);
            case ALIAS -> visitAlias(node);
            case WITH_ITEM -> visitWithItem(node);
        }
    }

    // === Statements ===

    protected void visitModule(AstNode node) {
        docstringAndBody(node);
    }

    private void docstringAndBody(AstNode node) {
        var body = node.nodes("body");
        if (isDocstring(body)) {
            writeDocstring(body.get(0));
            traverse(body.subList(1, body.size()));
        } else {
            traverse(body);
        }
    }

    private static boolean isDocstring(List<AstNode> body) {
        if (body.isEmpty() || !body.get(0).is(NodeType.EXPR)) {
            return false;
        }
        var value = body.get(0).node("value");
        return value.is(NodeType.CONSTANT) && value.value("value") instanceof String;
    }

    /**
     * Write the docstring statement of a module, class or function.
     */
    protected void writeDocstring(AstNode statement) {
        var constant = statement.node("value");
        fill();
        if ("u".equals(constant.value("kind"))) {
            write("u");
        }
        writeStrAvoidingBackslashes((String) constant.value("value"), MULTI_QUOTES);
    }

    protected void visitExpr(AstNode node) {
        fill();
        setPrecedence(Precedence.YIELD, node.node("value"));
        traverse(node.node("value"));
    }

    protected void visitImport(AstNode node) {
        fill("import ");
        interleave(() -> write(", "), this::traverse, node.nodes("names"));
    }

    protected void visitImportFrom(AstNode node) {
        fill("from ");
        write(".".repeat(node.intValue("level")));
        var module = node.string("module");
        if (module != null) {
            write(module);
        }
        write(" import ");
        interleave(() -> write(", "), this::traverse, node.nodes("names"));
    }

    protected void visitAssign(AstNode node) {
        fill();
        for (var target : node.nodes("targets")) {
            setPrecedence(Precedence.TUPLE, target);
            traverse(target);
            write(" = ");
        }
        traverse(node.node("value"));
    }

    protected void visitAugAssign(AstNode node) {
        fill();
        traverse(node.node("target"));
        write(" " + ((Operator) node.value("op")).symbol() + "= ");
        traverse(node.node("value"));
    }

    protected void visitAnnAssign(AstNode node) {
        fill();
        var target = node.node("target");
        delimitIf("(", ")", node.intValue("simple") == 0 && target.is(NodeType.NAME), () -> traverse(target));
        write(": ");
        traverse(node.node("annotation"));
        var value = node.node("value");
        if (value != null) {
            write(" = ");
            traverse(value);
        }
    }

    protected void visitReturn(AstNode node) {
        fill("return");
        var value = node.node("value");
        if (value != null) {
            write(" ");
            traverse(value);
        }
    }

    protected void visitDelete(AstNode node) {
        fill("del ");
        interleave(() -> write(", "), this::traverse, node.nodes("targets"));
    }

    protected void visitAssert(AstNode node) {
        fill("assert ");
        traverse(node.node("test"));
        var msg = node.node("msg");
        if (msg != null) {
            write(", ");
            traverse(msg);
        }
    }

    private void namesHelper(String keyword, AstNode node) {
        fill(keyword);
        interleave(() -> write(", "), name -> write((String) name), node.values("names"));
    }

    protected void visitRaise(AstNode node) {
        fill("raise");
        var exc = node.node("exc");
        var cause = node.node("cause");
        if (exc == null) {
            if (cause != null) {
                throw new IllegalArgumentException("Raise with cause but no exception");
            }
            return;
        }
        write(" ");
        traverse(exc);
        if (cause != null) {
            write(" from ");
            traverse(cause);
        }
    }

    protected void visitTry(AstNode node) {
        fill("try");
        block(() -> traverse(node.nodes("body")));
        traverse(node.nodes("handlers"));
        elseHelper("else", node.nodes("orelse"));
        elseHelper("finally", node.nodes("finalbody"));
    }

    private void elseHelper(String keyword, List<AstNode> body) {
        if (!body.isEmpty()) {
            fill(keyword);
            block(() -> traverse(body));
        }
    }

    protected void visitExceptHandler(AstNode node) {
        fill("except");
        var type = node.node("type");
        if (type != null) {
            write(" ");
            traverse(type);
        }
        var name = node.string("name");
        if (name != null) {
            write(" as ", name);
        }
        block(() -> traverse(node.nodes("body")));
    }

    protected void visitClassDef(AstNode node) {
        maybeNewline();
        decorators(node);
        fill("class " + node.string("name"));
        var bases = node.nodes("bases");
        var keywords = node.nodes("keywords");
        delimitIf("(", ")", !bases.isEmpty() || !keywords.isEmpty(), () -> {
            var items = new ArrayList<AstNode>(bases);
            items.addAll(keywords);
            interleave(() -> write(", "), this::traverse, items);
        });
        block(() -> docstringAndBody(node));
    }

    private void functionHelper(AstNode node, String keyword) {
        maybeNewline();
        decorators(node);
        fill(keyword + " " + node.string("name"));
        delimit("(", ")", () -> traverse(node.node("args")));
        var returns = node.node("returns");
        if (returns != null) {
            write(" -> ");
            traverse(returns);
        }
        block(() -> docstringAndBody(node));
    }

    private void decorators(AstNode node) {
        for (var decorator : node.nodes("decorator_list")) {
            fill("@");
            traverse(decorator);
        }
    }

    private void forHelper(String keyword, AstNode node) {
        fill(keyword);
        setPrecedence(Precedence.TUPLE, node.node("target"));
        traverse(node.node("target"));
        write(" in ");
        traverse(node.node("iter"));
        block(() -> traverse(node.nodes("body")));
        elseHelper("else", node.nodes("orelse"));
    }

    protected void visitIf(AstNode node) {
        fill("if ");
        traverse(node.node("test"));
        block(() -> traverse(node.nodes("body")));
        var current = node;
        // nested ifs collapse into elif chains
        while (current.nodes("orelse").size() == 1 && current.nodes("orelse").get(0).is(NodeType.IF)) {
            current = current.nodes("orelse").get(0);
            fill("elif ");
            traverse(current.node("test"));
            var body = current.nodes("body");
            block(() -> traverse(body));
        }
        elseHelper("else", current.nodes("orelse"));
    }

    protected void visitWhile(AstNode node) {
        fill("while ");
        traverse(node.node("test"));
        block(() -> traverse(node.nodes("body")));
        elseHelper("else", node.nodes("orelse"));
    }

    private void withHelper(String keyword, AstNode node) {
        fill(keyword);
        interleave(() -> write(", "), this::traverse, node.nodes("items"));
        block(() -> traverse(node.nodes("body")));
    }

    // === Expressions ===

    protected void visitNamedExpr(AstNode node) {
        requireParens(Precedence.NAMED_EXPR, node, () -> {
            setPrecedence(Precedence.ATOM, node.node("target"), node.node("value"));
            traverse(node.node("target"));
            write(" := ");
            traverse(node.node("value"));
        });
    }

    private void prefixHelper(String keyword, Precedence precedence, AstNode node) {
        requireParens(precedence, node, () -> {
            write(keyword);
            var value = node.node("value");
            if (value != null) {
                write(" ");
                setPrecedence(Precedence.ATOM, value);
                traverse(value);
            }
        });
    }

    protected void visitYieldFrom(AstNode node) {
        requireParens(Precedence.YIELD, node, () -> {
            write("yield from ");
            var value = node.node("value");
            if (value == null) {
                throw new IllegalArgumentException("YieldFrom without a value");
            }
            setPrecedence(Precedence.ATOM, value);
            traverse(value);
        });
    }

    protected void visitJoinedStr(AstNode node) {
        write("f");
        if (avoidBackslashes) {
            writeStrAvoidingBackslashes(buffered(() -> writeFStringInner(node)), ALL_QUOTES);
            return;
        }
        var quoteTypes = ALL_QUOTES;
        var text = new StringBuilder();
        for (var value : node.nodes("values")) {
            var part = buffered(() -> writeFStringInner(value));
            var escaped = strLiteralHelper(part, quoteTypes, value.is(NodeType.CONSTANT));
            text.append(escaped.text());
            quoteTypes = escaped.quotes();
        }
        var quote = quoteTypes.get(0);
        write(quote, text.toString(), quote);
    }

    protected void visitFormattedValue(AstNode node) {
        write("f");
        writeStrAvoidingBackslashes(buffered(() -> writeFStringInner(node)), ALL_QUOTES);
    }

    private void writeFStringInner(AstNode node) {
        if (node.is(NodeType.JOINED_STR)) {
            for (var value : node.nodes("values")) {
                writeFStringInner(value);
            }
        } else if (node.is(NodeType.CONSTANT) && node.value("value") instanceof String text) {
            write(text.replace("{", "{{").replace("}", "}}"));
        } else if (node.is(NodeType.FORMATTED_VALUE)) {
            formattedValueInner(node);
        } else {
            throw new IllegalArgumentException("Unexpected node inside JoinedStr: " + node.type());
        }
    }

    private void formattedValueInner(AstNode node) {
        delimit("{", "}", () -> {
            var inner = new BaseUnparser(null, true);
            var value = node.node("value");
            inner.setPrecedence(Precedence.TEST.next(), value);
            var expression = inner.render(value);
            if (expression.contains("\\")) {
                throw new IllegalArgumentException("Unable to avoid backslash in f-string expression part");
            }
            if (expression.startsWith("{")) {
                write(" ");
            }
            write(expression);
            int conversion = node.intValue("conversion");
            if (conversion != -1) {
                write("!", Character.toString((char) conversion));
            }
            var formatSpec = node.node("format_spec");
            if (formatSpec != null) {
                write(":");
                writeFStringInner(formatSpec);
            }
        });
    }

    /**
     * Like {@link #unparse(AstNode)} but keeps precedences assigned beforehand.
     */
    private String render(AstNode node) {
        out = new StringBuilder();
        traverse(node);
        return out.toString();
    }

    private record Escaped(String text, List<String> quotes) {}

    /**
     * Escape a string for use inside quotes, narrowing the usable quote types to those that don't clash.
     */
    private static Escaped strLiteralHelper(String text, List<String> quoteTypes, boolean escapeSpecialWhitespace) {
        var sb = new StringBuilder();
        text.codePoints().forEach(cp -> sb.append(cp == '\\' ? "\\\\" : PythonLiterals.escape(cp, escapeSpecialWhitespace)));
        var escaped = sb.toString();
        var possible = new ArrayList<String>();
        for (var quote : quoteTypes) {
            boolean multiline = MULTI_QUOTES.contains(quote);
            if ((multiline || escaped.indexOf('\n') < 0) && !escaped.contains(quote)) {
                possible.add(quote);
            }
        }
        if (possible.isEmpty()) {
            var repr = PythonLiterals.stringRepr(text);
            var quote = quoteTypes.stream()
                                  .filter(candidate -> candidate.charAt(0) == repr.charAt(0))
                                  .findFirst()
                                  .orElse(repr.substring(0, 1));
            return new Escaped(repr.substring(1, repr.length() - 1), List.of(quote));
        }
        if (!escaped.isEmpty()) {
            char last = escaped.charAt(escaped.length() - 1);
            // stable: quotes starting with the last character move to the end
            possible.sort((left, right) -> Boolean.compare(left.charAt(0) == last, right.charAt(0) == last));
            if (possible.get(0).charAt(0) == last) {
                escaped = escaped.substring(0, escaped.length() - 1) + "\\" + last;
            }
        }
        return new Escaped(escaped, Collections.unmodifiableList(possible));
    }

    protected void writeStrAvoidingBackslashes(String text, List<String> quoteTypes) {
        var escaped = strLiteralHelper(text, quoteTypes, false);
        var quote = escaped.quotes().get(0);
        write(quote, escaped.text(), quote);
    }

    protected void visitConstant(AstNode node) {
        var value = node.value("value");
        if (value instanceof Ellipsis) {
            write("...");
            return;
        }
        if ("u".equals(node.value("kind"))) {
            write("u");
        }
        if (avoidBackslashes && value instanceof String text) {
            writeStrAvoidingBackslashes(text, ALL_QUOTES);
        } else {
            write(PythonLiterals.repr(value));
        }
    }

    protected void visitList(AstNode node) {
        delimit("[", "]", () -> interleave(() -> write(", "), this::traverse, node.nodes("elts")));
    }

    private void comprehensionHelper(String open, String close, AstNode node) {
        delimit(open, close, () -> {
            traverse(node.node("elt"));
            traverse(node.nodes("generators"));
        });
    }

    protected void visitDictComp(AstNode node) {
        delimit("{", "}", () -> {
            traverse(node.node("key"));
            write(": ");
            traverse(node.node("value"));
            traverse(node.nodes("generators"));
        });
    }

    protected void visitComprehension(AstNode node) {
        write(node.intValue("is_async") != 0 ? " async for " : " for ");
        setPrecedence(Precedence.TUPLE, node.node("target"));
        traverse(node.node("target"));
        write(" in ");
        setPrecedence(Precedence.TEST.next(), node.node("iter"));
        setPrecedence(Precedence.TEST.next(), node.nodes("ifs"));
        traverse(node.node("iter"));
        for (var condition : node.nodes("ifs")) {
            write(" if ");
            traverse(condition);
        }
    }

    protected void visitIfExp(AstNode node) {
        requireParens(Precedence.TEST, node, () -> {
            setPrecedence(Precedence.TEST.next(), node.node("body"), node.node("test"));
            traverse(node.node("body"));
            write(" if ");
            traverse(node.node("test"));
            write(" else ");
            setPrecedence(Precedence.TEST, node.node("orelse"));
            traverse(node.node("orelse"));
        });
    }

    protected void visitSet(AstNode node) {
        var elements = node.nodes("elts");
        if (elements.isEmpty()) {
            // {} would be an empty dict
            write("{*()}");
            return;
        }
        delimit("{", "}", () -> interleave(() -> write(", "), this::traverse, elements));
    }

    protected void visitDict(AstNode node) {
        var keys = node.nodes("keys");
        var values = node.nodes("values");
        var indexes = new ArrayList<Integer>();
        for (int i = 0; i < keys.size(); i++) {
            indexes.add(i);
        }
        delimit("{", "}", () -> interleave(() -> write(", "), index -> {
            var key = keys.get(index);
            var value = values.get(index);
            if (key == null) {
                write("**");
                setPrecedence(Precedence.EXPR, value);
                traverse(value);
            } else {
                traverse(key);
                write(": ");
                traverse(value);
            }
        }, indexes));
    }

    protected void visitTuple(AstNode node) {
        var elements = node.nodes("elts");
        delimitIf("(", ")", elements.isEmpty() || getPrecedence(node) > Precedence.TUPLE.ordinal(),
                  () -> itemsView(elements));
    }

    private void itemsView(List<AstNode> items) {
        if (items.size() == 1) {
            traverse(items.get(0));
            write(",");
        } else {
            interleave(() -> write(", "), this::traverse, items);
        }
    }

    protected void visitUnaryOp(AstNode node) {
        var op = (Operator) node.value("op");
        var precedence = Precedence.of(op);
        requireParens(precedence, node, () -> {
            write(op.symbol());
            if (precedence != Precedence.FACTOR) {
                write(" ");
            }
            setPrecedence(precedence, node.node("operand"));
            traverse(node.node("operand"));
        });
    }

    protected void visitBinOp(AstNode node) {
        var op = (Operator) node.value("op");
        var precedence = Precedence.of(op);
        requireParens(precedence, node, () -> {
            boolean rightAssociative = op == Operator.POW;
            setPrecedence(rightAssociative ? precedence.next() : precedence, node.node("left"));
            traverse(node.node("left"));
            write(" " + op.symbol() + " ");
            setPrecedence(rightAssociative ? precedence : precedence.next(), node.node("right"));
            traverse(node.node("right"));
        });
    }

    protected void visitCompare(AstNode node) {
        requireParens(Precedence.CMP, node, () -> {
            setPrecedence(Precedence.CMP.next(), node.node("left"));
            setPrecedence(Precedence.CMP.next(), node.nodes("comparators"));
            traverse(node.node("left"));
            var ops = node.values("ops");
            var comparators = node.nodes("comparators");
            for (int i = 0; i < ops.size(); i++) {
                write(" " + ((Operator) ops.get(i)).symbol() + " ");
                traverse(comparators.get(i));
            }
        });
    }

    protected void visitBoolOp(AstNode node) {
        var op = (Operator) node.value("op");
        var precedence = Precedence.of(op);
        requireParens(precedence, node, () -> {
            var level = new Precedence[]{precedence};
            interleave(() -> write(" " + op.symbol() + " "), value -> {
                level[0] = level[0].next();
                setPrecedence(level[0], value);
                traverse(value);
            }, node.nodes("values"));
        });
    }

    protected void visitAttribute(AstNode node) {
        var value = node.node("value");
        setPrecedence(Precedence.ATOM, value);
        traverse(value);
        // 3.attr would read as a float literal
        if (value.is(NodeType.CONSTANT) && isInteger(value.value("value"))) {
            write(" ");
        }
        write(".", node.string("attr"));
    }

    private static boolean isInteger(@Nullable Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof java.math.BigInteger;
    }

    protected void visitCall(AstNode node) {
        setPrecedence(Precedence.ATOM, node.node("func"));
        traverse(node.node("func"));
        delimit("(", ")", () -> {
            var items = new ArrayList<AstNode>(node.nodes("args"));
            items.addAll(node.nodes("keywords"));
            interleave(() -> write(", "), this::traverse, items);
        });
    }

    protected void visitSubscript(AstNode node) {
        setPrecedence(Precedence.ATOM, node.node("value"));
        traverse(node.node("value"));
        var slice = node.node("slice");
        delimit("[", "]", () -> {
            if (slice.is(NodeType.TUPLE) && !slice.nodes("elts").isEmpty()) {
                itemsView(slice.nodes("elts"));
            } else {
                traverse(slice);
            }
        });
    }

    protected void visitStarred(AstNode node) {
        write("*");
        setPrecedence(Precedence.EXPR, node.node("value"));
        traverse(node.node("value"));
    }

    protected void visitSlice(AstNode node) {
        var lower = node.node("lower");
        if (lower != null) {
            traverse(lower);
        }
        write(":");
        var upper = node.node("upper");
        if (upper != null) {
            traverse(upper);
        }
        var step = node.node("step");
        if (step != null) {
            write(":");
            traverse(step);
        }
    }

    protected void visitArg(AstNode node) {
        write(node.string("arg"));
        var annotation = node.node("annotation");
        if (annotation != null) {
            write(": ");
            traverse(annotation);
        }
    }

    protected void visitArguments(AstNode node) {
        var first = new boolean[]{true};
        Runnable comma = () -> {
            if (first[0]) {
                first[0] = false;
            } else {
                write(", ");
            }
        };
        var posonly = node.nodes("posonlyargs");
        var all = new ArrayList<AstNode>(posonly);
        all.addAll(node.nodes("args"));
        var defaults = node.nodes("defaults");
        int missing = all.size() - defaults.size();
        for (int i = 0; i < all.size(); i++) {
            comma.run();
            traverse(all.get(i));
            if (i >= missing) {
                write("=");
                traverse(defaults.get(i - missing));
            }
            if (i + 1 == posonly.size()) {
                write(", /");
            }
        }
        var vararg = node.node("vararg");
        var kwonly = node.nodes("kwonlyargs");
        if (vararg != null || !kwonly.isEmpty()) {
            comma.run();
            write("*");
            if (vararg != null) {
                visitArg(vararg);
            }
        }
        var kwDefaults = node.nodes("kw_defaults");
        for (int i = 0; i < kwonly.size(); i++) {
            write(", ");
            traverse(kwonly.get(i));
            var defaultValue = i < kwDefaults.size() ? kwDefaults.get(i) : null;
            if (defaultValue != null) {
                write("=");
                traverse(defaultValue);
            }
        }
        var kwarg = node.node("kwarg");
        if (kwarg != null) {
            comma.run();
            write("**");
            visitArg(kwarg);
        }
    }

    protected void visitKeyword(AstNode node) {
        var arg = node.string("arg");
        if (arg == null) {
            write("**");
        } else {
            write(arg, "=");
        }
        traverse(node.node("value"));
    }

    protected void visitLambda(AstNode node) {
        requireParens(Precedence.TEST, node, () -> {
            write("lambda");
            var arguments = buffered(() -> traverse(node.node("args")));
            if (!arguments.isEmpty()) {
                write(" ", arguments);
            }
            write(": ");
            setPrecedence(Precedence.TEST, node.node("body"));
            traverse(node.node("body"));
        });
    }

    protected void visitAlias(AstNode node) {
        write(node.string("name"));
        var asname = node.string("asname");
        if (asname != null) {
            write(" as " + asname);
        }
    }

    protected void visitWithItem(AstNode node) {
        traverse(node.node("context_expr"));
        var vars = node.node("optional_vars");
        if (vars != null) {
            write(" as ");
            traverse(vars);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + (source == null ? "(no source)" : "(" + source.length() + " chars of source)");
    }
}
