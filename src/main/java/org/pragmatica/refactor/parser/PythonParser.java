package org.pragmatica.refactor.parser;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.error.ParseError;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Ellipsis;
import org.pragmatica.refactor.tree.ExprContext;
import org.pragmatica.refactor.tree.NodeType;
import org.pragmatica.refactor.tree.Nodes;
import org.pragmatica.refactor.tree.Operator;
import org.pragmatica.refactor.tree.SourceLocation;
import org.pragmatica.refactor.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive descent parser for Python 3.9 source text.
 *
 * <p>Node spans follow CPython: a node starts at the first token of the construct that produced it and
 * ends at its last non-layout token. A parenthesized expression keeps the span of its content, while
 * nodes built on top of it include the parentheses.
 */
public final class PythonParser {
    private static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
        "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
        "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
        "not", "lambda", "await", "None", "True", "False");
    private static final Set<String> EXPRESSION_START_OPS = Set.of(
        "(", "[", "{", "-", "+", "~", "*", "...");
    private static final Set<String> AUGMENTED_OPS = Set.of(
        "+=", "-=", "*=", "@=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "**=", "//=");
    private static final Map<String, Operator> OR_OPS = Map.of("|", Operator.BIT_OR);
    private static final Map<String, Operator> XOR_OPS = Map.of("^", Operator.BIT_XOR);
    private static final Map<String, Operator> AND_OPS = Map.of("&", Operator.BIT_AND);
    private static final Map<String, Operator> SHIFT_OPS = Map.of("<<", Operator.LSHIFT, ">>", Operator.RSHIFT);
    private static final Map<String, Operator> SUM_OPS = Map.of("+", Operator.ADD, "-", Operator.SUB);
    private static final Map<String, Operator> TERM_OPS = Map.of(
        "*", Operator.MULT, "/", Operator.DIV, "//", Operator.FLOOR_DIV, "%", Operator.MOD, "@", Operator.MAT_MULT);
    private static final Map<String, Operator> UNARY_OPS = Map.of(
        "+", Operator.UADD, "-", Operator.USUB, "~", Operator.INVERT);

    private final List<Token> tokens;
    private final Set<AstNode> parenthesized = Collections.newSetFromMap(new IdentityHashMap<>());
    private int pos;
    private Token lastSignificant;

    private PythonParser(List<Token> tokens) {
        this.tokens = tokens;
        this.lastSignificant = tokens.get(0);
    }

    /**
     * Parse a complete module.
     */
    public static AstNode parse(String source) throws SyntaxErrorException {
        var tokenized = Tokenizer.tokenize(source);
        try {
            return new PythonParser(tokenized.tokens()).module();
        } catch (Failure failure) {
            throw new SyntaxErrorException(failure.error);
        }
    }

    /**
     * Check whether source text parses, without keeping the tree.
     */
    public static boolean isValid(String source) {
        try {
            parse(source);
            return true;
        } catch (SyntaxErrorException e) {
            return false;
        }
    }

    private static final class Failure extends RuntimeException {
        private final ParseError error;

        Failure(ParseError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }

    // === Statements ===

    private AstNode module() {
        var body = new ArrayList<AstNode>();
        while (!(peek() instanceof Token.EndMarker)) {
            if (peek() instanceof Token.Newline) {
                advance();
                continue;
            }
            body.addAll(statement());
        }
        return new AstNode(NodeType.MODULE).set("body", body);
    }

    private List<AstNode> statement() {
        if (atOp("@")) {
            return List.of(decorated());
        }
        if (peek() instanceof Token.Name name) {
            var start = name.span().start();
            switch (name.text()) {
                case "def" -> {
                    return List.of(functionDef(List.of(), start, false));
                }
                case "class" -> {
                    return List.of(classDef(List.of(), start));
                }
                case "if" -> {
                    return List.of(ifStatement());
                }
                case "while" -> {
                    return List.of(whileStatement());
                }
                case "for" -> {
                    return List.of(forStatement(start, false));
                }
                case "try" -> {
                    return List.of(tryStatement());
                }
                case "with" -> {
                    return List.of(withStatement(start, false));
                }
                case "async" -> {
                    return List.of(asyncStatement(List.of()));
                }
                default -> {
                    return simpleStatements();
                }
            }
        }
        return simpleStatements();
    }

    private AstNode decorated() {
        var decorators = new ArrayList<AstNode>();
        while (atOp("@")) {
            advance();
            decorators.add(namedExpression());
            expectNewline();
        }
        var start = peek().span().start();
        if (atKeyword("def")) {
            return functionDef(decorators, start, false);
        }
        if (atKeyword("class")) {
            return classDef(decorators, start);
        }
        if (atKeyword("async")) {
            return asyncStatement(decorators);
        }
        throw fail("function or class definition");
    }

    private AstNode asyncStatement(List<AstNode> decorators) {
        var start = peek().span().start();
        expectKeyword("async");
        if (atKeyword("def")) {
            return functionDef(decorators, start, true);
        }
        if (decorators.isEmpty() && atKeyword("for")) {
            return forStatement(start, true);
        }
        if (decorators.isEmpty() && atKeyword("with")) {
            return withStatement(start, true);
        }
        throw fail(decorators.isEmpty() ? "'def', 'for' or 'with'" : "'def'");
    }

    private AstNode functionDef(List<AstNode> decorators, SourceLocation start, boolean isAsync) {
        expectKeyword("def");
        var name = expectName();
        expectOp("(");
        var args = parameters(")", true);
        expectOp(")");
        AstNode returns = null;
        if (atOp("->")) {
            advance();
            returns = expression();
        }
        expectOp(":");
        var body = block();
        var node = new AstNode(isAsync ? NodeType.ASYNC_FUNCTION_DEF : NodeType.FUNCTION_DEF)
            .set("name", name)
            .set("args", args)
            .set("body", body)
            .set("decorator_list", decorators)
            .set("returns", returns);
        return finish(node, start);
    }

    private AstNode classDef(List<AstNode> decorators, SourceLocation start) {
        expectKeyword("class");
        var name = expectName();
        var bases = new ArrayList<AstNode>();
        var keywords = new ArrayList<AstNode>();
        if (atOp("(")) {
            var parenStart = advance().span().start();
            callArguments(bases, keywords, parenStart, false);
            expectOp(")");
        }
        expectOp(":");
        var body = block();
        var node = new AstNode(NodeType.CLASS_DEF)
            .set("name", name)
            .set("bases", bases)
            .set("keywords", keywords)
            .set("body", body)
            .set("decorator_list", decorators);
        return finish(node, start);
    }

    private AstNode ifStatement() {
        var start = advance().span().start();
        var test = namedExpression();
        expectOp(":");
        var body = block();
        List<AstNode> orelse = List.of();
        if (atKeyword("elif")) {
            orelse = List.of(ifStatement());
        } else if (atKeyword("else")) {
            orelse = elseBlock();
        }
        return finish(new AstNode(NodeType.IF).set("test", test).set("body", body).set("orelse", orelse), start);
    }

    private AstNode whileStatement() {
        var start = advance().span().start();
        var test = namedExpression();
        expectOp(":");
        var body = block();
        var orelse = atKeyword("else") ? elseBlock() : List.<AstNode>of();
        return finish(new AstNode(NodeType.WHILE).set("test", test).set("body", body).set("orelse", orelse), start);
    }

    private AstNode forStatement(SourceLocation start, boolean isAsync) {
        expectKeyword("for");
        var target = targets();
        setContext(target, ExprContext.STORE);
        expectKeyword("in");
        var iter = starExpressions();
        expectOp(":");
        var body = block();
        var orelse = atKeyword("else") ? elseBlock() : List.<AstNode>of();
        var node = new AstNode(isAsync ? NodeType.ASYNC_FOR : NodeType.FOR)
            .set("target", target)
            .set("iter", iter)
            .set("body", body)
            .set("orelse", orelse);
        return finish(node, start);
    }

    private AstNode tryStatement() {
        var start = advance().span().start();
        expectOp(":");
        var body = block();
        var handlers = new ArrayList<AstNode>();
        while (atKeyword("except")) {
            var handlerStart = advance().span().start();
            AstNode type = null;
            String name = null;
            if (!atOp(":")) {
                type = expression();
                if (atKeyword("as")) {
                    advance();
                    name = expectName();
                }
            }
            expectOp(":");
            var handlerBody = block();
            handlers.add(finish(new AstNode(NodeType.EXCEPT_HANDLER)
                                    .set("type", type)
                                    .set("name", name)
                                    .set("body", handlerBody), handlerStart));
        }
        List<AstNode> orelse = List.of();
        if (!handlers.isEmpty() && atKeyword("else")) {
            orelse = elseBlock();
        }
        List<AstNode> finalbody = List.of();
        if (atKeyword("finally")) {
            advance();
            expectOp(":");
            finalbody = block();
        }
        if (handlers.isEmpty() && finalbody.isEmpty()) {
            throw fail("'except' or 'finally'");
        }
        var node = new AstNode(NodeType.TRY)
            .set("body", body)
            .set("handlers", handlers)
            .set("orelse", orelse)
            .set("finalbody", finalbody);
        return finish(node, start);
    }

    private AstNode withStatement(SourceLocation start, boolean isAsync) {
        expectKeyword("with");
        var items = new ArrayList<AstNode>();
        do {
            if (!items.isEmpty()) {
                advance();
            }
            var contextExpr = expression();
            AstNode vars = null;
            if (atKeyword("as")) {
                advance();
                vars = target();
                setContext(vars, ExprContext.STORE);
            }
            items.add(new AstNode(NodeType.WITH_ITEM).set("context_expr", contextExpr).set("optional_vars", vars));
        } while (atOp(","));
        expectOp(":");
        var body = block();
        var node = new AstNode(isAsync ? NodeType.ASYNC_WITH : NodeType.WITH).set("items", items).set("body", body);
        return finish(node, start);
    }

    private List<AstNode> elseBlock() {
        advance();
        expectOp(":");
        return block();
    }

    private List<AstNode> block() {
        if (!(peek() instanceof Token.Newline)) {
            return simpleStatements();
        }
        advance();
        if (!(peek() instanceof Token.Indent)) {
            throw new Failure(new ParseError.IndentationError(peek().span().start(), "expected an indented block"));
        }
        advance();
        var body = new ArrayList<AstNode>();
        while (!(peek() instanceof Token.Dedent) && !(peek() instanceof Token.EndMarker)) {
            if (peek() instanceof Token.Newline) {
                advance();
                continue;
            }
            body.addAll(statement());
        }
        if (peek() instanceof Token.Dedent) {
            advance();
        }
        return body;
    }

    private List<AstNode> simpleStatements() {
        var statements = new ArrayList<AstNode>();
        statements.add(simpleStatement());
        while (atOp(";")) {
            advance();
            if (peek() instanceof Token.Newline || peek() instanceof Token.EndMarker) {
                break;
            }
            statements.add(simpleStatement());
        }
        expectNewline();
        return statements;
    }

    private AstNode simpleStatement() {
        var token = peek();
        var start = token.span().start();
        if (!(token instanceof Token.Name)) {
            return expressionStatement(start);
        }
        switch (token.text()) {
            case "pass" -> {
                advance();
                return finish(new AstNode(NodeType.PASS), start);
            }
            case "break" -> {
                advance();
                return finish(new AstNode(NodeType.BREAK), start);
            }
            case "continue" -> {
                advance();
                return finish(new AstNode(NodeType.CONTINUE), start);
            }
            case "return" -> {
                advance();
                var value = atStatementEnd() ? null : starExpressions();
                return finish(new AstNode(NodeType.RETURN).set("value", value), start);
            }
            case "raise" -> {
                advance();
                AstNode exc = null;
                AstNode cause = null;
                if (!atStatementEnd()) {
                    exc = expression();
                    if (atKeyword("from")) {
                        advance();
                        cause = expression();
                    }
                }
                return finish(new AstNode(NodeType.RAISE).set("exc", exc).set("cause", cause), start);
            }
            case "global", "nonlocal" -> {
                advance();
                var names = new ArrayList<Object>();
                names.add(expectName());
                while (atOp(",")) {
                    advance();
                    names.add(expectName());
                }
                var type = token.text().equals("global") ? NodeType.GLOBAL : NodeType.NONLOCAL;
                return finish(new AstNode(type).set("names", names), start);
            }
            case "del" -> {
                advance();
                var targets = new ArrayList<AstNode>();
                targets.add(target());
                while (atOp(",")) {
                    advance();
                    if (atStatementEnd()) {
                        break;
                    }
                    targets.add(target());
                }
                targets.forEach(target -> setContext(target, ExprContext.DEL));
                return finish(new AstNode(NodeType.DELETE).set("targets", targets), start);
            }
            case "assert" -> {
                advance();
                var test = expression();
                AstNode msg = null;
                if (atOp(",")) {
                    advance();
                    msg = expression();
                }
                return finish(new AstNode(NodeType.ASSERT).set("test", test).set("msg", msg), start);
            }
            case "import" -> {
                return importStatement(start);
            }
            case "from" -> {
                return importFromStatement(start);
            }
            default -> {
                return expressionStatement(start);
            }
        }
    }

    private AstNode importStatement(SourceLocation start) {
        advance();
        var names = new ArrayList<AstNode>();
        do {
            if (!names.isEmpty()) {
                advance();
            }
            var aliasStart = peek().span().start();
            var name = dottedName();
            names.add(finish(Nodes.alias(name, optionalAsName()), aliasStart));
        } while (atOp(","));
        return finish(new AstNode(NodeType.IMPORT).set("names", names), start);
    }

    private AstNode importFromStatement(SourceLocation start) {
        advance();
        int level = 0;
        while (atOp(".") || atOp("...")) {
            level += advance().text().length();
        }
        String module = null;
        if (!atKeyword("import")) {
            module = dottedName();
        }
        expectKeyword("import");
        var names = new ArrayList<AstNode>();
        if (atOp("*")) {
            var aliasStart = advance().span().start();
            names.add(finish(Nodes.alias("*"), aliasStart));
        } else {
            boolean parenthesizedNames = atOp("(");
            if (parenthesizedNames) {
                advance();
            }
            do {
                if (!names.isEmpty()) {
                    advance();
                    if (parenthesizedNames && atOp(")")) {
                        break;
                    }
                }
                var aliasStart = peek().span().start();
                var name = expectName();
                names.add(finish(Nodes.alias(name, optionalAsName()), aliasStart));
            } while (atOp(","));
            if (parenthesizedNames) {
                expectOp(")");
            }
        }
        var node = new AstNode(NodeType.IMPORT_FROM).set("module", module).set("names", names).set("level", level);
        return finish(node, start);
    }

    private @Nullable String optionalAsName() {
        if (atKeyword("as")) {
            advance();
            return expectName();
        }
        return null;
    }

    private String dottedName() {
        var sb = new StringBuilder(expectName());
        while (atOp(".")) {
            advance();
            sb.append('.').append(expectName());
        }
        return sb.toString();
    }

    private AstNode expressionStatement(SourceLocation start) {
        var first = atKeyword("yield") ? yieldExpression() : starExpressions();
        if (atOp(":")) {
            return annotatedAssignment(first, start);
        }
        var token = peek();
        if (token instanceof Token.Op && AUGMENTED_OPS.contains(token.text())) {
            requireSingleTarget(first, "augmented assignment");
            setContext(first, ExprContext.STORE);
            advance();
            var symbol = token.text().substring(0, token.text().length() - 1);
            var op = Operator.binary(symbol).orElseThrow();
            var value = atKeyword("yield") ? yieldExpression() : starExpressions();
            return finish(new AstNode(NodeType.AUG_ASSIGN).set("target", first).set("op", op).set("value", value),
                          start);
        }
        if (atOp("=")) {
            var parts = new ArrayList<AstNode>();
            parts.add(first);
            while (atOp("=")) {
                advance();
                parts.add(atKeyword("yield") ? yieldExpression() : starExpressions());
            }
            var value = parts.remove(parts.size() - 1);
            parts.forEach(target -> setContext(target, ExprContext.STORE));
            return finish(Nodes.assign(parts, value), start);
        }
        return finish(Nodes.expr(first), start);
    }

    private AstNode annotatedAssignment(AstNode target, SourceLocation start) {
        requireSingleTarget(target, "annotated assignment");
        advance();
        var annotation = expression();
        AstNode value = null;
        if (atOp("=")) {
            advance();
            value = atKeyword("yield") ? yieldExpression() : starExpressions();
        }
        int simple = target.is(NodeType.NAME) && !parenthesized.contains(target) ? 1 : 0;
        setContext(target, ExprContext.STORE);
        var node = new AstNode(NodeType.ANN_ASSIGN)
            .set("target", target)
            .set("annotation", annotation)
            .set("value", value)
            .set("simple", simple);
        return finish(node, start);
    }

    private void requireSingleTarget(AstNode target, String construct) {
        if (!target.is(NodeType.NAME, NodeType.ATTRIBUTE, NodeType.SUBSCRIPT)) {
            throw new Failure(new ParseError.InvalidSyntax(locationOf(target),
                                                           "illegal target for " + construct));
        }
    }

    private void setContext(AstNode node, ExprContext ctx) {
        switch (node.type()) {
            case NAME, ATTRIBUTE, SUBSCRIPT -> node.set("ctx", ctx);
            case STARRED -> {
                node.set("ctx", ctx);
                setContext(node.node("value"), ctx);
            }
            case TUPLE, LIST -> {
                node.set("ctx", ctx);
                node.nodes("elts").forEach(element -> setContext(element, ctx));
            }
            default -> throw new Failure(new ParseError.InvalidSyntax(
                locationOf(node),
                (ctx == ExprContext.DEL ? "cannot delete " : "cannot assign to ") + node.type().pyName()));
        }
    }

    private static SourceLocation locationOf(AstNode node) {
        var span = node.span();
        return span == null ? SourceLocation.START : span.start();
    }

    // === Expressions ===

    private AstNode starExpressions() {
        var start = peek().span().start();
        var first = starExpression();
        if (!atOp(",")) {
            return first;
        }
        var elements = new ArrayList<AstNode>();
        elements.add(first);
        while (atOp(",")) {
            advance();
            if (!canStartExpression()) {
                break;
            }
            elements.add(starExpression());
        }
        return finish(Nodes.tuple(elements), start);
    }

    private AstNode starExpression() {
        if (atOp("*")) {
            var start = advance().span().start();
            var value = bitwiseOr();
            return finish(starred(value), start);
        }
        return expression();
    }

    private AstNode starNamedExpression() {
        if (atOp("*")) {
            var start = advance().span().start();
            var value = bitwiseOr();
            return finish(starred(value), start);
        }
        return namedExpression();
    }

    private static AstNode starred(AstNode value) {
        return new AstNode(NodeType.STARRED).set("value", value).set("ctx", ExprContext.LOAD);
    }

    private AstNode namedExpression() {
        var token = peek();
        if (token instanceof Token.Name && !KEYWORDS.contains(token.text())
            && peekAhead(1) instanceof Token.Op op && op.text().equals(":=")) {
            var start = token.span().start();
            advance();
            var target = finish(Nodes.name(token.text(), ExprContext.STORE), start);
            advance();
            var value = expression();
            return finish(new AstNode(NodeType.NAMED_EXPR).set("target", target).set("value", value), start);
        }
        return expression();
    }

    private AstNode expression() {
        if (atKeyword("lambda")) {
            return lambda();
        }
        var start = peek().span().start();
        var body = disjunction();
        if (!atKeyword("if")) {
            return body;
        }
        advance();
        var test = disjunction();
        expectKeyword("else");
        var orelse = expression();
        return finish(new AstNode(NodeType.IF_EXP).set("test", test).set("body", body).set("orelse", orelse), start);
    }

    private AstNode lambda() {
        var start = advance().span().start();
        var args = parameters(":", false);
        expectOp(":");
        var body = expression();
        return finish(new AstNode(NodeType.LAMBDA).set("args", args).set("body", body), start);
    }

    private AstNode disjunction() {
        return boolOp(Operator.OR, this::conjunction);
    }

    private AstNode conjunction() {
        return boolOp(Operator.AND, this::inversion);
    }

    private AstNode boolOp(Operator op, Supplier<AstNode> operand) {
        var start = peek().span().start();
        var first = operand.get();
        if (!atKeyword(op.symbol())) {
            return first;
        }
        var values = new ArrayList<AstNode>();
        values.add(first);
        while (atKeyword(op.symbol())) {
            advance();
            values.add(operand.get());
        }
        return finish(new AstNode(NodeType.BOOL_OP).set("op", op).set("values", values), start);
    }

    private AstNode inversion() {
        if (atKeyword("not")) {
            var start = advance().span().start();
            var operand = inversion();
            return finish(Nodes.unaryOp(Operator.NOT, operand), start);
        }
        return comparison();
    }

    private AstNode comparison() {
        var start = peek().span().start();
        var left = bitwiseOr();
        var ops = new ArrayList<Object>();
        var comparators = new ArrayList<AstNode>();
        for (var op = comparisonOperator(); op != null; op = comparisonOperator()) {
            ops.add(op);
            comparators.add(bitwiseOr());
        }
        if (ops.isEmpty()) {
            return left;
        }
        var node = new AstNode(NodeType.COMPARE).set("left", left).set("ops", ops).set("comparators", comparators);
        return finish(node, start);
    }

    private @Nullable Operator comparisonOperator() {
        var token = peek();
        if (token instanceof Token.Op) {
            var op = Operator.comparison(token.text());
            op.ifPresent(found -> advance());
            return op.orElse(null);
        }
        if (atKeyword("in")) {
            advance();
            return Operator.IN;
        }
        if (atKeyword("not") && peekAhead(1) instanceof Token.Name next && next.text().equals("in")) {
            advance();
            advance();
            return Operator.NOT_IN;
        }
        if (atKeyword("is")) {
            advance();
            if (atKeyword("not")) {
                advance();
                return Operator.IS_NOT;
            }
            return Operator.IS;
        }
        return null;
    }

    private AstNode bitwiseOr() {
        return binaryLevel(this::bitwiseXor, OR_OPS);
    }

    private AstNode bitwiseXor() {
        return binaryLevel(this::bitwiseAnd, XOR_OPS);
    }

    private AstNode bitwiseAnd() {
        return binaryLevel(this::shiftExpression, AND_OPS);
    }

    private AstNode shiftExpression() {
        return binaryLevel(this::sum, SHIFT_OPS);
    }

    private AstNode sum() {
        return binaryLevel(this::term, SUM_OPS);
    }

    private AstNode term() {
        return binaryLevel(this::factor, TERM_OPS);
    }

    private AstNode binaryLevel(Supplier<AstNode> operand, Map<String, Operator> ops) {
        var start = peek().span().start();
        var left = operand.get();
        while (peek() instanceof Token.Op token && ops.containsKey(token.text())) {
            advance();
            var right = operand.get();
            left = finish(Nodes.binOp(left, ops.get(token.text()), right), start);
        }
        return left;
    }

    private AstNode factor() {
        var token = peek();
        if (token instanceof Token.Op && UNARY_OPS.containsKey(token.text())) {
            var start = advance().span().start();
            var operand = factor();
            return finish(Nodes.unaryOp(UNARY_OPS.get(token.text()), operand), start);
        }
        return power();
    }

    private AstNode power() {
        var start = peek().span().start();
        var base = awaitPrimary();
        if (!atOp("**")) {
            return base;
        }
        advance();
        var exponent = factor();
        return finish(Nodes.binOp(base, Operator.POW, exponent), start);
    }

    private AstNode awaitPrimary() {
        if (atKeyword("await")) {
            var start = advance().span().start();
            var value = primary();
            return finish(Nodes.await(value), start);
        }
        return primary();
    }

    private AstNode primary() {
        var start = peek().span().start();
        var node = atom();
        while (true) {
            if (atOp(".")) {
                advance();
                var attr = expectName();
                node = finish(Nodes.attribute(node, attr), start);
            } else if (atOp("(")) {
                var parenStart = advance().span().start();
                var args = new ArrayList<AstNode>();
                var keywords = new ArrayList<AstNode>();
                var generator = callArguments(args, keywords, parenStart, true);
                expectOp(")");
                if (generator != null) {
                    finish(generator, parenStart);
                }
                node = finish(Nodes.call(node, args, keywords), start);
            } else if (atOp("[")) {
                advance();
                var slice = slices();
                expectOp("]");
                node = finish(new AstNode(NodeType.SUBSCRIPT)
                                  .set("value", node)
                                  .set("slice", slice)
                                  .set("ctx", ExprContext.LOAD), start);
            } else {
                return node;
            }
        }
    }

    /**
     * Parse call arguments up to the closing parenthesis. Returns the generator expression when it is the
     * sole, unparenthesized argument, so the caller can give it the span of the call parentheses.
     */
    private @Nullable AstNode callArguments(List<AstNode> args,
                                            List<AstNode> keywords,
                                            SourceLocation parenStart,
                                            boolean allowGenerator) {
        AstNode generator = null;
        while (!atOp(")")) {
            var start = peek().span().start();
            if (atOp("*")) {
                advance();
                var value = expression();
                args.add(finish(starred(value), start));
            } else if (atOp("**")) {
                advance();
                var value = expression();
                keywords.add(finish(Nodes.keyword(null, value), start));
            } else if (peek() instanceof Token.Name name && !KEYWORDS.contains(name.text())
                       && peekAhead(1) instanceof Token.Op op && op.text().equals("=")) {
                advance();
                advance();
                var value = expression();
                keywords.add(finish(Nodes.keyword(name.text(), value), start));
            } else {
                var value = namedExpression();
                if (allowGenerator && atComprehensionFor()) {
                    value = new AstNode(NodeType.GENERATOR_EXP).set("elt", value).set("generators", comprehensions());
                    value.setSpan(SourceSpan.at(parenStart));
                    generator = value;
                }
                args.add(value);
            }
            if (!atOp(",")) {
                break;
            }
            advance();
        }
        if (generator != null && (args.size() > 1 || !keywords.isEmpty())) {
            throw new Failure(new ParseError.InvalidSyntax(parenStart, "Generator expression must be parenthesized"));
        }
        return generator;
    }

    private AstNode slices() {
        var start = peek().span().start();
        var first = slice();
        if (!atOp(",")) {
            return first;
        }
        var elements = new ArrayList<AstNode>();
        elements.add(first);
        while (atOp(",")) {
            advance();
            if (atOp("]")) {
                break;
            }
            elements.add(slice());
        }
        return finish(Nodes.tuple(elements), start);
    }

    private AstNode slice() {
        var start = peek().span().start();
        AstNode lower = null;
        if (!atOp(":")) {
            lower = starNamedExpression();
            if (!atOp(":")) {
                return lower;
            }
        }
        advance();
        AstNode upper = null;
        if (!atOp(":") && !atOp("]") && !atOp(",")) {
            upper = expression();
        }
        AstNode step = null;
        if (atOp(":")) {
            advance();
            if (!atOp("]") && !atOp(",")) {
                step = expression();
            }
        }
        return finish(new AstNode(NodeType.SLICE).set("lower", lower).set("upper", upper).set("step", step), start);
    }

    private AstNode atom() {
        var token = peek();
        var start = token.span().start();
        if (token instanceof Token.Name) {
            switch (token.text()) {
                case "None" -> {
                    advance();
                    return finish(Nodes.constant(null), start);
                }
                case "True", "False" -> {
                    advance();
                    return finish(Nodes.constant(token.text().equals("True")), start);
                }
                default -> {
                    if (KEYWORDS.contains(token.text())) {
                        throw fail("expression");
                    }
                    advance();
                    return finish(Nodes.name(token.text()), start);
                }
            }
        }
        if (token instanceof Token.Number) {
            advance();
            try {
                return finish(Nodes.constant(LiteralParser.parseNumber(token.text())), start);
            } catch (IllegalArgumentException e) {
                throw new Failure(new ParseError.InvalidSyntax(start, "invalid number literal: " + e.getMessage()));
            }
        }
        if (token instanceof Token.Str) {
            return strings();
        }
        if (token instanceof Token.Op) {
            switch (token.text()) {
                case "(" -> {
                    return group();
                }
                case "[" -> {
                    return listDisplay();
                }
                case "{" -> {
                    return dictOrSetDisplay();
                }
                case "..." -> {
                    advance();
                    return finish(Nodes.constant(Ellipsis.INSTANCE), start);
                }
                default -> throw fail("expression");
            }
        }
        throw fail("expression");
    }

    private AstNode strings() {
        var start = peek().span().start();
        var texts = new ArrayList<String>();
        while (peek() instanceof Token.Str) {
            texts.add(advance().text());
        }
        try {
            return finish(LiteralParser.parseStrings(texts, text -> formattedExpression(text, start)), start);
        } catch (IllegalArgumentException e) {
            throw new Failure(new ParseError.InvalidSyntax(start, e.getMessage()));
        }
    }

    private static AstNode formattedExpression(String text, SourceLocation location) {
        try {
            var module = parse("(" + text + ")");
            var body = module.nodes("body");
            if (body.size() != 1 || !body.get(0).is(NodeType.EXPR)) {
                throw new Failure(new ParseError.InvalidSyntax(location, "f-string: invalid expression"));
            }
            return body.get(0).node("value").clearPositions();
        } catch (SyntaxErrorException e) {
            throw new Failure(new ParseError.InvalidSyntax(location, "f-string: " + e.error().message()));
        }
    }

    private AstNode group() {
        var start = advance().span().start();
        if (atOp(")")) {
            advance();
            return finish(Nodes.tuple(List.of()), start);
        }
        if (atKeyword("yield")) {
            var inner = yieldExpression();
            expectOp(")");
            parenthesized.add(inner);
            return inner;
        }
        var first = starNamedExpression();
        if (atComprehensionFor()) {
            var generators = comprehensions();
            expectOp(")");
            return finish(new AstNode(NodeType.GENERATOR_EXP).set("elt", first).set("generators", generators), start);
        }
        if (atOp(",")) {
            var elements = new ArrayList<AstNode>();
            elements.add(first);
            while (atOp(",")) {
                advance();
                if (atOp(")")) {
                    break;
                }
                elements.add(starNamedExpression());
            }
            expectOp(")");
            return finish(Nodes.tuple(elements), start);
        }
        expectOp(")");
        parenthesized.add(first);
        return first;
    }

    private AstNode listDisplay() {
        var start = advance().span().start();
        var elements = new ArrayList<AstNode>();
        if (!atOp("]")) {
            var first = starNamedExpression();
            if (atComprehensionFor()) {
                var generators = comprehensions();
                expectOp("]");
                return finish(new AstNode(NodeType.LIST_COMP).set("elt", first).set("generators", generators), start);
            }
            elements.add(first);
            while (atOp(",")) {
                advance();
                if (atOp("]")) {
                    break;
                }
                elements.add(starNamedExpression());
            }
        }
        expectOp("]");
        return finish(new AstNode(NodeType.LIST).set("elts", elements).set("ctx", ExprContext.LOAD), start);
    }

    private AstNode dictOrSetDisplay() {
        var start = advance().span().start();
        if (atOp("}")) {
            advance();
            return finish(new AstNode(NodeType.DICT), start);
        }
        var keys = new ArrayList<AstNode>();
        var values = new ArrayList<AstNode>();
        if (atOp("**")) {
            advance();
            keys.add(null);
            values.add(bitwiseOr());
            return dictRest(keys, values, start);
        }
        var first = starNamedExpression();
        if (atOp(":")) {
            advance();
            var value = expression();
            if (atComprehensionFor()) {
                var generators = comprehensions();
                expectOp("}");
                var node = new AstNode(NodeType.DICT_COMP).set("key", first).set("value", value).set("generators", generators);
                return finish(node, start);
            }
            keys.add(first);
            values.add(value);
            return dictRest(keys, values, start);
        }
        if (atComprehensionFor()) {
            var generators = comprehensions();
            expectOp("}");
            return finish(new AstNode(NodeType.SET_COMP).set("elt", first).set("generators", generators), start);
        }
        var elements = new ArrayList<AstNode>();
        elements.add(first);
        while (atOp(",")) {
            advance();
            if (atOp("}")) {
                break;
            }
            elements.add(starNamedExpression());
        }
        expectOp("}");
        return finish(new AstNode(NodeType.SET).set("elts", elements), start);
    }

    private AstNode dictRest(List<AstNode> keys, List<AstNode> values, SourceLocation start) {
        while (atOp(",")) {
            advance();
            if (atOp("}")) {
                break;
            }
            if (atOp("**")) {
                advance();
                keys.add(null);
                values.add(bitwiseOr());
            } else {
                keys.add(expression());
                expectOp(":");
                values.add(expression());
            }
        }
        expectOp("}");
        return finish(new AstNode(NodeType.DICT).set("keys", keys).set("values", values), start);
    }

    private boolean atComprehensionFor() {
        return atKeyword("for")
               || (atKeyword("async") && peekAhead(1) instanceof Token.Name next && next.text().equals("for"));
    }

    private List<AstNode> comprehensions() {
        var generators = new ArrayList<AstNode>();
        while (atComprehensionFor()) {
            int isAsync = 0;
            if (atKeyword("async")) {
                advance();
                isAsync = 1;
            }
            expectKeyword("for");
            var target = targets();
            setContext(target, ExprContext.STORE);
            expectKeyword("in");
            var iter = disjunction();
            var ifs = new ArrayList<AstNode>();
            while (atKeyword("if")) {
                advance();
                ifs.add(disjunction());
            }
            generators.add(new AstNode(NodeType.COMPREHENSION)
                               .set("target", target)
                               .set("iter", iter)
                               .set("ifs", ifs)
                               .set("is_async", isAsync));
        }
        return generators;
    }

    private AstNode yieldExpression() {
        var start = advance().span().start();
        if (atKeyword("from")) {
            advance();
            var value = expression();
            return finish(new AstNode(NodeType.YIELD_FROM).set("value", value), start);
        }
        var value = canStartExpression() ? starExpressions() : null;
        return finish(new AstNode(NodeType.YIELD).set("value", value), start);
    }

    private AstNode targets() {
        var start = peek().span().start();
        var first = target();
        if (!atOp(",")) {
            return first;
        }
        var elements = new ArrayList<AstNode>();
        elements.add(first);
        while (atOp(",")) {
            advance();
            if (!canStartTarget()) {
                break;
            }
            elements.add(target());
        }
        return finish(Nodes.tuple(elements), start);
    }

    private AstNode target() {
        if (atOp("*")) {
            var start = advance().span().start();
            var value = target();
            return finish(starred(value), start);
        }
        return bitwiseOr();
    }

    private boolean canStartTarget() {
        var token = peek();
        if (token instanceof Token.Name) {
            return !KEYWORDS.contains(token.text());
        }
        return atOp("(") || atOp("[") || atOp("*");
    }

    private boolean canStartExpression() {
        var token = peek();
        if (token instanceof Token.Name) {
            return !KEYWORDS.contains(token.text()) || EXPRESSION_KEYWORDS.contains(token.text());
        }
        if (token instanceof Token.Number || token instanceof Token.Str) {
            return true;
        }
        return token instanceof Token.Op && EXPRESSION_START_OPS.contains(token.text());
    }

    private AstNode parameters(String closing, boolean allowAnnotations) {
        var posonlyargs = new ArrayList<AstNode>();
        var args = new ArrayList<AstNode>();
        var defaults = new ArrayList<AstNode>();
        var kwonlyargs = new ArrayList<AstNode>();
        var kwDefaults = new ArrayList<AstNode>();
        AstNode vararg = null;
        AstNode kwarg = null;
        boolean afterStar = false;
        while (!atOp(closing)) {
            if (atOp("/")) {
                advance();
                posonlyargs.addAll(args);
                args.clear();
            } else if (atOp("*")) {
                advance();
                afterStar = true;
                if (peek() instanceof Token.Name) {
                    vararg = parameter(allowAnnotations);
                }
            } else if (atOp("**")) {
                advance();
                kwarg = parameter(allowAnnotations);
            } else {
                var location = peek().span().start();
                var parameter = parameter(allowAnnotations);
                AstNode defaultValue = null;
                if (atOp("=")) {
                    advance();
                    defaultValue = expression();
                }
                if (afterStar) {
                    kwonlyargs.add(parameter);
                    kwDefaults.add(defaultValue);
                } else {
                    args.add(parameter);
                    if (defaultValue != null) {
                        defaults.add(defaultValue);
                    } else if (!defaults.isEmpty()) {
                        throw new Failure(new ParseError.InvalidSyntax(location,
                                                                       "non-default argument follows default argument"));
                    }
                }
            }
            if (!atOp(",")) {
                break;
            }
            advance();
        }
        return new AstNode(NodeType.ARGUMENTS)
            .set("posonlyargs", posonlyargs)
            .set("args", args)
            .set("vararg", vararg)
            .set("kwonlyargs", kwonlyargs)
            .set("kw_defaults", kwDefaults)
            .set("kwarg", kwarg)
            .set("defaults", defaults);
    }

    private AstNode parameter(boolean allowAnnotations) {
        var start = peek().span().start();
        var name = expectName();
        AstNode annotation = null;
        if (allowAnnotations && atOp(":")) {
            advance();
            annotation = expression();
        }
        return finish(new AstNode(NodeType.ARG).set("arg", name).set("annotation", annotation), start);
    }

    // === Token helpers ===

    private AstNode finish(AstNode node, SourceLocation start) {
        return node.setSpan(SourceSpan.of(start, lastSignificant.span().end()));
    }

    private Token peek() {
        var token = tokens.get(pos);
        if (token instanceof Token.Error error) {
            throw new Failure(error.error());
        }
        return token;
    }

    private Token peekAhead(int distance) {
        return tokens.get(Math.min(pos + distance, tokens.size() - 1));
    }

    private Token advance() {
        var token = peek();
        if (!(token instanceof Token.EndMarker)) {
            pos++;
        }
        if (!(token instanceof Token.Newline || token instanceof Token.Indent
              || token instanceof Token.Dedent || token instanceof Token.EndMarker)) {
            lastSignificant = token;
        }
        return token;
    }

    private boolean atOp(String op) {
        var token = peek();
        return token instanceof Token.Op && token.text().equals(op);
    }

    private boolean atKeyword(String keyword) {
        var token = peek();
        return token instanceof Token.Name && token.text().equals(keyword);
    }

    private boolean atStatementEnd() {
        var token = peek();
        return token instanceof Token.Newline || token instanceof Token.EndMarker || atOp(";");
    }

    private void expectOp(String op) {
        if (!atOp(op)) {
            throw fail("'" + op + "'");
        }
        advance();
    }

    private void expectKeyword(String keyword) {
        if (!atKeyword(keyword)) {
            throw fail("'" + keyword + "'");
        }
        advance();
    }

    private String expectName() {
        var token = peek();
        if (!(token instanceof Token.Name) || KEYWORDS.contains(token.text())) {
            throw fail("identifier");
        }
        advance();
        return token.text();
    }

    private void expectNewline() {
        var token = peek();
        if (token instanceof Token.Newline) {
            advance();
        } else if (!(token instanceof Token.EndMarker)) {
            throw fail("newline");
        }
    }

    private Failure fail(String expected) {
        var token = peek();
        var location = token.span().start();
        if (token instanceof Token.EndMarker) {
            return new Failure(new ParseError.UnexpectedEof(location, expected));
        }
        if (token instanceof Token.Indent) {
            return new Failure(new ParseError.IndentationError(location, "unexpected indent"));
        }
        return new Failure(new ParseError.UnexpectedToken(location, Token.describe(token), expected));
    }
}
