package org.pragmatica.refactor;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;
import org.pragmatica.refactor.tree.Nodes;
import org.pragmatica.refactor.tree.Operator;
import org.pragmatica.refactor.tree.SourceLocation;
import org.pragmatica.refactor.tree.SourceSpan;
import org.pragmatica.refactor.unparse.UnparserBackend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for rule authors.
 */
public final class Common {
    private Common() {}

    /**
     * Source position of a node: 1-based lines, 0-based columns, end exclusive.
     */
    public record Position(int line, int column, int endLine, int endColumn) {}

    public static AstNode negate(AstNode node) {
        return Nodes.unaryOp(Operator.NOT, node);
    }

    /**
     * The node itself when {@code condition} holds, its negation otherwise.
     */
    public static AstNode applyCondition(boolean condition, AstNode node) {
        return condition ? node : negate(node);
    }

    /**
     * {@code true} for {@code ==}, {@code in} and {@code is}, {@code false} for their negated forms, empty for
     * ordering comparisons.
     */
    public static Optional<Boolean> isTruthy(Operator op) {
        return switch (op) {
            case EQ, IN, IS -> Optional.of(true);
            case NOT_EQ, NOT_IN, IS_NOT -> Optional.of(false);
            default -> Optional.empty();
        };
    }

    public static boolean isComprehension(AstNode node) {
        return node.is(NodeType.LIST_COMP, NodeType.SET_COMP, NodeType.DICT_COMP, NodeType.GENERATOR_EXP);
    }

    public static boolean isFunction(AstNode node) {
        return node.is(NodeType.FUNCTION_DEF, NodeType.ASYNC_FUNCTION_DEF, NodeType.LAMBDA);
    }

    /**
     * Whether the node opens a scope of its own.
     */
    public static boolean isContextful(AstNode node) {
        return node.is(NodeType.MODULE, NodeType.CLASS_DEF) || isFunction(node) || isComprehension(node);
    }

    /**
     * {@code FooBarBaz} to {@code foo_bar_baz}.
     */
    public static String pascalToSnake(String name) {
        var sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (i > 0 && Character.isUpperCase(c)) {
                sb.append('_');
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    /**
     * The target nearest to {@code node}, by line distance first and column distance second.
     */
    public static AstNode findClosest(AstNode node, List<AstNode> targets) {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("No targets to choose from");
        }
        return targets.stream()
                      .min(Comparator.<AstNode>comparingInt(target -> Math.abs(target.line() - node.line()))
                                     .thenComparingInt(target -> Math.abs(target.column() - node.column())))
                      .orElseThrow();
    }

    public static boolean hasPositions(NodeType type) {
        return type.isPositioned();
    }

    public static Position positionFor(AstNode node) {
        return new Position(node.line(), node.column(), node.endLine(), node.endColumn());
    }

    /**
     * Individual names bound by an assignment target: tuples and lists are unpacked, anything else is spelled
     * out as source ({@code obj.attr}, {@code items[0]}).
     */
    public static List<String> unpackLhs(AstNode node) {
        var result = new ArrayList<String>();
        if (node.is(NodeType.LIST, NodeType.TUPLE)) {
            for (var element : node.nodes("elts")) {
                result.addAll(unpackLhs(element));
            }
        } else if (node.is(NodeType.NAME)) {
            result.add(node.string("id"));
        } else {
            result.add(UnparserBackend.FAST.create(null).unparse(node));
        }
        return result;
    }

    /**
     * Like {@link AstNode#walk()} but stays within the scope opened by {@code node}: nested functions, lambdas
     * and classes contribute only the parts evaluated in the enclosing scope (decorators, defaults, annotations,
     * bases), nested comprehensions only their first iterable.
     */
    public static List<AstNode> walkScope(AstNode node) {
        if (!isContextful(node)) {
            throw new IllegalArgumentException(node.type() + " doesn't open a scope");
        }
        var result = new ArrayList<AstNode>();
        var todo = new ArrayDeque<AstNode>(scopeChildren(node, false));
        while (!todo.isEmpty()) {
            var current = todo.poll();
            todo.addAll(scopeChildren(current, true));
            result.add(current);
        }
        return result;
    }

    private static List<AstNode> scopeChildren(AstNode node, boolean nested) {
        var result = new ArrayList<AstNode>();
        if (isFunction(node)) {
            var args = node.node("args");
            if (nested) {
                if (!node.is(NodeType.LAMBDA)) {
                    result.addAll(node.nodes("decorator_list"));
                }
                result.addAll(args.nodes("defaults"));
                addPresent(result, args.nodes("kw_defaults"));
                if (!node.is(NodeType.LAMBDA) && node.node("returns") != null) {
                    result.add(node.node("returns"));
                }
            } else {
                result.addAll(args.nodes("posonlyargs"));
                result.addAll(args.nodes("args"));
                result.addAll(args.nodes("kwonlyargs"));
                addPresent(result, args.node("vararg"));
                addPresent(result, args.node("kwarg"));
                if (node.is(NodeType.LAMBDA)) {
                    result.add(node.node("body"));
                } else {
                    result.addAll(node.nodes("body"));
                }
            }
        } else if (node.is(NodeType.CLASS_DEF)) {
            if (nested) {
                result.addAll(node.nodes("decorator_list"));
                result.addAll(node.nodes("bases"));
                result.addAll(node.nodes("keywords"));
            } else {
                result.addAll(node.nodes("body"));
            }
        } else if (nested && isComprehension(node)) {
            var generators = node.nodes("generators");
            if (!generators.isEmpty()) {
                result.add(generators.get(0).node("iter"));
            }
        } else {
            result.addAll(node.children());
        }
        return result;
    }

    private static void addPresent(List<AstNode> result, List<AstNode> nodes) {
        for (var node : nodes) {
            addPresent(result, node);
        }
    }

    private static void addPresent(List<AstNode> result, @Nullable AstNode node) {
        if (node != null) {
            result.add(node);
        }
    }

    /**
     * Exact source text covered by the node, empty for unpositioned nodes.
     */
    public static Optional<String> getSourceSegment(String source, AstNode node) {
        if (!node.hasPosition()) {
            return Optional.empty();
        }
        var span = node.span();
        if (span.end().offset() > source.length()) {
            return Optional.empty();
        }
        return Optional.of(span.extract(source));
    }

    /**
     * Span of a statement including the decorators of a decorated function or class, which the node's own
     * span leaves out.
     */
    public static SourceSpan statementSpan(String source, AstNode node) {
        var span = node.span();
        if (span == null) {
            throw new IllegalArgumentException(node.type() + " node has no source position");
        }
        if (!node.is(NodeType.FUNCTION_DEF, NodeType.ASYNC_FUNCTION_DEF, NodeType.CLASS_DEF)
            || node.nodes("decorator_list").isEmpty()) {
            return span;
        }
        var first = node.nodes("decorator_list").get(0).span();
        if (first == null) {
            return span;
        }
        int lineStart = first.start().offset() - first.start().column();
        int column = 0;
        while (lineStart + column < source.length() && (source.charAt(lineStart + column) == ' '
                                                         || source.charAt(lineStart + column) == '\t'
                                                         || source.charAt(lineStart + column) == '\f')) {
            column++;
        }
        var start = SourceLocation.at(first.start().line(), column, lineStart + column);
        return SourceSpan.of(start, span.end());
    }

    public static String wrapWithParens(String text) {
        return "(" + text + ")";
    }

    /**
     * Structural equality ignoring positions.
     */
    public static boolean compareAst(@Nullable AstNode left, @Nullable AstNode right) {
        return left == null ? right == null : left.isSameAs(right);
    }
}
