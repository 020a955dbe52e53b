package org.pragmatica.refactor;

import org.junit.jupiter.api.Test;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;
import org.pragmatica.refactor.tree.Nodes;
import org.pragmatica.refactor.tree.Operator;
import org.pragmatica.refactor.unparse.UnparserBackend;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CommonTest {

    @Test
    void negate_wrapsInNot() throws SyntaxErrorException {
        var tree = PythonParser.parse("foo");
        var statement = tree.nodes("body").get(0);
        statement.set("value", Common.negate(statement.node("value")));

        assertThat(UnparserBackend.FAST.create(null).unparse(tree)).isEqualTo("not foo");
    }

    @Test
    void applyCondition_keepsOrNegates() {
        var name = Nodes.name("x");

        assertThat(Common.applyCondition(true, name)).isSameAs(name);
        assertThat(Common.applyCondition(false, name).value("op")).isEqualTo(Operator.NOT);
    }

    @Test
    void isTruthy_classifiesComparisons() {
        assertThat(Common.isTruthy(Operator.EQ)).contains(true);
        assertThat(Common.isTruthy(Operator.IS_NOT)).contains(false);
        assertThat(Common.isTruthy(Operator.LT)).isEmpty();
    }

    @Test
    void pascalToSnake_splitsOnCapitals() {
        assertThat(Common.pascalToSnake("ImportFinder")).isEqualTo("import_finder");
        assertThat(Common.pascalToSnake("Scope")).isEqualTo("scope");
    }

    @Test
    void unpackLhs_flattensTargets() throws SyntaxErrorException {
        var target = PythonParser.parse("(a, [b, c.d]), e[0] = x").nodes("body").get(0).nodes("targets").get(0);

        assertThat(Common.unpackLhs(target)).containsExactly("a", "b", "c.d", "e[0]");
    }

    @Test
    void findClosest_prefersLineThenColumn() throws SyntaxErrorException {
        var body = PythonParser.parse("a = 1\nb = 2; c = 3\nd = 4\n").nodes("body");
        var d = body.get(3);

        assertThat(Common.findClosest(d, List.of(body.get(0), body.get(1), body.get(2)))).isSameAs(body.get(1));
        assertThat(Common.findClosest(d, List.of(body.get(0), d))).isSameAs(d);
        assertThrows(IllegalArgumentException.class, () -> Common.findClosest(d, List.of()));
    }

    @Test
    void getSourceSegment_returnsExactText() throws SyntaxErrorException {
        var source = "x = call(a,\n         b)\n";
        var call = PythonParser.parse(source).nodes("body").get(0).node("value");

        assertThat(Common.getSourceSegment(source, call)).contains("call(a,\n         b)");
        assertThat(Common.getSourceSegment(source, Nodes.name("x"))).isEmpty();
    }

    @Test
    void statementSpan_includesDecorators() throws SyntaxErrorException {
        var source = "class A:\n    @first\n    @second\n    def f(self):\n        pass\n";
        var method = PythonParser.parse(source).nodes("body").get(0).nodes("body").get(0);
        var span = Common.statementSpan(source, method);

        assertThat(span.start().line()).isEqualTo(2);
        assertThat(span.start().column()).isEqualTo(4);
        assertThat(span.extract(source)).startsWith("@first").endsWith("pass");
    }

    @Test
    void walkScope_skipsNestedScopeBodies() throws SyntaxErrorException {
        var source = "def f(a=default):\n    x = 1\n    def g(b=inner_default):\n        y = 2\n    z = [w for w in items]\n";
        var function = PythonParser.parse(source).nodes("body").get(0);

        var names = Common.walkScope(function).stream()
                          .filter(node -> node.is(NodeType.NAME))
                          .map(node -> node.string("id"))
                          .toList();

        assertThat(names).contains("x", "z", "inner_default", "items")
                         .doesNotContain("default", "y", "w");
    }

    @Test
    void walkScope_nonScopeNode_isRejected() {
        AstNode name = Nodes.name("x");

        assertThrows(IllegalArgumentException.class, () -> Common.walkScope(name));
    }

    @Test
    void compareAst_ignoresPositions() throws SyntaxErrorException {
        var parsed = PythonParser.parse("f(1)").nodes("body").get(0).node("value");

        assertThat(Common.compareAst(parsed, Nodes.call(Nodes.name("f"), Nodes.constant(1L)))).isTrue();
        assertThat(Common.compareAst(null, null)).isTrue();
        assertThat(Common.compareAst(parsed, null)).isFalse();
    }
}
