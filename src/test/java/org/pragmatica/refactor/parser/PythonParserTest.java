package org.pragmatica.refactor.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.refactor.error.ParseError;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.ExprContext;
import org.pragmatica.refactor.tree.NodeType;
import org.pragmatica.refactor.tree.Operator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PythonParserTest {

    @Test
    void parse_assignment_buildsTreeWithPositions() throws SyntaxErrorException {
        var module = PythonParser.parse("x = 1\n");
        var assign = module.nodes("body").get(0);

        assertThat(module.type()).isEqualTo(NodeType.MODULE);
        assertThat(module.hasPosition()).isFalse();
        assertThat(assign.type()).isEqualTo(NodeType.ASSIGN);
        assertThat(assign.line()).isEqualTo(1);
        assertThat(assign.column()).isEqualTo(0);
        assertThat(assign.endColumn()).isEqualTo(5);

        var target = assign.nodes("targets").get(0);
        assertThat(target.string("id")).isEqualTo("x");
        assertThat(target.value("ctx")).isEqualTo(ExprContext.STORE);
        assertThat(assign.node("value").value("value")).isEqualTo(1L);
    }

    @Test
    void parse_parenthesizedOperand_outerNodeIncludesParentheses() throws SyntaxErrorException {
        var module = PythonParser.parse("(a + b) * c");
        var outer = module.nodes("body").get(0).node("value");
        var inner = outer.node("left");

        assertThat(outer.value("op")).isEqualTo(Operator.MULT);
        assertThat(outer.column()).isEqualTo(0);
        assertThat(outer.endColumn()).isEqualTo(11);
        assertThat(inner.column()).isEqualTo(1);
        assertThat(inner.endColumn()).isEqualTo(6);
    }

    @Test
    void parse_parenthesizedTuple_ownsItsParentheses() throws SyntaxErrorException {
        var tuple = PythonParser.parse("x = (1, 2)").nodes("body").get(0).node("value");

        assertThat(tuple.type()).isEqualTo(NodeType.TUPLE);
        assertThat(tuple.column()).isEqualTo(4);
        assertThat(tuple.endColumn()).isEqualTo(10);
    }

    @Test
    void parse_decoratedFunction_spanStartsAtDef() throws SyntaxErrorException {
        var function = PythonParser.parse("@deco\ndef f():\n    pass\n").nodes("body").get(0);

        assertThat(function.type()).isEqualTo(NodeType.FUNCTION_DEF);
        assertThat(function.nodes("decorator_list")).hasSize(1);
        assertThat(function.line()).isEqualTo(2);
        assertThat(function.endLine()).isEqualTo(3);
    }

    @Test
    void parse_adjacentStrings_areConcatenated() throws SyntaxErrorException {
        var constant = PythonParser.parse("'a' \"b\"").nodes("body").get(0).node("value");

        assertThat(constant.value("value")).isEqualTo("ab");
    }

    @Test
    void parse_fString_buildsUnpositionedParts() throws SyntaxErrorException {
        var joined = PythonParser.parse("f'a{b!r}'").nodes("body").get(0).node("value");

        assertThat(joined.type()).isEqualTo(NodeType.JOINED_STR);
        assertThat(joined.hasPosition()).isTrue();
        var parts = joined.nodes("values");
        assertThat(parts).hasSize(2);
        assertThat(parts.get(0).value("value")).isEqualTo("a");
        assertThat(parts.get(1).type()).isEqualTo(NodeType.FORMATTED_VALUE);
        assertThat(parts.get(1).intValue("conversion")).isEqualTo('r');
        assertThat(parts.get(1).node("value").hasPosition()).isFalse();
    }

    @Test
    void parse_annotatedAssignment_recordsSimpleTarget() throws SyntaxErrorException {
        var simple = PythonParser.parse("x: int = 1").nodes("body").get(0);
        var wrapped = PythonParser.parse("(x): int = 1").nodes("body").get(0);

        assertThat(simple.intValue("simple")).isEqualTo(1);
        assertThat(wrapped.intValue("simple")).isEqualTo(0);
    }

    @Test
    void parse_compoundStatements_nestBodies() throws SyntaxErrorException {
        var source = """
            for a, b in items:
                try:
                    pass
                except (ValueError, KeyError) as error:
                    continue
                finally:
                    done()
            else:
                stop()
            """;
        var loop = PythonParser.parse(source).nodes("body").get(0);

        assertThat(loop.type()).isEqualTo(NodeType.FOR);
        assertThat(loop.node("target").type()).isEqualTo(NodeType.TUPLE);
        assertThat(loop.nodes("orelse")).hasSize(1);
        var attempt = loop.nodes("body").get(0);
        assertThat(attempt.type()).isEqualTo(NodeType.TRY);
        assertThat(attempt.nodes("handlers").get(0).string("name")).isEqualTo("error");
        assertThat(attempt.nodes("finalbody")).hasSize(1);
    }

    @Test
    void parse_functionSignature_collectsAllParameterKinds() throws SyntaxErrorException {
        AstNode function = PythonParser.parse("def f(a, /, b=1, *args, c, d=2, **kw) -> int: ...")
                                       .nodes("body").get(0);
        var args = function.node("args");

        assertThat(args.nodes("posonlyargs")).hasSize(1);
        assertThat(args.nodes("args")).hasSize(1);
        assertThat(args.nodes("defaults")).hasSize(1);
        assertThat(args.node("vararg").string("arg")).isEqualTo("args");
        assertThat(args.nodes("kwonlyargs")).hasSize(2);
        assertThat(args.nodes("kw_defaults").get(0)).isNull();
        assertThat(args.node("kwarg").string("arg")).isEqualTo("kw");
        assertThat(function.node("returns").string("id")).isEqualTo("int");
    }

    @Test
    void parse_dictWithUnpacking_keepsNullKey() throws SyntaxErrorException {
        var dict = PythonParser.parse("{a: b, **c}").nodes("body").get(0).node("value");

        assertThat(dict.nodes("keys")).hasSize(2);
        assertThat(dict.nodes("keys").get(1)).isNull();
    }

    @Test
    void parse_sameSourceTwice_producesSameTree() throws SyntaxErrorException {
        var source = "def f(x):\n    return [y for y in x if y]\n";

        assertThat(PythonParser.parse(source).isSameAs(PythonParser.parse(source))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"x = (", "def f(:\n    pass\n", "1 = x", "if x:\npass\n", "x = 'a' b'c'"})
    void parse_invalidSource_throwsSyntaxError(String source) {
        assertThrows(SyntaxErrorException.class, () -> PythonParser.parse(source));
        assertThat(PythonParser.isValid(source)).isFalse();
    }

    @Test
    void parse_badDedent_reportsIndentationError() {
        var error = assertThrows(SyntaxErrorException.class, () -> PythonParser.parse("if x:\n    a\n  b\n"));

        assertThat(error.error()).isInstanceOf(ParseError.IndentationError.class);
    }
}
