package org.pragmatica.refactor.unparse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Nodes;
import org.pragmatica.refactor.tree.Operator;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BaseUnparserTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "x = 1",
        "a + b * c",
        "(a + b) * c",
        "a ** b ** c",
        "(a ** b) ** c",
        "not (a and b)",
        "-x",
        "a < b <= c",
        "a is not b",
        "a not in b",
        "x if y else z",
        "[x for x in y if x]",
        "{'a': 1, **b}",
        "f(a, *b, c=1, **d)",
        "a[1:2]",
        "lambda x, *, y=1: x + y",
        "(y := 1)",
        "f'a{b}c'",
        "print(\"it's\")",
        "x = (1, 2)",
        "x: int = 1",
        "x += 1",
        "del a, b",
        "assert x, 'msg'",
        "raise E from e",
        "import os.path as p, sys",
        "from . import x as y",
        "while x:\n    break",
        "for a, b in c:\n    continue\nelse:\n    pass",
        "with a as b, c:\n    pass",
        "if a:\n    pass\nelif b:\n    pass\nelse:\n    pass",
        "try:\n    pass\nexcept E as e:\n    pass\nelse:\n    pass\nfinally:\n    pass",
        "class A(B, metaclass=M):\n    pass",
        "@deco\ndef f(a, /, b=1, *args, c, d=2, **kw) -> int:\n    return a",
        "async def f():\n    await x",
        "def f():\n    global a, b",
        "def f():\n    \"\"\"Doc.\"\"\"\n    return 1",
        "x = 1\n\ndef f():\n    pass"
    })
    void unparse_canonicalSource_reproducesIt(String source) throws SyntaxErrorException {
        assertThat(new BaseUnparser(source).unparse(PythonParser.parse(source))).isEqualTo(source);
    }

    @Test
    void unparse_singleNode_writesOnlyThatNode() throws SyntaxErrorException {
        var source = "a +      b + c # comment";
        var right = PythonParser.parse(source).nodes("body").get(0).node("value").node("right");

        assertThat(new BaseUnparser(source).unparse(right)).isEqualTo("c");
    }

    @Test
    void unparse_synthesizedNodes_addsRequiredParentheses() {
        var sum = Nodes.binOp(Nodes.name("a"), Operator.ADD, Nodes.name("b"));
        var product = Nodes.binOp(sum, Operator.MULT, Nodes.name("c"));
        var unparser = UnparserBackend.FAST.create(null);

        assertThat(unparser.unparse(product)).isEqualTo("(a + b) * c");
        assertThat(unparser.unparse(Nodes.await(Nodes.call(Nodes.name("f"), Nodes.constant(1L)))))
            .isEqualTo("await f(1)");
        assertThat(unparser.unparse(Nodes.importFrom("typing", List.of(Nodes.alias("List"), Nodes.alias("Dict", "D")))))
            .isEqualTo("from typing import List, Dict as D");
    }

    @Test
    void unparse_attributeOfInteger_separatesDot() {
        var node = Nodes.attribute(Nodes.constant(3L), "real");

        assertThat(new BaseUnparser(null).unparse(node)).isEqualTo("3 .real");
    }

    @Test
    void unparse_sameInstanceTwice_startsFromCleanState() throws SyntaxErrorException {
        var unparser = new BaseUnparser(null);
        var tree = PythonParser.parse("if a:\n    b = 1");

        assertThat(unparser.unparse(tree)).isEqualTo(unparser.unparse(tree));
    }

    @Test
    void unparse_overriddenVisitor_changesLayout() throws SyntaxErrorException {
        var source = "[1, 2]";
        var unparser = new BaseUnparser(source) {
            @Override
            protected void visitList(AstNode node) {
                delimit("[", "]", () -> {
                    indented(() -> {
                        fill();
                        interleave(() -> {
                            write(",");
                            fill();
                        }, this::traverse, node.nodes("elts"));
                    });
                    maybeNewline();
                });
            }
        };

        assertThat(unparser.unparse(PythonParser.parse(source))).isEqualTo("[\n    1,\n    2\n]");
    }
}
