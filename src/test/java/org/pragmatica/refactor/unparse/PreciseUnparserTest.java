package org.pragmatica.refactor.unparse;

import org.junit.jupiter.api.Test;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.Nodes;

import static org.assertj.core.api.Assertions.assertThat;

class PreciseUnparserTest {

    @Test
    void unparse_changedCall_keepsUntouchedArgumentsVerbatim() throws SyntaxErrorException {
        var source = """
            def func():
                if something:
                    print(
                        call(.1),
                        maybe+something_else,
                        maybe / other,
                        thing   . a
                    )
            """;
        var tree = PythonParser.parse(source);
        printCall(tree).nodes("args").add(Nodes.constant(3L));

        assertThat(new PreciseUnparser(source).unparse(tree))
            .isEqualTo("def func():\n"
                       + "    if something:\n"
                       + "        print(call(.1), maybe+something_else, maybe / other, thing   . a, 3)");
    }

    @Test
    void unparse_multilineLiteral_isReindentedToItsBlock() throws SyntaxErrorException {
        var source = """
            def func():
                if something:
                    print(
                        "bleh"
                        "zoom"
                    )
            """;
        var tree = PythonParser.parse(source);
        printCall(tree).nodes("args").add(Nodes.constant(3L));

        assertThat(new PreciseUnparser(source).unparse(tree))
            .isEqualTo("def func():\n"
                       + "    if something:\n"
                       + "        print(\"bleh\"\n"
                       + "            \"zoom\", 3)");
    }

    @Test
    void unparse_alignedComments_travelWithTheirStatements() throws SyntaxErrorException {
        var source = """
            def foo():
            # unindented comment
                # indented but not connected comment

                # a
                # a1
                print()
                # a2
                print()
                # b

                # b2
                print(
                    c # e
                )
                # c
                print(d)
                # final comment
            """;
        var tree = PythonParser.parse(source);
        var body = tree.nodes("body").get(0).nodes("body");
        body.remove(body.size() - 1);

        assertThat(new PreciseUnparser(source).unparse(tree))
            .isEqualTo("def foo():\n"
                       + "    # a\n"
                       + "    # a1\n"
                       + "    print()\n"
                       + "    # a2\n"
                       + "    print()\n"
                       + "    # b\n"
                       + "    # b2\n"
                       + "    print(\n"
                       + "        c # e\n"
                       + "    )\n"
                       + "    # c");
    }

    @Test
    void unparse_removedSibling_keepsTrailingCommentsOfOthers() throws SyntaxErrorException {
        var source = "x = 1   # one\ny  =  2 # two\nz = 3    # three\n";
        var tree = PythonParser.parse(source);
        tree.nodes("body").remove(1);

        assertThat(new PreciseUnparser(source).unparse(tree)).isEqualTo("x = 1   # one\nz = 3    # three");
    }

    @Test
    void unparse_changedFunction_keepsTrailingCommentOfBodyStatement() throws SyntaxErrorException {
        var source = "def f():\n    x = 1  # keep me\n    y = 2\n";
        var tree = PythonParser.parse(source);
        var function = tree.nodes("body").get(0);
        function.nodes("body").remove(1);

        assertThat(new PreciseUnparser(source).unparse(function)).isEqualTo("def f():\n    x = 1  # keep me");
    }

    @Test
    void unparse_commentAfterUnparsedNode_isLeftInSource() throws SyntaxErrorException {
        var source = "def f():\n    y = 1\n    return x  # result\n";
        var tree = PythonParser.parse(source);
        var function = tree.nodes("body").get(0);
        function.nodes("body").remove(0);

        assertThat(new PreciseUnparser(source).unparse(function)).isEqualTo("def f():\n    return x");
    }

    @Test
    void unparse_unchangedStatement_isCopiedAsWritten() throws SyntaxErrorException {
        var source = "x   =   [1,\n       2]  # keep\n";
        var tree = PythonParser.parse(source);

        assertThat(new PreciseUnparser(source).unparse(tree.nodes("body").get(0))).isEqualTo("x   =   [1,\n       2]");
    }

    @Test
    void unparse_nodeWithoutSource_fallsBackToSynthesis() throws SyntaxErrorException {
        var source = "result = compute(a,b)\n";
        var tree = PythonParser.parse(source);
        var assign = tree.nodes("body").get(0);
        assign.set("value", Nodes.binOp(assign.node("value"), org.pragmatica.refactor.tree.Operator.ADD,
                                        Nodes.constant(1L)));

        assertThat(UnparserBackend.PRECISE.create(source).unparse(assign)).isEqualTo("result = compute(a,b) + 1");
    }

    private static AstNode printCall(AstNode tree) {
        return tree.nodes("body").get(0).nodes("body").get(0).nodes("body").get(0).node("value");
    }
}
