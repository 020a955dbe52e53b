package org.pragmatica.refactor.internal;

import org.junit.jupiter.api.Test;
import org.pragmatica.refactor.Common;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;

import static org.assertj.core.api.Assertions.assertThat;

class PositionProviderTest {

    @Test
    void inferIdentifierPosition_everyDefinition_pointsAtItsName() throws SyntaxErrorException {
        var source = """
            class Outer(Base):
                @decorator
                async def  method(self):
                    def inner(): pass
                    return inner

            def top(x):
                return x
            """;
        var tree = PythonParser.parse(source);
        var lines = source.split("\\n");

        int checked = 0;
        for (AstNode node : tree.walk()) {
            if (node.is(NodeType.FUNCTION_DEF, NodeType.ASYNC_FUNCTION_DEF, NodeType.CLASS_DEF)) {
                var position = PositionProvider.inferIdentifierPosition(node, node.string("name"), source).orElseThrow();
                var line = lines[position.line() - 1];
                assertThat(line.substring(position.column(), position.endColumn())).isEqualTo(node.string("name"));
                checked++;
            }
        }
        assertThat(checked).isEqualTo(4);
    }

    @Test
    void inferIdentifierPosition_nameOnContinuationLine_usesThatLine() throws SyntaxErrorException {
        var source = "class \\\n    Foo:\n    pass\n";
        var node = PythonParser.parse(source).nodes("body").get(0);

        assertThat(PositionProvider.inferIdentifierPosition(node, "Foo", source))
            .contains(new Common.Position(2, 4, 2, 7));
    }

    @Test
    void inferIdentifierPosition_unexpectedTokens_isEmpty() throws SyntaxErrorException {
        var source = "def f():\n    x = 1\n";
        var tree = PythonParser.parse(source);
        var function = tree.nodes("body").get(0);

        assertThat(PositionProvider.inferIdentifierPosition(function, "g", source)).isEmpty();
        assertThat(PositionProvider.inferIdentifierPosition(function.nodes("body").get(0), "x", source)).isEmpty();
    }
}
