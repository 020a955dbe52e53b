package org.pragmatica.refactor.context;

import org.junit.jupiter.api.Test;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.tree.Nodes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AncestryTest {

    @Test
    void getParent_returnsHoldingNode() throws SyntaxErrorException {
        var source = "2 + 3 + 4";
        var tree = PythonParser.parse(source);
        var ancestry = Context.of(source, tree).ancestry();
        var statement = tree.nodes("body").get(0);
        var inner = statement.node("value").node("left");

        assertSame(tree, ancestry.getParent(statement).orElseThrow());
        assertSame(inner, ancestry.getParent(inner.node("right")).orElseThrow());
        assertThat(ancestry.getParent(tree)).isEmpty();
    }

    @Test
    void traverse_listsFieldsUpToRoot() throws SyntaxErrorException {
        var source = "def f():\n    return x\n";
        var tree = PythonParser.parse(source);
        var ancestry = Context.of(source, tree).ancestry();
        var function = tree.nodes("body").get(0);
        var name = function.nodes("body").get(0).node("value");

        assertThat(ancestry.traverse(name))
            .extracting(Ancestry.Link::field)
            .containsExactly("value", "body", "body");
        assertThat(ancestry.getParents(name)).hasSize(3).last().isSameAs(tree);
    }

    @Test
    void infer_foreignNode_isRejected() throws SyntaxErrorException {
        var source = "x";
        var ancestry = Context.of(source, PythonParser.parse(source)).ancestry();

        assertThrows(IllegalArgumentException.class, () -> ancestry.infer(Nodes.name("x")));
    }
}
