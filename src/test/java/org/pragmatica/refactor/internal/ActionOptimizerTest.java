package org.pragmatica.refactor.internal;

import org.junit.jupiter.api.Test;
import org.pragmatica.refactor.action.Rename;
import org.pragmatica.refactor.action.Replace;
import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.error.InvalidActionException;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.tree.Nodes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ActionOptimizerTest {
    private static final String SOURCE = "def  old_name(a,\n              b):  # keep me\n    return a\n";

    @Test
    void optimize_replaceChangingOnlyName_becomesRename() throws SyntaxErrorException {
        var tree = PythonParser.parse(SOURCE);
        var context = Context.of(SOURCE, tree);
        var function = tree.nodes("body").get(0);
        var replace = new Replace(function, function.copy().set("name", "new_name"));

        var optimized = ActionOptimizer.optimize(replace, context);

        assertThat(optimized).isInstanceOf(Rename.class);
        assertThat(((Rename) optimized).identifier().column()).isEqualTo(5);
        assertThat(optimized.apply(context, SOURCE))
            .isEqualTo("def  new_name(a,\n              b):  # keep me\n    return a\n");
    }

    @Test
    void rename_otherAnchor_isRejected() throws SyntaxErrorException {
        var tree = PythonParser.parse(SOURCE);
        var context = Context.of(SOURCE, tree);
        var function = tree.nodes("body").get(0);
        var rename = ActionOptimizer.optimize(new Replace(function, function.copy().set("name", "new_name")), context);

        var reparsed = PythonParser.parse(SOURCE);
        var other = Context.of(SOURCE, reparsed);

        assertThrows(InvalidActionException.class,
                     () -> rename.splice(reparsed.nodes("body").get(0), other, context, SOURCE));
    }

    @Test
    void optimize_replaceChangingMore_isKept() throws SyntaxErrorException {
        var tree = PythonParser.parse(SOURCE);
        var context = Context.of(SOURCE, tree);
        var function = tree.nodes("body").get(0);
        var target = function.copy().set("name", "new_name");
        target.nodes("body").set(0, Nodes.pass());
        var replace = new Replace(function, target);

        assertSame(replace, ActionOptimizer.optimize(replace, context));
    }

    @Test
    void optimize_replaceOfOtherNodes_isKept() throws SyntaxErrorException {
        var source = "x = 1\n";
        var tree = PythonParser.parse(source);
        var assign = tree.nodes("body").get(0);
        var replace = new Replace(assign.node("value"), Nodes.constant(2L));

        assertSame(replace, ActionOptimizer.optimize(replace, Context.of(source, tree)));
    }
}
