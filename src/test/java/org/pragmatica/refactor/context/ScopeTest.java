package org.pragmatica.refactor.context;

import org.junit.jupiter.api.Test;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;
import org.pragmatica.refactor.unparse.UnparserBackend;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScopeTest {

    @Test
    void resolve_nestedScopes_followVisibilityRules() throws SyntaxErrorException {
        var source = """
            a = 5
            self_read(a)
            class B:
                b = 4
                self_read(b)
                def foo(self):
                    c = 3
                    self_read(c)
                    def bar():
                        d = 2
                        self_read(d)
                        return a, b, c, d

            out_read(b)
            out_read(c)
            out_read(d)
            def something():
                out_read(b)
                out_read(c)
                out_read(d)

                def something():
                    out_read(b)
                    out_read(c)
                    out_read(d)
            """;
        var tree = PythonParser.parse(source);
        var scope = Context.of(source, tree).scope();

        var definitions = new HashMap<String, ScopeInfo>();
        for (var node : tree.walk()) {
            if (node.is(NodeType.ASSIGN)) {
                definitions.put(node.nodes("targets").get(0).string("id"), scope.resolve(node));
            }
        }
        var returned = tree.nodes("body").get(2).nodes("body").get(2).nodes("body").get(2).nodes("body").get(2)
                           .node("value");
        assertThat(returned.type()).isEqualTo(NodeType.TUPLE);
        var cursors = new HashMap<String, ScopeInfo>();
        for (var element : returned.nodes("elts")) {
            cursors.put(element.string("id"), scope.resolve(element));
        }

        assertTrue(cursors.get("a").canReach(definitions.get("a")));
        assertThat(definitions.get("a").definitions().keySet()).containsExactlyInAnyOrder("a", "B", "something");
        assertFalse(cursors.get("b").canReach(definitions.get("b")));
        assertThat(definitions.get("b").definitions().keySet()).containsExactlyInAnyOrder("b", "foo");
        assertTrue(cursors.get("c").canReach(definitions.get("c")));
        assertThat(definitions.get("c").definitions().keySet()).containsExactlyInAnyOrder("self", "c", "bar");
        assertTrue(cursors.get("d").canReach(definitions.get("d")));
        assertThat(definitions.get("d").definitions().keySet()).containsExactlyInAnyOrder("d");

        for (var read : calls(tree, "self_read", scope).entrySet()) {
            assertTrue(read.getValue().canReach(definitions.get(read.getKey().string("id"))), read.getKey().toString());
        }
        for (var read : calls(tree, "out_read", scope).entrySet()) {
            assertFalse(read.getValue().canReach(definitions.get(read.getKey().string("id"))), read.getKey().toString());
        }
        assertThrows(IllegalArgumentException.class, () -> scope.resolve(tree));
    }

    @Test
    void definitions_collectEveryBindingForm() throws SyntaxErrorException {
        var source = """
            import g_i
            import g_i_1, g_i.d

            from fi import g_fi_1
            from fi.d import g_fi_2, g_fi_3

            g_a = 1
            g_a_1 = g_a_2 = 2
            g_a_2 = 3
            accessor()

            def g_f(f_arg, *, f_arg1 = (g_a_4 := something)) -> (g_a_5 := other):
                object.d = 1
                f_loc, f_loc_1 = (1, 2)
                f_loc_2 = lambda: (l_loc := 1) and accessor()

                import f_i
                accessor()

                return [accessor() for comp_1 in y for comp_2 in z]

            class g_c:
                c_a = 1
                c_a_1, c_a_2 = meth_factory(c_a_3 := d)

                accessor()

                def c_f():
                    c_f.d = 3
                    for f_for_a, f_for_b in c:
                        with x as (f_a.d, f_a.d.d1.d2):
                            pass
                        accessor()
            """;
        var tree = PythonParser.parse(source);
        var scope = Context.of(source, tree).scope();

        var scopes = new HashMap<String, ScopeInfo>();
        for (var call : calls(tree, "accessor", scope).values()) {
            scopes.put(call.name(), call);
        }

        assertThat(scopes.keySet()).containsExactlyInAnyOrder(
            "<global>", "g_f", "g_c", "g_c.c_f", "g_f.<locals>.<lambda>", "g_f.<locals>.<listcomp>");
        assertThat(scopes.get("<global>").definitions().keySet()).containsExactlyInAnyOrder(
            "g_i", "g_i_1", "g_i.d", "g_fi_1", "g_fi_2", "g_fi_3", "g_a", "g_a_1", "g_a_2", "g_f", "g_c", "g_a_4",
            "g_a_5");
        assertThat(scopes.get("g_f").definitions().keySet()).containsExactlyInAnyOrder(
            "object.d", "f_loc", "f_loc_1", "f_loc_2", "f_i", "f_arg", "f_arg1");
        assertThat(scopes.get("g_c").definitions().keySet()).containsExactlyInAnyOrder(
            "c_a", "c_a_1", "c_a_2", "c_f", "c_a_3");
        assertThat(scopes.get("g_c.c_f").definitions().keySet()).containsExactlyInAnyOrder(
            "c_f.d", "f_for_a", "f_for_b", "f_a.d", "f_a.d.d1.d2");
        assertThat(scopes.get("g_f.<locals>.<lambda>").definitions().keySet()).containsExactly("l_loc");
        assertThat(scopes.get("g_f.<locals>.<listcomp>").definitions().keySet())
            .containsExactlyInAnyOrder("comp_1", "comp_2");

        var global = scopes.get("<global>");
        var unparser = UnparserBackend.FAST.create(null);
        List<AstNode> single = global.definitions().get("g_a_1");
        List<AstNode> twice = global.definitions().get("g_a_2");
        assertThat(single).hasSize(1);
        assertThat(unparser.unparse(single.get(0).node("value"))).isEqualTo("2");
        assertThat(twice).extracting(node -> unparser.unparse(node.node("value"))).containsExactly("2", "3");
        assertThat(global.getDefinitions("missing")).isEmpty();
    }

    @Test
    void resolve_sameNodeTwice_returnsSameInstance() throws SyntaxErrorException {
        var source = "def f():\n    x = 1\n";
        var tree = PythonParser.parse(source);
        var scope = Context.of(source, tree).scope();
        var assign = tree.nodes("body").get(0).nodes("body").get(0);

        assertSame(scope.resolve(assign), scope.resolve(assign));
        assertSame(scope.globalScope(), scope.resolve(tree.nodes("body").get(0)));
        assertThat(scope.resolve(assign).parent()).containsSame(scope.globalScope());
    }

    /**
     * First argument of every call to {@code function}, with its scope.
     */
    private static Map<AstNode, ScopeInfo> calls(AstNode tree, String function, Scope scope) {
        var result = new HashMap<AstNode, ScopeInfo>();
        for (var node : tree.walk()) {
            if (node.is(NodeType.CALL) && node.node("func").is(NodeType.NAME)
                && function.equals(node.node("func").string("id"))) {
                var target = node.nodes("args").isEmpty() ? node : node.nodes("args").get(0);
                result.put(target, scope.resolve(target));
            }
        }
        return result;
    }
}
