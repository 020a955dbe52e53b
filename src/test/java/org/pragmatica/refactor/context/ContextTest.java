package org.pragmatica.refactor.context;

import org.junit.jupiter.api.Test;
import org.pragmatica.refactor.error.SyntaxErrorException;
import org.pragmatica.refactor.parser.PythonParser;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.unparse.BaseUnparser;
import org.pragmatica.refactor.unparse.UnparserBackend;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContextTest {

    static final class Counter extends Representative {
        static final Key<Counter> KEY = Key.of("counter", Counter::new);

        Counter(Context context) {
            super(context);
        }
    }

    @Test
    void get_declaredRepresentative_isBuiltOnce() throws SyntaxErrorException {
        var context = context("hello", Configuration.DEFAULT, List.of(Counter.KEY));

        assertThat(context.provides(Counter.KEY)).isTrue();
        assertSame(context.get(Counter.KEY), context.get(Counter.KEY));
    }

    @Test
    void get_undeclaredRepresentative_isRejected() throws SyntaxErrorException {
        var context = context("hello", Configuration.DEFAULT, List.of());

        assertThat(context.provides(Counter.KEY)).isFalse();
        var error = assertThrows(IllegalStateException.class, () -> context.get(Counter.KEY));
        assertThat(error.getMessage()).contains("'counter'");
    }

    @Test
    void get_builtinRepresentatives_areAlwaysAvailable() throws SyntaxErrorException {
        var context = context("hello", Configuration.DEFAULT, List.of());

        assertThat(context.provides(Ancestry.KEY)).isTrue();
        assertThat(context.provides(Scope.KEY)).isTrue();
        assertThat(context.scope().globalScope().type()).isEqualTo(ScopeType.GLOBAL);
    }

    @Test
    void unparse_usesConfiguredBackend() throws SyntaxErrorException {
        var regular = context("hey", Configuration.DEFAULT, List.of());
        var fast = context("hey", Configuration.builder().unparser(UnparserBackend.FAST).build(), List.of());
        var custom = context("hey", Configuration.builder().unparser(source -> new BaseUnparser(source) {
            @Override
            public String unparse(AstNode node) {
                return "<chulak>";
            }
        }).build(), List.of());

        assertThat(regular.unparse(PythonParser.parse("hey"))).isEqualTo("hey");
        assertThat(fast.unparse(PythonParser.parse("hey"))).isEqualTo("hey");
        assertThat(custom.unparse(PythonParser.parse("hey"))).isEqualTo("<chulak>");
    }

    @Test
    void toString_withoutFile_showsPlaceholder() throws SyntaxErrorException {
        assertThat(context("x", Configuration.DEFAULT, List.of()).toString()).startsWith("Context[<string>");
    }

    private static Context context(String source, Configuration config, List<Representative.Key<?>> keys)
        throws SyntaxErrorException {
        return Context.create(source, PythonParser.parse(source), null, config, keys);
    }
}
