package org.pragmatica.refactor;

import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.context.Representative;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Registration of a rule with a session: how to build it for a snapshot and which representatives it reads.
 */
public record RuleSpec(String name, Function<Context, ? extends Rule> factory, List<Representative.Key<?>> providers) {
    public RuleSpec {
        providers = List.copyOf(providers);
    }

    public static RuleSpec of(String name, Function<Context, ? extends Rule> factory,
                              Representative.Key<?>... providers) {
        return new RuleSpec(name, factory, Arrays.asList(providers));
    }

    Rule instantiate(Context context) {
        return factory.apply(context);
    }
}
