package org.pragmatica.refactor.context;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A computation over one source snapshot, built at most once per {@link Context} and shared by every rule that
 * declares its {@link Key}.
 */
public abstract class Representative {
    protected final Context context;

    protected Representative(Context context) {
        this.context = context;
    }

    /**
     * Identifies a kind of representative, how to build it and which other representatives it needs. Keys
     * compare by identity, so each kind is declared once, usually as a {@code KEY} constant.
     */
    public static final class Key<R extends Representative> {
        private final String name;
        private final Function<Context, R> factory;
        private final Supplier<List<Key<?>>> dependencies;

        private Key(String name, Function<Context, R> factory, Supplier<List<Key<?>>> dependencies) {
            this.name = name;
            this.factory = factory;
            this.dependencies = dependencies;
        }

        public static <R extends Representative> Key<R> of(String name, Function<Context, R> factory,
                                                           Key<?>... dependencies) {
            var list = List.copyOf(Arrays.asList(dependencies));
            return new Key<>(name, factory, () -> list);
        }

        /**
         * Key whose dependencies are looked up on demand, for representatives that depend on each other.
         */
        public static <R extends Representative> Key<R> deferred(String name, Function<Context, R> factory,
                                                                 Supplier<List<Key<?>>> dependencies) {
            return new Key<>(name, factory, dependencies);
        }

        public String name() {
            return name;
        }

        public List<Key<?>> dependencies() {
            return dependencies.get();
        }

        R create(Context context) {
            return factory.apply(context);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Transitive closure of the given keys and everything they depend on. Dependency cycles are allowed.
     */
    public static Set<Key<?>> resolve(Collection<? extends Key<?>> keys) {
        var resolved = new LinkedHashSet<Key<?>>();
        var pending = new ArrayDeque<Key<?>>(keys);
        while (!pending.isEmpty()) {
            var key = pending.poll();
            if (resolved.add(key)) {
                pending.addAll(key.dependencies());
            }
        }
        return resolved;
    }
}
