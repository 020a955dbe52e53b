package org.pragmatica.refactor.context;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.FileInfo;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.unparse.BaseUnparser;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything known about one source snapshot: the text, its tree, the file it came from, the session
 * configuration and the representatives rules asked for.
 *
 * <p>Representatives are created on first access. {@link Ancestry} and {@link Scope} are always available;
 * any other representative must have been declared by one of the session's rules.
 */
public final class Context {
    private static final List<Representative.Key<?>> BUILTIN = List.of(Ancestry.KEY, Scope.KEY);

    private final String source;
    private final AstNode tree;
    @Nullable
    private final FileInfo file;
    private final Configuration config;
    private final Set<Representative.Key<?>> available;
    private final Map<Representative.Key<?>, Representative> representatives = new HashMap<>();
    private final Set<Representative.Key<?>> creating = new HashSet<>();
    @Nullable
    private BaseUnparser unparser;

    private Context(String source, AstNode tree, @Nullable FileInfo file, Configuration config,
                    Set<Representative.Key<?>> available) {
        this.source = source;
        this.tree = tree;
        this.file = file;
        this.config = config;
        this.available = available;
    }

    public static Context of(String source, AstNode tree) {
        return create(source, tree, null, Configuration.DEFAULT, List.of());
    }

    /**
     * Context providing the given representatives and, transitively, their dependencies.
     */
    public static Context create(String source, AstNode tree, @Nullable FileInfo file, Configuration config,
                                 Collection<? extends Representative.Key<?>> keys) {
        var available = new LinkedHashSet<>(Representative.resolve(keys));
        available.addAll(Representative.resolve(BUILTIN));
        return new Context(source, tree, file, config, available);
    }

    public String source() {
        return source;
    }

    public AstNode tree() {
        return tree;
    }

    public Optional<FileInfo> file() {
        return Optional.ofNullable(file);
    }

    public Configuration config() {
        return config;
    }

    /**
     * Source text of the node through the configured unparser.
     */
    public String unparse(AstNode node) {
        if (unparser == null) {
            unparser = config.unparser().create(source);
        }
        return unparser.unparse(node);
    }

    public boolean provides(Representative.Key<?> key) {
        return available.contains(key);
    }

    @SuppressWarnings("unchecked")
    public <R extends Representative> R get(Representative.Key<R> key) {
        var existing = representatives.get(key);
        if (existing != null) {
            return (R) existing;
        }
        if (!available.contains(key)) {
            throw new IllegalStateException("'" + key.name() + "' provider is not available on this context, "
                                            + "none of the rules of this session declared it");
        }
        if (!creating.add(key)) {
            throw new IllegalStateException("'" + key.name() + "' provider needs itself to be built");
        }
        try {
            var created = key.create(this);
            representatives.put(key, created);
            return created;
        } finally {
            creating.remove(key);
        }
    }

    public Ancestry ancestry() {
        return get(Ancestry.KEY);
    }

    public Scope scope() {
        return get(Scope.KEY);
    }

    @Override
    public String toString() {
        var name = file == null || file.path() == null ? "<string>" : file.path().toString();
        return "Context[" + name + ", providers=" + available + "]";
    }
}
