package org.pragmatica.refactor;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.refactor.context.Context;
import org.pragmatica.refactor.error.PreconditionFailure;
import org.pragmatica.refactor.tree.AstNode;
import org.pragmatica.refactor.tree.NodeType;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * A refactoring rule, instantiated once per source snapshot.
 *
 * <p>{@link #match(AstNode)} is offered every positioned node of the snapshot. A rule either returns the
 * edit to make or reports no match, by returning empty or by failing one of its preconditions through
 * {@link #require(boolean)}, {@link #present(Object)} or {@link #expect(AstNode, NodeType...)}.
 */
public abstract class Rule {
    protected final Context context;

    protected Rule(Context context) {
        this.context = context;
    }

    /**
     * Whether the rule applies to the given file at all. {@code file} is {@code null} for in-memory sources.
     */
    public boolean checkFile(@Nullable Path file) {
        return true;
    }

    public abstract Optional<Match> match(AstNode node);

    protected static void require(boolean condition) {
        if (!condition) {
            throw new PreconditionFailure("Precondition failed");
        }
    }

    protected static void require(boolean condition, String message) {
        if (!condition) {
            throw new PreconditionFailure(message);
        }
    }

    /**
     * The value, which must be present.
     */
    protected static <T> T present(@Nullable T value) {
        if (value == null) {
            throw new PreconditionFailure("Required value is missing");
        }
        return value;
    }

    /**
     * The node, which must be of one of the given kinds.
     */
    protected static AstNode expect(@Nullable AstNode node, NodeType... types) {
        if (node == null || !node.is(types)) {
            throw new PreconditionFailure("Expected one of " + Arrays.toString(types) + ", got "
                                          + (node == null ? "nothing" : node.type()));
        }
        return node;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
