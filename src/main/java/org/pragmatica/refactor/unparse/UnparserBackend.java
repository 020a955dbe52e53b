package org.pragmatica.refactor.unparse;

import org.jetbrains.annotations.Nullable;

/**
 * Built-in unparsers.
 */
public enum UnparserBackend implements UnparserFactory {
    /** Canonical re-synthesis from the tree. */
    FAST {
        @Override
        public BaseUnparser create(@Nullable String source) {
            return new BaseUnparser(source);
        }
    },
    /** Original text where it still matches the tree, with aligned comments. */
    PRECISE {
        @Override
        public BaseUnparser create(@Nullable String source) {
            return new PreciseUnparser(source);
        }
    }
}
