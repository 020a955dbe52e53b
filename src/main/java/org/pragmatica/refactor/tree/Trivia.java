package org.pragmatica.refactor.tree;

/**
 * Non-semantic source content collected by the tokenizer next to the token stream.
 */
public sealed interface Trivia {
    SourceSpan span();

    String text();

    /**
     * A {@code #} comment, text includes the hash sign.
     */
    record Comment(SourceSpan span, String text) implements Trivia {
        public int line() {
            return span.start().line();
        }

        public int column() {
            return span.start().column();
        }
    }

    /**
     * A backslash line continuation.
     */
    record Continuation(SourceSpan span, String text) implements Trivia {}
}
