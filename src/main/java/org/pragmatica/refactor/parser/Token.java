package org.pragmatica.refactor.parser;

import org.pragmatica.refactor.error.ParseError;
import org.pragmatica.refactor.tree.SourceSpan;

/**
 * Tokens of Python source text.
 */
public sealed interface Token {
    SourceSpan span();

    /** Source text of the token, empty for layout tokens. */
    String text();

    record Name(SourceSpan span, String text) implements Token {}

    record Number(SourceSpan span, String text) implements Token {}

    /** String literal including prefix and quotes. */
    record Str(SourceSpan span, String text) implements Token {}

    record Op(SourceSpan span, String text) implements Token {}

    record Newline(SourceSpan span) implements Token {
        @Override
        public String text() {
            return "";
        }
    }

    record Indent(SourceSpan span) implements Token {
        @Override
        public String text() {
            return "";
        }
    }

    record Dedent(SourceSpan span) implements Token {
        @Override
        public String text() {
            return "";
        }
    }

    record EndMarker(SourceSpan span) implements Token {
        @Override
        public String text() {
            return "";
        }
    }

    /** Scanning failure; always the last significant token of the stream. */
    record Error(SourceSpan span, ParseError error) implements Token {
        @Override
        public String text() {
            return "";
        }
    }

    /**
     * Human readable description for error messages.
     */
    static String describe(Token token) {
        if (token instanceof Newline) {
            return "newline";
        }
        if (token instanceof Indent) {
            return "indent";
        }
        if (token instanceof Dedent) {
            return "dedent";
        }
        if (token instanceof EndMarker) {
            return "end of input";
        }
        if (token instanceof Str) {
            return "string literal";
        }
        if (token instanceof Number) {
            return "number " + token.text();
        }
        return "'" + token.text() + "'";
    }
}
