package org.pragmatica.refactor.error;

import org.pragmatica.refactor.tree.SourceLocation;

/**
 * Python syntax error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * A token that doesn't fit the grammar at this point.
     */
    record UnexpectedToken(SourceLocation location, String found, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected " + expected;
        }
    }

    /**
     * Input ended inside a construct.
     */
    record UnexpectedEof(SourceLocation location, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Inconsistent or unexpected indentation.
     */
    record IndentationError(SourceLocation location, String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }

    /**
     * Well-formed tokens describing an invalid construct (bad assignment target, malformed literal, ...).
     */
    record InvalidSyntax(SourceLocation location, String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }
}
