package org.pragmatica.refactor.error;

/**
 * Raised when Python source text can't be parsed.
 */
public final class SyntaxErrorException extends Exception {
    private final ParseError error;

    public SyntaxErrorException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    /**
     * Diagnostic pointing at the offending location.
     */
    public Diagnostic diagnostic() {
        var diagnostic = Diagnostic.error(error.message(), error.location());
        if (error instanceof ParseError.UnexpectedToken unexpected) {
            return diagnostic.withLabel("expected " + unexpected.expected());
        }
        if (error instanceof ParseError.UnexpectedEof eof) {
            return diagnostic.withLabel("expected " + eof.expected());
        }
        return diagnostic;
    }
}
