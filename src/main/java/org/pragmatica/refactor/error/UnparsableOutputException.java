package org.pragmatica.refactor.error;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A rule produced source text that doesn't parse.
 */
public final class UnparsableOutputException extends RuntimeException {
    private final String source;
    @Nullable
    private final Path dump;

    public UnparsableOutputException(String source, @Nullable Path dump, SyntaxErrorException cause) {
        super(dump == null
              ? "Generated source is unparsable: " + cause.getMessage()
              : "Generated source is unparsable, saved to " + dump + ": " + cause.getMessage(),
              cause);
        this.source = source;
        this.dump = dump;
    }

    /** The generated text. */
    public String source() {
        return source;
    }

    /** Temporary file the text was written to, in debug mode. */
    public Optional<Path> dump() {
        return Optional.ofNullable(dump);
    }
}
