package org.pragmatica.refactor.context;

import org.pragmatica.refactor.unparse.UnparserBackend;
import org.pragmatica.refactor.unparse.UnparserFactory;

import java.util.Objects;

/**
 * Settings of a refactoring session.
 *
 * @param unparser  backend used to turn replacement trees into text
 * @param debugMode persist unparsable output to a temporary file and log more
 */
public record Configuration(UnparserFactory unparser, boolean debugMode) {
    public static final Configuration DEFAULT = new Configuration(UnparserBackend.PRECISE, false);

    public Configuration {
        Objects.requireNonNull(unparser, "unparser");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UnparserFactory unparser = UnparserBackend.PRECISE;
        private boolean debugMode;

        private Builder() {}

        public Builder unparser(UnparserFactory factory) {
            this.unparser = factory;
            return this;
        }

        public Builder debugMode(boolean enabled) {
            this.debugMode = enabled;
            return this;
        }

        public Configuration build() {
            return new Configuration(unparser, debugMode);
        }
    }
}
