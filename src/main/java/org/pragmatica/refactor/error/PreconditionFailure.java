package org.pragmatica.refactor.error;

/**
 * Signals that a rule does not apply to the node it was asked to match. The session treats it as "no match".
 */
public final class PreconditionFailure extends RuntimeException {
    public PreconditionFailure(String message) {
        super(message, null, false, false);
    }
}
