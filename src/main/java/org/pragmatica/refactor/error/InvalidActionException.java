package org.pragmatica.refactor.error;

/**
 * An action can't be applied to the source it targets.
 */
public final class InvalidActionException extends RuntimeException {
    public InvalidActionException(String message) {
        super(message);
    }
}
