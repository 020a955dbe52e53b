package org.pragmatica.refactor.error;

/**
 * A chained action no longer addresses a node of the expected kind after earlier actions of the same chain.
 */
public final class OverlappingActionsException extends RuntimeException {
    public OverlappingActionsException(String message, Throwable cause) {
        super(message, cause);
    }
}
