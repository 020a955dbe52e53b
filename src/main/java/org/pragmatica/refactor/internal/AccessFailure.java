package org.pragmatica.refactor.internal;

/**
 * A {@link GraphPath} step doesn't lead to a node of the expected kind.
 */
public final class AccessFailure extends Exception {
    public AccessFailure(String message) {
        super(message);
    }
}
