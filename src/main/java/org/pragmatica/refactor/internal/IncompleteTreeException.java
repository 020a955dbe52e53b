package org.pragmatica.refactor.internal;

/**
 * Two revisions of a node hold incompatible kinds of values in the same field, so they can't be compared.
 */
public final class IncompleteTreeException extends RuntimeException {
    public IncompleteTreeException(String message) {
        super(message);
    }
}
