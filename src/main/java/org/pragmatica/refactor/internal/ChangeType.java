package org.pragmatica.refactor.internal;

/**
 * Kind of divergence between two revisions of a node.
 */
public enum ChangeType {
    /** Different node kinds, or a list item appearing or disappearing. */
    FULL,
    FIELD_ADDITION,
    FIELD_REMOVAL,
    /** A leaf item of a list field differs. */
    ITEM_VALUE,
    /** An atomic field differs. */
    FIELD_VALUE,
    /** A list field has a different length. */
    FIELD_SIZE
}
