package org.schemaforge.incremental;

/**
 * How CDC delete events reach the target.
 */
public enum DeleteStrategy {
    HARD_DELETE,
    SOFT_DELETE,
    IGNORE
}
