package org.schemaforge.incremental;

/**
 * How matched rows are treated by UPSERT.
 */
public enum MergeStrategy {
    /** Overwrite every non-key column. */
    UPDATE_ALL,
    /** Overwrite every non-key column, only for rows where at least one value differs. */
    UPDATE_CHANGED,
    /** Overwrite only the configured update columns. */
    UPDATE_SELECTIVE,
    /** Leave matched rows untouched; only insert new ones. */
    UPDATE_NONE
}
