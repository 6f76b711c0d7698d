package org.schemaforge.render;

/**
 * What a CREATE TABLE statement is for. Staging tables are recreated on every load.
 */
public enum TableKind {
    PERMANENT,
    STAGING
}
