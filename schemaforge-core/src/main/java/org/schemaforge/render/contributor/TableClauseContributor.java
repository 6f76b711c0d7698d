package org.schemaforge.render.contributor;

/**
 * Writes table-level clauses after the closing parenthesis. Each clause starts with a newline.
 */
public interface TableClauseContributor extends DdlContributor {
}
