package org.schemaforge.render.contributor;

/**
 * Writes inside the parentheses of CREATE TABLE. Each entry ends with {@code ",\n"}.
 */
public interface TableBodyContributor extends DdlContributor {
}
