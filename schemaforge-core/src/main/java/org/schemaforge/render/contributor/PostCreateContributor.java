package org.schemaforge.render.contributor;

/**
 * Writes complete statements that follow the CREATE TABLE statement.
 */
public interface PostCreateContributor extends DdlContributor {
}
