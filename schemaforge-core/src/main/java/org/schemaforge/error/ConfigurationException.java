package org.schemaforge.error;

import lombok.Getter;

/**
 * An incremental load configuration is missing a field its pattern needs, or names
 * a column the schema does not have.
 */
@Getter
public class ConfigurationException extends SchemaForgeException {

    private final String field;

    public ConfigurationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }
}
