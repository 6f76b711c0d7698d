package org.schemaforge.error;

/**
 * Root of every error raised by schema inference, rendering and load-script generation.
 */
public class SchemaForgeException extends RuntimeException {

    public SchemaForgeException(String message) {
        super(message);
    }

    public SchemaForgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
