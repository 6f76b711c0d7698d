package org.schemaforge.error;

public class SchemaDocumentException extends SchemaForgeException {

    public SchemaDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
