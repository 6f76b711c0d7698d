package org.schemaforge.error;

import lombok.Getter;

import java.util.List;

/**
 * A schema is structurally broken or asks a platform for something it cannot express.
 * Carries every problem found, not just the first one.
 */
@Getter
public class ValidationException extends SchemaForgeException {

    private final List<String> problems;

    public ValidationException(String subject, List<String> problems) {
        super("Validation failed for " + subject + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
