package org.schemaforge.incremental;

public enum PatternComplexity {
    SIMPLE,
    MEDIUM,
    ADVANCED
}
