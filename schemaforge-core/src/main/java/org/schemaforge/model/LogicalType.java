package org.schemaforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Platform-neutral column type. Renderers map each value to a physical type of their own.
 */
public enum LogicalType {
    INTEGER,
    BIGINT,
    FLOAT,
    DECIMAL,
    STRING,
    TEXT,
    BOOLEAN,
    DATE,
    TIMESTAMP,
    TIMESTAMPTZ,
    JSON,
    BINARY;

    @JsonValue
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static LogicalType fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Logical type token must not be null");
        }
        for (LogicalType type : values()) {
            if (type.name().equalsIgnoreCase(token.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown logical type: " + token);
    }

    public boolean isIntegral() {
        return this == INTEGER || this == BIGINT;
    }

    public boolean isNumeric() {
        return isIntegral() || this == FLOAT || this == DECIMAL;
    }

    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP || this == TIMESTAMPTZ;
    }
}
