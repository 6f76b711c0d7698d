package org.schemaforge.inference;

import org.schemaforge.model.LogicalType;

/**
 * Outcome of inferring one column: the logical type, nullability and any type parameters
 * that were detectable from the values.
 */
public record InferredType(LogicalType logicalType,
                           boolean nullable,
                           Integer precision,
                           Integer scale,
                           String dateFormat,
                           String timezone) {

    public static InferredType of(LogicalType logicalType, boolean nullable) {
        return new InferredType(logicalType, nullable, null, null, null, null);
    }

    public static InferredType decimal(boolean nullable, int precision, int scale) {
        return new InferredType(LogicalType.DECIMAL, nullable, precision, scale, null, null);
    }

    public static InferredType temporal(LogicalType logicalType, boolean nullable, String dateFormat, String timezone) {
        return new InferredType(logicalType, nullable, null, null, dateFormat, timezone);
    }
}
