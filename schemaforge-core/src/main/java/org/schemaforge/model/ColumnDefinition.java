package org.schemaforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One column of a {@link CanonicalSchema}.
 * <p>
 * {@code precision}/{@code scale} belong to DECIMAL columns, {@code maxLength} to STRING columns
 * and {@code dateFormat}/{@code timezone} to temporal columns; {@link CanonicalSchema#validate()}
 * reports any other combination.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnDefinition {

    @JsonProperty("name")
    String name;

    @JsonProperty("logical_type")
    LogicalType logicalType;

    @JsonProperty("nullable")
    boolean nullable;

    @JsonProperty("original_name")
    String originalName;

    @JsonProperty("max_length")
    Integer maxLength;

    @JsonProperty("precision")
    Integer precision;

    @JsonProperty("scale")
    Integer scale;

    @JsonProperty("description")
    String description;

    @JsonProperty("date_format")
    String dateFormat;

    @JsonProperty("timezone")
    String timezone;

    @JsonCreator
    public ColumnDefinition(@JsonProperty("name") String name,
                            @JsonProperty("logical_type") LogicalType logicalType,
                            @JsonProperty("nullable") Boolean nullable,
                            @JsonProperty("original_name") String originalName,
                            @JsonProperty("max_length") Integer maxLength,
                            @JsonProperty("precision") Integer precision,
                            @JsonProperty("scale") Integer scale,
                            @JsonProperty("description") String description,
                            @JsonProperty("date_format") String dateFormat,
                            @JsonProperty("timezone") String timezone) {
        this.name = name;
        this.logicalType = logicalType;
        this.nullable = nullable == null || nullable;
        this.originalName = originalName;
        this.maxLength = maxLength;
        this.precision = precision;
        this.scale = scale;
        this.description = description;
        this.dateFormat = dateFormat;
        this.timezone = timezone;
    }

    public static ColumnDefinition of(String name, LogicalType type) {
        return builder().name(name).logicalType(type).build();
    }

    public static ColumnDefinition required(String name, LogicalType type) {
        return builder().name(name).logicalType(type).nullable(false).build();
    }

    /**
     * Columns are nullable unless the builder says otherwise.
     */
    public static class ColumnDefinitionBuilder {
        private boolean nullable = true;
    }
}
