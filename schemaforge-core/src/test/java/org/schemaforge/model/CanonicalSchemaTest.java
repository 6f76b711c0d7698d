package org.schemaforge.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalSchemaTest {

    private static CanonicalSchema.CanonicalSchemaBuilder customers() {
        return CanonicalSchema.builder()
                .tableName("customers")
                .datasetName("analytics")
                .columns(List.of(
                        ColumnDefinition.required("customer_id", LogicalType.BIGINT),
                        ColumnDefinition.of("email", LogicalType.STRING),
                        ColumnDefinition.of("created_at", LogicalType.TIMESTAMP)));
    }

    @Test
    @DisplayName("Well-formed schema has no validation problems")
    void validSchema() {
        assertThat(customers().build().validate()).isEmpty();
    }

    @Test
    @DisplayName("Missing table name and empty column list are both reported")
    void missingTableAndColumns() {
        CanonicalSchema schema = CanonicalSchema.builder().columns(List.of()).build();

        assertThat(schema.validate())
                .contains("table_name is required", "schema must contain at least one column");
    }

    @Test
    @DisplayName("Column names are unique regardless of case")
    void duplicateColumnsIgnoringCase() {
        CanonicalSchema schema = customers()
                .columns(List.of(ColumnDefinition.of("Email", LogicalType.STRING),
                        ColumnDefinition.of("email", LogicalType.STRING)))
                .build();

        assertThat(schema.validate()).containsExactly("Duplicate column name: email");
    }

    @Test
    @DisplayName("Type parameters on the wrong logical type are rejected")
    void typeParametersMustMatchType() {
        CanonicalSchema schema = customers()
                .columns(List.of(
                        ColumnDefinition.builder().name("amount").logicalType(LogicalType.FLOAT).precision(10).scale(2).build(),
                        ColumnDefinition.builder().name("code").logicalType(LogicalType.INTEGER).maxLength(5).build(),
                        ColumnDefinition.builder().name("label").logicalType(LogicalType.STRING).dateFormat("yyyy").build()))
                .build();

        assertThat(schema.validate()).hasSize(3)
                .anyMatch(m -> m.contains("precision/scale only apply to decimal"))
                .anyMatch(m -> m.contains("max_length only applies to string"))
                .anyMatch(m -> m.contains("date_format/timezone only apply"));
    }

    @Test
    @DisplayName("Hints naming unknown columns are reported per field")
    void hintReferencesMustExist() {
        CanonicalSchema schema = customers()
                .optimization(OptimizationHints.builder()
                        .partitionColumns(List.of("created_at"))
                        .clusterColumns(List.of("region"))
                        .distributionColumn("missing")
                        .build())
                .build();

        assertThat(schema.validate()).containsExactly(
                "cluster_columns column 'region' not found in schema",
                "distribution_column column 'missing' not found in schema");
    }

    @Test
    @DisplayName("A missing column named by several hints is reported once, under its first hint")
    void hintReferenceReportedOnce() {
        OptimizationHints hints = OptimizationHints.builder()
                .clusterColumns(List.of("region", "email"))
                .sortColumns(List.of("region"))
                .distributionColumn("region")
                .build();
        CanonicalSchema schema = customers().optimization(hints).build();

        assertThat(hints.referencedColumns()).containsExactly("region", "email");
        assertThat(schema.validate()).containsExactly("cluster_columns column 'region' not found in schema");
    }

    @Test
    @DisplayName("Only one partition column and a positive expiration are accepted")
    void partitionRules() {
        CanonicalSchema schema = customers()
                .optimization(OptimizationHints.builder()
                        .partitionColumns(List.of("created_at", "email"))
                        .partitionExpirationDays(0)
                        .build())
                .build();

        assertThat(schema.validate())
                .anyMatch(m -> m.startsWith("partition_columns supports a single column"))
                .contains("partition_expiration_days must be positive");
    }

    @Test
    @DisplayName("Column lookup ignores case and qualified name skips missing parts")
    void lookupAndQualifiedName() {
        CanonicalSchema schema = customers().build();

        assertThat(schema.getColumn("EMAIL")).map(ColumnDefinition::getName).contains("email");
        assertThat(schema.hasColumn("phone")).isFalse();
        assertThat(schema.columnNames()).containsExactly("customer_id", "email", "created_at");
        assertThat(schema.qualifiedName(".")).isEqualTo("analytics.customers");
        assertThat(schema.toBuilder().projectId("acme").build().qualifiedName(".")).isEqualTo("acme.analytics.customers");
    }

    @Test
    @DisplayName("Missing optimization defaults to no hints")
    void defaultsToNoHints() {
        CanonicalSchema schema = customers().build();

        assertThat(schema.getOptimization().hasOptimizations()).isFalse();
        assertThat(schema.getColumn("email")).get().extracting(ColumnDefinition::isNullable).isEqualTo(true);
    }
}
