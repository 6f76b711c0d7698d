package org.schemaforge.render.bigquery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemaforge.error.ValidationException;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;
import org.schemaforge.model.OptimizationHints;
import org.schemaforge.render.RenderFixtures;
import org.schemaforge.render.TableKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BigQueryRendererTest {

    private static final OptimizationHints PARTITIONED = OptimizationHints.builder()
            .partitionColumns(List.of("event_ts"))
            .clusterColumns(List.of("id"))
            .partitionExpirationDays(30)
            .requirePartitionFilter(true)
            .build();

    @Test
    @DisplayName("DDL quotes the table path and renders partition, cluster and options")
    void ddlWithHints() {
        CanonicalSchema schema = RenderFixtures.eventsWith(PARTITIONED).toBuilder().description("Events").build();

        String ddl = new BigQueryRenderer(schema).toDdl();

        assertThat(ddl).isEqualTo("""
                CREATE TABLE `acme.analytics.events` (
                  id INT64 NOT NULL,
                  event_ts TIMESTAMP,
                  name STRING(100) OPTIONS(description="Event name"),
                  amount NUMERIC(12, 2)
                )
                PARTITION BY DATE(event_ts)
                CLUSTER BY id
                OPTIONS(
                  partition_expiration_days=30,
                  require_partition_filter=true,
                  description="Events"
                );
                """);
    }

    @Test
    @DisplayName("Staging DDL replaces the table and drops layout clauses")
    void stagingDdl() {
        String ddl = new BigQueryRenderer(RenderFixtures.eventsWith(PARTITIONED)).toDdl(TableKind.STAGING);

        assertThat(ddl).startsWith("CREATE OR REPLACE TABLE `acme.analytics.events` (\n")
                .doesNotContain("PARTITION BY")
                .doesNotContain("CLUSTER BY");
    }

    @Test
    @DisplayName("Wide decimals become BIGNUMERIC and keywords are backtick quoted")
    void bigNumericAndKeywords() {
        CanonicalSchema schema = CanonicalSchema.builder()
                .tableName("t")
                .datasetName("d")
                .columns(List.of(
                        ColumnDefinition.builder().name("total").logicalType(LogicalType.DECIMAL)
                                .precision(40).scale(2).build(),
                        ColumnDefinition.of("order", LogicalType.STRING)))
                .build();

        String ddl = new BigQueryRenderer(schema).toDdl();

        assertThat(ddl).contains("total BIGNUMERIC(40, 2)").contains("`order` STRING");
    }

    @Test
    @DisplayName("A dataset is required")
    void requiresDataset() {
        CanonicalSchema schema = RenderFixtures.events().toBuilder().datasetName(null).build();

        assertThatThrownBy(() -> new BigQueryRenderer(schema))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("dataset_name is required for bigquery");
    }

    @Test
    @DisplayName("Partitioning on a non-temporal column is reported and blocks DDL")
    void partitionTypeCheck() {
        BigQueryRenderer renderer = new BigQueryRenderer(RenderFixtures.eventsWith(
                OptimizationHints.builder().partitionColumns(List.of("name")).build()));

        assertThat(renderer.validate())
                .containsExactly("BigQuery partition column 'name' must be a date or timestamp, got string");
        assertThatThrownBy(renderer::toDdl).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("More than four cluster columns are reported")
    void clusterLimit() {
        CanonicalSchema wide = RenderFixtures.wide(5).toBuilder()
                .optimization(OptimizationHints.builder()
                        .clusterColumns(List.of("c1", "c2", "c3", "c4", "c5"))
                        .build())
                .build();

        assertThat(new BigQueryRenderer(wide).validate())
                .containsExactly("BigQuery supports max 4 cluster columns, got 5");
    }

    @Test
    @DisplayName("Schema document is refused while capability problems remain")
    void schemaDocumentRequiresValidSchema() {
        CanonicalSchema wide = RenderFixtures.wide(5).toBuilder()
                .optimization(OptimizationHints.builder()
                        .clusterColumns(List.of("c1", "c2", "c3", "c4", "c5"))
                        .build())
                .build();

        assertThatThrownBy(() -> new BigQueryRenderer(wide).toSchemaDocument())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("BigQuery supports max 4 cluster columns, got 5");
    }

    @Test
    @DisplayName("Schema document lists name, base type and mode per column")
    void schemaDocument() throws Exception {
        BigQueryRenderer renderer = new BigQueryRenderer(RenderFixtures.events());

        JsonNode fields = new ObjectMapper().readTree(renderer.toSchemaDocument());

        assertThat(renderer.supportsSchemaDocument()).isTrue();
        assertThat(fields).hasSize(4);
        assertThat(fields.get(0).get("name").asText()).isEqualTo("id");
        assertThat(fields.get(0).get("type").asText()).isEqualTo("INT64");
        assertThat(fields.get(0).get("mode").asText()).isEqualTo("REQUIRED");
        assertThat(fields.get(2).get("type").asText()).isEqualTo("STRING");
        assertThat(fields.get(2).get("description").asText()).isEqualTo("Event name");
        assertThat(fields.get(3).get("precision").asInt()).isEqualTo(12);
        assertThat(fields.get(3).get("scale").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("bq mk carries partitioning and clustering flags")
    void cliCreate() {
        String command = new BigQueryRenderer(RenderFixtures.eventsWith(PARTITIONED)).toCliCreate();

        assertThat(command).isEqualTo("bq mk --table --schema=events_schema.json"
                + " --time_partitioning_field=event_ts --time_partitioning_type=DAY"
                + " --time_partitioning_expiration=2592000 --require_partition_filter"
                + " --clustering_fields=id acme:analytics.events");
    }

    @Test
    @DisplayName("bq load picks the source format from the file extension")
    void cliLoad() {
        BigQueryRenderer renderer = new BigQueryRenderer(RenderFixtures.events());

        assertThat(renderer.toCliLoad("gs://bucket/events.csv")).isEqualTo(
                "bq load --source_format=CSV --skip_leading_rows=1 --schema=events_schema.json"
                        + " acme:analytics.events gs://bucket/events.csv");
        assertThat(renderer.toCliLoad("gs://bucket/events.parquet"))
                .isEqualTo("bq load --source_format=PARQUET acme:analytics.events gs://bucket/events.parquet");
    }
}
