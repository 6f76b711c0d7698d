package org.schemaforge.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.schemaforge.document.SchemaDocumentCodec;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;
import org.schemaforge.model.OptimizationHints;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaForgeCliTest {

    @TempDir Path tmp;

    private static final String ORDERS_CSV = String.join("\n",
            "order_id,customer,ordered_at",
            "1,alice,2024-01-01",
            "2,bob,2024-01-02",
            "3,alice,2024-01-03",
            "");

    private static class StreamCaptor implements AutoCloseable {
        private final PrintStream origOut = System.out;
        private final PrintStream origErr = System.err;
        private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
        private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
        StreamCaptor() {
            System.setOut(new PrintStream(outBuf));
            System.setErr(new PrintStream(errBuf));
        }
        String out() { return outBuf.toString(); }
        String err() { return errBuf.toString(); }
        @Override public void close() {
            System.setOut(origOut);
            System.setErr(origErr);
        }
    }

    private static CanonicalSchema orders() {
        return CanonicalSchema.builder()
                .tableName("orders")
                .datasetName("sales")
                .columns(List.of(
                        ColumnDefinition.required("order_id", LogicalType.INTEGER),
                        ColumnDefinition.of("customer", LogicalType.STRING),
                        ColumnDefinition.of("ordered_at", LogicalType.DATE)))
                .build();
    }

    private Path writeSchema(CanonicalSchema schema) {
        Path file = tmp.resolve("orders.json");
        new SchemaDocumentCodec().write(schema, file);
        return file;
    }

    private Path writeCsv() throws IOException {
        Path file = tmp.resolve("orders.csv");
        Files.writeString(file, ORDERS_CSV);
        return file;
    }

    private static int run(String... args) {
        return new CommandLine(new SchemaForgeCli()).execute(args);
    }

    @Test
    @DisplayName("infer writes a schema document for a CSV file")
    void infersSchemaDocument() throws IOException {
        Path csv = writeCsv();
        Path out = tmp.resolve("schemas").resolve("orders.json");

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = run("infer", csv.toString(), "-t", "orders", "--dataset", "sales", "--out", out.toString());

            assertThat(code).isEqualTo(0);
            assertThat(sc.out()).contains("Wrote schema for 'orders' (3 columns) to");
        }
        CanonicalSchema schema = new SchemaDocumentCodec().read(out);
        assertThat(schema.getDatasetName()).isEqualTo("sales");
        assertThat(schema.getColumns()).extracting(ColumnDefinition::getLogicalType)
                .containsExactly(LogicalType.INTEGER, LogicalType.STRING, LogicalType.DATE);
    }

    @Test
    @DisplayName("infer with a missing CSV file exits 1")
    void inferMissingFile() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = run("infer", tmp.resolve("missing.csv").toString(), "-t", "orders");

            assertThat(code).isEqualTo(1);
            assertThat(sc.err()).contains("CSV file not found");
        }
    }

    @Test
    @DisplayName("ddl prints CREATE TABLE for the chosen platform")
    void rendersDdl() {
        Path schema = writeSchema(orders());

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = run("ddl", schema.toString(), "-d", "snowflake");

            assertThat(code).isEqualTo(0);
            assertThat(sc.out())
                    .startsWith("CREATE TABLE sales.orders (")
                    .contains("order_id NUMBER(38,0) NOT NULL");
        }
    }

    @Test
    @DisplayName("ddl lists every compatibility problem and exits 1")
    void reportsIncompatibleSchema() {
        CanonicalSchema partitioned = orders().toBuilder()
                .optimization(OptimizationHints.builder().partitionColumns(List.of("ordered_at")).build())
                .build();
        Path schema = writeSchema(partitioned);

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = run("ddl", schema.toString(), "--platform", "snowflake");

            assertThat(code).isEqualTo(1);
            assertThat(sc.err())
                    .contains("Schema 'orders' is not compatible with Snowflake:")
                    .contains("Snowflake does not support partitioning (partition_columns: [ordered_at])");
            assertThat(sc.out()).isEmpty();
        }
    }

    @Test
    @DisplayName("ddl with an unknown platform exits 1")
    void unsupportedPlatform() {
        Path schema = writeSchema(orders());

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = run("ddl", schema.toString(), "-d", "oracle");

            assertThat(code).isEqualTo(1);
            assertThat(sc.err()).contains("DDL generation failed: Unsupported platform: oracle");
        }
    }

    @Test
    @DisplayName("incremental prints staging DDL followed by the load transaction")
    void generatesUpsert() {
        Path schema = writeSchema(orders());

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = run("incremental", schema.toString(), "-d", "postgresql", "-P", "upsert", "-k", "order_id");

            assertThat(code).isEqualTo(0);
            assertThat(sc.out())
                    .contains("CREATE TABLE \"sales\".\"orders_staging\" (")
                    .contains("BEGIN;")
                    .contains("ON CONFLICT (\"order_id\") DO UPDATE SET")
                    .endsWith("COMMIT;\n");
        }
    }

    @Test
    @DisplayName("incremental without keys reports the missing field")
    void upsertNeedsKeys() {
        Path schema = writeSchema(orders());

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = run("incremental", schema.toString(), "-d", "bigquery", "-P", "upsert");

            assertThat(code).isEqualTo(1);
            assertThat(sc.err()).contains("primary_keys cannot be empty for upsert");
        }
    }

    @Test
    @DisplayName("keys ranks the unique identifier first")
    void detectsKeys() throws IOException {
        Path csv = writeCsv();

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = run("keys", csv.toString());

            assertThat(code).isEqualTo(0);
            assertThat(sc.out()).startsWith("1. order_id  confidence=1.00");
        }
    }

    @Test
    @DisplayName("keys --validate rejects a duplicated column")
    void validatesKey() throws IOException {
        Path csv = writeCsv();

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = run("keys", csv.toString(), "--validate", "customer");

            assertThat(code).isEqualTo(1);
            assertThat(sc.err())
                    .contains("Key (customer) is not valid:")
                    .contains("Found 1 duplicate key value(s) for customer");
        }
    }
}
