package org.schemaforge.cli.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaIoServiceTest {

    @TempDir
    Path tempDir;

    private SchemaIoService service;

    @BeforeEach
    void setUp() {
        service = new SchemaIoService();
    }

    private static CanonicalSchema products() {
        return CanonicalSchema.builder()
                .tableName("products")
                .columns(List.of(
                        ColumnDefinition.required("sku", LogicalType.STRING),
                        ColumnDefinition.of("price", LogicalType.FLOAT)))
                .build();
    }

    @Test
    @DisplayName("Saved YAML document loads back into the same schema")
    void savesAndLoadsYaml() {
        Path file = tempDir.resolve("products.yaml");

        service.saveSchema(products(), file);
        CanonicalSchema loaded = service.loadSchema(file);

        assertThat(loaded).isEqualTo(products());
    }

    @Test
    @DisplayName("Missing schema file is reported with its path")
    void missingSchemaFile() {
        Path file = tempDir.resolve("absent.json");

        assertThatThrownBy(() -> service.loadSchema(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Schema file not found: " + file);
    }

    @Test
    @DisplayName("emit creates parent directories and writes the text as is")
    void emitsToFile() throws IOException {
        Path out = tempDir.resolve("sql").resolve("load.sql");

        service.emit("SELECT 1;\n", out);

        assertThat(out).exists();
        assertThat(Files.readString(out)).isEqualTo("SELECT 1;\n");
    }
}
