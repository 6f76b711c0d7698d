package org.schemaforge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemaforge.error.UnsupportedCapabilityException;
import org.schemaforge.incremental.IncrementalFixtures;
import org.schemaforge.incremental.IncrementalScript;
import org.schemaforge.incremental.LoadPattern;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.KeyCandidate;
import org.schemaforge.render.Platform;
import org.schemaforge.render.Renderer;
import org.schemaforge.sample.TabularSample;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaForgeTest {

    private static TabularSample customers() {
        return TabularSample.builder()
                .column("Customer ID", "1", "2", "3", "4")
                .column("Signup Date", "2024-01-01", "2024-02-01", "2024-03-01", "2024-04-01")
                .column("Country", "DE", "DE", "FR", "US")
                .build();
    }

    @Test
    @DisplayName("Inferred schema renders for a named platform")
    void infersAndRenders() {
        // given
        CanonicalSchema schema = SchemaForge.inferSchema(customers(), "customers").toBuilder()
                .datasetName("crm")
                .build();

        // when
        Renderer renderer = SchemaForge.getRenderer("snowflake", schema);

        // then
        assertThat(renderer.platform()).isEqualTo(Platform.SNOWFLAKE);
        assertThat(renderer.validate()).isEmpty();
        assertThat(renderer.toDdl())
                .startsWith("CREATE TABLE crm.customers")
                .contains("customer_id NUMBER(38,0) NOT NULL")
                .contains("signup_date DATE");
    }

    @Test
    @DisplayName("Detected key drives an upsert on every platform that merges")
    void detectsKeyForUpsert() {
        List<KeyCandidate> keys = SchemaForge.detectKeys(customers());
        assertThat(keys).isNotEmpty();
        assertThat(keys.get(0).getColumns()).containsExactly("Customer ID");

        IncrementalScript script = SchemaForge.getIncrementalGenerator(Platform.SQLSERVER)
                .generate(IncrementalFixtures.customers(), "customers",
                        IncrementalFixtures.keyed(LoadPattern.UPSERT).build());

        assertThat(script.getStatements()).hasSize(1);
        assertThat(script.getStatements().get(0)).startsWith("MERGE");
    }

    @Test
    @DisplayName("Merge shortcut upserts on the given keys")
    void generatesMerge() {
        // when
        IncrementalScript script = SchemaForge.generateMerge("snowflake", IncrementalFixtures.customers(),
                "customers", List.of("customer_id"));

        // then
        assertThat(script.toSql())
                .startsWith("BEGIN TRANSACTION;\n\nMERGE INTO crm.customers AS target\n")
                .contains("ON target.customer_id = source.customer_id");
    }

    @Test
    @DisplayName("Merge shortcut is refused where the platform has no MERGE")
    void mergeRejectedOnRedshift() {
        assertThatThrownBy(() -> SchemaForge.generateMerge(Platform.REDSHIFT, IncrementalFixtures.customers(),
                "customers", List.of("customer_id")))
                .isInstanceOf(UnsupportedCapabilityException.class)
                .hasMessageContaining("no native MERGE");
    }

    @Test
    @DisplayName("Unknown platform names are rejected")
    void rejectsUnknownPlatform() {
        assertThatThrownBy(() -> SchemaForge.getIncrementalGenerator("oracle"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported platform: oracle");
    }
}
