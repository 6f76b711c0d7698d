package org.schemaforge.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.schemaforge.error.UnsupportedCapabilityException;
import org.schemaforge.render.bigquery.BigQueryRenderer;
import org.schemaforge.render.sqlserver.SqlServerRenderer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RendererFactoryTest {

    @ParameterizedTest
    @EnumSource(Platform.class)
    @DisplayName("Every platform has a renderer that emits DDL for a plain schema")
    void everyPlatformRenders(Platform platform) {
        Renderer renderer = RendererFactory.getRenderer(platform, RenderFixtures.events());

        assertThat(renderer.platform()).isEqualTo(platform);
        assertThat(renderer.validate()).isEmpty();
        assertThat(renderer.toDdl()).contains("CREATE TABLE").endsWith(";\n");
        assertThat(renderer.toPhysicalTypes()).containsOnlyKeys("id", "event_ts", "name", "amount");
    }

    @ParameterizedTest
    @EnumSource(Platform.class)
    @DisplayName("Schema document support follows the capability table")
    void schemaDocumentFollowsCapabilities(Platform platform) {
        Renderer renderer = RendererFactory.getRenderer(platform, RenderFixtures.events());
        boolean expected = DialectCapabilities.of(platform).schemaDocument();

        assertThat(renderer.supportsSchemaDocument()).isEqualTo(expected);
        if (!expected) {
            assertThatThrownBy(renderer::toSchemaDocument)
                    .isInstanceOf(UnsupportedCapabilityException.class)
                    .hasMessageContaining("structured schema documents");
        }
    }

    @ParameterizedTest
    @CsvSource({"bq, BIGQUERY", "BigQuery, BIGQUERY", "pg, POSTGRESQL", "mssql, SQLSERVER", " snowflake , SNOWFLAKE"})
    @DisplayName("Platform names and aliases resolve case-insensitively")
    void resolvesAliases(String name, Platform expected) {
        assertThat(Platform.fromName(name)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Renderer lookup by name returns the platform's renderer")
    void lookupByName() {
        assertThat(RendererFactory.getRenderer("bigquery", RenderFixtures.events())).isInstanceOf(BigQueryRenderer.class);
        assertThat(RendererFactory.getRenderer("tsql", RenderFixtures.events())).isInstanceOf(SqlServerRenderer.class);
    }

    @Test
    @DisplayName("Unknown platform names are rejected")
    void unknownPlatform() {
        assertThatThrownBy(() -> RendererFactory.getRenderer("oracle", RenderFixtures.events()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported platform: oracle");
    }

    @Test
    @DisplayName("All five platforms are listed")
    void supportedPlatforms() {
        assertThat(RendererFactory.supportedPlatforms()).hasSize(5);
    }
}
