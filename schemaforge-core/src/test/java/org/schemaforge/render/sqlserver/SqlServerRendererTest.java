package org.schemaforge.render.sqlserver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemaforge.error.UnsupportedCapabilityException;
import org.schemaforge.error.ValidationException;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;
import org.schemaforge.model.OptimizationHints;
import org.schemaforge.render.RenderFixtures;
import org.schemaforge.render.TableKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlServerRendererTest {

    @Test
    @DisplayName("DDL brackets identifiers and clusters through a separate index")
    void ddl() {
        SqlServerRenderer renderer = new SqlServerRenderer(RenderFixtures.eventsWith(
                OptimizationHints.builder().clusterColumns(List.of("id")).build()));

        assertThat(renderer.toDdl()).isEqualTo("""
                CREATE TABLE [acme].[analytics].[events] (
                  [id] BIGINT NOT NULL,
                  [event_ts] DATETIME2,
                  [name] NVARCHAR(100),
                  [amount] DECIMAL(12,2)
                );
                CREATE CLUSTERED INDEX [cix_events] ON [acme].[analytics].[events] ([id]);
                """);
    }

    @Test
    @DisplayName("Staging DDL drops and recreates without the index")
    void stagingDdl() {
        SqlServerRenderer renderer = new SqlServerRenderer(RenderFixtures.eventsWith(
                OptimizationHints.builder().clusterColumns(List.of("id")).build()));

        assertThat(renderer.toDdl(TableKind.STAGING))
                .startsWith("DROP TABLE IF EXISTS [acme].[analytics].[events];\n")
                .doesNotContain("CLUSTERED INDEX");
    }

    @Test
    @DisplayName("JSON columns have no physical type")
    void jsonUnsupported() {
        List<ColumnDefinition> columns = new ArrayList<>(RenderFixtures.events().getColumns());
        columns.add(ColumnDefinition.of("payload", LogicalType.JSON));
        CanonicalSchema schema = RenderFixtures.events().toBuilder().columns(columns).build();
        SqlServerRenderer renderer = new SqlServerRenderer(schema);

        assertThat(renderer.validate()).containsExactly("SQL Server has no physical type for json (column 'payload')");
        assertThatThrownBy(renderer::toDdl).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("CSV loads go through bcp and creates through sqlcmd")
    void cliCommands() {
        SqlServerRenderer renderer = new SqlServerRenderer(RenderFixtures.events());

        assertThat(renderer.toCliLoad("data/events.csv"))
                .isEqualTo("bcp analytics.events in \"data/events.csv\" -S \"$MSSQL_SERVER\" -d \"$MSSQL_DATABASE\""
                        + " -T -c -t\",\" -F 2");
        assertThat(renderer.toCliCreate()).startsWith("sqlcmd -S \"$MSSQL_SERVER\" -d \"$MSSQL_DATABASE\" -b -Q \"CREATE TABLE");
    }

    @Test
    @DisplayName("Non-CSV loads are refused with a locale-independent format name")
    void nonCsvLoad() {
        SqlServerRenderer renderer = new SqlServerRenderer(RenderFixtures.events());
        Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThatThrownBy(() -> renderer.toCliLoad("data/events.JSON"))
                    .isInstanceOf(UnsupportedCapabilityException.class)
                    .hasMessage("sqlserver does not support bulk loading json files: data/events.JSON");
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }
}
