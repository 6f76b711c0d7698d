package org.schemaforge.render;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.render.contributor.DdlContributor;
import org.schemaforge.render.contributor.TableBodyContributor;
import org.schemaforge.render.contributor.TableClauseContributor;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CreateTableBuilderTest {

    @Mock
    DdlDialect dialect;

    private final CanonicalSchema schema = RenderFixtures.events();

    @BeforeEach
    void setUp() {
        lenient().when(dialect.openCreateTable(anyString(), any())).thenReturn("CREATE TABLE t (\n");
        lenient().when(dialect.closeCreateTable()).thenReturn("\n)");
        lenient().when(dialect.columnDefinitionSql(any()))
                .thenAnswer(inv -> inv.<ColumnDefinition>getArgument(0).getName() + " X");
    }

    @Test
    @DisplayName("Columns, clauses and post statements are assembled in order without a trailing comma")
    void assemblesInOrder() {
        when(dialect.partitionClause(schema)).thenReturn(Optional.of("PARTITION BY p"));
        when(dialect.clusteringClauses(schema)).thenReturn(List.of("CLUSTER BY c"));
        when(dialect.tableOptionsClause(schema)).thenReturn(Optional.empty());
        when(dialect.postCreateStatements(schema, "t")).thenReturn(List.of("COMMENT ON TABLE t IS 'x'"));

        String ddl = new CreateTableBuilder("t", TableKind.PERMANENT, dialect).defaultsFrom(schema).build();

        assertThat(ddl).isEqualTo("""
                CREATE TABLE t (
                  id X,
                  event_ts X,
                  name X,
                  amount X
                )
                PARTITION BY p
                CLUSTER BY c;
                COMMENT ON TABLE t IS 'x';
                """);
    }

    @Test
    @DisplayName("Staging tables carry columns only")
    void stagingSkipsHints() {
        String ddl = new CreateTableBuilder("t", TableKind.STAGING, dialect).defaultsFrom(schema).build();

        assertThat(ddl).endsWith("amount X\n);\n");
        verify(dialect, never()).partitionClause(any());
        verify(dialect, never()).postCreateStatements(any(), anyString());
    }

    @Test
    @DisplayName("Contributors run by priority regardless of registration order")
    void priorityOrder() {
        TableClauseContributor late = clause(90, "\nLATE");
        TableClauseContributor early = clause(10, "\nEARLY");

        String ddl = new CreateTableBuilder("t", TableKind.PERMANENT, dialect)
                .add(body(1, "  only X,\n"))
                .add(late)
                .add(early)
                .build();

        assertThat(ddl).isEqualTo("CREATE TABLE t (\n  only X\n)\nEARLY\nLATE;\n");
    }

    @Test
    @DisplayName("Unknown contributor kinds are rejected")
    void rejectsUnknownContributor() {
        DdlContributor unknown = mock(DdlContributor.class);

        assertThatThrownBy(() -> new CreateTableBuilder("t", TableKind.PERMANENT, dialect).add(unknown))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Unsupported contributor type");
    }

    private static TableBodyContributor body(int priority, String text) {
        return new TableBodyContributor() {
            @Override
            public int priority() {
                return priority;
            }

            @Override
            public void contribute(StringBuilder sb, DdlDialect dialect) {
                sb.append(text);
            }
        };
    }

    private static TableClauseContributor clause(int priority, String text) {
        return new TableClauseContributor() {
            @Override
            public int priority() {
                return priority;
            }

            @Override
            public void contribute(StringBuilder sb, DdlDialect dialect) {
                sb.append(text);
            }
        };
    }
}
