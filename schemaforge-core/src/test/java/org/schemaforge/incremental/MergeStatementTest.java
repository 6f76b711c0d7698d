package org.schemaforge.incremental;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MergeStatementTest {

    @Test
    @DisplayName("Clauses are emitted in the order they were added")
    void clauseOrder() {
        String sql = MergeStatement.into("t", "target", "s", "source", "target.id = source.id")
                .whenMatchedDelete("source.op = 'D'")
                .whenMatchedUpdate(null, List.of("name = source.name", "qty = source.qty"))
                .whenNotMatchedInsert("WHEN NOT MATCHED", null, List.of("id", "name"), List.of("source.id", "source.name"))
                .build();

        assertThat(sql).isEqualTo("""
                MERGE INTO t AS target
                USING s AS source
                ON target.id = source.id
                WHEN MATCHED AND source.op = 'D' THEN
                  DELETE
                WHEN MATCHED THEN
                  UPDATE SET name = source.name,
                    qty = source.qty
                WHEN NOT MATCHED THEN
                  INSERT (id, name)
                  VALUES (source.id, source.name)""");
    }

    @Test
    @DisplayName("A MERGE without clauses cannot be built")
    void requiresClause() {
        MergeStatement merge = MergeStatement.into("t", "target", "s", "source", "1 = 1");

        assertThat(merge.hasClauses()).isFalse();
        assertThatThrownBy(merge::build)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("MERGE needs at least one WHEN clause");
    }
}
