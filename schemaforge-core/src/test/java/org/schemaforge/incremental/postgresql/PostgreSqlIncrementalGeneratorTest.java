package org.schemaforge.incremental.postgresql;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemaforge.incremental.DeleteStrategy;
import org.schemaforge.incremental.IncrementalConfig;
import org.schemaforge.incremental.IncrementalScript;
import org.schemaforge.incremental.LoadPattern;
import org.schemaforge.incremental.MergeStrategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.schemaforge.incremental.IncrementalFixtures.cdc;
import static org.schemaforge.incremental.IncrementalFixtures.customerChanges;
import static org.schemaforge.incremental.IncrementalFixtures.customers;
import static org.schemaforge.incremental.IncrementalFixtures.dimCustomer;
import static org.schemaforge.incremental.IncrementalFixtures.incremental;
import static org.schemaforge.incremental.IncrementalFixtures.keyed;
import static org.schemaforge.incremental.IncrementalFixtures.scd2;

class PostgreSqlIncrementalGeneratorTest {

    private final PostgreSqlIncrementalGenerator generator = new PostgreSqlIncrementalGenerator();

    @Test
    @DisplayName("Changed-only upsert is an ON CONFLICT update guarded by IS DISTINCT FROM")
    void upsertChangedOnly() {
        IncrementalConfig config = keyed(LoadPattern.UPSERT)
                .mergeStrategy(MergeStrategy.UPDATE_CHANGED)
                .updatedAtColumn("updated_at")
                .build();

        IncrementalScript script = generator.generate(customers(), "customers", config);

        assertThat(script.getStatements()).containsExactly("""
                INSERT INTO "crm"."customers" AS target ("customer_id", "name", "email", "updated_at")
                SELECT source."customer_id", source."name", source."email", source."updated_at"
                FROM "crm"."customers_staging" AS source
                ON CONFLICT ("customer_id") DO UPDATE SET
                    "name" = EXCLUDED."name",
                    "email" = EXCLUDED."email",
                    "updated_at" = CURRENT_TIMESTAMP
                WHERE (target."name" IS DISTINCT FROM EXCLUDED."name"
                    OR target."email" IS DISTINCT FROM EXCLUDED."email")""");
        assertThat(script.toSql()).startsWith("BEGIN;\n\n").endsWith(";\n\nCOMMIT;\n");
    }

    @Test
    @DisplayName("Insert-only upsert does nothing on conflict")
    void upsertNone() {
        String statement = generator.generate(customers(), "customers",
                keyed(LoadPattern.UPSERT).mergeStrategy(MergeStrategy.UPDATE_NONE).build()).getStatements().get(0);

        assertThat(statement).endsWith("ON CONFLICT (\"customer_id\") DO NOTHING");
    }

    @Test
    @DisplayName("Staging DDL drops and recreates the table")
    void stagingDdl() {
        String ddl = generator.generateStagingDdl(customers(), "customers", keyed(LoadPattern.UPSERT).build());

        assertThat(ddl).startsWith("DROP TABLE IF EXISTS \"crm\".\"customers_staging\";\n"
                + "CREATE TABLE \"crm\".\"customers_staging\" (\n");
    }

    @Test
    @DisplayName("CDC soft delete updates flagged rows, then upserts inserts and updates")
    void cdcSoftDelete() {
        IncrementalScript script = generator.generate(customerChanges(), "customers", cdc(DeleteStrategy.SOFT_DELETE));

        assertThat(script.getStatements()).hasSize(2);
        assertThat(script.getStatements().get(0))
                .startsWith("UPDATE \"crm\".\"customers\" AS target\nSET \"is_deleted\" = TRUE\nFROM (")
                .endsWith("AND source.\"op\" = 'D'");
        assertThat(script.getStatements().get(1))
                .contains("WHERE source.\"op\" IN ('I', 'U')\nON CONFLICT (\"customer_id\") DO UPDATE SET");
    }

    @Test
    @DisplayName("SCD type 2 compares md5 row fingerprints null-safely")
    void scdType2() {
        IncrementalScript script = generator.generate(dimCustomer(), "dim_customer", scd2());

        assertThat(script.getStatements().get(0)).contains(
                "md5(ROW(target.\"name\", target.\"city\")::text) IS DISTINCT FROM md5(ROW(source.\"name\", source.\"city\")::text)");
    }

    @Test
    @DisplayName("Incremental lookback subtracts an interval from a scalar subquery")
    void incrementalWithLookback() {
        String insert = generator.generate(customers(), "customers", incremental("updated_at", "2 hours"))
                .getStatements().get(0);

        assertThat(insert).endsWith("WHERE source.\"updated_at\" > (SELECT COALESCE(MAX(\"updated_at\"), "
                + "CAST('1970-01-01' AS TIMESTAMP)) FROM \"crm\".\"customers\") - INTERVAL '2 hours'");
    }

    @Test
    @DisplayName("Maintenance runs VACUUM ANALYZE")
    void maintenance() {
        assertThat(generator.maintenanceStatements(customers(), "customers"))
                .containsExactly("VACUUM ANALYZE \"crm\".\"customers\"");
    }
}
