package org.schemaforge.incremental.sqlserver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemaforge.incremental.DeleteStrategy;
import org.schemaforge.incremental.IncrementalConfig;
import org.schemaforge.incremental.IncrementalScript;
import org.schemaforge.incremental.LoadPattern;
import org.schemaforge.incremental.MergeStrategy;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.schemaforge.incremental.IncrementalFixtures.cdc;
import static org.schemaforge.incremental.IncrementalFixtures.customerChanges;
import static org.schemaforge.incremental.IncrementalFixtures.customers;
import static org.schemaforge.incremental.IncrementalFixtures.dimCustomer;
import static org.schemaforge.incremental.IncrementalFixtures.incremental;
import static org.schemaforge.incremental.IncrementalFixtures.keyed;

class SqlServerIncrementalGeneratorTest {

    private final SqlServerIncrementalGenerator generator = new SqlServerIncrementalGenerator();

    @Test
    @DisplayName("Upsert MERGE inserts through WHEN NOT MATCHED BY TARGET")
    void upsert() {
        String merge = generator.generate(customers(), "customers", keyed(LoadPattern.UPSERT).build())
                .getStatements().get(0);

        assertThat(merge)
                .startsWith("MERGE INTO [crm].[customers] AS target\nUSING [crm].[customers_staging] AS source\n"
                        + "ON target.[customer_id] = source.[customer_id]")
                .contains("WHEN NOT MATCHED BY TARGET THEN\n  INSERT ([customer_id], [name], [email], [updated_at])");
    }

    @Test
    @DisplayName("Changed-only updates compare with EXCEPT")
    void upsertChangedOnly() {
        IncrementalConfig config = keyed(LoadPattern.UPSERT).mergeStrategy(MergeStrategy.UPDATE_CHANGED).build();

        String merge = generator.generate(customers(), "customers", config).getStatements().get(0);

        assertThat(merge).contains("WHEN MATCHED AND EXISTS (SELECT target.[name], target.[email], target.[updated_at]"
                + " EXCEPT SELECT source.[name], source.[email], source.[updated_at]) THEN");
    }

    @Test
    @DisplayName("CDC soft delete runs as its own joined UPDATE before the MERGE")
    void cdcSoftDelete() {
        IncrementalScript script = generator.generate(customerChanges(), "customers", cdc(DeleteStrategy.SOFT_DELETE));

        assertThat(script.getStatements()).hasSize(2);
        assertThat(script.getStatements().get(0))
                .startsWith("UPDATE target\nSET [is_deleted] = 1\nFROM [crm].[customers] AS target\nINNER JOIN (")
                .endsWith("  ON target.[customer_id] = source.[customer_id]\nWHERE source.[op] = N'D'");
        assertThat(script.getStatements().get(1))
                .startsWith("MERGE INTO")
                .doesNotContain("N'D'")
                .contains("WHEN NOT MATCHED BY TARGET AND source.[op] IN (N'I', N'U') THEN");
    }

    @Test
    @DisplayName("Incremental load declares a typed T-SQL variable")
    void incrementalWithLookback() {
        IncrementalScript script = generator.generate(customers(), "customers", incremental("updated_at", "30 minutes"));

        assertThat(script.getPreamble()).containsExactly("DECLARE @max_ts DATETIME2 = (SELECT ISNULL(MAX([updated_at]), "
                + "CAST(N'1970-01-01' AS DATETIME2)) FROM [crm].[customers])");
        assertThat(script.getStatements().get(0)).endsWith("WHERE source.[updated_at] > DATEADD(MINUTE, -30, @max_ts)");
    }

    @Test
    @DisplayName("SCD type 2 uses BIT literals and SHA-256 hashes")
    void scdType2() {
        IncrementalConfig config = keyed(LoadPattern.SCD_TYPE2).hashColumns(List.of("city")).build();

        IncrementalScript script = generator.generate(dimCustomer(), "dim_customer", config);

        assertThat(script.getStatements().get(0))
                .contains("SET [effective_to] = GETDATE(),\n    [is_current] = 0")
                .contains("WHERE target.[is_current] = 1\n  AND HASHBYTES('SHA2_256', "
                        + "ISNULL(CAST(target.[city] AS NVARCHAR(MAX)), N'<null>')) <> HASHBYTES('SHA2_256', "
                        + "ISNULL(CAST(source.[city] AS NVARCHAR(MAX)), N'<null>'))");
        assertThat(script.getStatements().get(1)).contains("CAST(N'9999-12-31' AS DATETIME2), 1");
        assertThat(script.toSql()).startsWith("BEGIN TRANSACTION;").endsWith("COMMIT TRANSACTION;\n");
    }

    @Test
    @DisplayName("Maintenance refreshes statistics")
    void maintenance() {
        assertThat(generator.maintenanceStatements(customers(), "customers"))
                .containsExactly("UPDATE STATISTICS [crm].[customers]");
    }
}
