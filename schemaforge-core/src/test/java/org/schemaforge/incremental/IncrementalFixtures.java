package org.schemaforge.incremental;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;

import java.util.List;

public final class IncrementalFixtures {

    private IncrementalFixtures() {
    }

    /**
     * crm.customers(customer_id, name, email, updated_at).
     */
    public static CanonicalSchema customers() {
        return CanonicalSchema.builder()
                .tableName("customers")
                .datasetName("crm")
                .columns(List.of(
                        ColumnDefinition.required("customer_id", LogicalType.INTEGER),
                        ColumnDefinition.of("name", LogicalType.STRING),
                        ColumnDefinition.of("email", LogicalType.STRING),
                        ColumnDefinition.of("updated_at", LogicalType.TIMESTAMP)))
                .build();
    }

    /**
     * Change feed of customers with an operation code, a sequence number and a soft-delete flag.
     */
    public static CanonicalSchema customerChanges() {
        return CanonicalSchema.builder()
                .tableName("customers")
                .datasetName("crm")
                .columns(List.of(
                        ColumnDefinition.required("customer_id", LogicalType.INTEGER),
                        ColumnDefinition.of("name", LogicalType.STRING),
                        ColumnDefinition.of("is_deleted", LogicalType.BOOLEAN),
                        ColumnDefinition.of("op", LogicalType.STRING),
                        ColumnDefinition.of("seq", LogicalType.BIGINT)))
                .build();
    }

    /**
     * crm.dim_customer with SCD type 2 bookkeeping columns.
     */
    public static CanonicalSchema dimCustomer() {
        return CanonicalSchema.builder()
                .tableName("dim_customer")
                .datasetName("crm")
                .columns(List.of(
                        ColumnDefinition.required("customer_id", LogicalType.INTEGER),
                        ColumnDefinition.of("name", LogicalType.STRING),
                        ColumnDefinition.of("city", LogicalType.STRING),
                        ColumnDefinition.of("effective_from", LogicalType.TIMESTAMP),
                        ColumnDefinition.of("effective_to", LogicalType.TIMESTAMP),
                        ColumnDefinition.of("is_current", LogicalType.BOOLEAN)))
                .build();
    }

    public static IncrementalConfig.IncrementalConfigBuilder keyed(LoadPattern pattern) {
        return IncrementalConfig.builder().loadPattern(pattern).primaryKeys(List.of("customer_id"));
    }

    public static IncrementalConfig scd2() {
        return keyed(LoadPattern.SCD_TYPE2).hashColumns(List.of("name", "city")).build();
    }

    public static IncrementalConfig cdc(DeleteStrategy deletes) {
        return keyed(LoadPattern.CDC_MERGE)
                .operationColumn("op")
                .sequenceColumn("seq")
                .deleteStrategy(deletes)
                .softDeleteColumn(deletes == DeleteStrategy.SOFT_DELETE ? "is_deleted" : null)
                .build();
    }

    public static IncrementalConfig incremental(String column, String lookback) {
        return IncrementalConfig.builder()
                .loadPattern(LoadPattern.INCREMENTAL_TIMESTAMP)
                .incrementalColumn(column)
                .lookbackWindow(lookback == null ? null : LookbackWindow.parse(lookback))
                .build();
    }
}
