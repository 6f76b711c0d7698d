package org.schemaforge.inference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemaforge.error.ValidationException;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;
import org.schemaforge.model.OptimizationHints;
import org.schemaforge.sample.TabularSample;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaInferrerTest {

    private final SchemaInferrer inferrer = new SchemaInferrer();

    private static TabularSample orders() {
        return TabularSample.builder()
                .column("Order ID", "1", "2", "3")
                .column("Order Date", "2024-01-01", "2024-01-02", "2024-01-03")
                .column("Amount", "10.50", "20.00", "")
                .column("Is Gift", "yes", "no", "no")
                .build();
    }

    @Test
    @DisplayName("Columns keep source order, standardized names and original headers")
    void infersColumns() {
        CanonicalSchema schema = inferrer.inferSchema(orders(), "orders", InferenceOptions.defaults());

        assertThat(schema.getTableName()).isEqualTo("orders");
        assertThat(schema.columnNames()).containsExactly("order_id", "order_date", "amount", "is_gift");
        assertThat(schema.getColumns()).extracting(ColumnDefinition::getOriginalName)
                .containsExactly("Order ID", "Order Date", "Amount", "Is Gift");
        assertThat(schema.getColumns()).extracting(ColumnDefinition::getLogicalType)
                .containsExactly(LogicalType.INTEGER, LogicalType.DATE, LogicalType.FLOAT, LogicalType.BOOLEAN);
        assertThat(schema.getColumn("amount")).get().satisfies(amount -> {
            assertThat(amount.isNullable()).isTrue();
            assertThat(amount.getPrecision()).isNull();
        });
        assertThat(schema.getColumn("order_id")).get().extracting(ColumnDefinition::isNullable).isEqualTo(false);
    }

    @Test
    @DisplayName("Raw names are kept when standardization is off")
    void keepsRawNames() {
        InferenceOptions options = InferenceOptions.builder().standardizeNames(false).build();

        CanonicalSchema schema = inferrer.inferSchema(orders(), "orders", options);

        assertThat(schema.columnNames()).containsExactly("Order ID", "Order Date", "Amount", "Is Gift");
    }

    @Test
    @DisplayName("Hints given by source header are translated to standardized names")
    void translatesHints() {
        InferenceOptions options = InferenceOptions.builder()
                .datasetName("sales")
                .optimization(OptimizationHints.builder()
                        .partitionColumns(List.of("Order Date"))
                        .clusterColumns(List.of("order_id"))
                        .build())
                .build();

        CanonicalSchema schema = inferrer.inferSchema(orders(), "orders", options);

        assertThat(schema.getDatasetName()).isEqualTo("sales");
        assertThat(schema.getOptimization().getPartitionColumns()).containsExactly("order_date");
        assertThat(schema.getOptimization().getClusterColumns()).containsExactly("order_id");
    }

    @Test
    @DisplayName("Hints naming unknown columns fail validation")
    void rejectsUnknownHintColumns() {
        InferenceOptions options = InferenceOptions.builder()
                .optimization(OptimizationHints.builder().sortColumns(List.of("missing")).build())
                .build();

        assertThatThrownBy(() -> inferrer.inferSchema(orders(), "orders", options))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("sort_columns column 'missing' not found in schema");
    }
}
