package org.schemaforge.render;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;

import java.util.List;
import java.util.Optional;

/**
 * SQL vocabulary of one platform, shared by its renderer and its incremental generator.
 */
public interface DdlDialect {

    Platform platform();

    DialectCapabilities capabilities();

    IdentifierPolicy identifierPolicy();

    String quoteIdentifier(String raw);

    String tableReference(String projectId, String datasetName, String tableName);

    default String tableReference(CanonicalSchema schema) {
        return tableReference(schema.getProjectId(), schema.getDatasetName(), schema.getTableName());
    }

    LogicalTypeMapper typeMapper();

    default String physicalType(ColumnDefinition column) {
        return typeMapper().map(column);
    }

    String columnDefinitionSql(ColumnDefinition column);

    String openCreateTable(String tableReference, TableKind kind);

    String closeCreateTable();

    /**
     * Clauses placed between the closing parenthesis and the terminating semicolon, in this order:
     * partition, then cluster/sort/distribution, then table options.
     */
    Optional<String> partitionClause(CanonicalSchema schema);

    List<String> clusteringClauses(CanonicalSchema schema);

    Optional<String> tableOptionsClause(CanonicalSchema schema);

    /**
     * Statements that must run after CREATE TABLE, e.g. comments or indexes. Each without a trailing semicolon.
     */
    List<String> postCreateStatements(CanonicalSchema schema, String tableReference);

    String stringLiteral(String value);
}
