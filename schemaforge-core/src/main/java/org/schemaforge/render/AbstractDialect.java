package org.schemaforge.render;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.model.ColumnDefinition;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public abstract class AbstractDialect implements DdlDialect {
    protected final LogicalTypeMapper typeMapper;
    protected final IdentifierPolicy identifierPolicy;
    protected final DialectCapabilities capabilities;

    protected AbstractDialect() {
        this.typeMapper = initializeTypeMapper();
        this.identifierPolicy = initializeIdentifierPolicy();
        this.capabilities = DialectCapabilities.of(platform());
    }

    protected abstract LogicalTypeMapper initializeTypeMapper();
    protected abstract IdentifierPolicy initializeIdentifierPolicy();

    @Override
    public DialectCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public LogicalTypeMapper typeMapper() {
        return typeMapper;
    }

    @Override
    public IdentifierPolicy identifierPolicy() {
        return identifierPolicy;
    }

    @Override
    public String quoteIdentifier(String raw) {
        return identifierPolicy.apply(raw);
    }

    @Override
    public String tableReference(String projectId, String datasetName, String tableName) {
        return Stream.of(projectId, datasetName, tableName)
                .filter(part -> part != null && !part.isBlank())
                .map(this::quoteIdentifier)
                .collect(Collectors.joining("."));
    }

    @Override
    public String columnDefinitionSql(ColumnDefinition column) {
        StringBuilder sb = new StringBuilder(quoteIdentifier(column.getName()))
                .append(' ')
                .append(physicalType(column));
        if (!column.isNullable()) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }

    @Override
    public String openCreateTable(String tableReference, TableKind kind) {
        if (kind == TableKind.STAGING) {
            return "DROP TABLE IF EXISTS " + tableReference + ";\nCREATE TABLE " + tableReference + " (\n";
        }
        return "CREATE TABLE " + tableReference + " (\n";
    }

    @Override
    public String closeCreateTable() {
        return "\n)";
    }

    @Override
    public Optional<String> partitionClause(CanonicalSchema schema) {
        return Optional.empty();
    }

    @Override
    public List<String> clusteringClauses(CanonicalSchema schema) {
        return List.of();
    }

    @Override
    public Optional<String> tableOptionsClause(CanonicalSchema schema) {
        return Optional.empty();
    }

    @Override
    public List<String> postCreateStatements(CanonicalSchema schema, String tableReference) {
        return List.of();
    }

    @Override
    public String stringLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    protected String columnList(List<String> columns) {
        return columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }
}
