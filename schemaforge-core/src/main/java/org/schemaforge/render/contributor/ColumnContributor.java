package org.schemaforge.render.contributor;

import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.render.DdlDialect;

import java.util.List;

public record ColumnContributor(List<ColumnDefinition> columns) implements TableBodyContributor {
    @Override
    public int priority() {
        return 40;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (ColumnDefinition c : columns) {
            sb.append("  ").append(dialect.columnDefinitionSql(c)).append(",\n");
        }
    }
}
