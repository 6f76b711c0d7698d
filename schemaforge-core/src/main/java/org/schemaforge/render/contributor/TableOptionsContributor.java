package org.schemaforge.render.contributor;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.DdlDialect;

public record TableOptionsContributor(CanonicalSchema schema) implements TableClauseContributor {
    @Override
    public int priority() {
        return 70;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        dialect.tableOptionsClause(schema).ifPresent(clause -> sb.append('\n').append(clause));
    }
}
