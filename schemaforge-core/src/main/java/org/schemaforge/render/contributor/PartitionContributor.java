package org.schemaforge.render.contributor;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.DdlDialect;

public record PartitionContributor(CanonicalSchema schema) implements TableClauseContributor {
    @Override
    public int priority() {
        return 50;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        dialect.partitionClause(schema).ifPresent(clause -> sb.append('\n').append(clause));
    }
}
