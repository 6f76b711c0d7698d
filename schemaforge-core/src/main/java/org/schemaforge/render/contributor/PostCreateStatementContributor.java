package org.schemaforge.render.contributor;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.DdlDialect;

public record PostCreateStatementContributor(CanonicalSchema schema, String tableReference) implements PostCreateContributor {
    @Override
    public int priority() {
        return 80;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (String statement : dialect.postCreateStatements(schema, tableReference)) {
            sb.append(statement).append(";\n");
        }
    }
}
