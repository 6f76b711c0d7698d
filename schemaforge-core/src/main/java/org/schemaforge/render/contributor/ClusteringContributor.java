package org.schemaforge.render.contributor;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.DdlDialect;

/**
 * Cluster, sort and distribution clauses.
 */
public record ClusteringContributor(CanonicalSchema schema) implements TableClauseContributor {
    @Override
    public int priority() {
        return 60;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (String clause : dialect.clusteringClauses(schema)) {
            sb.append('\n').append(clause);
        }
    }
}
