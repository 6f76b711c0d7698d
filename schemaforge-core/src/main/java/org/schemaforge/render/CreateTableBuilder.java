package org.schemaforge.render;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.contributor.ClusteringContributor;
import org.schemaforge.render.contributor.ColumnContributor;
import org.schemaforge.render.contributor.DdlContributor;
import org.schemaforge.render.contributor.PartitionContributor;
import org.schemaforge.render.contributor.PostCreateContributor;
import org.schemaforge.render.contributor.PostCreateStatementContributor;
import org.schemaforge.render.contributor.TableBodyContributor;
import org.schemaforge.render.contributor.TableClauseContributor;
import org.schemaforge.render.contributor.TableOptionsContributor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class CreateTableBuilder {
    private final String tableReference;
    private final TableKind kind;
    private final DdlDialect dialect;
    private final List<DdlContributor> body = new ArrayList<>();
    private final List<DdlContributor> clauses = new ArrayList<>();
    private final List<DdlContributor> post = new ArrayList<>();

    public CreateTableBuilder(String tableReference, TableKind kind, DdlDialect dialect) {
        this.tableReference = tableReference;
        this.kind = kind;
        this.dialect = dialect;
    }

    public <T extends DdlContributor> CreateTableBuilder add(T c) {
        if (c instanceof TableBodyContributor) {
            body.add(c);
        } else if (c instanceof TableClauseContributor) {
            clauses.add(c);
        } else if (c instanceof PostCreateContributor) {
            post.add(c);
        } else {
            throw new IllegalArgumentException("Unsupported contributor type: " + c.getClass().getName());
        }
        return this;
    }

    public String build() {
        StringBuilder sb = new StringBuilder(dialect.openCreateTable(tableReference, kind));

        body.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        trimTrailingComma(sb);

        sb.append(dialect.closeCreateTable());

        clauses.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        sb.append(";\n");

        post.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        return sb.toString();
    }

    private void trimTrailingComma(StringBuilder sb) {
        int last = sb.lastIndexOf(",\n");
        if (last != -1) sb.delete(last, last + 2);
    }

    /**
     * Columns plus every hint-driven clause. Staging tables carry columns only.
     */
    public CreateTableBuilder defaultsFrom(CanonicalSchema schema) {
        this.add(new ColumnContributor(schema.getColumns()));
        if (kind == TableKind.STAGING) {
            return this;
        }
        this.add(new PartitionContributor(schema));
        this.add(new ClusteringContributor(schema));
        this.add(new TableOptionsContributor(schema));
        this.add(new PostCreateStatementContributor(schema, tableReference));
        return this;
    }
}
