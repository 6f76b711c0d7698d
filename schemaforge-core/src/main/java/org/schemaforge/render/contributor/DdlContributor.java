package org.schemaforge.render.contributor;

import org.schemaforge.render.DdlDialect;

public interface DdlContributor {
    int priority();

    void contribute(StringBuilder sb, DdlDialect dialect);
}
