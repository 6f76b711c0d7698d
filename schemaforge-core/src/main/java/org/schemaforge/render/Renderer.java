package org.schemaforge.render;

import org.schemaforge.model.CanonicalSchema;

import java.util.List;
import java.util.Map;

/**
 * Renders one {@link CanonicalSchema} for one platform.
 * <p>
 * A renderer is bound to its schema at construction, which fails for structurally broken
 * schemas. Capability problems are reported by {@link #validate()}; the generating methods
 * refuse to emit text while that list is non-empty.
 */
public interface Renderer {

    Platform platform();

    CanonicalSchema schema();

    /**
     * @return one message per capability the schema needs and the platform lacks; empty when compatible
     */
    List<String> validate();

    /**
     * Physical type per column, in column order.
     */
    Map<String, String> toPhysicalTypes();

    default String toDdl() {
        return toDdl(TableKind.PERMANENT);
    }

    String toDdl(TableKind kind);

    /**
     * Shell invocation that creates the table with the platform's client tool.
     */
    String toCliCreate();

    /**
     * Shell invocation that bulk-loads {@code dataReference} (a local path or bucket URI) into the table.
     */
    String toCliLoad(String dataReference);

    default boolean supportsSchemaDocument() {
        return false;
    }

    /**
     * Structured schema artifact for native bulk-load tooling.
     */
    String toSchemaDocument();
}
