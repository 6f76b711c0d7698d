package org.schemaforge.incremental;

import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.Platform;

import java.util.List;

/**
 * Emits staging DDL and load statements for one platform.
 * Implementations are stateless; a single instance may serve concurrent calls.
 */
public interface IncrementalGenerator {

    Platform platform();

    boolean supports(LoadPattern pattern);

    /**
     * @throws org.schemaforge.error.ConfigurationException if the config lacks what its pattern needs
     * @throws org.schemaforge.error.UnsupportedCapabilityException if the platform cannot run the pattern
     */
    void validate(CanonicalSchema schema, IncrementalConfig config);

    /**
     * Validates, then generates the staging DDL and the pattern's statements for {@code tableName},
     * qualified like {@code schema}.
     */
    IncrementalScript generate(CanonicalSchema schema, String tableName, IncrementalConfig config);

    String generateStagingDdl(CanonicalSchema schema, String tableName, IncrementalConfig config);

    /**
     * Query returning the target's current maximum of {@code column} as {@code max_value}.
     */
    String maxValueQuery(CanonicalSchema schema, String tableName, String column);

    /**
     * Housekeeping worth running after a load, e.g. statistics refresh. May be empty.
     */
    List<String> maintenanceStatements(CanonicalSchema schema, String tableName);
}
