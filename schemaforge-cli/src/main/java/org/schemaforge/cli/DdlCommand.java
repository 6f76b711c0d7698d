package org.schemaforge.cli;

import lombok.extern.slf4j.Slf4j;
import org.schemaforge.SchemaForge;
import org.schemaforge.cli.service.SchemaIoService;
import org.schemaforge.config.ConfigurationLoader;
import org.schemaforge.model.CanonicalSchema;
import org.schemaforge.render.Platform;
import org.schemaforge.render.Renderer;
import org.schemaforge.render.TableKind;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Renders DDL, client-tool commands or the structured schema document for one platform.
 */
@Slf4j
@CommandLine.Command(
        name = "ddl",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "Renders CREATE TABLE DDL for a schema document."
)
public class DdlCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", description = "Schema document (.json, .yaml)")
    private Path schemaFile;
    @CommandLine.Option(names = {"-d", "--platform"}, description = "bigquery, snowflake, redshift, postgresql, sqlserver; configured default when omitted")
    private String platformName;
    @CommandLine.Option(names = "--staging", description = "Render staging DDL without optimization clauses")
    private boolean staging;
    @CommandLine.Option(names = "--cli-create", description = "Print the client-tool command that creates the table")
    private boolean cliCreate;
    @CommandLine.Option(names = "--cli-load", paramLabel = "DATA", description = "Print the client-tool command that loads DATA")
    private String cliLoad;
    @CommandLine.Option(names = "--schema-doc", description = "Print the platform's structured schema document")
    private boolean schemaDocument;
    @CommandLine.Option(names = "--out", description = "Output file; stdout when omitted")
    private Path out;
    @CommandLine.Option(names = "--profile", description = "Configuration profile (dev, prod, test ...)")
    private String profile;

    @Override
    public Integer call() {
        try {
            SchemaIoService io = new SchemaIoService();
            CanonicalSchema schema = io.loadSchema(schemaFile);
            Platform platform = platformName != null
                    ? Platform.fromName(platformName)
                    : new ConfigurationLoader().loadSettings(profile).defaultPlatform();
            Renderer renderer = SchemaForge.getRenderer(platform, schema);

            List<String> problems = renderer.validate();
            if (!problems.isEmpty()) {
                System.err.println("Schema '" + schema.getTableName() + "' is not compatible with "
                        + platform.displayName() + ":");
                problems.forEach(problem -> System.err.println("   - " + problem));
                return 1;
            }

            io.emit(render(renderer), out);
            return 0;
        } catch (Exception e) {
            System.err.println("DDL generation failed: " + e.getMessage());
            log.debug("DDL generation failed", e);
            return 1;
        }
    }

    private String render(Renderer renderer) {
        if (schemaDocument) {
            return renderer.toSchemaDocument();
        }
        if (cliCreate) {
            return renderer.toCliCreate();
        }
        if (cliLoad != null) {
            return renderer.toCliLoad(cliLoad);
        }
        return renderer.toDdl(staging ? TableKind.STAGING : TableKind.PERMANENT);
    }
}
