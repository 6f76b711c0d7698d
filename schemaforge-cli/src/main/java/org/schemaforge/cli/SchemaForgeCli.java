package org.schemaforge.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point: schema inference, DDL rendering, incremental load generation and key detection.
 */
@CommandLine.Command(
        name = "schemaforge",
        mixinStandardHelpOptions = true,
        version = "schemaforge 1.0",
        description = "Canonical schema inference and multi-platform SQL generation",
        subcommands = {
                InferCommand.class,
                DdlCommand.class,
                IncrementalCommand.class,
                KeysCommand.class
        }
)
public class SchemaForgeCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SchemaForgeCli()).execute(args);
        System.exit(exitCode);
    }
}
