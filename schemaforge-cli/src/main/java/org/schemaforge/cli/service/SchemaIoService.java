package org.schemaforge.cli.service;

import org.schemaforge.document.SchemaDocumentCodec;
import org.schemaforge.model.CanonicalSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads schema documents and writes command output to a file or stdout.
 */
public class SchemaIoService {

    private final SchemaDocumentCodec codec;

    public SchemaIoService() {
        this(new SchemaDocumentCodec());
    }

    public SchemaIoService(SchemaDocumentCodec codec) {
        this.codec = codec;
    }

    public CanonicalSchema loadSchema(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Schema file not found: " + path);
        }
        return codec.read(path);
    }

    /**
     * Writes the schema document to {@code out}, or prints it as JSON when {@code out} is null.
     */
    public void saveSchema(CanonicalSchema schema, Path out) {
        if (out == null) {
            System.out.print(codec.toJson(schema));
            System.out.println();
            return;
        }
        codec.write(schema, out);
    }

    /**
     * Writes {@code text} to {@code out}, or prints it when {@code out} is null.
     */
    public void emit(String text, Path out) throws IOException {
        if (out == null) {
            System.out.print(text);
            if (!text.endsWith("\n")) {
                System.out.println();
            }
            return;
        }
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(out, text);
    }
}
