package org.schemaforge.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import lombok.extern.slf4j.Slf4j;
import org.schemaforge.error.SchemaDocumentException;
import org.schemaforge.model.CanonicalSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads and writes the persisted form of a {@link CanonicalSchema}.
 * JSON is the primary format; YAML is accepted for hand-written documents.
 */
@Slf4j
public class SchemaDocumentCodec {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public SchemaDocumentCodec() {
        this.jsonMapper = configure(new ObjectMapper());
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String toJson(CanonicalSchema schema) {
        return write(jsonMapper, schema);
    }

    public CanonicalSchema fromJson(String json) {
        return read(jsonMapper, json);
    }

    public String toYaml(CanonicalSchema schema) {
        return write(yamlMapper, schema);
    }

    public CanonicalSchema fromYaml(String yaml) {
        return read(yamlMapper, yaml);
    }

    public void write(CanonicalSchema schema, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, write(mapperFor(path), schema));
            log.debug("Wrote schema document for '{}' to {}", schema.getTableName(), path);
        } catch (IOException e) {
            throw new SchemaDocumentException("Failed to write schema document " + path, e);
        }
    }

    public CanonicalSchema read(Path path) {
        try {
            return read(mapperFor(path), Files.readString(path));
        } catch (IOException e) {
            throw new SchemaDocumentException("Failed to read schema document " + path, e);
        }
    }

    private ObjectMapper mapperFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? yamlMapper : jsonMapper;
    }

    private static String write(ObjectMapper mapper, CanonicalSchema schema) {
        try {
            return mapper.writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw new SchemaDocumentException("Failed to serialize schema '" + schema.getTableName() + "'", e);
        }
    }

    private static CanonicalSchema read(ObjectMapper mapper, String content) {
        try {
            return mapper.readValue(content, CanonicalSchema.class);
        } catch (JsonProcessingException e) {
            throw new SchemaDocumentException("Malformed schema document: " + e.getOriginalMessage(), e);
        }
    }
}
