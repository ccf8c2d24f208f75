package com.pubannotator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central registry of built-in annotation schemas, plus loading of schemas from JSON definition
 * files.
 * <p>
 * Definition file format:
 * <pre>
 * {"name": "publication",
 *  "fields": [
 *    {"name": "title", "type": "string", "required": true},
 *    {"name": "category", "type": "enum", "values": ["review", "preprint"]},
 *    {"name": "authors", "type": "list", "items": {"fields": [{"name": "name", "type": "string", "required": true}]}}
 *  ]}
 * </pre>
 * {@code required} defaults to false.
 */
public final class AnnotationSchemas {
    public static final String PUBLICATION = "publication";

    private static final AnnotationSchema AUTHOR = AnnotationSchema.of("author",
        SchemaField.string("name", true),
        SchemaField.string("affiliation", false)
    );

    private static final AnnotationSchema PUBLICATION_SCHEMA = AnnotationSchema.of(PUBLICATION,
        SchemaField.string("title", true),
        SchemaField.enumOf("category", true, "research-article", "review", "preprint", "dataset", "editorial", "other"),
        SchemaField.string("summary", true),
        SchemaField.bool("peerReviewed", false),
        SchemaField.listOf("authors", false, AUTHOR)
    );

    private static final Map<String, AnnotationSchema> BUILT_IN = Map.of(PUBLICATION, PUBLICATION_SCHEMA);

    private AnnotationSchemas() {}

    public static AnnotationSchema publication() {
        return PUBLICATION_SCHEMA;
    }

    /**
     * Resolves a built-in schema by name, or loads the schema definition file at that path.
     * @throws IOException if the name is not built in and the file cannot be read
     * @throws IllegalArgumentException if the definition is malformed
     */
    public static AnnotationSchema resolve(String nameOrPath) throws IOException {
        AnnotationSchema builtIn = BUILT_IN.get(nameOrPath);
        if (builtIn != null) return builtIn;
        Path path = Paths.get(nameOrPath);
        if (!Files.isRegularFile(path)) {
            throw new IOException("Unknown schema '" + nameOrPath + "': not a built-in schema and no such file");
        }
        return load(path);
    }

    public static AnnotationSchema load(Path path) throws IOException {
        JsonNode root = new ObjectMapper().readTree(path.toFile());
        return fromJson(root, fileStem(path));
    }

    static AnnotationSchema fromJson(JsonNode node, String defaultName) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Schema definition must be a JSON object");
        }
        String name = node.path("name").asText(defaultName);
        JsonNode fieldsNode = node.path("fields");
        if (!fieldsNode.isArray()) {
            throw new IllegalArgumentException("Schema '" + name + "' must have a 'fields' array");
        }
        List<SchemaField> fields = new ArrayList<>();
        for (JsonNode f : fieldsNode) {
            String fieldName = f.path("name").asText("");
            FieldType type = FieldType.fromLabel(f.path("type").asText(null));
            boolean required = f.path("required").asBoolean(false);
            List<String> values = new ArrayList<>();
            f.path("values").forEach(v -> values.add(v.asText()));
            AnnotationSchema items = type == FieldType.LIST ? fromJson(f.get("items"), name + "." + fieldName) : null;
            fields.add(new SchemaField(fieldName, type, required, values, items));
        }
        return new AnnotationSchema(name, fields);
    }

    private static String fileStem(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
