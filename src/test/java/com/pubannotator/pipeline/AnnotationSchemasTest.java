package com.pubannotator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Built-in schemas, definition files and schema descriptions.
 */
public class AnnotationSchemasTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tmp;

    @Test
    void testBuiltInPublicationSchema() throws Exception {
        AnnotationSchema schema = AnnotationSchemas.resolve("publication");

        assertSame(AnnotationSchemas.publication(), schema);
        assertTrue(schema.field("title").required);
        assertEquals(FieldType.ENUM, schema.field("category").type);
        assertEquals(FieldType.LIST, schema.field("authors").type);
        assertTrue(schema.field("authors").itemSchema.field("name").required);
    }

    @Test
    void testLoadDefinitionFile() throws Exception {
        Path file = Paths.get(getClass().getResource("/schemas/dataset.json").toURI());

        AnnotationSchema schema = AnnotationSchemas.resolve(file.toString());

        assertEquals("dataset", schema.name());
        assertEquals(4, schema.fields().size());
        assertEquals(FieldType.BOOLEAN, schema.field("openAccess").type);
        assertFalse(schema.field("openAccess").required);
        assertTrue(schema.field("license").allowedValues.contains("cc0"));
        assertEquals(FieldType.STRING, schema.field("files").itemSchema.field("path").type);

        ValidationResult result = new OutputParser().parse(
            "{\"title\": \"Census\", \"license\": \"cc0\", \"files\": [{\"path\": \"a.csv\"}]}", schema);
        assertTrue(result.isValid(), result.toString());
    }

    @Test
    void testUnknownSchemaIsAnError() {
        assertThrows(IOException.class, () -> AnnotationSchemas.resolve("no-such-schema"));
    }

    @Test
    void testMalformedDefinitionsRejected() throws Exception {
        Path noFields = tmp.resolve("broken.json");
        Files.writeString(noFields, "{\"name\": \"broken\"}");
        assertThrows(IllegalArgumentException.class, () -> AnnotationSchemas.load(noFields));

        JsonNode badType = mapper.readTree("{\"fields\": [{\"name\": \"x\", \"type\": \"number\"}]}");
        assertThrows(IllegalArgumentException.class, () -> AnnotationSchemas.fromJson(badType, "t"));

        JsonNode enumWithoutValues = mapper.readTree("{\"fields\": [{\"name\": \"x\", \"type\": \"enum\"}]}");
        assertThrows(IllegalArgumentException.class, () -> AnnotationSchemas.fromJson(enumWithoutValues, "t"));

        JsonNode duplicate = mapper.readTree("{\"fields\": [{\"name\": \"x\", \"type\": \"string\"}, {\"name\": \"x\", \"type\": \"bool\"}]}");
        assertThrows(IllegalArgumentException.class, () -> AnnotationSchemas.fromJson(duplicate, "t"));
    }

    @Test
    void testDefaultNameFromFileStem() throws Exception {
        Path file = tmp.resolve("thesis.json");
        Files.writeString(file, "{\"fields\": [{\"name\": \"title\", \"type\": \"string\", \"required\": true}]}");
        assertEquals("thesis", AnnotationSchemas.load(file).name());
    }

    @Test
    void testDescribeListsRequiredFieldsAndEnumValues() {
        ObjectNode description = AnnotationSchemas.publication().describe();
        String text = description.toString();

        assertTrue(text.contains("research-article"));
        assertTrue(description.path("required").toString().contains("title"));
        assertFalse(description.path("required").toString().contains("peerReviewed"));
    }
}
