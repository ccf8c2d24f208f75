package com.pubannotator.pipeline;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of the structured output expected from the annotation service.
 * <p>
 * Fields keep their declaration order. Field names are unique within one schema.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public final class AnnotationSchema {
    private final String name;
    private final List<SchemaField> fields;
    private final Map<String, SchemaField> byName;

    public AnnotationSchema(String name, List<SchemaField> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Schema " + name + " must declare at least one field");
        }
        Map<String, SchemaField> index = new LinkedHashMap<>();
        for (SchemaField field : fields) {
            if (index.put(field.fieldName, field) != null) {
                throw new IllegalArgumentException("Duplicate field '" + field.fieldName + "' in schema " + name);
            }
        }
        this.name = name == null ? "anonymous" : name;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.byName = Collections.unmodifiableMap(index);
    }

    public static AnnotationSchema of(String name, SchemaField... fields) {
        return new AnnotationSchema(name, List.of(fields));
    }

    public String name() {
        return name;
    }

    public List<SchemaField> fields() {
        return fields;
    }

    /** Returns the field with the given name, or null if the schema does not declare it. */
    public SchemaField field(String fieldName) {
        return byName.get(fieldName);
    }

    /**
     * Renders this schema as a JSON-Schema-like object, sent to the annotation service as part of
     * the prompt context.
     */
    public ObjectNode describe() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode root = nodes.objectNode();
        root.put("type", "object");
        ObjectNode properties = root.putObject("properties");
        ArrayNode required = nodes.arrayNode();
        for (SchemaField field : fields) {
            ObjectNode property = properties.putObject(field.fieldName);
            switch (field.type) {
                case STRING -> property.put("type", "string");
                case BOOLEAN -> property.put("type", "boolean");
                case ENUM -> {
                    property.put("type", "string");
                    ArrayNode values = property.putArray("enum");
                    field.allowedValues.forEach(values::add);
                }
                case LIST -> {
                    property.put("type", "array");
                    property.set("items", field.itemSchema.describe());
                }
            }
            if (field.required) required.add(field.fieldName);
        }
        root.set("required", required);
        return root;
    }

    @Override
    public String toString() {
        return "AnnotationSchema{" + name + ", fields=" + byName.keySet() + "}";
    }
}
