package com.pubannotator.pipeline;

import java.util.List;

/**
 * One named field of an {@link AnnotationSchema}.
 * <p>
 * {@code allowedValues} is only meaningful for {@link FieldType#ENUM}, {@code itemSchema} only for
 * {@link FieldType#LIST} (each list item is a structured value validated against it).
 */
public class SchemaField {
    public final String fieldName;
    public final FieldType type;
    public final boolean required;
    public final List<String> allowedValues;
    public final AnnotationSchema itemSchema;

    public SchemaField(String fieldName, FieldType type, boolean required,
                       List<String> allowedValues, AnnotationSchema itemSchema) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Field type cannot be null for field " + fieldName);
        }
        if (type == FieldType.ENUM && (allowedValues == null || allowedValues.isEmpty())) {
            throw new IllegalArgumentException("Enum field " + fieldName + " needs at least one allowed value");
        }
        if (type == FieldType.LIST && itemSchema == null) {
            throw new IllegalArgumentException("List field " + fieldName + " needs an item schema");
        }
        this.fieldName = fieldName;
        this.type = type;
        this.required = required;
        this.allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        this.itemSchema = itemSchema;
    }

    public static SchemaField string(String name, boolean required) {
        return new SchemaField(name, FieldType.STRING, required, null, null);
    }

    public static SchemaField bool(String name, boolean required) {
        return new SchemaField(name, FieldType.BOOLEAN, required, null, null);
    }

    public static SchemaField enumOf(String name, boolean required, String... values) {
        return new SchemaField(name, FieldType.ENUM, required, List.of(values), null);
    }

    public static SchemaField listOf(String name, boolean required, AnnotationSchema itemSchema) {
        return new SchemaField(name, FieldType.LIST, required, null, itemSchema);
    }
}
