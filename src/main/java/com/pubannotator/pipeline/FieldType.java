package com.pubannotator.pipeline;

import java.util.Locale;

/**
 * Value types an {@link AnnotationSchema} field may declare.
 */
public enum FieldType {
    STRING("string"),
    BOOLEAN("bool"),
    ENUM("enum"),
    LIST("list");

    private final String label;

    FieldType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a type label as written in a schema definition file. Accepts {@code boolean} as an
     * alias of {@code bool}.
     */
    public static FieldType fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Field type cannot be null");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("boolean")) return BOOLEAN;
        for (FieldType type : values()) {
            if (type.label.equals(normalized)) return type;
        }
        throw new IllegalArgumentException("Unknown field type: " + label);
    }
}
