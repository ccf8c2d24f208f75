package com.pubannotator.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fully-typed value produced by {@link SchemaValidator}.
 * <p>
 * Values are {@link String} (string and enum fields), {@link Boolean} (bool fields) or
 * {@code List<Annotation>} (list-of-structured fields). Optional fields the response omitted are
 * simply absent. Instances are immutable and only ever built from a value that passed validation.
 */
public final class Annotation {
    private final Map<String, Object> values;

    Annotation(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> values() {
        return values;
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public String getString(String field) {
        Object value = values.get(field);
        return value instanceof String s ? s : null;
    }

    public Boolean getBoolean(String field) {
        Object value = values.get(field);
        return value instanceof Boolean b ? b : null;
    }

    @SuppressWarnings("unchecked")
    public List<Annotation> getList(String field) {
        Object value = values.get(field);
        return value instanceof List<?> list ? (List<Annotation>) list : List.of();
    }

    /**
     * Converts this annotation into plain maps and lists, ready for Jackson serialization.
     */
    public Map<String, Object> toPlainMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getValue() instanceof List<?> list) {
                List<Object> items = new ArrayList<>();
                for (Object item : list) {
                    items.add(((Annotation) item).toPlainMap());
                }
                out.put(entry.getKey(), items);
            } else {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Annotation other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Annotation" + values;
    }
}
