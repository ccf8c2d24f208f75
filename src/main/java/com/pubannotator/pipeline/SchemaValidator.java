package com.pubannotator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a parsed JSON object against an {@link AnnotationSchema}.
 * <p>
 * Rules: every required field is present and non-null; every present value matches its declared
 * type (strings are JSON strings, bools are JSON booleans, enum values are one of the allowed
 * strings, lists are arrays of objects valid against the item schema); an optional field that is
 * null or absent is left out of the result; undeclared fields are ignored. The first violation
 * in declaration order is reported. Never throws.
 */
public class SchemaValidator {

    public ValidationResult validate(JsonNode root, AnnotationSchema schema, String rawText) {
        if (root == null || !root.isObject()) {
            return ValidationResult.validationError("$", "expected a JSON object", rawText);
        }
        Outcome outcome = validateObject(root, schema, "");
        if (outcome.errorPath != null) {
            return ValidationResult.validationError(outcome.errorPath, outcome.errorMessage, rawText);
        }
        return ValidationResult.valid(new Annotation(outcome.values));
    }

    private Outcome validateObject(JsonNode node, AnnotationSchema schema, String prefix) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (SchemaField field : schema.fields()) {
            String path = prefix.isEmpty() ? field.fieldName : prefix + "." + field.fieldName;
            JsonNode value = node.get(field.fieldName);
            if (value == null || value.isNull()) {
                if (field.required) return Outcome.error(path, "required field is missing");
                continue;
            }
            switch (field.type) {
                case STRING -> {
                    if (!value.isTextual()) return Outcome.error(path, "expected string but got " + kindOf(value));
                    values.put(field.fieldName, value.textValue());
                }
                case BOOLEAN -> {
                    if (!value.isBoolean()) return Outcome.error(path, "expected bool but got " + kindOf(value));
                    values.put(field.fieldName, value.booleanValue());
                }
                case ENUM -> {
                    if (!value.isTextual()) return Outcome.error(path, "expected one of " + field.allowedValues + " but got " + kindOf(value));
                    if (!field.allowedValues.contains(value.textValue())) {
                        return Outcome.error(path, "value '" + value.textValue() + "' is not one of " + field.allowedValues);
                    }
                    values.put(field.fieldName, value.textValue());
                }
                case LIST -> {
                    if (!value.isArray()) return Outcome.error(path, "expected list but got " + kindOf(value));
                    List<Annotation> items = new ArrayList<>();
                    int index = 0;
                    for (Iterator<JsonNode> it = value.elements(); it.hasNext(); index++) {
                        JsonNode item = it.next();
                        String itemPath = path + "[" + index + "]";
                        if (!item.isObject()) return Outcome.error(itemPath, "expected object but got " + kindOf(item));
                        Outcome nested = validateObject(item, field.itemSchema, itemPath);
                        if (nested.errorPath != null) return nested;
                        items.add(new Annotation(nested.values));
                    }
                    values.put(field.fieldName, List.copyOf(items));
                }
            }
        }
        return Outcome.ok(values);
    }

    private static String kindOf(JsonNode node) {
        return node.getNodeType().name().toLowerCase();
    }

    private static final class Outcome {
        final Map<String, Object> values;
        final String errorPath;
        final String errorMessage;

        private Outcome(Map<String, Object> values, String errorPath, String errorMessage) {
            this.values = values;
            this.errorPath = errorPath;
            this.errorMessage = errorMessage;
        }

        static Outcome ok(Map<String, Object> values) {
            return new Outcome(values, null, null);
        }

        static Outcome error(String path, String message) {
            return new Outcome(null, path, message);
        }
    }
}
