package com.pubannotator.pipeline;

/**
 * Tagged outcome of parsing and validating one annotation response.
 * <p>
 * Exactly one of three shapes: {@link Kind#VALID} with a non-null {@link #annotation()},
 * {@link Kind#PARSE_ERROR} (the text held no JSON object) or {@link Kind#VALIDATION_ERROR} (the
 * object did not satisfy the schema, {@link #fieldPath()} names the offending field). Error
 * shapes carry the raw response truncated for diagnostics.
 */
public final class ValidationResult {
    public enum Kind { VALID, PARSE_ERROR, VALIDATION_ERROR }

    static final int RAW_EXCERPT_LENGTH = 200;

    private final Kind kind;
    private final Annotation annotation;
    private final String message;
    private final String fieldPath;
    private final String rawExcerpt;

    private ValidationResult(Kind kind, Annotation annotation, String message, String fieldPath, String rawText) {
        this.kind = kind;
        this.annotation = annotation;
        this.message = message;
        this.fieldPath = fieldPath;
        this.rawExcerpt = rawText == null ? null : Utils.truncate(rawText, RAW_EXCERPT_LENGTH);
    }

    public static ValidationResult valid(Annotation annotation) {
        if (annotation == null) {
            throw new IllegalArgumentException("A valid result needs an annotation");
        }
        return new ValidationResult(Kind.VALID, annotation, null, null, null);
    }

    public static ValidationResult parseError(String message, String rawText) {
        return new ValidationResult(Kind.PARSE_ERROR, null, message, null, rawText == null ? "" : rawText);
    }

    public static ValidationResult validationError(String fieldPath, String message, String rawText) {
        return new ValidationResult(Kind.VALIDATION_ERROR, null, message, fieldPath, rawText == null ? "" : rawText);
    }

    public Kind kind() { return kind; }
    public boolean isValid() { return kind == Kind.VALID; }
    public Annotation annotation() { return annotation; }
    public String message() { return message; }
    public String fieldPath() { return fieldPath; }
    public String rawExcerpt() { return rawExcerpt; }

    /** One-line diagnostic used as a record's last error. */
    public String describe() {
        return switch (kind) {
            case VALID -> "valid";
            case PARSE_ERROR -> "ParseError: " + message + " (raw: " + rawExcerpt + ")";
            case VALIDATION_ERROR -> "ValidationError at " + fieldPath + ": " + message + " (raw: " + rawExcerpt + ")";
        };
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{VALID, " + annotation + "}" : "ValidationResult{" + describe() + "}";
    }
}
