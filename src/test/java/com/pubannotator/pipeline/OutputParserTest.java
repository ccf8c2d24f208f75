package com.pubannotator.pipeline;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OutputParserTest {
    private static final String FENCE = "```";

    private final OutputParser parser = new OutputParser();
    private final AnnotationSchema schema = AnnotationSchemas.publication();

    @Test
    void testDirectJsonObject() {
        ValidationResult result = parser.parse(FakeAnnotationService.valid("Deep Nets"), schema);

        assertTrue(result.isValid(), result.toString());
        assertEquals("Deep Nets", result.annotation().getString("title"));
        assertEquals("review", result.annotation().getString("category"));
        assertFalse(result.annotation().has("peerReviewed"));
    }

    @Test
    void testFencedJsonWithProse() {
        String text = "Here is the annotation:\n" + FENCE + "json\n" + FakeAnnotationService.valid("Fenced") + "\n" + FENCE + "\nHope it helps.";

        ValidationResult result = parser.parse(text, schema);

        assertTrue(result.isValid(), result.toString());
        assertEquals("Fenced", result.annotation().getString("title"));
    }

    @Test
    void testBareFenceWithoutLanguageTag() {
        String text = FENCE + "\n" + FakeAnnotationService.valid("Bare") + FENCE;
        assertTrue(parser.parse(text, schema).isValid());
    }

    @Test
    void testMalformedJsonIsParseError() {
        ValidationResult result = parser.parse("{\"title\": \"unterminated", schema);

        assertEquals(ValidationResult.Kind.PARSE_ERROR, result.kind());
        assertNull(result.annotation());
        assertTrue(result.describe().startsWith("ParseError"));
    }

    @Test
    void testMultipleFencedBlocksRejected() {
        String text = FENCE + "json\n" + FakeAnnotationService.valid("One") + "\n" + FENCE + "\n"
            + FENCE + "json\n" + FakeAnnotationService.valid("Two") + "\n" + FENCE;

        ValidationResult result = parser.parse(text, schema);

        assertEquals(ValidationResult.Kind.PARSE_ERROR, result.kind());
        assertTrue(result.message().contains("2 fenced blocks"), result.message());
    }

    @Test
    void testTopLevelArrayIsParseError() {
        assertEquals(ValidationResult.Kind.PARSE_ERROR, parser.parse("[1, 2, 3]", schema).kind());
    }

    @Test
    void testTrailingGarbageIsParseError() {
        assertEquals(ValidationResult.Kind.PARSE_ERROR, parser.parse(FakeAnnotationService.valid("X") + " trailing", schema).kind());
    }

    @Test
    void testEmptyAndNullTextAreParseErrors() {
        assertEquals(ValidationResult.Kind.PARSE_ERROR, parser.parse("", schema).kind());
        assertEquals(ValidationResult.Kind.PARSE_ERROR, parser.parse("   \n ", schema).kind());
        assertEquals(ValidationResult.Kind.PARSE_ERROR, parser.parse(null, schema).kind());
    }

    @Test
    void testRawExcerptTruncated() {
        String longText = "x".repeat(1_000);

        ValidationResult result = parser.parse(longText, schema);

        assertEquals(ValidationResult.RAW_EXCERPT_LENGTH + 3, result.rawExcerpt().length());
    }

    @Test
    void testMissingRequiredField() {
        ValidationResult result = parser.parse("{\"title\": \"T\", \"category\": \"review\"}", schema);

        assertEquals(ValidationResult.Kind.VALIDATION_ERROR, result.kind());
        assertEquals("summary", result.fieldPath());
    }

    @Test
    void testNullRequiredFieldCountsAsMissing() {
        ValidationResult result = parser.parse("{\"title\": null, \"category\": \"review\", \"summary\": \"s\"}", schema);
        assertEquals("title", result.fieldPath());
    }

    @Test
    void testWrongTypeIsNotCoerced() {
        ValidationResult result = parser.parse("{\"title\": 42, \"category\": \"review\", \"summary\": \"s\"}", schema);

        assertEquals(ValidationResult.Kind.VALIDATION_ERROR, result.kind());
        assertEquals("title", result.fieldPath());
        assertTrue(result.message().contains("expected string"), result.message());

        ValidationResult boolAsString = parser.parse(
            "{\"title\": \"T\", \"category\": \"review\", \"summary\": \"s\", \"peerReviewed\": \"yes\"}", schema);
        assertEquals("peerReviewed", boolAsString.fieldPath());
    }

    @Test
    void testEnumValueOutsideAllowedSet() {
        ValidationResult result = parser.parse("{\"title\": \"T\", \"category\": \"blog\", \"summary\": \"s\"}", schema);

        assertEquals("category", result.fieldPath());
        assertTrue(result.describe().startsWith("ValidationError at category"));
    }

    @Test
    void testNestedListItemsValidated() {
        String ok = "{\"title\": \"T\", \"category\": \"preprint\", \"summary\": \"s\", \"peerReviewed\": false,"
            + " \"authors\": [{\"name\": \"Ada\"}, {\"name\": \"Alan\", \"affiliation\": \"NPL\"}]}";
        ValidationResult valid = parser.parse(ok, schema);
        assertTrue(valid.isValid(), valid.toString());
        List<Annotation> authors = valid.annotation().getList("authors");
        assertEquals(2, authors.size());
        assertEquals("NPL", authors.get(1).getString("affiliation"));
        assertEquals(Boolean.FALSE, valid.annotation().getBoolean("peerReviewed"));

        String bad = "{\"title\": \"T\", \"category\": \"preprint\", \"summary\": \"s\","
            + " \"authors\": [{\"name\": \"Ada\"}, {\"affiliation\": \"NPL\"}]}";
        assertEquals("authors[1].name", parser.parse(bad, schema).fieldPath());

        String notObject = "{\"title\": \"T\", \"category\": \"preprint\", \"summary\": \"s\", \"authors\": [\"Ada\"]}";
        assertEquals("authors[0]", parser.parse(notObject, schema).fieldPath());
    }

    @Test
    void testUnknownFieldsIgnored() {
        String text = "{\"title\": \"T\", \"category\": \"review\", \"summary\": \"s\", \"confidence\": 0.9}";

        ValidationResult result = parser.parse(text, schema);

        assertTrue(result.isValid());
        assertFalse(result.annotation().has("confidence"));
    }

    @Test
    void testNeverThrowsOnArbitraryText() {
        String[] inputs = {"{", "}", FENCE, FENCE + FENCE, "null", "true", "\"just a string\"", "{\"a\":}", "\u0000", FENCE + "json\n[]\n" + FENCE};
        for (String input : inputs) {
            ValidationResult result = assertDoesNotThrow(() -> parser.parse(input, schema), input);
            assertFalse(result.isValid(), input);
        }
    }

    @Test
    void testNullSchemaRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{}", null));
    }
}
