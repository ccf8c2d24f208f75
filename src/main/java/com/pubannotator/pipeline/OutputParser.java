package com.pubannotator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw annotation service output into a {@link ValidationResult}.
 * <p>
 * Two-stage strategy:
 * <ol>
 *   <li><b>Direct</b>: the whole trimmed text must be a single JSON object.</li>
 *   <li><b>Fenced</b>: otherwise the text must contain exactly one fenced block
 *       (<code>```</code> or <code>```json</code> up to the next <code>```</code>) whose contents
 *       are a single JSON object.</li>
 * </ol>
 * The first stage that yields an object is validated with {@link SchemaValidator}. Each stage
 * reports a tagged {@link Stage} instead of throwing, and {@link #parse(String, AnnotationSchema)}
 * never throws for any input text.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public class OutputParser {
    private static final Pattern FENCE = Pattern.compile("```[A-Za-z0-9_+-]*[ \\t]*\\r?\\n?(.*?)```", Pattern.DOTALL);

    private final ObjectMapper mapper = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private final SchemaValidator validator;

    public OutputParser() {
        this(new SchemaValidator());
    }

    public OutputParser(SchemaValidator validator) {
        this.validator = validator;
    }

    public ValidationResult parse(String text, AnnotationSchema schema) {
        if (schema == null) {
            throw new IllegalArgumentException("Schema cannot be null");
        }
        if (text == null || text.isBlank()) {
            return ValidationResult.parseError("empty response", text);
        }
        Stage direct = parseObject(text.trim());
        if (direct.node != null) {
            return validator.validate(direct.node, schema, text);
        }
        List<String> blocks = fencedBlocks(text);
        if (blocks.isEmpty()) {
            return ValidationResult.parseError("response is not a JSON object (" + direct.error + ") and contains no fenced block", text);
        }
        if (blocks.size() > 1) {
            return ValidationResult.parseError("response contains " + blocks.size() + " fenced blocks, expected exactly one", text);
        }
        Stage fenced = parseObject(blocks.get(0).trim());
        if (fenced.node == null) {
            return ValidationResult.parseError("fenced block is not a JSON object (" + fenced.error + ")", text);
        }
        return validator.validate(fenced.node, schema, text);
    }

    /**
     * Returns the contents of every fenced block in the text, in order of appearance.
     */
    List<String> fencedBlocks(String text) {
        List<String> blocks = new ArrayList<>();
        Matcher matcher = FENCE.matcher(text);
        while (matcher.find()) {
            blocks.add(matcher.group(1));
        }
        return blocks;
    }

    private Stage parseObject(String candidate) {
        if (candidate.isEmpty()) {
            return Stage.failed("empty");
        }
        try {
            JsonNode node = mapper.readTree(candidate);
            if (node == null || node.isMissingNode()) {
                return Stage.failed("no content");
            }
            if (!node.isObject()) {
                return Stage.failed("top-level value is " + node.getNodeType().name().toLowerCase());
            }
            return Stage.parsed(node);
        } catch (JsonProcessingException e) {
            return Stage.failed(firstLine(e.getOriginalMessage()));
        }
    }

    private static String firstLine(String message) {
        if (message == null) return "malformed JSON";
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static final class Stage {
        final JsonNode node;
        final String error;

        private Stage(JsonNode node, String error) {
            this.node = node;
            this.error = error;
        }

        static Stage parsed(JsonNode node) {
            return new Stage(node, null);
        }

        static Stage failed(String error) {
            return new Stage(null, error);
        }
    }
}
