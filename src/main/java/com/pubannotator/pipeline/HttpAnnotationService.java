package com.pubannotator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Annotation service client for OpenAI-compatible {@code /chat/completions} endpoints.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Sends the prompt context plus the schema description as the system message and the record
 *       payload as the user message, with temperature 0.</li>
 *   <li>Returns {@code choices[0].message.content} verbatim; fences and malformed JSON are left for
 *       {@link OutputParser}.</li>
 *   <li>Maps I/O errors, interruption, 408, 429 and 5xx to retryable {@link TransportException}s;
 *       any other non-2xx status is not retryable.</li>
 * </ul>
 * Exactly one HTTP call per {@link #annotate} invocation.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public class HttpAnnotationService implements AnnotationServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(HttpAnnotationService.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client;
    private final URI endpoint;
    private final String model;
    private final String apiKey;
    private final Duration timeout;

    public HttpAnnotationService(String endpoint, String model, String apiKey, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), endpoint, model, apiKey, timeout);
    }

    public HttpAnnotationService(HttpClient client, String endpoint, String model, String apiKey, Duration timeout) {
        this.client = client;
        this.endpoint = URI.create(endpoint);
        this.model = model;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    public static HttpAnnotationService fromConfig(PipelineConfig config) {
        return new HttpAnnotationService(config.annotationEndpoint(), config.annotationModel(),
            config.annotationApiKey(), config.annotationTimeout());
    }

    @Override
    public String annotate(String promptContext, String payload, AnnotationSchema schema) throws TransportException {
        String body;
        try {
            body = mapper.writeValueAsString(buildRequestBody(promptContext, payload, schema));
        } catch (JsonProcessingException e) {
            throw new TransportException("Could not serialize annotation request: " + e.getMessage(), false, -1);
        }
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("User-Agent", "PublicationAnnotator/1.0")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("Annotation request to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Annotation request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            boolean retryable = status == 408 || status == 429 || status >= 500;
            logger.debug("Annotation service answered {}: {}", status, Utils.truncate(response.body(), 200));
            throw new TransportException("Annotation service returned HTTP " + status + ": "
                + Utils.truncate(response.body(), 200), retryable, status);
        }
        return extractContent(response.body());
    }

    ObjectNode buildRequestBody(String promptContext, String payload, AnnotationSchema schema) {
        ObjectNode root = mapper.createObjectNode();
        root.put("model", model);
        root.put("temperature", 0);
        ArrayNode messages = root.putArray("messages");
        String system = (promptContext == null ? "" : promptContext)
            + "\nRespond with JSON matching this schema:\n" + schema.describe().toString();
        messages.addObject().put("role", "system").put("content", system);
        messages.addObject().put("role", "user").put("content", payload == null ? "" : payload);
        return root;
    }

    /**
     * Pulls the first choice's message content out of a chat-completions response envelope.
     * @throws TransportException (retryable) if the envelope is not what the protocol promises
     */
    String extractContent(String responseBody) throws TransportException {
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new TransportException("Unreadable response envelope: " + Utils.truncate(responseBody, 200), true, 200);
        }
        JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new TransportException("Response envelope has no choices[0].message.content: "
                + Utils.truncate(responseBody, 200), true, 200);
        }
        return content.textValue();
    }
}
