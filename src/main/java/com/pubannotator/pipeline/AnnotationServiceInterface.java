package com.pubannotator.pipeline;

/**
 * Interface for the external structured-generation service.
 * <p>
 * Implementations make exactly one call per invocation: no retries, no output repair. The
 * returned text may be malformed; {@link OutputParser} deals with that.
 */
public interface AnnotationServiceInterface {
    /**
     * Requests an annotation for one record payload.
     * @param promptContext Instructions framing the request
     * @param payload Raw record content to annotate
     * @param schema Shape the response is expected to follow
     * @return Raw response text
     * @throws TransportException if no usable response was received
     */
    String annotate(String promptContext, String payload, AnnotationSchema schema) throws TransportException;
}
