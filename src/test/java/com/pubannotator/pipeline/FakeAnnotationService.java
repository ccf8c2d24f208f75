package com.pubannotator.pipeline;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted annotation service for tests. Answers come from a {@link Responder} keyed by payload and
 * per-payload call number; call counts, call start times and peak concurrency are recorded.
 */
class FakeAnnotationService implements AnnotationServiceInterface {

    @FunctionalInterface
    interface Responder {
        String respond(String payload, int call) throws TransportException;
    }

    private final Responder responder;
    private final long latencyMs;
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> callTimes = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    final CountDownLatch firstCall = new CountDownLatch(1);

    FakeAnnotationService(Responder responder) {
        this(responder, 0);
    }

    FakeAnnotationService(Responder responder, long latencyMs) {
        this.responder = responder;
        this.latencyMs = latencyMs;
    }

    @Override
    public String annotate(String promptContext, String payload, AnnotationSchema schema) throws TransportException {
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        callTimes.computeIfAbsent(payload, k -> new CopyOnWriteArrayList<>()).add(System.nanoTime());
        int call = calls.computeIfAbsent(payload, k -> new AtomicInteger()).incrementAndGet();
        firstCall.countDown();
        try {
            if (latencyMs > 0) {
                Thread.sleep(latencyMs);
            }
            return responder.respond(payload, call);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted", e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    int calls(String payload) {
        AtomicInteger count = calls.get(payload);
        return count == null ? 0 : count.get();
    }

    int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    List<Long> callTimes(String payload) {
        return callTimes.getOrDefault(payload, List.of());
    }

    int maxInFlight() {
        return maxInFlight.get();
    }

    static String valid(String title) {
        return "{\"title\": \"" + title + "\", \"category\": \"review\", \"summary\": \"About " + title + "\"}";
    }
}
