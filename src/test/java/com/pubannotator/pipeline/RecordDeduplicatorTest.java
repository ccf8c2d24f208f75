package com.pubannotator.pipeline;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Identity assignment and first-occurrence-wins deduplication.
 */
public class RecordDeduplicatorTest {
    private final RecordDeduplicator deduplicator = new RecordDeduplicator();

    private static List<RawRecord> sample() {
        return List.of(
            new RawRecord(null, "https://example.org/a", "alpha", "in.csv#row2", Map.of()),
            new RawRecord(null, "https://example.org/b", "beta", "in.csv#row3", Map.of()),
            new RawRecord(null, "HTTPS://Example.org/a/", "alpha, second copy", "in.csv#row4", Map.of("lang", "en"))
        );
    }

    @Test
    void testFirstOccurrenceWins() {
        DedupResult result = deduplicator.deduplicate(sample(), new IdGenerator("pub_"));

        assertEquals(2, result.survivors().size());
        PipelineRecord a = result.survivors().get(0);
        assertEquals("pub_001", a.id());
        assertEquals("https://example.org/a", a.identityKey());
        assertEquals("alpha", a.rawPayload());
        assertEquals("in.csv#row2", a.sourceLocator());
        assertTrue(a.metadata().isEmpty());
        assertEquals("pub_002", result.survivors().get(1).id());

        assertEquals(1, result.duplicates().size());
        DedupResult.Duplicate dup = result.duplicates().get(0);
        assertEquals(2, dup.sequence());
        assertEquals("in.csv#row4", dup.sourceLocator());
        assertEquals("pub_001", dup.keptId());
    }

    @Test
    void testAssignmentIsDeterministic() {
        DedupResult first = deduplicator.deduplicate(sample(), new IdGenerator("pub_"));
        DedupResult second = deduplicator.deduplicate(sample(), new IdGenerator("pub_"));
        for (int i = 0; i < first.survivors().size(); i++) {
            assertEquals(first.survivors().get(i).id(), second.survivors().get(i).id());
            assertEquals(first.survivors().get(i).identityKey(), second.survivors().get(i).identityKey());
        }
    }

    @Test
    void testDeduplicatingSurvivorsIsIdempotent() {
        DedupResult first = deduplicator.deduplicate(sample(), new IdGenerator("pub_"));
        List<RawRecord> again = new ArrayList<>();
        first.survivors().forEach(r -> again.add(r.toRawRecord()));

        DedupResult second = deduplicator.deduplicate(again, new IdGenerator("pub_"));

        assertTrue(second.duplicates().isEmpty());
        assertEquals(first.survivors().size(), second.survivors().size());
        for (int i = 0; i < first.survivors().size(); i++) {
            PipelineRecord before = first.survivors().get(i);
            PipelineRecord after = second.survivors().get(i);
            assertEquals(before.id(), after.id());
            assertEquals(before.identityKey(), after.identityKey());
            assertEquals(before.rawPayload(), after.rawPayload());
        }
    }

    @Test
    void testSuppliedIdsKeptAndSkippedByGenerator() {
        List<RawRecord> input = List.of(
            new RawRecord(null, "https://example.org/1", "one", null, Map.of()),
            new RawRecord("pub_001", "https://example.org/2", "two", null, Map.of()),
            new RawRecord(null, "https://example.org/3", "three", null, Map.of())
        );

        DedupResult result = deduplicator.deduplicate(input, new IdGenerator("pub_"));

        assertEquals("pub_002", result.survivors().get(0).id());
        assertEquals("pub_001", result.survivors().get(1).id());
        assertEquals("pub_003", result.survivors().get(2).id());
    }

    @Test
    void testCollidingSuppliedIdGetsGeneratedOne() {
        List<RawRecord> input = List.of(
            new RawRecord("doc-7", "https://example.org/1", "one", null, Map.of()),
            new RawRecord("doc-7", "https://example.org/2", "two", null, Map.of())
        );

        DedupResult result = deduplicator.deduplicate(input, new IdGenerator("pub_"));

        assertEquals("doc-7", result.survivors().get(0).id());
        assertEquals("pub_001", result.survivors().get(1).id());
    }

    @Test
    void testStoredIdsReusedForKnownIdentityKeys() {
        Map<String, String> stored = Map.of(
            "https://example.org/b", "pub_001",
            "https://example.org/gone", "pub_002");

        DedupResult result = deduplicator.deduplicate(sample(), new IdGenerator("pub_"), stored);

        assertEquals("pub_003", result.survivors().get(0).id());
        assertEquals("pub_001", result.survivors().get(1).id());
        assertEquals("pub_003", result.duplicates().get(0).keptId());
    }

    @Test
    void testSuppliedIdBeatsStoredId() {
        List<RawRecord> input = List.of(
            new RawRecord("pub_001", "https://example.org/a", "alpha", "in.csv#row2", Map.of()),
            new RawRecord(null, "https://example.org/b", "beta", "in.csv#row3", Map.of()));

        DedupResult result = deduplicator.deduplicate(input, new IdGenerator("pub_"), Map.of("https://example.org/b", "pub_001"));

        assertEquals("pub_001", result.survivors().get(0).id());
        assertEquals("pub_002", result.survivors().get(1).id());
    }

    @Test
    void testSurvivorsStartNew() {
        DedupResult result = deduplicator.deduplicate(sample(), new IdGenerator("pub_"));
        result.survivors().forEach(r -> {
            assertEquals(RecordStatus.NEW, r.status());
            assertEquals(0, r.attempts());
            assertNull(r.annotation());
        });
    }
}
