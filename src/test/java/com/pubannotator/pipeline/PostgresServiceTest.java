package com.pubannotator.pipeline;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store against an embedded PostgreSQL. PostgreSQL refuses to start as root, so the
 * class is skipped there.
 */
@DisabledIfSystemProperty(named = "user.name", matches = "root")
public class PostgresServiceTest {
    private static EmbeddedPostgres postgres;
    private static PostgresService store;

    @BeforeAll
    static void startDatabase() throws Exception {
        postgres = EmbeddedPostgres.builder().start();
        store = new PostgresService(String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort()), "postgres", "postgres");
        store.createTables();
    }

    @AfterAll
    static void stopDatabase() throws Exception {
        if (postgres != null) postgres.close();
    }

    private static PersistedEntry entry(String id, RecordStatus status, Map<String, Object> annotation) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        return new PersistedEntry(id, "https://example.org/" + id, "in.csv#row2", status,
            annotation == null ? null : (String) annotation.get("title"),
            annotation == null ? null : (String) annotation.get("category"),
            "payload", annotation, Map.of("lang", "en"), 2, annotation == null ? "ParseError: nope" : null, now, now);
    }

    @Test
    void testCreateTablesIsRepeatable() {
        assertDoesNotThrow(() -> store.createTables());
    }

    @Test
    void testUpsertRoundTripsAnnotationJson() throws Exception {
        Map<String, Object> annotation = Map.of("title", "Graphs", "category", "review",
            "authors", List.of(Map.of("name", "Ada")));
        store.upsert(entry("pg_001", RecordStatus.ANNOTATED, annotation));

        PersistedEntry stored = store.find("pg_001").orElseThrow();
        assertEquals(RecordStatus.ANNOTATED, stored.status());
        assertEquals("Graphs", stored.title());
        assertEquals("review", stored.category());
        assertEquals(annotation, stored.annotation());
        assertEquals(Map.of("lang", "en"), stored.metadata());
        assertTrue(store.alreadyProcessed("pg_001"));
    }

    @Test
    void testUpsertOverwritesAndKeepsSingleRow() throws Exception {
        store.upsert(entry("pg_002", RecordStatus.FAILED, null));
        assertTrue(store.markedFailed("pg_002"));
        int before = store.count();

        store.upsert(entry("pg_002", RecordStatus.ANNOTATED, Map.of("title", "Late", "category", "other")));
        store.upsert(entry("pg_002", RecordStatus.ANNOTATED, Map.of("title", "Late", "category", "other")));

        assertEquals(before, store.count());
        assertFalse(store.markedFailed("pg_002"));
        assertEquals("Late", store.find("pg_002").orElseThrow().title());
    }

    @Test
    void testIdsByIdentityKeyListsStoredEntries() throws Exception {
        store.upsert(entry("pg_003", RecordStatus.EXHAUSTED, null));

        assertEquals("pg_003", store.idsByIdentityKey().get("https://example.org/pg_003"));
    }

    @Test
    void testMissingIdIsEmpty() throws Exception {
        assertTrue(store.find("pg_404").isEmpty());
        assertFalse(store.alreadyProcessed("pg_404"));
    }
}
