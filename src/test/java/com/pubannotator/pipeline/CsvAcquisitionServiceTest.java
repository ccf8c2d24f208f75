package com.pubannotator.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvAcquisitionServiceTest {
    @TempDir
    Path tmp;

    private Path write(String content) throws IOException {
        Path file = tmp.resolve("input.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testReadsRecordsWithMetadata() throws Exception {
        Path file = write("id,URL,text,journal\n"
            + ",https://example.org/a,\"Paper A, with a comma\",Nature\n"
            + "doc-9,https://example.org/b,\"Multi\nline\",\n");

        List<RawRecord> records = new CsvAcquisitionService(file).acquire();

        assertEquals(2, records.size());
        RawRecord a = records.get(0);
        assertNull(a.id());
        assertEquals("https://example.org/a", a.naturalKey());
        assertEquals("Paper A, with a comma", a.rawPayload());
        assertEquals("Nature", a.metadata().get("journal"));
        assertEquals("input.csv#row2", a.sourceLocator());

        RawRecord b = records.get(1);
        assertEquals("doc-9", b.id());
        assertEquals("Multi\nline", b.rawPayload());
        assertTrue(b.metadata().isEmpty());
    }

    @Test
    void testContentColumnAccepted() throws Exception {
        Path file = write("url,content\nhttps://example.org/c,Body text\n");
        assertEquals("Body text", new CsvAcquisitionService(file).acquire().get(0).rawPayload());
    }

    @Test
    void testRowsWithoutUrlSkipped() throws Exception {
        Path file = write("url,text\n,orphan\nhttps://example.org/d,kept\n");

        List<RawRecord> records = new CsvAcquisitionService(file).acquire();

        assertEquals(1, records.size());
        assertEquals("kept", records.get(0).rawPayload());
    }

    @Test
    void testMissingUrlColumnIsAnError() throws Exception {
        Path file = write("title,text\nA,B\n");
        IOException e = assertThrows(IOException.class, () -> new CsvAcquisitionService(file).acquire());
        assertTrue(e.getMessage().contains("url"));
    }

    @Test
    void testEmptyFileYieldsNoRecords() throws Exception {
        assertTrue(new CsvAcquisitionService(write("")).acquire().isEmpty());
    }

    @Test
    void testMissingFileIsAnError() {
        assertThrows(IOException.class, () -> new CsvAcquisitionService(tmp.resolve("nope.csv")).acquire());
    }
}
