package com.pubannotator.pipeline;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {
    @TempDir
    Path tmp;

    @Test
    void testWriteRunReport() throws Exception {
        PipelineConfig config = PipelineConfig.builder()
            .maxAttempts(1).baseDelay(Duration.ZERO).jitter(Duration.ZERO).gracePeriod(Duration.ofSeconds(1)).build();
        FakeAnnotationService service = new FakeAnnotationService((payload, call) ->
            payload.equals("bad") ? "no json here" : FakeAnnotationService.valid(payload));
        List<RawRecord> input = List.of(
            new RawRecord(null, "https://example.org/1", "good", "in.csv#row2", Map.of()),
            new RawRecord(null, "https://example.org/2", "bad", "in.csv#row3", Map.of()),
            new RawRecord(null, "https://example.org/1/", "good again", "in.csv#row4", Map.of())
        );
        RunSummary summary = new PipelineCoordinator(config, service, new InMemoryPersistenceService(),
            AnnotationSchemas.publication()).run(new PipelineCoordinatorTest.ListSource(input));

        Path written = new CsvService(tmp.resolve("out").toString()).writeRunReport(summary, "report.csv");

        assertTrue(Files.exists(written));
        List<String[]> rows;
        try (Reader in = Files.newBufferedReader(written); CSVReader reader = new CSVReader(in)) {
            rows = reader.readAll();
        }
        assertArrayEquals(CsvService.HEADER, rows.get(0));
        assertEquals("DUPLICATE", rows.get(1)[0]);
        assertEquals("in.csv#row4", rows.get(1)[2]);
        assertTrue(rows.get(1)[4].contains("pub_001"));
        assertEquals("FAILED", rows.get(2)[0]);
        assertEquals("pub_002", rows.get(2)[1]);
        assertEquals("1", rows.get(2)[3]);
        assertTrue(rows.get(2)[4].startsWith("ParseError"));

        String[] annotatedTotal = rows.stream().filter(r -> r[0].equals("TOTAL") && r[1].equals("annotated"))
            .findFirst().orElseThrow();
        assertEquals("1", annotatedTotal[4]);
        String[] status = rows.stream().filter(r -> r[0].equals("TOTAL") && r[1].equals("status"))
            .findFirst().orElseThrow();
        assertEquals("COMPLETED", status[4]);
    }

    @Test
    void testRejectsBadArguments() {
        CsvService csvService = new CsvService(tmp.toString());
        assertThrows(IllegalArgumentException.class, () -> csvService.writeRunReport(null, "x.csv"));
        assertThrows(IllegalArgumentException.class, () -> csvService.writeRunReport(new RunSummary("s"), " "));
    }
}
