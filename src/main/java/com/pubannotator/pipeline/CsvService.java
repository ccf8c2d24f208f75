package com.pubannotator.pipeline;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Service for exporting run reports to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>One {@code DUPLICATE} row per skipped duplicate, naming the id that was kept.</li>
 *   <li>One row per failed or exhausted record with its attempt count and last error.</li>
 *   <li>{@code TOTAL} rows with the per-outcome counters of the run.</li>
 * </ul>
 * Files land in the configured output directory, which is created on demand.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String[] HEADER = {"Outcome", "Id", "Source", "Attempts", "Detail"};
    private static final int DETAIL_LIMIT = 500;

    private final Path outputDir;

    public CsvService(String outputDir) {
        this.outputDir = Paths.get(outputDir);
    }

    @Override
    public Path writeRunReport(RunSummary summary, String filename) throws IOException {
        if (summary == null) {
            throw new IllegalArgumentException("Run summary cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(Utils.sanitizeFilename(filename));
        int rows = 0;
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER);
            for (DedupResult.Duplicate dup : summary.duplicates()) {
                writer.writeNext(new String[]{
                    "DUPLICATE", "", safe(dup.sourceLocator()), "0", "duplicate of " + dup.keptId() + " (" + dup.identityKey() + ")"
                });
                rows++;
            }
            for (RunSummary.FailedRecord f : summary.failures()) {
                writer.writeNext(new String[]{
                    f.status().name(), safe(f.id()), safe(f.sourceLocator()), Integer.toString(f.attempts()),
                    safe(Utils.truncate(f.lastError(), DETAIL_LIMIT))
                });
                rows++;
            }
            total(writer, "status", summary.status().name());
            total(writer, "acquired", summary.acquired());
            total(writer, "annotated", summary.annotated());
            total(writer, "failed", summary.failed());
            total(writer, "exhausted", summary.exhausted());
            total(writer, "cancelled", summary.cancelled());
            total(writer, "skipped_duplicate", summary.skippedDuplicate());
            total(writer, "skipped_already_processed", summary.skippedAlreadyProcessed());
            total(writer, "skipped_previously_failed", summary.skippedPreviouslyFailed());
            total(writer, "persisted", summary.persisted());
        }
        logger.info("Wrote run report with {} detail rows to {}", rows, target);
        return target;
    }

    private static void total(CSVWriter writer, String name, Object value) {
        writer.writeNext(new String[]{"TOTAL", name, "", "", String.valueOf(value)});
    }

    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
