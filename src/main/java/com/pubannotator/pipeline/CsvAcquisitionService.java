package com.pubannotator.pipeline;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Acquisition source reading records from a CSV file with OpenCSV.
 * <p>
 * The header row is required. Recognized columns (case-insensitive): {@code url} (natural key,
 * required), {@code text} or {@code content} (payload), {@code id} (optional pre-existing id).
 * Every other column is carried along as record metadata. Rows with an empty {@code url} are
 * skipped with a warning.
 */
public class CsvAcquisitionService implements AcquisitionServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvAcquisitionService.class);

    private final Path file;

    public CsvAcquisitionService(Path file) {
        this.file = file;
    }

    @Override
    public List<RawRecord> acquire() throws IOException {
        List<String[]> rows;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            rows = reader.readAll();
        } catch (CsvException e) {
            throw new IOException("Malformed CSV in " + file + " at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }
        if (rows.isEmpty()) {
            logger.warn("CSV file {} is empty.", file);
            return List.of();
        }
        String[] header = rows.get(0);
        int urlCol = -1, textCol = -1, idCol = -1;
        for (int i = 0; i < header.length; i++) {
            String name = header[i].trim().toLowerCase(Locale.ROOT);
            switch (name) {
                case "url" -> urlCol = i;
                case "text", "content" -> { if (textCol < 0) textCol = i; }
                case "id" -> idCol = i;
                default -> { }
            }
        }
        if (urlCol < 0) {
            throw new IOException("CSV file " + file + " has no 'url' column");
        }

        List<RawRecord> records = new ArrayList<>();
        for (int r = 1; r < rows.size(); r++) {
            String[] row = rows.get(r);
            String url = cell(row, urlCol);
            if (url.isBlank()) {
                logger.warn("Skipping CSV row {} in {}: empty url.", r + 1, file);
                continue;
            }
            Map<String, String> metadata = new LinkedHashMap<>();
            for (int c = 0; c < header.length; c++) {
                if (c == urlCol || c == textCol || c == idCol) continue;
                String value = cell(row, c);
                if (!value.isEmpty()) metadata.put(header[c].trim(), value);
            }
            String locator = file.getFileName() + "#row" + (r + 1);
            records.add(new RawRecord(idCol < 0 ? null : cell(row, idCol), url, cell(row, textCol), locator, metadata));
        }
        logger.info("Read {} records from {}.", records.size(), file);
        return records;
    }

    @Override
    public String describe() {
        return "csv:" + file;
    }

    private static String cell(String[] row, int col) {
        if (col < 0 || col >= row.length || row[col] == null) return "";
        return row[col].trim();
    }
}
