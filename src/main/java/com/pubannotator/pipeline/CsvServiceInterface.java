package com.pubannotator.pipeline;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for CSV export of run reports.
 */
public interface CsvServiceInterface {
    /**
     * Writes the outcome of a run to a CSV file with a header row.
     * @param summary finished run
     * @param filename name of the output CSV file, resolved against the output directory
     * @return path of the written file
     * @throws IOException if writing fails
     */
    Path writeRunReport(RunSummary summary, String filename) throws IOException;
}
