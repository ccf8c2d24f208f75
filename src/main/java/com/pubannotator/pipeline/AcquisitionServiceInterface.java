package com.pubannotator.pipeline;

import java.io.IOException;
import java.util.List;

/**
 * Interface for acquisition sources feeding the pipeline.
 * <p>
 * A source is finite and restartable: each call to {@link #acquire()} reads it again from the
 * beginning and returns the records in the same order.
 */
public interface AcquisitionServiceInterface {
    /**
     * Reads all raw records from the source.
     * @return Raw records in source order
     * @throws IOException if the source cannot be read
     */
    List<RawRecord> acquire() throws IOException;

    /**
     * Human-readable description of the source for logs and reports.
     */
    String describe();
}
