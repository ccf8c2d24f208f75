package com.pubannotator.pipeline;

import java.util.HashSet;
import java.util.Set;

/**
 * Sequential identifier source owned by one pipeline run.
 * <p>
 * Produces {@code prefix + zero-padded counter} ({@code pub_001}, {@code pub_002}, ...), skipping
 * any id already reserved for a record that arrived with its own identifier. All methods are
 * synchronized; a generator is never shared between runs.
 */
public class IdGenerator {
    private final String prefix;
    private final int width;
    private final Set<String> reserved = new HashSet<>();
    private int counter;

    public IdGenerator(String prefix, int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Id width must be at least 1");
        }
        this.prefix = prefix == null ? "" : prefix;
        this.width = width;
    }

    public IdGenerator(String prefix) {
        this(prefix, 3);
    }

    /**
     * Marks an externally supplied id as taken.
     * @return false if the id was already taken in this run
     */
    public synchronized boolean reserve(String id) {
        return reserved.add(id);
    }

    public synchronized String next() {
        String candidate;
        do {
            counter++;
            candidate = prefix + String.format("%0" + width + "d", counter);
        } while (reserved.contains(candidate));
        reserved.add(candidate);
        return candidate;
    }
}
