package io.marketlake.marketdata.store;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Flat key-value object storage addressed by partition keys. Keys use {@code /} separators.
 */
public interface ObjectStore {
    /** Writes or replaces {@code key}. Readers never observe a partially written object. */
    void put(String key, byte[] bytes) throws IOException;

    boolean exists(String key) throws IOException;

    InputStream open(String key) throws IOException;

    default byte[] get(String key) throws IOException {
        try (InputStream in = open(key)) {
            return in.readAllBytes();
        }
    }

    /**
     * Resolves each pattern (an exact key or a glob with {@code *} matching within one segment) to the objects it
     * matches. The result has one entry per pattern, in pattern order; an entry with no objects is a miss.
     */
    List<ObjectRead> getMany(List<String> patterns) throws IOException;
}
