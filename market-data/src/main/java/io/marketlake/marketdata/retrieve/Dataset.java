package io.marketlake.marketdata.retrieve;

import io.marketlake.marketdata.DatasetKind;
import io.marketlake.marketdata.schema.CanonicalTable;
import io.marketlake.marketdata.schema.CsvTableCodec;
import io.marketlake.marketdata.store.ObjectStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lazily decoded union of stored partitions. Nothing beyond the headers is read until {@link #tables()} or
 * {@link #collect()} is called.
 */
public final class Dataset {
    private final DatasetKind kind;
    private final List<String> partitionKeys;
    private final ObjectStore store;

    Dataset(DatasetKind kind, List<String> partitionKeys, ObjectStore store) {
        this.kind = kind;
        this.partitionKeys = List.copyOf(partitionKeys);
        this.store = store;
    }

    public DatasetKind kind() { return kind; }

    /** Keys of the partitions found, in retrieval order. */
    public List<String> partitionKeys() { return partitionKeys; }

    public boolean isEmpty() { return partitionKeys.isEmpty(); }

    /** One table per partition, decoded as the stream is consumed. */
    public Stream<CanonicalTable> tables() {
        return partitionKeys.stream().map(this::read);
    }

    /** All partitions unioned in order into one table. */
    public CanonicalTable collect() {
        return CanonicalTable.concat(kind, tables().collect(Collectors.toList()));
    }

    private CanonicalTable read(String key) {
        try (InputStream in = store.open(key)) {
            return CsvTableCodec.decode(in, kind, key);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read partition " + key, e);
        }
    }

    @Override
    public String toString() {
        return "Dataset{" + kind + ", partitions=" + partitionKeys.size() + '}';
    }
}
