package io.marketlake.marketdata.retrieve;

import com.codahale.metrics.Counter;
import io.marketlake.marketdata.LogicalRequest;
import io.marketlake.marketdata.MissingPartitionException;
import io.marketlake.marketdata.PartitionAddressing;
import io.marketlake.marketdata.schema.CsvTableCodec;
import io.marketlake.marketdata.schema.SchemaRegistry;
import io.marketlake.marketdata.store.ObjectRead;
import io.marketlake.marketdata.store.ObjectStore;
import io.marketlake.marketdata.store.StoredObject;
import io.marketlake.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads back what ingest wrote. Keys come from the same addressing the write path uses; every found partition's
 * header is checked against the registry before the dataset is handed out.
 */
public class RetrievalScanner {
    private static final Logger log = LoggerFactory.getLogger(RetrievalScanner.class);

    private final ObjectStore store;
    private final Counter missingCounter;

    public RetrievalScanner(ObjectStore store, Metrics metrics) {
        this.store = store;
        this.missingCounter = (metrics == null ? new Metrics(null) : metrics).counter("retrieval.partitions.missing");
    }

    /**
     * @throws io.marketlake.marketdata.InvalidRangeException when the request has no start and is not {@code all}
     * @throws MissingPartitionException under {@link MissingPolicy#FAIL} for the first pattern matching nothing
     * @throws io.marketlake.marketdata.schema.SchemaMismatchException when a stored header has drifted
     */
    public Dataset retrieve(LogicalRequest request, MissingPolicy policy) {
        List<String> patterns = PartitionAddressing.patternsFor(request);
        List<ObjectRead> reads;
        try {
            reads = store.getMany(patterns);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list partitions for " + request, e);
        }

        Set<String> keys = new LinkedHashSet<>();
        int missing = 0;
        for (ObjectRead read : reads) {
            if (read.isMissing()) {
                if (policy == MissingPolicy.FAIL) throw new MissingPartitionException(read.pattern());
                missing++;
                missingCounter.inc();
                log.warn("Partition {} is not stored, skipping", read.pattern());
                continue;
            }
            for (StoredObject o : read.objects()) keys.add(o.key());
        }

        List<String> found = new ArrayList<>(keys);
        for (String key : found) validateHeader(request, key);
        log.info("Retrieved {} partition(s) for {} ({} missing)", found.size(), request, missing);
        return new Dataset(request.kind(), found, store);
    }

    private void validateHeader(LogicalRequest request, String key) {
        try (InputStream in = store.open(key)) {
            SchemaRegistry.validateHeader(request.kind(), CsvTableCodec.readHeader(in), key);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read header of " + key, e);
        }
    }
}
